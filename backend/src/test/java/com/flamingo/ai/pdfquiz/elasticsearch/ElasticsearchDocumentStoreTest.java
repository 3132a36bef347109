package com.flamingo.ai.pdfquiz.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorResponse;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.CountResponse;
import co.elastic.clients.elasticsearch.core.OpenPointInTimeResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.core.search.HitsMetadata;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.ElasticsearchIndicesClient;
import co.elastic.clients.elasticsearch.indices.GetIndexResponse;
import co.elastic.clients.elasticsearch.indices.IndexState;
import co.elastic.clients.transport.endpoints.BooleanResponse;
import com.flamingo.ai.pdfquiz.config.ElasticsearchConfig;
import com.flamingo.ai.pdfquiz.config.RagConfig;
import com.flamingo.ai.pdfquiz.exception.CollectionNotFoundException;
import com.flamingo.ai.pdfquiz.exception.StorageException;
import com.flamingo.ai.pdfquiz.service.ingest.PdfChunk;
import com.flamingo.ai.pdfquiz.service.rag.embedding.EmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ElasticsearchDocumentStore Tests")
@SuppressWarnings({"unchecked", "rawtypes"})
class ElasticsearchDocumentStoreTest {

  @Mock private ElasticsearchClient elasticsearchClient;
  @Mock private ElasticsearchIndicesClient indicesClient;
  @Mock private EmbeddingService embeddingService;

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final RagConfig ragConfig = new RagConfig();
  private final ElasticsearchConfig elasticsearchConfig = new ElasticsearchConfig();

  private ElasticsearchDocumentStore store;

  @BeforeEach
  void setUp() {
    lenient().when(elasticsearchClient.indices()).thenReturn(indicesClient);
    store =
        new ElasticsearchDocumentStore(
            elasticsearchClient, embeddingService, ragConfig, elasticsearchConfig, meterRegistry);
  }

  private void indexExists(boolean exists) throws IOException {
    when(indicesClient.exists(any(Function.class))).thenReturn(new BooleanResponse(exists));
  }

  private static ElasticsearchException indexNotFound() {
    return new ElasticsearchException(
        "es/search",
        ErrorResponse.of(
            r ->
                r.status(404)
                    .error(e -> e.type("index_not_found_exception").reason("no such index"))));
  }

  private static Hit<Map> hit(String id, int page, long sortKey) {
    Map<String, Object> source = new HashMap<>();
    source.put("pdf_id", "doc-1");
    source.put("pdf_name", "Biology");
    source.put("page_number", page);
    source.put("total_pages", 40);
    source.put("content", "text " + id);
    Hit<Map> hit = mock(Hit.class);
    lenient().when(hit.id()).thenReturn(id);
    lenient().when(hit.source()).thenReturn(source);
    lenient().when(hit.sort()).thenReturn(List.of(FieldValue.of(sortKey)));
    return hit;
  }

  private static SearchResponse<Map> response(List<Hit<Map>> hits) {
    HitsMetadata<Map> metadata = mock(HitsMetadata.class);
    lenient().when(metadata.hits()).thenReturn(hits);
    SearchResponse<Map> response = mock(SearchResponse.class);
    lenient().when(response.hits()).thenReturn(metadata);
    return response;
  }

  private static List<PdfChunk> chunks(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> new PdfChunk("doc-1", i + 1, 0, "page " + (i + 1), "Biology", count))
        .toList();
  }

  @Nested
  @DisplayName("Adding chunks")
  class Adding {

    @BeforeEach
    void embedEveryPassage() {
      lenient()
          .when(embeddingService.embedPassages(anyList()))
          .thenAnswer(
              inv ->
                  ((List<String>) inv.getArgument(0))
                      .stream().map(p -> List.of(0.1f, 0.2f)).toList());
    }

    @Test
    @DisplayName("Should create the collection and send one bulk request per batch")
    void shouldBulkIndexInBatches() throws IOException {
      ragConfig.getIngestion().setBatchSize(2);
      indexExists(false);
      BulkResponse ok = mock(BulkResponse.class);
      when(ok.errors()).thenReturn(false);
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(ok);

      store.add(chunks(5), "Doc-1");

      ArgumentCaptor<BulkRequest> bulks = ArgumentCaptor.forClass(BulkRequest.class);
      verify(elasticsearchClient, times(3)).bulk(bulks.capture());
      assertThat(bulks.getAllValues())
          .extracting(b -> b.operations().size())
          .containsExactly(2, 2, 1);
      assertThat(bulks.getAllValues().get(0).operations().get(0).index().index())
          .isEqualTo("pdf_doc-1");
      verify(indicesClient).create(any(CreateIndexRequest.class));
      verify(indicesClient).refresh(any(Function.class));
      assertThat(meterRegistry.counter("document_store.chunks.added").count()).isEqualTo(5.0);
    }

    @Test
    @DisplayName("Should fail when a bulk response reports item errors")
    void shouldFailOnBulkItemErrors() throws IOException {
      indexExists(true);
      BulkResponse failed = mock(BulkResponse.class);
      when(failed.errors()).thenReturn(true);
      when(elasticsearchClient.bulk(any(BulkRequest.class))).thenReturn(failed);

      assertThatThrownBy(() -> store.add(chunks(3), "doc-1"))
          .isInstanceOf(StorageException.class)
          .hasMessageContaining("reported item failures");
      verify(indicesClient, never()).refresh(any(Function.class));
      assertThat(meterRegistry.counter("document_store.index.errors").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should do nothing for an empty chunk list")
    void shouldSkipEmptyInput() throws IOException {
      store.add(List.of(), "doc-1");

      verify(elasticsearchClient, never()).bulk(any(BulkRequest.class));
    }
  }

  @Nested
  @DisplayName("Lookups on missing collections")
  class MissingCollections {

    @Test
    @DisplayName("Should return no results without embedding the query")
    void searchShouldReturnEmpty() throws IOException {
      indexExists(false);

      assertThat(store.search("mitosis", "doc-1", 5)).isEmpty();
      verify(embeddingService, never()).embedQuery(anyString());
    }

    @Test
    @DisplayName("Should return no results when the index vanishes mid-search")
    void searchShouldTolerateDisappearingIndex() throws IOException {
      indexExists(true);
      when(embeddingService.embedQuery("mitosis")).thenReturn(List.of(0.1f));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(indexNotFound());

      assertThat(store.search("mitosis", "doc-1", 5)).isEmpty();
    }

    @Test
    @DisplayName("Should report a missing collection on describe and loadAll")
    void describeAndLoadShouldThrow() throws IOException {
      indexExists(false);

      assertThatThrownBy(() -> store.describe("doc-1"))
          .isInstanceOf(CollectionNotFoundException.class);
      assertThatThrownBy(() -> store.loadAll("doc-1"))
          .isInstanceOf(CollectionNotFoundException.class);
    }

    @Test
    @DisplayName("Should report false when deleting a missing collection")
    void deleteShouldReturnFalse() throws IOException {
      indexExists(false);

      assertThat(store.delete("doc-1")).isFalse();
      verify(indicesClient, never()).delete(any(Function.class));
    }
  }

  @Test
  @DisplayName("Should delete an existing collection")
  void shouldDeleteExistingCollection() throws IOException {
    indexExists(true);

    assertThat(store.delete("doc-1")).isTrue();
    verify(indicesClient).delete(any(Function.class));
  }

  @Test
  @DisplayName("Should wrap transport failures in StorageException")
  void shouldWrapTransportFailures() throws IOException {
    when(indicesClient.exists(any(Function.class))).thenThrow(new IOException("connection reset"));

    assertThatThrownBy(() -> store.exists("doc-1"))
        .isInstanceOf(StorageException.class)
        .hasCauseInstanceOf(IOException.class);
    assertThat(meterRegistry.counter("document_store.errors", "operation", "exists").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should list collections in name order from their first chunk")
  void shouldListCollections() throws IOException {
    GetIndexResponse indices = mock(GetIndexResponse.class);
    IndexState state = mock(IndexState.class);
    when(indices.indices()).thenReturn(Map.of("pdf_b", state, "pdf_a", state));
    when(indicesClient.get(any(Function.class))).thenReturn(indices);
    CountResponse count = mock(CountResponse.class);
    when(count.count()).thenReturn(4L);
    when(elasticsearchClient.count(any(Function.class))).thenReturn(count);
    Hit<Map> first = hit("es-1", 1, 0);
    SearchResponse<Map> sample = response(List.of(first));
    when(elasticsearchClient.search(any(Function.class), eq(Map.class))).thenReturn(sample);

    List<CollectionInfo> infos = store.listAll();

    assertThat(infos)
        .containsExactly(
            new CollectionInfo("a", 4, "Biology", 40), new CollectionInfo("b", 4, "Biology", 40));
  }

  @Nested
  @DisplayName("Loading a whole collection")
  class LoadingAll {

    @BeforeEach
    void openPointInTime() throws IOException {
      elasticsearchConfig.setScanPageSize(2);
      indexExists(true);
      OpenPointInTimeResponse pit = mock(OpenPointInTimeResponse.class);
      when(pit.id()).thenReturn("pit-1");
      when(elasticsearchClient.openPointInTime(any(Function.class))).thenReturn(pit);
    }

    @Test
    @DisplayName("Should page past the first response until a short page arrives")
    void shouldReadEveryPage() throws IOException {
      Hit<Map> h1 = hit("es-1", 1, 10);
      Hit<Map> h2 = hit("es-2", 2, 11);
      Hit<Map> h3 = hit("es-3", 3, 12);
      SearchResponse<Map> firstPage = response(List.of(h1, h2));
      SearchResponse<Map> lastPage = response(List.of(h3));
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenReturn(firstPage, lastPage);

      List<DocumentChunk> loaded = store.loadAll("doc-1");

      assertThat(loaded).extracting(DocumentChunk::getId).containsExactly("es-1", "es-2", "es-3");
      ArgumentCaptor<SearchRequest> requests = ArgumentCaptor.forClass(SearchRequest.class);
      verify(elasticsearchClient, times(2)).search(requests.capture(), eq(Map.class));
      SearchRequest second = requests.getAllValues().get(1);
      assertThat(requests.getAllValues().get(0).searchAfter()).isEmpty();
      assertThat(second.pit().id()).isEqualTo("pit-1");
      assertThat(second.searchAfter()).hasSize(1);
      assertThat(second.searchAfter().get(0).longValue()).isEqualTo(11L);
      verify(elasticsearchClient).closePointInTime(any(Function.class));
    }

    @Test
    @DisplayName("Should close the point in time when a page fails")
    void shouldClosePointInTimeOnFailure() throws IOException {
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("timeout"));

      assertThatThrownBy(() -> store.loadAll("doc-1")).isInstanceOf(StorageException.class);
      verify(elasticsearchClient).closePointInTime(any(Function.class));
    }
  }

  @Nested
  @DisplayName("Document conversion")
  class Conversion {

    private final PdfChunk chunk = new PdfChunk("Doc-A", 3, 1, "Mitochondria", "Biology", 12);

    @Test
    @DisplayName("Should write page_number and legacy pages under the current layout")
    void shouldWriteCurrentLayout() {
      Map<String, Object> doc =
          ElasticsearchDocumentStore.convertToDocument(
              chunk, List.of(0.1f, 0.2f), RagConfig.MetadataSchema.CURRENT);

      assertThat(doc)
          .containsEntry("pdf_id", "Doc-A")
          .containsEntry("chunk_id", "3_1")
          .containsEntry("source", "pdf")
          .containsEntry("pdf_name", "Biology")
          .containsEntry("pages", "3")
          .containsEntry("page_number", 3)
          .containsEntry("chunk_index_on_page", 1)
          .containsEntry("total_pages", 12)
          .containsEntry("content", "Mitochondria");
    }

    @Test
    @DisplayName("Should omit page_number under the legacy layout")
    void shouldWriteLegacyLayout() {
      Map<String, Object> doc =
          ElasticsearchDocumentStore.convertToDocument(
              chunk, List.of(0.1f), RagConfig.MetadataSchema.LEGACY);

      assertThat(doc).containsEntry("pages", "3").doesNotContainKeys("page_number");
    }

    @Test
    @DisplayName("Should read stored fields and keep raw metadata without content or vector")
    void shouldReadStoredDocument() {
      Map<String, Object> source = new HashMap<>();
      source.put("pdf_id", "doc-a");
      source.put("chunk_id", "2_0");
      source.put("pdf_name", "Biology");
      source.put("pages", "2");
      source.put("page_number", "2");
      source.put("total_pages", 12L);
      source.put("content", "Chloroplasts");
      source.put("embedding", List.of(0.5, 0.5));

      DocumentChunk result = ElasticsearchDocumentStore.convertFromDocument("es-1", source, 1.7);

      assertThat(result.getId()).isEqualTo("es-1");
      assertThat(result.getContent()).isEqualTo("Chloroplasts");
      assertThat(result.getPageNumber()).isEqualTo(2);
      assertThat(result.getTotalPages()).isEqualTo(12);
      assertThat(result.getRelevanceScore()).isEqualTo(1.7);
      assertThat(result.getMetadata())
          .containsKey("pages")
          .doesNotContainKeys("content", "embedding");
    }

    @Test
    @DisplayName("Should default a missing score to zero")
    void shouldDefaultMissingScore() {
      DocumentChunk result =
          ElasticsearchDocumentStore.convertFromDocument("es-2", Map.of("content", "x"), null);

      assertThat(result.getRelevanceScore()).isZero();
      assertThat(result.getPageNumber()).isNull();
    }

    @Test
    @DisplayName("Should lowercase index names under the configured prefix")
    void shouldLowercaseIndexNames() {
      assertThat(store.indexName("ABC-123")).isEqualTo("pdf_abc-123");

      elasticsearchConfig.setIndexPrefix("quiz_");
      assertThat(store.indexName("ABC-123")).isEqualTo("quiz_abc-123");
    }
  }
}
