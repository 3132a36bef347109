package com.flamingo.ai.pdfquiz.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import com.flamingo.ai.pdfquiz.config.ElasticsearchConfig;
import com.flamingo.ai.pdfquiz.config.RagConfig;
import com.flamingo.ai.pdfquiz.exception.CollectionNotFoundException;
import com.flamingo.ai.pdfquiz.exception.StorageException;
import com.flamingo.ai.pdfquiz.service.ingest.PageChunker;
import com.flamingo.ai.pdfquiz.service.ingest.PdfChunk;
import com.flamingo.ai.pdfquiz.service.rag.embedding.EmbeddingService;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch-backed {@link DocumentStore} keeping one index, {@code pdf_<documentId>}, per
 * document.
 *
 * <p>Indices are created on first insert with a fixed mapping and dynamic fields disabled. Chunks
 * get generated {@code _id}s; the page-scoped {@code chunk_id} is a plain field. Whole-collection
 * scans page through a point in time, so no chunk is skipped however large the document is.
 */
@Service
@Slf4j
public class ElasticsearchDocumentStore implements DocumentStore {

  private static final String SHARD_DOC = "_shard_doc";

  static final String FIELD_DOCUMENT_ID = "pdf_id";
  static final String FIELD_CHUNK_ID = "chunk_id";
  static final String FIELD_SOURCE = "source";
  static final String FIELD_NAME = "pdf_name";
  static final String FIELD_PAGES = "pages";
  static final String FIELD_PAGE_NUMBER = "page_number";
  static final String FIELD_TOTAL_PAGES = "total_pages";
  static final String FIELD_INDEX_ON_PAGE = "chunk_index_on_page";
  static final String FIELD_CONTENT = "content";
  static final String FIELD_EMBEDDING = "embedding";

  private static final Set<String> NON_METADATA_FIELDS = Set.of(FIELD_CONTENT, FIELD_EMBEDDING);

  private final ElasticsearchClient elasticsearchClient;
  private final EmbeddingService embeddingService;
  private final RagConfig ragConfig;
  private final ElasticsearchConfig elasticsearchConfig;
  private final MeterRegistry meterRegistry;

  public ElasticsearchDocumentStore(
      ElasticsearchClient elasticsearchClient,
      EmbeddingService embeddingService,
      RagConfig ragConfig,
      ElasticsearchConfig elasticsearchConfig,
      MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.embeddingService = embeddingService;
    this.ragConfig = ragConfig;
    this.elasticsearchConfig = elasticsearchConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "document_store.add", description = "Time to embed and store chunks")
  public void add(List<PdfChunk> chunks, String documentId) {
    if (chunks.isEmpty()) {
      log.warn("No chunks to add for PDF {}", documentId);
      return;
    }
    String indexName = indexName(documentId);
    RagConfig.MetadataSchema schema = ragConfig.getIngestion().getMetadataSchema();
    try {
      ensureIndex(indexName);

      List<List<PdfChunk>> batches =
          Lists.partition(chunks, ragConfig.getIngestion().getBatchSize());
      for (int b = 0; b < batches.size(); b++) {
        List<PdfChunk> batch = batches.get(b);
        List<List<Float>> vectors =
            embeddingService.embedPassages(batch.stream().map(PdfChunk::content).toList());

        BulkRequest.Builder bulk = new BulkRequest.Builder();
        for (int i = 0; i < batch.size(); i++) {
          Map<String, Object> doc = convertToDocument(batch.get(i), vectors.get(i), schema);
          bulk.operations(op -> op.index(idx -> idx.index(indexName).document(doc)));
        }
        BulkResponse response = elasticsearchClient.bulk(bulk.build());
        if (response.errors()) {
          meterRegistry.counter("document_store.index.errors").increment();
          throw new StorageException(
              "Bulk insert into " + indexName + " reported item failures", null);
        }
        log.debug(
            "Added batch {}/{} ({} chunks) to {}", b + 1, batches.size(), batch.size(), indexName);
      }

      elasticsearchClient.indices().refresh(r -> r.index(indexName));
      meterRegistry.counter("document_store.chunks.added").increment(chunks.size());
      log.info("Added {} chunks to collection {}", chunks.size(), indexName);
    } catch (StorageException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      log.error("Failed to add chunks to {}: {}", indexName, e.getMessage(), e);
      throw new StorageException("Failed to add chunks for PDF " + documentId, e);
    }
  }

  @Override
  @Timed(value = "document_store.search", description = "Time for a collection similarity search")
  public List<DocumentChunk> search(String query, String documentId, int k) {
    String indexName = indexName(documentId);
    try {
      if (!indexExists(indexName)) {
        log.warn("Collection {} does not exist, returning no results", indexName);
        return List.of();
      }
      List<Float> queryVector = embeddingService.embedQuery(query);
      SearchRequest request =
          SearchRequest.of(
              s ->
                  s.index(indexName)
                      .knn(
                          kn ->
                              kn.field(FIELD_EMBEDDING)
                                  .queryVector(queryVector)
                                  .k(k)
                                  .numCandidates(Math.max(k * 2, 10)))
                      .source(src -> src.filter(f -> f.excludes(FIELD_EMBEDDING)))
                      .size(k));
      List<DocumentChunk> results = mapHits(elasticsearchClient.search(request, Map.class));
      meterRegistry.counter("document_store.search").increment();
      log.debug("Search in {} returned {} chunks", indexName, results.size());
      return results;
    } catch (ElasticsearchException e) {
      if (isIndexMissing(e)) {
        log.warn("Collection {} disappeared during search", indexName);
        return List.of();
      }
      throw storageFailure("search", indexName, e);
    } catch (IOException | RuntimeException e) {
      throw storageFailure("search", indexName, e);
    }
  }

  @Override
  public CollectionInfo describe(String documentId) {
    String indexName = indexName(documentId);
    try {
      if (!indexExists(indexName)) {
        throw new CollectionNotFoundException(documentId);
      }
      return describeIndex(documentId, indexName);
    } catch (CollectionNotFoundException e) {
      throw e;
    } catch (ElasticsearchException e) {
      if (isIndexMissing(e)) {
        throw new CollectionNotFoundException(documentId);
      }
      throw storageFailure("describe", indexName, e);
    } catch (IOException | RuntimeException e) {
      throw storageFailure("describe", indexName, e);
    }
  }

  @Override
  public boolean delete(String documentId) {
    String indexName = indexName(documentId);
    try {
      if (!indexExists(indexName)) {
        return false;
      }
      elasticsearchClient.indices().delete(d -> d.index(indexName));
      meterRegistry.counter("document_store.collections.deleted").increment();
      log.info("Deleted collection {}", indexName);
      return true;
    } catch (ElasticsearchException e) {
      if (isIndexMissing(e)) {
        return false;
      }
      throw storageFailure("delete", indexName, e);
    } catch (IOException | RuntimeException e) {
      throw storageFailure("delete", indexName, e);
    }
  }

  @Override
  public List<CollectionInfo> listAll() {
    String prefix = elasticsearchConfig.getIndexPrefix();
    try {
      Set<String> indices =
          elasticsearchClient
              .indices()
              .get(g -> g.index(prefix + "*").allowNoIndices(true))
              .indices()
              .keySet();
      List<CollectionInfo> infos = new ArrayList<>();
      for (String indexName : indices.stream().sorted().toList()) {
        String documentId = indexName.substring(prefix.length());
        try {
          infos.add(describeIndex(documentId, indexName));
        } catch (IOException | RuntimeException e) {
          log.warn("Skipping collection {} while listing: {}", indexName, e.getMessage());
        }
      }
      return infos;
    } catch (IOException | RuntimeException e) {
      throw storageFailure("list", prefix + "*", e);
    }
  }

  @Override
  public boolean exists(String documentId) {
    String indexName = indexName(documentId);
    try {
      return indexExists(indexName);
    } catch (IOException | RuntimeException e) {
      throw storageFailure("exists", indexName, e);
    }
  }

  @Override
  @Timed(value = "document_store.load_all", description = "Time to load a whole collection")
  public List<DocumentChunk> loadAll(String documentId) {
    String indexName = indexName(documentId);
    try {
      if (!indexExists(indexName)) {
        throw new CollectionNotFoundException(documentId);
      }
      List<DocumentChunk> chunks = scan(indexName);
      log.debug("Loaded {} chunks from {}", chunks.size(), indexName);
      return chunks;
    } catch (CollectionNotFoundException e) {
      throw e;
    } catch (ElasticsearchException e) {
      if (isIndexMissing(e)) {
        throw new CollectionNotFoundException(documentId);
      }
      throw storageFailure("load", indexName, e);
    } catch (IOException | RuntimeException e) {
      throw storageFailure("load", indexName, e);
    }
  }

  /** Index name for a document; Elasticsearch only accepts lowercase names. */
  @VisibleForTesting
  String indexName(String documentId) {
    return elasticsearchConfig.getIndexPrefix() + documentId.toLowerCase(Locale.ROOT);
  }

  @VisibleForTesting
  static Map<String, Object> convertToDocument(
      PdfChunk chunk, List<Float> embedding, RagConfig.MetadataSchema schema) {
    Map<String, Object> doc = new LinkedHashMap<>();
    doc.put(FIELD_DOCUMENT_ID, chunk.documentId());
    doc.put(FIELD_CHUNK_ID, chunk.chunkId());
    doc.put(FIELD_SOURCE, "pdf");
    doc.put(FIELD_NAME, chunk.documentName());
    doc.put(FIELD_PAGES, String.valueOf(chunk.pageNumber()));
    doc.put(FIELD_TOTAL_PAGES, chunk.totalPages());
    if (schema == RagConfig.MetadataSchema.CURRENT) {
      doc.put(FIELD_PAGE_NUMBER, chunk.pageNumber());
      doc.put(FIELD_INDEX_ON_PAGE, chunk.indexOnPage());
    }
    doc.put(FIELD_CONTENT, chunk.content());
    doc.put(FIELD_EMBEDDING, embedding);
    return doc;
  }

  @VisibleForTesting
  static DocumentChunk convertFromDocument(String id, Map<String, Object> source, Double score) {
    Map<String, Object> metadata = new HashMap<>(source);
    NON_METADATA_FIELDS.forEach(metadata::remove);

    return DocumentChunk.builder()
        .id(id)
        .documentId(asString(source.get(FIELD_DOCUMENT_ID)))
        .chunkId(asString(source.get(FIELD_CHUNK_ID)))
        .content(asString(source.get(FIELD_CONTENT)))
        .documentName(asString(source.get(FIELD_NAME)))
        .totalPages(asInteger(source.get(FIELD_TOTAL_PAGES)))
        .chunkIndexOnPage(asInteger(source.get(FIELD_INDEX_ON_PAGE)))
        .pageNumber(asInteger(source.get(FIELD_PAGE_NUMBER)))
        .pages(asString(source.get(FIELD_PAGES)))
        .relevanceScore(score != null ? score : 0.0)
        .metadata(metadata)
        .build();
  }

  private Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put(FIELD_DOCUMENT_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_CHUNK_ID, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_SOURCE, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_NAME, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_PAGES, Property.of(p -> p.keyword(k -> k)));
    properties.put(FIELD_PAGE_NUMBER, Property.of(p -> p.integer(i -> i)));
    properties.put(FIELD_TOTAL_PAGES, Property.of(p -> p.integer(i -> i)));
    properties.put(FIELD_INDEX_ON_PAGE, Property.of(p -> p.integer(i -> i)));
    properties.put(FIELD_CONTENT, Property.of(p -> p.text(t -> t)));
    properties.put(
        FIELD_EMBEDDING,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(elasticsearchConfig.getVectorDimensions())
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  private void ensureIndex(String indexName) throws IOException {
    if (indexExists(indexName)) {
      return;
    }
    Map<String, Property> properties = defineIndexProperties();
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(indexName)
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    try {
      elasticsearchClient.indices().create(request);
      meterRegistry.counter("document_store.collections.created").increment();
      log.info("Created collection {}", indexName);
    } catch (ElasticsearchException e) {
      // a concurrent ingest of the same document may have created it first
      if (!"resource_already_exists_exception".equals(errorType(e))) {
        throw e;
      }
    }
  }

  private boolean indexExists(String indexName) throws IOException {
    return elasticsearchClient.indices().exists(e -> e.index(indexName)).value();
  }

  private CollectionInfo describeIndex(String documentId, String indexName) throws IOException {
    long count = elasticsearchClient.count(c -> c.index(indexName)).count();
    SearchResponse<Map> first =
        elasticsearchClient.search(
            s ->
                s.index(indexName)
                    .size(1)
                    .source(src -> src.filter(f -> f.excludes(FIELD_EMBEDDING))),
            Map.class);
    List<DocumentChunk> sample = mapHits(first);

    String name = PageChunker.defaultDocumentName(documentId);
    Integer totalPages = null;
    if (!sample.isEmpty()) {
      DocumentChunk chunk = sample.get(0);
      if (chunk.getDocumentName() != null) {
        name = chunk.getDocumentName();
      }
      totalPages = chunk.getTotalPages();
    }
    return new CollectionInfo(documentId, count, name, totalPages);
  }

  /** Reads every hit of an index in shard order, one page per request. */
  private List<DocumentChunk> scan(String indexName) throws IOException {
    int pageSize = elasticsearchConfig.getScanPageSize();
    String keepAlive = elasticsearchConfig.getScanKeepAlive();
    String pitId =
        elasticsearchClient
            .openPointInTime(o -> o.index(indexName).keepAlive(t -> t.time(keepAlive)))
            .id();
    List<DocumentChunk> chunks = new ArrayList<>();
    try {
      List<FieldValue> after = null;
      while (true) {
        SearchResponse<Map> page =
            elasticsearchClient.search(scanRequest(pitId, keepAlive, pageSize, after), Map.class);
        List<Hit<Map>> hits = page.hits().hits();
        chunks.addAll(mapHits(page));
        if (page.pitId() != null) {
          pitId = page.pitId();
        }
        if (hits.size() < pageSize) {
          return chunks;
        }
        after = hits.get(hits.size() - 1).sort();
      }
    } finally {
      closePointInTime(pitId, indexName);
    }
  }

  private static SearchRequest scanRequest(
      String pitId, String keepAlive, int pageSize, List<FieldValue> after) {
    SearchRequest.Builder builder =
        new SearchRequest.Builder()
            .pit(p -> p.id(pitId).keepAlive(t -> t.time(keepAlive)))
            .query(q -> q.matchAll(m -> m))
            .sort(so -> so.field(f -> f.field(SHARD_DOC).order(SortOrder.Asc)))
            .source(src -> src.filter(f -> f.excludes(FIELD_EMBEDDING)))
            .size(pageSize);
    if (after != null) {
      builder.searchAfter(after);
    }
    return builder.build();
  }

  private void closePointInTime(String pitId, String indexName) {
    try {
      elasticsearchClient.closePointInTime(c -> c.id(pitId));
    } catch (IOException | RuntimeException e) {
      // the point in time expires on its own after the keep-alive
      log.warn("Could not close point in time on {}: {}", indexName, e.getMessage());
    }
  }

  @SuppressWarnings("unchecked")
  private List<DocumentChunk> mapHits(SearchResponse<Map> response) {
    List<DocumentChunk> chunks = new ArrayList<>();
    for (Hit<Map> hit : response.hits().hits()) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        chunks.add(convertFromDocument(hit.id(), source, hit.score()));
      }
    }
    return chunks;
  }

  private StorageException storageFailure(String operation, String indexName, Exception e) {
    log.error("Document store {} failed for {}: {}", operation, indexName, e.getMessage(), e);
    meterRegistry.counter("document_store.errors", "operation", operation).increment();
    return new StorageException("Document store " + operation + " failed for " + indexName, e);
  }

  private static boolean isIndexMissing(ElasticsearchException e) {
    return "index_not_found_exception".equals(errorType(e));
  }

  private static String errorType(ElasticsearchException e) {
    return e.error() != null ? e.error().type() : null;
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static Integer asInteger(Object value) {
    if (value instanceof Number n) {
      return n.intValue();
    }
    if (value instanceof String s) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }
}
