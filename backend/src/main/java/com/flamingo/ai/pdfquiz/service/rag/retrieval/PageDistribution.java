package com.flamingo.ai.pdfquiz.service.rag.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.SortedMap;

/**
 * How a collection's chunks spread over pages, and which metadata layout they use.
 *
 * @param documentId the document
 * @param totalChunks chunks scanned
 * @param currentSchemaChunks chunks resolved from {@code page_number}
 * @param legacySchemaChunks chunks resolved from the legacy {@code pages} list
 * @param unresolvedChunks chunks with no usable page metadata
 * @param chunksPerPage resolved page to chunk count
 * @param minPage lowest resolved page, or {@code null}
 * @param maxPage highest resolved page, or {@code null}
 */
public record PageDistribution(
    @JsonProperty("pdf_id") String documentId,
    @JsonProperty("total_chunks") int totalChunks,
    @JsonProperty("page_number_chunks") int currentSchemaChunks,
    @JsonProperty("legacy_pages_chunks") int legacySchemaChunks,
    @JsonProperty("unresolved_chunks") int unresolvedChunks,
    @JsonProperty("page_distribution") SortedMap<Integer, Integer> chunksPerPage,
    @JsonProperty("min_page") Integer minPage,
    @JsonProperty("max_page") Integer maxPage) {}
