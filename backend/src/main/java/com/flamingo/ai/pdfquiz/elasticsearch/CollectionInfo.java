package com.flamingo.ai.pdfquiz.elasticsearch;

/**
 * Summary of one document's collection.
 *
 * @param documentId the document
 * @param chunkCount stored chunks
 * @param documentName display name from the first chunk
 * @param totalPages page count from the first chunk, or {@code null} when unknown
 */
public record CollectionInfo(
    String documentId, long chunkCount, String documentName, Integer totalPages) {}
