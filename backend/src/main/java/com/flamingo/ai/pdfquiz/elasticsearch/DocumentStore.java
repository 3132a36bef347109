package com.flamingo.ai.pdfquiz.elasticsearch;

import com.flamingo.ai.pdfquiz.exception.CollectionNotFoundException;
import com.flamingo.ai.pdfquiz.exception.StorageException;
import com.flamingo.ai.pdfquiz.service.ingest.PdfChunk;
import java.util.List;

/**
 * One vector collection per document.
 *
 * <p>Backend and embedding failures surface as {@link StorageException} and are never retried
 * here. Adding the same document twice without deleting it first stores its chunks twice.
 */
public interface DocumentStore {

  /**
   * Embeds and stores chunks, creating the document's collection when it does not exist yet.
   *
   * @param chunks chunks of one document
   * @param documentId the document
   */
  void add(List<PdfChunk> chunks, String documentId);

  /**
   * Similarity search inside one collection.
   *
   * @return up to {@code k} chunks, best first; empty when the collection does not exist
   */
  List<DocumentChunk> search(String query, String documentId, int k);

  /**
   * Describes a collection from its chunk count and first chunk.
   *
   * @throws CollectionNotFoundException if the collection does not exist
   */
  CollectionInfo describe(String documentId);

  /**
   * Removes a whole collection.
   *
   * @return whether the collection existed
   */
  boolean delete(String documentId);

  /** Describes every collection. */
  List<CollectionInfo> listAll();

  boolean exists(String documentId);

  /**
   * Loads every chunk of a collection in storage order, without similarity ranking.
   *
   * @throws CollectionNotFoundException if the collection does not exist
   */
  List<DocumentChunk> loadAll(String documentId);
}
