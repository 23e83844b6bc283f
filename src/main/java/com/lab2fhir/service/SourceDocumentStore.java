package com.lab2fhir.service;

/**
 * Blob storage for uploaded report documents. Keys are derived from the content hash,
 * so storing the same bytes twice is harmless.
 */
public interface SourceDocumentStore {

    /**
     * Persists the bytes and returns a URI that {@link #load(String)} understands.
     */
    String store(String contentHash, byte[] content, String mediaType);

    byte[] load(String storageUri);
}
