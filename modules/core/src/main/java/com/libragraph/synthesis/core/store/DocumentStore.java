package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.DocumentRecord;

import java.util.Optional;
import java.util.UUID;

public interface DocumentStore {

    Optional<DocumentRecord> findById(UUID documentId);

    /** Sets the document status and stamps {@code processed_at}. */
    void markProcessed(UUID documentId, String status);

    default DocumentRecord require(UUID documentId) {
        return findById(documentId).orElseThrow(() -> new DocumentNotFoundException(documentId));
    }
}
