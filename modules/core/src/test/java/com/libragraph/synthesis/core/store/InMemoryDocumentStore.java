package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.DocumentRecord;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryDocumentStore implements DocumentStore {

    private final Map<UUID, DocumentRecord> documents = new HashMap<>();

    public synchronized UUID create(UUID pipelineId, String filename, String text) {
        UUID id = UUID.randomUUID();
        documents.put(id, new DocumentRecord(id, pipelineId, filename, "gpt-4", "pending", text, null));
        return id;
    }

    @Override
    public synchronized Optional<DocumentRecord> findById(UUID documentId) {
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public synchronized void markProcessed(UUID documentId, String status) {
        DocumentRecord d = require(documentId);
        documents.put(documentId, new DocumentRecord(d.id(), d.pipelineId(), d.filename(), d.sourceLlm(),
                status, d.extractedText(), Instant.now()));
    }
}
