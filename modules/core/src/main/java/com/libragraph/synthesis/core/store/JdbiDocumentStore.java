package com.libragraph.synthesis.core.store;

import com.libragraph.synthesis.core.dao.DocumentDao;
import com.libragraph.synthesis.core.dao.DocumentRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jdbi.v3.core.Jdbi;

import java.util.Optional;
import java.util.UUID;

@ApplicationScoped
public class JdbiDocumentStore implements DocumentStore {

    @Inject
    Jdbi jdbi;

    @Override
    public Optional<DocumentRecord> findById(UUID documentId) {
        return jdbi.withExtension(DocumentDao.class, dao -> dao.findById(documentId));
    }

    @Override
    public void markProcessed(UUID documentId, String status) {
        int rows = jdbi.withExtension(DocumentDao.class, dao -> dao.markProcessed(documentId, status));
        if (rows == 0) throw new DocumentNotFoundException(documentId);
    }
}
