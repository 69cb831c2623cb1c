package com.libragraph.synthesis.core.db;

import com.libragraph.synthesis.core.dao.DatabaseDao;
import com.libragraph.synthesis.core.service.AbstractManagedService;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Root infrastructure service that gates access to the database.
 * Starts eagerly at boot via {@code @Startup}, verifies PG connectivity and, when
 * {@code synthesis.db.apply-schema} is set, applies {@value #SCHEMA_RESOURCE}.
 */
@ApplicationScoped
@Startup
public class DatabaseService extends AbstractManagedService {

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    @Inject
    Jdbi jdbi;

    @ConfigProperty(name = "synthesis.db.apply-schema", defaultValue = "true")
    boolean applySchema;

    private String pgVersion;

    @Override
    public String serviceId() {
        return "database";
    }

    @Override
    protected void doStart() {
        pgVersion = jdbi.withExtension(DatabaseDao.class, DatabaseDao::pgVersion);
        log.infof("Connected to: %s", pgVersion);
        if (applySchema) {
            String script = loadSchema();
            jdbi.useHandle(h -> h.createScript(script).execute());
            log.infof("Applied %s", SCHEMA_RESOURCE);
        }
    }

    @Override
    protected void doStop() {
        log.info("DatabaseService stopping (Agroal manages pool shutdown)");
    }

    /** Executes SELECT 1 to verify connectivity. Calls {@link #fail} on error. */
    public boolean ping() {
        try {
            jdbi.withExtension(DatabaseDao.class, DatabaseDao::ping);
            return true;
        } catch (Exception e) {
            fail(e);
            return false;
        }
    }

    public String pgVersion() {
        return pgVersion;
    }

    private String loadSchema() {
        try (InputStream in = Thread.currentThread().getContextClassLoader()
                .getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }

    @PostConstruct
    void init() {
        try {
            start();
        } catch (Exception e) {
            throw new RuntimeException("DatabaseService failed to start", e);
        }
    }

    @PreDestroy
    void shutdown() {
        try {
            stop();
        } catch (Exception e) {
            log.warn("Error stopping DatabaseService", e);
        }
    }
}
