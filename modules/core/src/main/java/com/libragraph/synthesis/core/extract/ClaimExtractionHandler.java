package com.libragraph.synthesis.core.extract;

import com.libragraph.synthesis.core.classify.ClaimExtractor;
import com.libragraph.synthesis.core.classify.ExtractedClaim;
import com.libragraph.synthesis.core.dao.DocumentRecord;
import com.libragraph.synthesis.core.dao.NewClaim;
import com.libragraph.synthesis.core.job.Job;
import com.libragraph.synthesis.core.job.JobContext;
import com.libragraph.synthesis.core.job.JobHandler;
import com.libragraph.synthesis.core.job.JobType;
import com.libragraph.synthesis.core.stats.PipelineStatsUpdater;
import com.libragraph.synthesis.core.store.ClaimStore;
import com.libragraph.synthesis.core.store.DocumentStore;
import com.libragraph.synthesis.core.store.PipelineStore;
import com.libragraph.synthesis.types.ClaimType;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Extracts claims from one document's text, stores them, marks the document
 * {@value #DOCUMENT_STATUS_EXTRACTED} and recounts the pipeline's claims.
 */
@ApplicationScoped
public class ClaimExtractionHandler implements JobHandler {

    private static final Logger log = Logger.getLogger(ClaimExtractionHandler.class);

    static final String DOCUMENT_STATUS_EXTRACTED = "claims_extracted";
    static final double DEFAULT_CONFIDENCE = 0.8;
    static final double INITIAL_IMPORTANCE = 0.5;

    private final DocumentStore documentStore;
    private final PipelineStore pipelineStore;
    private final ClaimStore claimStore;
    private final ClaimExtractor extractor;
    private final PipelineStatsUpdater statsUpdater;

    @Inject
    public ClaimExtractionHandler(DocumentStore documentStore, PipelineStore pipelineStore,
                                  ClaimStore claimStore, ClaimExtractor extractor,
                                  PipelineStatsUpdater statsUpdater) {
        this.documentStore = documentStore;
        this.pipelineStore = pipelineStore;
        this.claimStore = claimStore;
        this.extractor = extractor;
        this.statsUpdater = statsUpdater;
    }

    @Override
    public JobType jobType() {
        return JobType.CLAIM_EXTRACTION;
    }

    @Override
    public Map<String, Object> handle(Job job, JobContext ctx) {
        ClaimExtractionRequest request = ctx.payloadAs(ClaimExtractionRequest.class);
        if (request == null || request.pipelineId() == null || request.documentId() == null) {
            throw new IllegalArgumentException("Job " + job.id() + " needs pipeline_id and document_id");
        }
        UUID pipelineId = request.pipelineId();
        UUID documentId = request.documentId();
        log.infof("Processing claim extraction for document %s", documentId);

        pipelineStore.require(pipelineId);
        DocumentRecord document = documentStore.require(documentId);
        if (document.extractedText() == null || document.extractedText().isBlank()) {
            throw new IllegalStateException("Document " + documentId + " has no extracted text");
        }
        ctx.reportProgress(10);

        List<ExtractedClaim> extracted = extractor.extract(
                document.extractedText(), document.filename(), document.sourceLlm());
        ctx.reportProgress(50);

        List<NewClaim> claims = new ArrayList<>();
        for (ExtractedClaim e : extracted) {
            if (e.text() == null || e.text().isBlank()) {
                log.warnf("Skipping extracted claim without text in document %s", documentId);
                continue;
            }
            claims.add(toNewClaim(pipelineId, documentId, e));
        }
        claimStore.insertAll(claims);
        log.infof("Saved %d claims for document %s", claims.size(), documentId);

        documentStore.markProcessed(documentId, DOCUMENT_STATUS_EXTRACTED);
        statsUpdater.refreshClaimCount(pipelineId);
        ctx.reportProgress(90);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("document_id", documentId.toString());
        result.put("claims_extracted", claims.size());
        return result;
    }

    static NewClaim toNewClaim(UUID pipelineId, UUID documentId, ExtractedClaim e) {
        double confidence = e.confidence() == null ? DEFAULT_CONFIDENCE : Math.max(0.0, Math.min(1.0, e.confidence()));
        return new NewClaim(
                UUID.randomUUID(),
                pipelineId,
                documentId,
                e.text(),
                ClaimType.fromLabelOrDefault(e.type()).label(),
                confidence,
                e.evidenceType(),
                e.sourceSpanStart(),
                e.sourceSpanEnd(),
                e.surroundingContext(),
                INITIAL_IMPORTANCE);
    }
}
