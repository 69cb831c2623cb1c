package com.libragraph.synthesis.core.classify;

import java.util.List;

/** Splits a document's text into atomic claims. */
public interface ClaimExtractor {

    /**
     * @param sourceName the document's file name
     * @param sourceLlm  the model that produced the document, or null
     * @throws ClassificationException on timeout, transport failure or an unusable answer
     */
    List<ExtractedClaim> extract(String text, String sourceName, String sourceLlm);
}
