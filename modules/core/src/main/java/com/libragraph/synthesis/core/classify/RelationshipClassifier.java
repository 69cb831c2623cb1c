package com.libragraph.synthesis.core.classify;

/**
 * Judges the semantic relationship between two claims. Claim A and claim B are the pair in the
 * order they were asked about; the judgment's {@link Direction} is relative to that order.
 */
public interface RelationshipClassifier {

    /**
     * @throws ClassificationException on timeout, transport failure or an unusable answer
     */
    RelationshipJudgment classify(String claimAText, String claimAType,
                                  String claimBText, String claimBType);
}
