package com.libragraph.synthesis.core.inference;

import com.libragraph.synthesis.core.dao.ClaimRecord;

import java.util.UUID;

/**
 * Two distinct claims to classify, in the order the classifier sees them (A, then B).
 */
public record ClaimPair(ClaimRecord a, ClaimRecord b) {

    public ClaimPair {
        if (a.id().equals(b.id())) {
            throw new IllegalArgumentException("A claim cannot be paired with itself: " + a.id());
        }
    }

    /** Order-independent identity of the pair. */
    public Key key() {
        UUID x = a.id();
        UUID y = b.id();
        return x.compareTo(y) <= 0 ? new Key(x, y) : new Key(y, x);
    }

    public record Key(UUID low, UUID high) {}
}
