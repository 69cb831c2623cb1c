package com.libragraph.synthesis.core.inference;

import com.libragraph.synthesis.core.dao.ClaimRecord;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Bounds the pairwise comparison space of a claim set.
 * <ol>
 *   <li>The top fifth of claims by confidence (at least one) is paired with every other claim.</li>
 *   <li>The remaining claims are grouped by type; each is paired with up to the next
 *   {@value #TYPE_WINDOW} claims of its group, in input order.</li>
 * </ol>
 * Pairs are deduplicated regardless of order, keeping the first one found, then cut to
 * {@code maxPairs}. Fan-out pairs therefore come first.
 */
public class PairSelector {

    private static final Logger log = Logger.getLogger(PairSelector.class);

    public static final int DEFAULT_MAX_PAIRS = 250;
    static final int TYPE_WINDOW = 3;

    private final int maxPairs;

    public PairSelector(int maxPairs) {
        if (maxPairs < 0) {
            throw new IllegalArgumentException("maxPairs must be >= 0: " + maxPairs);
        }
        this.maxPairs = maxPairs;
    }

    public PairSelector() {
        this(DEFAULT_MAX_PAIRS);
    }

    public int maxPairs() {
        return maxPairs;
    }

    public List<ClaimPair> select(List<ClaimRecord> claims) {
        if (claims.size() < 2) {
            return List.of();
        }

        List<ClaimPair> candidates = new ArrayList<>();

        List<ClaimRecord> important = importantClaims(claims);
        Set<UUID> importantIds = new HashSet<>();
        for (ClaimRecord claim : important) {
            importantIds.add(claim.id());
        }

        for (ClaimRecord anchor : important) {
            for (ClaimRecord other : claims) {
                if (!anchor.id().equals(other.id())) {
                    candidates.add(new ClaimPair(anchor, other));
                }
            }
        }

        Map<String, List<ClaimRecord>> byType = new LinkedHashMap<>();
        for (ClaimRecord claim : claims) {
            if (importantIds.contains(claim.id())) continue;
            byType.computeIfAbsent(claim.effectiveType(), t -> new ArrayList<>()).add(claim);
        }
        for (List<ClaimRecord> group : byType.values()) {
            for (int i = 0; i < group.size(); i++) {
                int end = Math.min(i + 1 + TYPE_WINDOW, group.size());
                for (int j = i + 1; j < end; j++) {
                    candidates.add(new ClaimPair(group.get(i), group.get(j)));
                }
            }
        }

        Set<ClaimPair.Key> seen = new LinkedHashSet<>();
        List<ClaimPair> selected = new ArrayList<>();
        for (ClaimPair pair : candidates) {
            if (selected.size() >= maxPairs) break;
            if (seen.add(pair.key())) {
                selected.add(pair);
            }
        }

        log.debugf("Selected %d of %d candidate pairs for %d claims (%d important)",
                selected.size(), candidates.size(), claims.size(), important.size());
        return selected;
    }

    /** Top {@code max(1, n / 5)} claims by confidence; ties keep input order. */
    static List<ClaimRecord> importantClaims(List<ClaimRecord> claims) {
        int count = Math.max(1, claims.size() / 5);
        List<ClaimRecord> sorted = new ArrayList<>(claims);
        sorted.sort(Comparator.comparingDouble(ClaimRecord::effectiveConfidence).reversed());
        return sorted.subList(0, count);
    }
}
