package com.libragraph.synthesis.core.classify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.synthesis.types.DependencyStrength;
import com.libragraph.synthesis.types.RelationshipType;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the classifier's JSON answer:
 * <pre>
 * {"relationship_type": "EVIDENTIAL", "direction": "A_to_B", "confidence": 0.85,
 *  "explanation": "...", "semantic_markers": ["..."], "strength": "moderate"}
 * </pre>
 * Missing fields take their defaults; confidence is clamped to [0, 1].
 */
public class RelationshipJudgmentParser {

    private final ObjectMapper objectMapper;

    public RelationshipJudgmentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public RelationshipJudgment parse(String raw) {
        JsonNode root = readObject(raw);

        String label = text(root, "relationship_type");
        if (label == null) {
            label = RelationshipType.NO_RELATIONSHIP_LABEL;
        }

        return new RelationshipJudgment(
                label,
                Direction.fromLabel(text(root, "direction")),
                confidence(root.get("confidence")),
                text(root, "explanation"),
                DependencyStrength.fromLabel(text(root, "strength")),
                markers(root.get("semantic_markers")));
    }

    JsonNode readObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ClassificationException("Empty classifier response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(stripFence(raw));
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Malformed classifier response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ClassificationException("Classifier response is not a JSON object");
        }
        return root;
    }

    /** Drops a surrounding markdown code fence, if the model added one. */
    static String stripFence(String raw) {
        String s = raw.trim();
        if (!s.startsWith("```")) return s;
        int firstNewline = s.indexOf('\n');
        int closing = s.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) return s;
        return s.substring(firstNewline + 1, closing).trim();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static double confidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return RelationshipJudgment.DEFAULT_CONFIDENCE;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new ClassificationException("Non-numeric confidence: " + node.asText());
            }
        } else {
            throw new ClassificationException("Non-numeric confidence: " + node);
        }
        if (Double.isNaN(value)) {
            throw new ClassificationException("Non-numeric confidence: NaN");
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static List<String> markers(JsonNode node) {
        List<String> markers = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode m : node) {
                if (!m.isNull()) markers.add(m.asText());
            }
        }
        return markers;
    }
}
