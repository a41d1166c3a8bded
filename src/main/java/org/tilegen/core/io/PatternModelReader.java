package org.tilegen.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tilegen.core.model.Direction;
import org.tilegen.core.model.InvalidModelException;
import org.tilegen.core.model.PatternModel;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the model produced by sample extraction.
 *
 * <pre>
 * {
 *   "patterns": [ {"id": 0, "weight": 3.0}, ... ],
 *   "rules":    [ {"a": 0, "b": 1, "dir": "EAST"}, ... ]
 * }
 * </pre>
 * A rule may use {@code "dirs": ["N","E"]} or {@code "dir": "*"} for several directions.
 */
public class PatternModelReader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static PatternModel read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromTree(MAPPER.readTree(in));
        } catch (JsonProcessingException e) {
            throw new InvalidModelException("Malformed pattern model JSON in " + path + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read pattern model: " + path.toAbsolutePath(), e);
        }
    }

    public static PatternModel parse(String json) {
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidModelException("Malformed pattern model JSON: " + e.getOriginalMessage());
        }
    }

    private static PatternModel fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidModelException("Pattern model must be a JSON object");
        }
        PatternModel.Builder b = PatternModel.builder();

        JsonNode patterns = root.path("patterns");
        if (!patterns.isArray()) {
            throw new InvalidModelException("Missing \"patterns\" array");
        }
        for (JsonNode p : patterns) {
            b.pattern(requireInt(p, "id"), requireDouble(p, "weight"));
        }

        JsonNode rules = root.path("rules");
        if (!rules.isMissingNode() && !rules.isArray()) {
            throw new InvalidModelException("\"rules\" must be an array");
        }
        for (JsonNode r : rules) {
            int a = requireInt(r, "a");
            int to = requireInt(r, "b");
            if (r.has("dirs")) {
                JsonNode dirs = r.get("dirs");
                if (!dirs.isArray() || dirs.isEmpty()) {
                    throw new InvalidModelException("\"dirs\" must be a non-empty array in " + r);
                }
                for (JsonNode d : dirs) {
                    if (!d.isTextual()) {
                        throw new InvalidModelException("Direction must be a string in " + r);
                    }
                    b.rule(a, to, direction(d.asText()));
                }
            } else {
                String dir = r.path("dir").asText("");
                if ("*".equals(dir.trim())) {
                    b.allDirections(a, to);
                } else {
                    b.rule(a, to, direction(dir));
                }
            }
        }
        return b.build();
    }

    private static Direction direction(String raw) {
        try {
            return Direction.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new InvalidModelException(e.getMessage());
        }
    }

    private static int requireInt(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.canConvertToInt()) {
            throw new InvalidModelException("Missing or non-integer \"" + field + "\" in " + node);
        }
        return v.asInt();
    }

    private static double requireDouble(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isNumber()) {
            throw new InvalidModelException("Missing or non-numeric \"" + field + "\" in " + node);
        }
        return v.asDouble();
    }
}
