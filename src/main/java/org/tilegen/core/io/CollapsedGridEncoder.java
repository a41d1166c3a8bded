package org.tilegen.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tilegen.core.service.CollapsedGrid;

/**
 * Compact JSON hand-off to the export side.
 * Short-key schema:
 * w     = width
 * h     = height
 * cells = pattern ids, row-major
 */
public class CollapsedGridEncoder {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String encode(CollapsedGrid grid) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("w", grid.width());
        root.put("h", grid.height());
        ArrayNode cells = root.putArray("cells");
        for (int id : grid.toArray()) {
            cells.add(id);
        }
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to encode grid JSON", e);
        }
    }

    public static CollapsedGrid decode(String json) {
        try {
            JsonNode root = MAPPER.readTree(json);
            int w = root.path("w").asInt(-1);
            int h = root.path("h").asInt(-1);
            JsonNode cells = root.path("cells");
            if (w <= 0 || h <= 0 || !cells.isArray()) {
                throw new IllegalArgumentException("Not an encoded grid: missing w/h/cells");
            }
            int[] ids = new int[cells.size()];
            for (int i = 0; i < ids.length; i++) {
                JsonNode cell = cells.get(i);
                if (!cell.isIntegralNumber() || !cell.canConvertToInt()) {
                    throw new IllegalArgumentException("Cell " + i + " is not a pattern id: " + cell);
                }
                ids[i] = cell.asInt();
            }
            return new CollapsedGrid(w, h, ids);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed grid JSON", e);
        }
    }
}
