package com.priceintel.harvester.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.harvester.model.ErrorCode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows from a JSON or XML document, read through Jackson's tree model.
 *
 * The record list is the root array, or the first array of objects found under the root
 * (e.g. {@code {"products": [...]}} or repeated {@code <product>} elements). Nested objects are
 * flattened to dotted keys; the leaf name is also kept when it does not clash.
 */
class TreeRowReader implements RowReader {

    private static final int MAX_SEARCH_DEPTH = 3;

    private final ObjectMapper mapper;
    private final String formatName;

    TreeRowReader(ObjectMapper mapper, String formatName) {
        this.mapper = mapper;
        this.formatName = formatName;
    }

    @Override
    public Rows read(String content) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new FeedParseException(ErrorCode.PARSE_FAILED,
                    "Invalid " + formatName + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) return Rows.complete(List.of());

        JsonNode records = findRecords(root, 0);
        List<Map<String, String>> rows = new ArrayList<>();
        if (records == null) {
            if (root.isObject() && hasScalarField(root)) {
                rows.add(flatten(root));
            }
            return Rows.complete(rows);
        }
        for (JsonNode node : records) {
            if (node.isObject()) rows.add(flatten(node));
        }
        return Rows.complete(rows);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode findRecords(JsonNode node, int depth) {
        if (node.isArray()) return node;
        if (!node.isObject() || depth >= MAX_SEARCH_DEPTH) return null;

        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            JsonNode child = it.next();
            if (child.isArray() && child.size() > 0 && child.get(0).isObject()) return child;
        }
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            JsonNode child = it.next();
            if (child.isObject()) {
                JsonNode found = findRecords(child, depth + 1);
                if (found != null) return found;
                // single repeated XML element collapses to an object
                if (depth == 0 && !hasScalarField(node) && hasScalarField(child)) {
                    return mapper.createArrayNode().add(child);
                }
            }
        }
        return null;
    }

    private boolean hasScalarField(JsonNode node) {
        for (Iterator<JsonNode> it = node.elements(); it.hasNext(); ) {
            if (it.next().isValueNode()) return true;
        }
        return false;
    }

    private Map<String, String> flatten(JsonNode node) {
        Map<String, String> row = new LinkedHashMap<>();
        flattenInto(node, "", row);
        return row;
    }

    private void flattenInto(JsonNode node, String prefix, Map<String, String> row) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
            JsonNode value = field.getValue();

            if (value.isValueNode()) {
                if (!value.isNull()) {
                    row.put(key, value.asText());
                    if (!prefix.isEmpty()) row.putIfAbsent(field.getKey(), value.asText());
                }
            } else if (value.isObject()) {
                flattenInto(value, key, row);
            } else if (value.isArray() && value.size() > 0 && value.get(0).isValueNode()) {
                row.put(key, value.get(0).asText());
            }
        }
    }
}
