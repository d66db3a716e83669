package com.questrail.empire.protocol.gge.internal.match;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * NestedHeaders
 * =============================================================================
 * Dot-path writes into nested JSON objects and structural comparison of an
 * expected header "pattern" against a server payload.
 *
 * <h2>Comparison rules</h2>
 * <ul>
 *   <li>A missing or JSON {@code null} pattern or candidate never matches.</li>
 *   <li>An array candidate matches if <em>any</em> element matches the pattern.</li>
 *   <li>Every key of the pattern must match: container values recurse, scalar values
 *       must be present in the candidate and equal. Numbers compare by value, so
 *       {@code 1} equals {@code 1.0}.</li>
 * </ul>
 */
public final class NestedHeaders
{
    private NestedHeaders() {
    }

    /**
     * Write {@code value} at {@code path} ({@code "a.b.c"}), creating intermediate
     * objects where they are missing or are not objects.
     */
    public static void setNestedValue(ObjectNode target, String path, JsonNode value)
    {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(path, "path");

        String[] keys = path.split("\\.", -1);
        ObjectNode current = target;
        for (int i = 0; i < keys.length - 1; i++) {
            JsonNode next = current.get(keys[i]);
            if (next == null || !next.isObject()) {
                current = current.putObject(keys[i]);
            } else {
                current = (ObjectNode) next;
            }
        }
        current.set(keys[keys.length - 1], value);
    }

    /**
     * Structural comparison of {@code pattern} against {@code candidate}.
     */
    public static boolean matches(JsonNode pattern, JsonNode candidate)
    {
        if (isAbsent(pattern) || isAbsent(candidate)) {
            return false;
        }
        if (candidate.isArray()) {
            for (JsonNode element : candidate) {
                if (matches(pattern, element)) {
                    return true;
                }
            }
            return false;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = patternFields(pattern);
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!candidate.isContainerNode()) {
                return false;
            }

            JsonNode expected = field.getValue();
            JsonNode actual = candidate.get(field.getKey());
            if (expected.isContainerNode() || expected.isNull()) {
                if (!matches(expected, actual)) {
                    return false;
                }
            } else if (actual == null || !scalarEquals(expected, actual)) {
                return false;
            }
        }
        return true;
    }

    private static Iterator<Map.Entry<String, JsonNode>> patternFields(JsonNode pattern)
    {
        if (pattern.isObject()) {
            return pattern.fields();
        }
        if (pattern.isArray()) {
            // Arrays used as patterns are compared key-by-index, like an object.
            Map<String, JsonNode> indexed = new LinkedHashMap<>();
            for (int i = 0; i < pattern.size(); i++) {
                indexed.put(Integer.toString(i), pattern.get(i));
            }
            return indexed.entrySet().iterator();
        }
        // A scalar pattern has no keys to check.
        return Collections.emptyIterator();
    }

    private static boolean scalarEquals(JsonNode expected, JsonNode actual)
    {
        if (expected.isNumber() && actual.isNumber()) {
            return expected.decimalValue().compareTo(actual.decimalValue()) == 0;
        }
        return expected.equals(actual);
    }

    private static boolean isAbsent(JsonNode node)
    {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
