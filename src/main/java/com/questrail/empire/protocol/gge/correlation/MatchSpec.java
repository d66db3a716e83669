package com.questrail.empire.protocol.gge.correlation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.empire.protocol.gge.internal.match.NestedHeaders;

import java.util.Objects;

/**
 * MatchSpec
 * =============================================================================
 * How a delimited response payload is compared once the command name matched.
 *
 * <ul>
 *   <li>{@link Any}: payload is irrelevant, including an absent one.</li>
 *   <li>{@link Present}: a payload segment must exist.</li>
 *   <li>{@link Exact}: payload must equal the given value.</li>
 *   <li>{@link Pattern}: structural comparison through
 *       {@link NestedHeaders#matches(JsonNode, JsonNode)}; the payload must be a
 *       JSON object or array.</li>
 * </ul>
 */
public sealed interface MatchSpec
{
    boolean matches(JsonNode payload);

    static MatchSpec any() {
        return Any.INSTANCE;
    }

    static MatchSpec present() {
        return Present.INSTANCE;
    }

    static MatchSpec exactly(JsonNode value) {
        return new Exact(value);
    }

    static MatchSpec exactly(String value) {
        return new Exact(TextNode.valueOf(value));
    }

    static MatchSpec pattern(JsonNode pattern) {
        return new Pattern(pattern);
    }

    record Any() implements MatchSpec {
        static final Any INSTANCE = new Any();

        @Override
        public boolean matches(JsonNode payload) {
            return true;
        }
    }

    record Present() implements MatchSpec {
        static final Present INSTANCE = new Present();

        @Override
        public boolean matches(JsonNode payload) {
            return payload != null;
        }
    }

    record Exact(JsonNode value) implements MatchSpec {
        public Exact {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean matches(JsonNode payload) {
            return value.equals(payload);
        }
    }

    record Pattern(JsonNode pattern) implements MatchSpec {
        public Pattern {
            Objects.requireNonNull(pattern, "pattern");
        }

        @Override
        public boolean matches(JsonNode payload) {
            return payload != null
                    && payload.isContainerNode()
                    && NestedHeaders.matches(pattern, payload);
        }
    }
}
