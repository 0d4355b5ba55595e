package com.lelantos.tracker.shape;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * One way a list-valued response can be shaped. Rules are tried in order; the first match wins.
 */
public sealed interface ShapeRule permits ShapeRule.BareArray, ShapeRule.Envelope {

    Optional<JsonNode> match(JsonNode root);

    static ShapeRule bareArray() {
        return BareArray.INSTANCE;
    }

    static ShapeRule envelope(String field) {
        return new Envelope(field);
    }

    /** The response itself is the array. */
    final class BareArray implements ShapeRule {

        private static final BareArray INSTANCE = new BareArray();

        private BareArray() {
        }

        @Override
        public Optional<JsonNode> match(JsonNode root) {
            return root != null && root.isArray() ? Optional.of(root) : Optional.empty();
        }

        @Override
        public String toString() {
            return "[...]";
        }
    }

    /** The array sits under {@code field} of a JSON object. */
    record Envelope(String field) implements ShapeRule {

        @Override
        public Optional<JsonNode> match(JsonNode root) {
            if (root == null || !root.isObject()) {
                return Optional.empty();
            }
            JsonNode value = root.get(field);
            return value != null && value.isArray() ? Optional.of(value) : Optional.empty();
        }

        @Override
        public String toString() {
            return "{" + field + ": [...]}";
        }
    }
}
