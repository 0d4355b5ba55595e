package com.lelantos.tracker.shape;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Lenient field readers for tracker JSON. Each takes candidate field names in priority order and returns the first
 * usable value. Numbers may arrive as JSON numbers or numeric strings.
 */
public final class JsonFields {

    /** Epoch values below this are seconds, at or above it milliseconds. */
    static final long EPOCH_MILLIS_THRESHOLD = 1_000_000_000_000L;

    private JsonFields() {
    }

    public static Optional<String> text(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String s = value.asText().strip();
                if (!s.isEmpty()) {
                    return Optional.of(s);
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<BigDecimal> decimal(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String name : names) {
            Optional<BigDecimal> value = toDecimal(node.get(name));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    /**
     * Integral fields only; a fractional or out-of-range value counts as absent.
     */
    public static Optional<Integer> integer(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String name : names) {
            Optional<BigDecimal> value = toDecimal(node.get(name));
            if (value.isPresent()) {
                try {
                    return Optional.of(value.get().intValueExact());
                } catch (ArithmeticException e) {
                    continue;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a timestamp given as epoch seconds, epoch millis or an ISO-8601 string.
     */
    public static Optional<Instant> instant(JsonNode node, String... names) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value == null || value.isNull()) {
                continue;
            }
            Optional<BigDecimal> epoch = toDecimal(value);
            if (epoch.isPresent()) {
                long v = epoch.get().longValue();
                if (v > 0) {
                    return Optional.of(v < EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochSecond(v) : Instant.ofEpochMilli(v));
                }
                continue;
            }
            if (value.isTextual()) {
                Optional<Instant> parsed = parseIso(value.asText().strip());
                if (parsed.isPresent()) {
                    return parsed;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> toDecimal(JsonNode value) {
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.decimalValue());
        }
        if (value.isTextual()) {
            String s = value.asText().strip();
            if (s.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(s));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Instant> parseIso(String s) {
        try {
            return Optional.of(Instant.parse(s));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(OffsetDateTime.parse(s).toInstant());
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }
}
