package com.coinpulse.core.provider;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Lenient field access for upstream JSON. Missing, null and mistyped fields
 * fall back to defaults instead of throwing.
 */
final class JsonFields {

    private JsonFields() {
    }

    static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText().trim() : "";
    }

    static double number(JsonNode node, String field) {
        return optionalNumber(node, field).orElse(0.0);
    }

    /**
     * Finite numeric field, also accepting numbers sent as strings ("45", "0.91").
     * "NaN" and "Infinity" count as absent.
     */
    static OptionalDouble optionalNumber(JsonNode node, String field) {
        JsonNode value = node.path(field);
        double parsed;
        if (value.isNumber()) {
            parsed = value.doubleValue();
        } else if (value.isTextual()) {
            try {
                parsed = Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
    }

    static OptionalLong optionalLong(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isIntegralNumber()) {
            return OptionalLong.of(value.longValue());
        }
        if (value.isTextual()) {
            try {
                return OptionalLong.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    static Integer integerOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.intValue() : null;
    }
}
