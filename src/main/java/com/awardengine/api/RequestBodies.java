package com.awardengine.api;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Field extraction for the small JSON bodies the controllers accept.
 */
final class RequestBodies {

    private RequestBodies() {
    }

    static int requireInt(Map<String, Object> body, String field) {
        Object value = body == null ? null : body.get(field);
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException(field + " is required and must be an integer");
        }
        try {
            // exact: rejects fractions and anything outside the int range, big integers included
            return new BigDecimal(number.toString()).intValueExact();
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException(field + " must be an integer, got " + number, ex);
        }
    }

    static double requireNumber(Map<String, Object> body, String field) {
        Object value = body == null ? null : body.get(field);
        if (!(value instanceof Number number)) {
            throw new IllegalArgumentException(field + " is required and must be a number");
        }
        return number.doubleValue();
    }

    /** Null is allowed and clears the label. */
    static String optionalString(Map<String, Object> body, String field) {
        Object value = body == null ? null : body.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return text;
    }
}
