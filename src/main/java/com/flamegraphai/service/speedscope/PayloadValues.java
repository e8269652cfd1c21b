package com.flamegraphai.service.speedscope;

import java.util.List;
import java.util.Map;

/**
 * Type checks for the generic tree produced by the JSON decoder
 * (maps, lists, numbers, strings, booleans and nulls).
 */
final class PayloadValues {

    private PayloadValues() {
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> asRecord(Object value, ParseErrorKind kind, String message) {
        if (!(value instanceof Map)) {
            throw new SpeedscopeParseException(kind, message);
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    static List<Object> asListOrNull(Object value) {
        return value instanceof List ? (List<Object>) value : null;
    }

    static double asNumber(Object value, ParseErrorKind kind, String message) {
        // Booleans and numeric strings are not numbers here
        if (!(value instanceof Number)) {
            throw new SpeedscopeParseException(kind, message);
        }
        double number = ((Number) value).doubleValue();
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw new SpeedscopeParseException(kind, message);
        }
        return number;
    }

    static int asIndex(Object value, int max, String message) {
        double number = asNumber(value, ParseErrorKind.INVALID_FRAME_REFERENCE, message);
        if (number != Math.rint(number) || number < 0 || number >= max) {
            throw new SpeedscopeParseException(ParseErrorKind.INVALID_FRAME_REFERENCE, message);
        }
        return (int) number;
    }

    static double requireFinite(double value, ParseErrorKind kind, String message) {
        if (!Double.isFinite(value)) {
            throw new SpeedscopeParseException(kind, message);
        }
        return value;
    }

    static String asText(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }

    static Object elementAt(List<Object> list, int index) {
        return index < list.size() ? list.get(index) : null;
    }
}
