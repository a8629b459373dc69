package com.echoboard.realtime.handler;

import com.echoboard.realtime.error.ValidationException;

/**
 * Length limits and field checks for inbound events. Over-long text is cut, not rejected.
 */
final class Inputs {

    static final int CARD_TEXT = 280;
    static final int TAG = 16;
    static final int NAME = 32;
    static final int CHANNEL = 32;
    static final int EMOJI = 16;
    static final int TITLE = 80;

    private Inputs() {}

    /** Trims and truncates to {@code max} code points; null becomes the empty string. */
    static String clip(String value, int max) {
        if (value == null) return "";
        String trimmed = value.strip();
        if (trimmed.codePointCount(0, trimmed.length()) <= max) return trimmed;
        return trimmed.substring(0, trimmed.offsetByCodePoints(0, max));
    }

    static String clipOr(String value, int max, String fallback) {
        String clipped = clip(value, max);
        return clipped.isEmpty() ? fallback : clipped;
    }

    static String required(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("missing " + field);
        }
        return value.strip();
    }

    static long required(Long value, String field) {
        if (value == null) {
            throw new ValidationException("missing " + field);
        }
        return value;
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
