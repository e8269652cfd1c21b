package com.flamegraphai.service.speedscope;

/**
 * Categories of speedscope document violations.
 * All of them are client faults and abort the whole parse.
 */
public enum ParseErrorKind {
    MALFORMED_DOCUMENT,
    INVALID_FRAME_REFERENCE,
    INVALID_WEIGHT,
    INVALID_TIMESTAMP,
    UNSUPPORTED_PROFILE_TYPE,
    MALFORMED_EVENT_STREAM,
    NON_MONOTONIC_TIMESTAMPS,
    UNBALANCED_STACK,
    INVALID_EVENT_TYPE,
    UNCLOSED_FRAMES,
    NO_MEASURABLE_ACTIVITY
}
