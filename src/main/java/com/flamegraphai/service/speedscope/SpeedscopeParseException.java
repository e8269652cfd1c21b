package com.flamegraphai.service.speedscope;

import lombok.Getter;

/**
 * Raised when an uploaded speedscope document cannot be turned into hotspots.
 * The message is safe to hand back to the client as is.
 */
@Getter
public class SpeedscopeParseException extends RuntimeException {

    private final ParseErrorKind kind;

    public SpeedscopeParseException(ParseErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Tells a malformed document (client fault) apart from any other failure.
     */
    public static boolean isParseError(Throwable error) {
        return error instanceof SpeedscopeParseException;
    }
}
