package com.skillmd.federation.source;

/**
 * Thrown when a source call fails in a way the caller has to know about:
 * the upstream could not be reached, answered with something unreadable, or
 * the caller gave up waiting.
 *
 * Soft upstream failures (rejected credentials, upstream throttling) are
 * not reported this way; sources turn those into an empty result.
 */
public class SourceException extends RuntimeException {

    public enum Kind { TRANSPORT, DECODE, UPSTREAM, CANCELLED, DEADLINE_EXCEEDED }

    private final Kind       kind;
    private final SourceType source;

    public SourceException(Kind kind, SourceType source, String message) {
        super("[" + kind + "] " + source + ": " + message);
        this.kind   = kind;
        this.source = source;
    }

    public SourceException(Kind kind, SourceType source, String message, Throwable cause) {
        super("[" + kind + "] " + source + ": " + message, cause);
        this.kind   = kind;
        this.source = source;
    }

    public Kind getKind()         { return kind; }
    public SourceType getSource() { return source; }

    /** True when the caller's context ended rather than the source failing. */
    public boolean isCancellation() {
        return kind == Kind.CANCELLED || kind == Kind.DEADLINE_EXCEEDED;
    }
}
