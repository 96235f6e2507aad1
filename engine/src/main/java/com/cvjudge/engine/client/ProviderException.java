package com.cvjudge.engine.client;

/**
 * Thrown by a {@link JudgeClient} when a call attempt fails.
 *
 * Unchecked, like every failure crossing the adapter boundary; the
 * orchestrator catches it and turns the kind into a retry decision.
 */
public class ProviderException extends RuntimeException {

    public enum Kind {
        /** Timeout, rate limit, 5xx or I/O problem. Retried with backoff. */
        TRANSIENT,
        /** The provider answered but the body could not be read. One repair call, then retried. */
        MALFORMED,
        /** Authentication or request error. The judge gets no further attempts. */
        FATAL
    }

    private final Kind kind;

    public ProviderException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    /**
     * Classify a non-2xx HTTP status.
     *
     * 408 and 429 are the only 4xx codes worth retrying; every other 4xx
     * means the request itself (or its credentials) is wrong.
     */
    public static ProviderException fromStatus(String provider, int status, String body) {
        Kind kind;
        if (status == 408 || status == 429 || status >= 500) {
            kind = Kind.TRANSIENT;
        } else {
            kind = Kind.FATAL;
        }
        return new ProviderException(kind,
                "%s API error %d: %s".formatted(provider, status, abbreviate(body)));
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= 300 ? body : body.substring(0, 300) + "...";
    }
}
