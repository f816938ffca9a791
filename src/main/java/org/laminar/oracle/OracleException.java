package org.laminar.oracle;

/**
 * The extraction oracle could not produce a process document.
 */
public class OracleException extends Exception {

    public enum Reason {
        /** No API key or model configured. */
        NOT_CONFIGURED,
        /** The model call itself failed (network, authentication, timeout). */
        UPSTREAM_FAILURE,
        EMPTY_RESPONSE,
        /** The response contained no parseable JSON. */
        INVALID_JSON,
        /** The response was JSON but not a process document. */
        SCHEMA_MISMATCH
    }

    private final Reason reason;

    public OracleException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public OracleException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
