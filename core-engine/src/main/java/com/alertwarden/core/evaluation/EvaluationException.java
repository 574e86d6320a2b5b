package com.alertwarden.core.evaluation;

/**
 * The telemetry pull for a rule failed. This is distinct from a non-breach:
 * an evaluation that ends in this exception produced no data at all.
 *
 * @since 1.0.0
 */
public class EvaluationException extends Exception {

    private static final long serialVersionUID = 1L;

    /** Why the pull failed. */
    public enum Reason {
        /** Backend unreachable or returned an error. */
        UNAVAILABLE,
        /** Backend answered with something that is not a finite number. */
        MALFORMED_RESULT,
        /** Backend had no data for the window. */
        NO_DATA,
        /** The call did not finish within the telemetry timeout. */
        TIMEOUT
    }

    private final Reason reason;

    public EvaluationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public EvaluationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
