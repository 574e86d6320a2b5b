package com.alertwarden.core.state;

/**
 * A second concurrent Firing instance was about to be minted for one rule.
 *
 * <p>
 * Per-rule serialization makes this impossible; if it is ever thrown it is a
 * programming error and is deliberately not caught by the engine.
 * </p>
 *
 * @since 1.0.0
 */
public class DedupViolationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String ruleId;

    public DedupViolationException(String ruleId, String message) {
        super("Dedup violation for rule '" + ruleId + "': " + message);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
