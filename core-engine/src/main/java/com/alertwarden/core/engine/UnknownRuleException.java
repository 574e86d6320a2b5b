package com.alertwarden.core.engine;

/**
 * The rule id is not part of the active configuration.
 *
 * @since 1.0.0
 */
public class UnknownRuleException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String ruleId;

    public UnknownRuleException(String ruleId) {
        super("Unknown rule: '" + ruleId + "'");
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
