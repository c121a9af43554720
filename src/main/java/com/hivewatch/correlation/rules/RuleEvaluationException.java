package com.hivewatch.correlation.rules;

/**
 * Thrown when one rule cannot be evaluated. The engine disables that rule and carries on.
 */
public class RuleEvaluationException extends RuntimeException {

    private final String ruleId;

    public RuleEvaluationException(String ruleId, String message) {
        super(message);
        this.ruleId = ruleId;
    }

    public RuleEvaluationException(String ruleId, String message, Throwable cause) {
        super(message, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
