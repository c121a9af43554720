package com.hivewatch.correlation.rules;

import com.hivewatch.domain.RuleDefinition;
import com.hivewatch.domain.RuleKind;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executable form of a {@link RuleDefinition}. Instances belong to one rule snapshot and are
 * shared by every evaluation that uses it.
 */
public abstract class CompiledRule {

    private final RuleDefinition definition;
    private final AtomicBoolean disabled = new AtomicBoolean(false);

    protected CompiledRule(RuleDefinition definition) {
        this.definition = definition;
    }

    /**
     * @throws RuleEvaluationException if the rule cannot be evaluated
     */
    public abstract boolean matches(EvaluationContext context);

    public String getId() {
        return definition.getId();
    }

    public RuleKind getKind() {
        return definition.getKind();
    }

    public int getRiskWeight() {
        return definition.getRiskWeight();
    }

    public RuleDefinition getDefinition() {
        return definition;
    }

    /**
     * Stateful rules are evaluated even after they matched a session, to keep their state current.
     */
    public boolean isStateful() {
        return definition.getKind().isStateful();
    }

    public boolean isDisabled() {
        return disabled.get();
    }

    /**
     * @return true if this call disabled the rule, false if it already was
     */
    public boolean disable() {
        return disabled.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + getId() + "}";
    }
}
