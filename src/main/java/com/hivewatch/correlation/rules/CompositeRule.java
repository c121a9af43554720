package com.hivewatch.correlation.rules;

import com.hivewatch.domain.RuleDefinition;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Boolean combination of other rules' trigger states within the same session.
 * Parameters: {@code operator} ({@code AND} or {@code OR}) and {@code rules} (rule ids).
 */
public class CompositeRule extends CompiledRule {

    private final boolean all;
    private final List<String> subRules;

    public CompositeRule(RuleDefinition definition) {
        super(definition);
        RuleParameters params = new RuleParameters(definition);
        String operator = params.string("operator", "AND").toUpperCase(Locale.ROOT);
        if (!operator.equals("AND") && !operator.equals("OR")) {
            throw new IllegalArgumentException("Rule " + definition.getId() + ": operator must be AND or OR");
        }
        this.all = operator.equals("AND");
        this.subRules = List.copyOf(params.strings("rules"));
        if (subRules.isEmpty()) {
            throw new IllegalArgumentException("Rule " + definition.getId() + " lists no sub-rules");
        }
        if (subRules.contains(definition.getId())) {
            throw new IllegalArgumentException("Rule " + definition.getId() + " refers to itself");
        }
    }

    @Override
    public boolean matches(EvaluationContext context) {
        Set<String> triggered = context.getTriggered();
        if (all) {
            return triggered.containsAll(subRules);
        }
        for (String id : subRules) {
            if (triggered.contains(id)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getSubRules() {
        return subRules;
    }
}
