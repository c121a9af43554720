package com.hivewatch.correlation.rules;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RuleDefinition;

import java.util.Map;
import java.util.Objects;

/**
 * Matches an event kind, optionally with payload field equalities
 * ({@code event_kind: login_success}, {@code fields: {username: root}}).
 */
public class EventMatchRule extends CompiledRule {

    private final EventKind eventKind;
    private final Map<String, Object> fields;

    public EventMatchRule(RuleDefinition definition) {
        super(definition);
        RuleParameters params = new RuleParameters(definition);
        String kind = params.string("event_kind", null);
        if (kind == null) {
            throw new IllegalArgumentException("Rule " + definition.getId() + " has no event_kind");
        }
        this.eventKind = EventKind.fromValue(kind);
        this.fields = Map.copyOf(params.map("fields"));
    }

    @Override
    public boolean matches(EvaluationContext context) {
        Event event = context.getEvent();
        if (event.getKind() != eventKind) {
            return false;
        }
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            if (!Objects.equals(event.getString(field.getKey()), String.valueOf(field.getValue()))) {
                return false;
            }
        }
        return true;
    }
}
