package com.hivewatch.correlation.rules;

import com.hivewatch.domain.Event;
import com.hivewatch.domain.EventKind;
import com.hivewatch.domain.RuleDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Substring and regular-expression match against command text.
 *
 * Parameters: {@code patterns} (substrings, case-insensitive) and/or {@code regex}
 * (one or a list, matched with find). Any single hit matches. Unclassified events are
 * matched against their raw payload text.
 */
public class CommandPatternRule extends CompiledRule {

    private final List<String> substrings;
    private final List<Pattern> regexes = new ArrayList<>();
    private final String compileError;

    public CommandPatternRule(RuleDefinition definition) {
        super(definition);
        RuleParameters params = new RuleParameters(definition);
        this.substrings = params.strings("patterns").stream()
            .map(p -> p.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());

        String error = null;
        for (String regex : params.strings("regex")) {
            try {
                regexes.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                error = "invalid regex '" + regex + "': " + e.getDescription();
                break;
            }
        }
        this.compileError = error;

        if (substrings.isEmpty() && regexes.isEmpty() && compileError == null) {
            throw new IllegalArgumentException("Rule " + definition.getId() + " has no patterns or regex");
        }
    }

    @Override
    public boolean matches(EvaluationContext context) {
        if (compileError != null) {
            throw new RuleEvaluationException(getId(), compileError);
        }
        String text = textOf(context.getEvent());
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String substring : substrings) {
            if (lower.contains(substring)) {
                return true;
            }
        }
        for (Pattern regex : regexes) {
            if (regex.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static String textOf(Event event) {
        if (event.getKind() == EventKind.COMMAND) {
            return event.getCommand();
        }
        if (event.getKind() == EventKind.UNCLASSIFIED) {
            return event.getPayload().values().stream()
                .map(Object::toString)
                .collect(Collectors.joining(" "));
        }
        return null;
    }
}
