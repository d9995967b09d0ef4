package org.dps.configurator.settings.visibility;

import org.dps.configurator.settings.ConfigurationException;
import org.dps.configurator.settings.model.Operator;
import org.dps.configurator.settings.model.VisibilityCondition;
import org.dps.configurator.settings.model.VisibilityRule;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ConditionParser {
    private static final Pattern EXPRESSION = Pattern.compile("([A-Z][A-Z0-9_]*)(==|!=|<=|>=|<|>)(.*)");

    private ConditionParser() {
    }

    public static VisibilityCondition parse(String expression) {
        Matcher matcher = EXPRESSION.matcher(expression == null ? "" : expression.trim());
        if (!matcher.matches()) {
            throw new ConfigurationException("Invalid visibility expression: " + expression);
        }
        Operator operator = Operator.fromSymbol(matcher.group(2))
                .orElseThrow(() -> new ConfigurationException("Unknown operator in: " + expression));
        return new VisibilityCondition(matcher.group(1), operator, matcher.group(3));
    }

    /**
     * Parses both condition groups of a setting. Every referenced setting must already be declared,
     * which keeps the visibility graph acyclic.
     */
    public static VisibilityRule parseRule(String owner, List<String> all, List<String> any, Predicate<String> declared) {
        List<VisibilityCondition> allConditions = parseAll(owner, all, declared);
        List<VisibilityCondition> anyConditions = parseAll(owner, any, declared);
        if (allConditions.isEmpty() && anyConditions.isEmpty()) {
            return VisibilityRule.ALWAYS;
        }
        return new VisibilityRule(allConditions, anyConditions);
    }

    private static List<VisibilityCondition> parseAll(String owner, List<String> expressions, Predicate<String> declared) {
        List<VisibilityCondition> conditions = new ArrayList<>();
        if (expressions == null) {
            return conditions;
        }
        for (String expression : expressions) {
            VisibilityCondition condition = parse(expression);
            if (condition.setting().equals(owner) || !declared.test(condition.setting())) {
                throw new ConfigurationException("Visibility of '" + owner + "' references '"
                        + condition.setting() + "', which must be declared before it");
            }
            conditions.add(condition);
        }
        return conditions;
    }
}
