/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.compiler.analysis;

import com.mailrules.api.model.Action;
import com.mailrules.api.model.ActionType;
import com.mailrules.api.model.CanonicalField;
import com.mailrules.api.model.Condition;
import com.mailrules.api.model.PredicateOperator;
import com.mailrules.api.model.Rule;
import com.mailrules.compiler.analysis.CompatibilityReport.Issue;
import com.mailrules.compiler.analysis.CompatibilityReport.IssueKind;
import com.mailrules.runtime.fields.FieldResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Checks rules against the field-kind dispatch table before they are evaluated.
 *
 * <p>Runtime evaluation tolerates every problem reported here by demoting the offending
 * condition to false or skipping the action. The analyzer surfaces those cases at load
 * time instead of once per message.
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li>rule has conditions and a known {@code conditions_predicate}</li>
 *   <li>each condition is well formed, names a known field and predicate, and the
 *   predicate is allowed for the field's kind</li>
 *   <li>date predicates carry an integer value</li>
 *   <li>each action has a known type and its required parameter</li>
 * </ul>
 */
public class ConditionCompatibilityAnalyzer {

    private static final String KNOWN_FIELDS = String.join(", ", new TreeSet<>(FieldResolver.knownNames().keySet()));

    private final FieldResolver fieldResolver;

    public ConditionCompatibilityAnalyzer() {
        this(new FieldResolver());
    }

    public ConditionCompatibilityAnalyzer(FieldResolver fieldResolver) {
        this.fieldResolver = fieldResolver;
    }

    public CompatibilityReport analyze(List<Rule> rules) {
        List<Issue> issues = new ArrayList<>();
        for (int r = 0; r < rules.size(); r++) {
            analyzeRule(r, rules.get(r), issues);
        }
        return new CompatibilityReport(issues);
    }

    private void analyzeRule(int ruleIndex, Rule rule, List<Issue> issues) {
        String name = rule.displayName();

        if (rule.policy() == null) {
            issues.add(new Issue(ruleIndex, name, -1, IssueKind.UNKNOWN_POLICY,
                    "unknown conditions_predicate '" + rule.conditionsPredicate() + "', all will be used"));
        }
        if (rule.conditions().isEmpty()) {
            issues.add(new Issue(ruleIndex, name, -1, IssueKind.NO_CONDITIONS,
                    "rule has no conditions and will never match"));
        }

        for (int c = 0; c < rule.conditions().size(); c++) {
            checkCondition(ruleIndex, name, c, rule.conditions().get(c), issues);
        }
        for (int a = 0; a < rule.actions().size(); a++) {
            checkAction(ruleIndex, name, a, rule.actions().get(a), issues);
        }
    }

    private void checkCondition(int ruleIndex, String name, int position, Condition condition,
                                List<Issue> issues) {
        if (!condition.isWellFormed()) {
            issues.add(new Issue(ruleIndex, name, position, IssueKind.MALFORMED_CONDITION,
                    "condition is missing its field, predicate or value"));
            return;
        }

        Optional<CanonicalField> field = fieldResolver.tryResolve(condition.field());
        if (field.isEmpty()) {
            issues.add(new Issue(ruleIndex, name, position, IssueKind.UNRESOLVED_FIELD,
                    "unknown field '" + condition.field() + "', expected one of " + KNOWN_FIELDS));
            return;
        }

        PredicateOperator operator = PredicateOperator.fromString(condition.predicate());
        if (operator == null) {
            issues.add(new Issue(ruleIndex, name, position, IssueKind.UNKNOWN_PREDICATE,
                    "unknown predicate '" + condition.predicate() + "'"));
            return;
        }

        if (!field.get().kind().allows(operator)) {
            issues.add(new Issue(ruleIndex, name, position, IssueKind.PREDICATE_NOT_ALLOWED,
                    "predicate '" + operator.ruleName() + "' cannot be applied to "
                            + field.get().kind() + " field '" + field.get().canonicalName()
                            + "', allowed: " + allowedNames(field.get())));
            return;
        }

        if (operator.isDateOperator() && !isInteger(condition.value())) {
            issues.add(new Issue(ruleIndex, name, position, IssueKind.INVALID_DATE_VALUE,
                    "date predicate '" + operator.ruleName() + "' needs an integer, got '"
                            + condition.value() + "'"));
        }
    }

    private void checkAction(int ruleIndex, String name, int position, Action action, List<Issue> issues) {
        ActionType type = ActionType.fromString(action.type());
        if (type == null) {
            issues.add(new Issue(ruleIndex, name, position, IssueKind.UNKNOWN_ACTION,
                    "unknown action type '" + action.type() + "'"));
            return;
        }
        String required = switch (type) {
            case MOVE_MESSAGE -> Action.MAILBOX;
            case ADD_LABEL -> Action.LABEL_NAME;
            default -> null;
        };
        if (required != null && action.parameter(required).isEmpty()) {
            issues.add(new Issue(ruleIndex, name, position, IssueKind.MISSING_ACTION_PARAMETER,
                    type.ruleName() + " requires '" + required + "'"));
        }
    }

    private static String allowedNames(CanonicalField field) {
        return field.kind().allowedOperators().stream()
                .map(PredicateOperator::ruleName)
                .collect(Collectors.joining(", "));
    }

    private static boolean isInteger(String value) {
        try {
            Integer.parseInt(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
