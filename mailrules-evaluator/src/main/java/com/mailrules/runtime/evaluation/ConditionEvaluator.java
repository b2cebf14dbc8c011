/*
 * Copyright (c) 2025 Mail Rules Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.mailrules.runtime.evaluation;

import com.mailrules.api.exceptions.ConditionException;
import com.mailrules.api.exceptions.UnsupportedPredicateException;
import com.mailrules.api.model.CanonicalField;
import com.mailrules.api.model.Condition;
import com.mailrules.api.model.ConditionOutcome;
import com.mailrules.api.model.MessageRecord;
import com.mailrules.api.model.PredicateOperator;
import com.mailrules.infra.metrics.Counter;
import com.mailrules.infra.metrics.MetricNames;
import com.mailrules.infra.metrics.MetricsRegistry;
import com.mailrules.runtime.context.EvaluationContext;
import com.mailrules.runtime.fields.AddressParser;
import com.mailrules.runtime.fields.FieldResolver;
import com.mailrules.runtime.operators.DatePredicateEvaluator;
import com.mailrules.runtime.operators.StringPredicateEvaluator;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Evaluates a single condition against a message record.
 *
 * <h2>Dispatch</h2>
 * <ul>
 *   <li>TEXT and TIMESTAMP fields: the predicate applies to the value directly.</li>
 *   <li>{@code from_address}: the bare address is extracted from the header first.</li>
 *   <li>Address lists: positive predicates hold if any element satisfies them, negated
 *   predicates hold if no element satisfies the positive form. An empty list therefore
 *   fails {@code equals}/{@code contains} and passes their negations.</li>
 * </ul>
 *
 * <h2>Failure isolation</h2>
 * <p>Every failure raised while evaluating a condition is caught here, logged and turned
 * into a {@code false} outcome carrying a diagnostic. Nothing propagates to the rule.
 */
public final class ConditionEvaluator {

    private static final Logger logger = Logger.getLogger(ConditionEvaluator.class.getName());

    private final FieldResolver fieldResolver;
    private final StringPredicateEvaluator stringPredicates;
    private final DatePredicateEvaluator datePredicates;
    private final AddressParser addressParser;
    private final Counter evaluatedCounter;
    private final Counter errorCounter;

    public ConditionEvaluator(MetricsRegistry metrics) {
        this(new FieldResolver(), new StringPredicateEvaluator(), new DatePredicateEvaluator(),
                new AddressParser(), metrics);
    }

    public ConditionEvaluator(FieldResolver fieldResolver,
                              StringPredicateEvaluator stringPredicates,
                              DatePredicateEvaluator datePredicates,
                              AddressParser addressParser,
                              MetricsRegistry metrics) {
        this.fieldResolver = Objects.requireNonNull(fieldResolver);
        this.stringPredicates = Objects.requireNonNull(stringPredicates);
        this.datePredicates = Objects.requireNonNull(datePredicates);
        this.addressParser = Objects.requireNonNull(addressParser);
        this.evaluatedCounter = metrics.counter(MetricNames.CONDITIONS_EVALUATED);
        this.errorCounter = metrics.counter(MetricNames.CONDITION_ERRORS);
    }

    public ConditionOutcome evaluate(int index, Condition condition, MessageRecord record,
                                     EvaluationContext ctx) {
        evaluatedCounter.increment();

        if (condition == null || !condition.isWellFormed()) {
            String diagnostic = "Skipping invalid condition: " + condition;
            logger.warning("Rule '" + ctx.ruleDescription() + "': " + diagnostic);
            errorCounter.increment();
            return ConditionOutcome.failed(index, condition, diagnostic);
        }

        try {
            boolean matched = test(condition, record, ctx);
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Message " + ctx.messageId() + ": condition [" + condition + "] -> " + matched);
            }
            return ConditionOutcome.of(index, condition, matched);
        } catch (ConditionException e) {
            logger.warning("Rule '" + ctx.ruleDescription() + "', message " + ctx.messageId()
                    + ": condition [" + condition + "] failed: " + e.getMessage());
            errorCounter.increment();
            return ConditionOutcome.failed(index, condition, e.getMessage());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Rule '" + ctx.ruleDescription() + "', message " + ctx.messageId()
                    + ": unexpected error evaluating condition [" + condition + "]", e);
            errorCounter.increment();
            return ConditionOutcome.failed(index, condition, "Unexpected error: " + e);
        }
    }

    boolean test(Condition condition, MessageRecord record, EvaluationContext ctx)
            throws ConditionException {
        CanonicalField field = fieldResolver.resolve(condition.field());
        PredicateOperator operator = PredicateOperator.fromString(condition.predicate());
        if (operator == null) {
            throw new UnsupportedPredicateException("Unsupported predicate '" + condition.predicate()
                    + "' for field '" + field.canonicalName() + "'");
        }

        return switch (field.kind()) {
            case TEXT -> stringPredicates.test(operator, textValue(field, record), condition.value());
            case ADDRESS -> stringPredicates.test(operator,
                    addressParser.bareAddress(record.sender()), condition.value());
            case ADDRESS_LIST -> testAddressList(field, operator,
                    addressValues(field, record), condition.value());
            case TIMESTAMP -> datePredicates.test(operator, record.receivedAt(),
                    condition.value(), ctx.now());
        };
    }

    private boolean testAddressList(CanonicalField field, PredicateOperator operator,
                                    List<String> addresses, String ruleValue)
            throws UnsupportedPredicateException {
        if (!operator.isStringOperator()) {
            throw new UnsupportedPredicateException("Unsupported predicate '" + operator.ruleName()
                    + "' for address list field '" + field.canonicalName() + "'");
        }

        if (operator.isNegated()) {
            PredicateOperator positive = operator.positive();
            for (String address : addresses) {
                if (stringPredicates.test(positive, address, ruleValue)) {
                    return false;
                }
            }
            return true;
        }

        for (String address : addresses) {
            if (stringPredicates.test(operator, address, ruleValue)) {
                return true;
            }
        }
        return false;
    }

    private static String textValue(CanonicalField field, MessageRecord record) {
        return switch (field) {
            case SUBJECT -> record.subject();
            case BODY_PLAIN -> record.plainBody();
            default -> throw new IllegalArgumentException("Not a text field: " + field);
        };
    }

    private List<String> addressValues(CanonicalField field, MessageRecord record) {
        List<String> raw = switch (field) {
            case TO_ADDRESSES -> record.to();
            case CC_ADDRESSES -> record.cc();
            case BCC_ADDRESSES -> record.bcc();
            default -> throw new IllegalArgumentException("Not an address list field: " + field);
        };
        return addressParser.bareAddresses(raw);
    }
}
