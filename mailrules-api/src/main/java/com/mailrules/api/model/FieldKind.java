package com.mailrules.api.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Value kind of a canonical record field, with the predicates it accepts.
 */
public enum FieldKind {
    /** Single free-text value. */
    TEXT(PredicateOperator.STRING_OPERATORS),
    /** Single raw address header; compared on its bare address. */
    ADDRESS(PredicateOperator.STRING_OPERATORS),
    /** Ordered list of raw addresses; predicates are quantified over the elements. */
    ADDRESS_LIST(PredicateOperator.STRING_OPERATORS),
    /** Point in time; compared by age. */
    TIMESTAMP(PredicateOperator.DATE_OPERATORS);

    private final Set<PredicateOperator> allowedOperators;

    FieldKind(Set<PredicateOperator> allowedOperators) {
        this.allowedOperators = allowedOperators;
    }

    public boolean allows(PredicateOperator operator) {
        return allowedOperators.contains(operator);
    }

    public Set<PredicateOperator> allowedOperators() {
        return EnumSet.copyOf(allowedOperators);
    }
}
