package com.mailrules.api;

import com.mailrules.api.model.Rule;

import java.util.List;

/**
 * Supplies the currently active rules, in evaluation order.
 */
@FunctionalInterface
public interface RuleSource {

    List<Rule> rules();
}
