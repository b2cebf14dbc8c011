package com.mailrules.compiler.analysis;

import java.util.List;

/**
 * Load-time findings for a rule set. An empty report means every condition can be
 * evaluated and every action can be planned as written.
 */
public record CompatibilityReport(List<Issue> issues) {

    public CompatibilityReport {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public boolean isClean() {
        return issues.isEmpty();
    }

    public List<Issue> issuesOfKind(IssueKind kind) {
        return issues.stream().filter(i -> i.kind() == kind).toList();
    }

    public enum IssueKind {
        NO_CONDITIONS,
        UNKNOWN_POLICY,
        MALFORMED_CONDITION,
        UNRESOLVED_FIELD,
        UNKNOWN_PREDICATE,
        PREDICATE_NOT_ALLOWED,
        INVALID_DATE_VALUE,
        UNKNOWN_ACTION,
        MISSING_ACTION_PARAMETER
    }

    /**
     * One finding. {@code position} is the condition or action index within the rule,
     * or -1 for findings about the rule itself.
     */
    public record Issue(int ruleIndex, String ruleDescription, int position, IssueKind kind, String message) {

        public String format() {
            String where = position < 0 ? "" : " #" + position;
            return String.format("Rule %d ('%s')%s: %s", ruleIndex, ruleDescription, where, message);
        }
    }
}
