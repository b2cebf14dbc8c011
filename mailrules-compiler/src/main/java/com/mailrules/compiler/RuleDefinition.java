package com.mailrules.compiler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.mailrules.api.model.Action;
import com.mailrules.api.model.Condition;
import com.mailrules.api.model.Rule;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of one rule in the rules file.
 *
 * <pre>{@code
 * {
 *   "description": "Archive interview mails",
 *   "conditions_predicate": "all",
 *   "conditions": [{"field": "from", "predicate": "contains", "value": "tenmiles.com"}],
 *   "actions": [{"type": "move_message", "mailbox": "Archive"}]
 * }
 * }</pre>
 *
 * Action parameters sit next to {@code type}; a nested {@code parameters} object is
 * accepted as well.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record RuleDefinition(
        @JsonProperty("description") String description,
        @JsonProperty("conditions_predicate") String conditionsPredicate,
        @JsonProperty("conditions") List<ConditionDefinition> conditions,
        @JsonProperty("actions") List<Map<String, JsonNode>> actions) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ConditionDefinition(
            @JsonProperty("field") String field,
            @JsonProperty("predicate") String predicate,
            @JsonProperty("value") JsonNode value) {

        Condition toCondition() {
            return new Condition(field, predicate, text(value));
        }
    }

    Rule toRule() {
        List<Condition> parsedConditions = conditions == null
                ? List.of()
                : conditions.stream()
                        .map(c -> c == null ? new Condition(null, null, null) : c.toCondition())
                        .toList();
        List<Action> parsedActions = actions == null
                ? List.of()
                : actions.stream()
                        .map(RuleDefinition::toAction)
                        .toList();
        return new Rule(description, conditionsPredicate, parsedConditions, parsedActions);
    }

    private static Action toAction(Map<String, JsonNode> raw) {
        if (raw == null) {
            return new Action(null, Map.of());
        }
        Map<String, String> parameters = new LinkedHashMap<>();
        String type = null;
        for (Map.Entry<String, JsonNode> entry : raw.entrySet()) {
            JsonNode node = entry.getValue();
            if ("type".equals(entry.getKey())) {
                type = text(node);
            } else if ("parameters".equals(entry.getKey()) && node != null && node.isObject()) {
                node.fields().forEachRemaining(p -> putText(parameters, p.getKey(), p.getValue()));
            } else {
                putText(parameters, entry.getKey(), node);
            }
        }
        return new Action(type, parameters);
    }

    private static void putText(Map<String, String> parameters, String key, JsonNode node) {
        String value = text(node);
        if (value != null) {
            parameters.put(key, value);
        }
    }

    /** Scalars become their text form; JSON null or a missing node becomes {@code null}. */
    static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
