package com.mailrules.compiler;

import com.mailrules.api.exceptions.RuleLoadException;
import com.mailrules.api.model.Action;
import com.mailrules.api.model.Condition;
import com.mailrules.api.model.ConditionsPredicate;
import com.mailrules.api.model.Rule;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleLoaderTest {

    @TempDir
    Path tempDir;

    private RuleLoader loader;

    @BeforeEach
    void setUp() {
        loader = new RuleLoader(OpenTelemetry.noop().getTracer("test"));
    }

    private Path writeRules(String json) throws IOException {
        Path rulesFile = tempDir.resolve("rules.json");
        Files.writeString(rulesFile, json);
        return rulesFile;
    }

    @Test
    @DisplayName("Should load the bundled rules file")
    void loadsRulesFile() throws URISyntaxException {
        Path path = Path.of(Objects.requireNonNull(getClass().getResource("/rules.json")).toURI());

        List<Rule> rules = loader.load(path);

        assertThat(rules).hasSize(3);
        Rule first = rules.get(0);
        assertThat(first.description()).isEqualTo("Archive interview mails from tenmiles");
        assertThat(first.policy()).isEqualTo(ConditionsPredicate.ALL);
        assertThat(first.conditions()).containsExactly(
                new Condition("From", "contains", "tenmiles.com"),
                new Condition("Subject", "contains", "Interview"),
                new Condition("Date Received", "less_than_days", "2"));
        assertThat(first.actions()).containsExactly(
                new Action("move_message", Map.of("mailbox", "Archive")),
                new Action("mark_as_read", Map.of()));

        assertThat(rules.get(1).policy()).isEqualTo(ConditionsPredicate.ANY);
        assertThat(rules.get(2).conditionsPredicate()).isEqualTo("all");
        assertThat(rules.get(2).actions().get(0).parameter(Action.LABEL_NAME)).contains("Old");
    }

    @Test
    @DisplayName("Should keep malformed conditions with an absent value")
    void keepsMalformedConditions() throws IOException {
        Path rulesFile = writeRules("""
                [
                  {
                    "description": "broken",
                    "conditions": [
                      {"field": "subject", "predicate": "contains", "value": null},
                      {"field": "subject", "predicate": "contains"},
                      {"field": "subject", "predicate": "equals", "value": true}
                    ],
                    "actions": []
                  }
                ]
                """);

        List<Condition> conditions = loader.load(rulesFile).get(0).conditions();

        assertThat(conditions).hasSize(3);
        assertThat(conditions.get(0).isWellFormed()).isFalse();
        assertThat(conditions.get(1).value()).isNull();
        assertThat(conditions.get(2).value()).isEqualTo("true");
    }

    @Test
    @DisplayName("Should return an empty list for an empty array")
    void emptyArray() throws IOException {
        assertThat(loader.load(writeRules("[]"))).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-array root")
    void rejectsObjectRoot() throws IOException {
        Path rulesFile = writeRules("{\"description\": \"not a list\"}");

        assertThatThrownBy(() -> loader.load(rulesFile))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("JSON array");
    }

    @Test
    @DisplayName("Should reject non-array conditions")
    void rejectsNonArrayConditions() throws IOException {
        Path rulesFile = writeRules("[{\"description\": \"x\", \"conditions\": \"subject\"}]");

        assertThatThrownBy(() -> loader.load(rulesFile))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("non-array 'conditions'");
    }

    @Test
    @DisplayName("Should reject invalid JSON")
    void rejectsInvalidJson() throws IOException {
        Path rulesFile = writeRules("[{\"description\": ");

        assertThatThrownBy(() -> loader.load(rulesFile))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("Invalid JSON");
    }

    @Test
    @DisplayName("Should reject a missing file")
    void rejectsMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("absent.json")))
                .isInstanceOf(RuleLoadException.class)
                .hasMessageContaining("not found");
    }
}
