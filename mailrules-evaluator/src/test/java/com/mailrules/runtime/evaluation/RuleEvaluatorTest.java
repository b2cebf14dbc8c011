package com.mailrules.runtime.evaluation;

import com.mailrules.api.model.Action;
import com.mailrules.api.model.Condition;
import com.mailrules.api.model.ConditionsPredicate;
import com.mailrules.api.model.MessageRecord;
import com.mailrules.api.model.Rule;
import com.mailrules.api.model.RuleEvaluation;
import com.mailrules.infra.metrics.MetricNames;
import com.mailrules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RuleEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-06-01T09:00:00Z");
    private static final List<Action> ARCHIVE = List.of(Action.of("move_message", Action.MAILBOX, "Archive"));

    private InMemoryMetricsRegistry metrics;
    private RuleEvaluator evaluator;

    private final MessageRecord interview = MessageRecord.builder("msg-1")
            .sender("HR Team <hr@tenmiles.com>")
            .subject("Your Interview Schedule")
            .receivedAt(NOW.minusSeconds(86_400).atOffset(ZoneOffset.UTC).toLocalDateTime())
            .build();

    private final MessageRecord recipients = MessageRecord.builder("msg-2")
            .to("user1@test.com", "user2@example.com")
            .build();

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        evaluator = new RuleEvaluator(Clock.fixed(NOW, ZoneOffset.UTC), metrics);
    }

    private static Condition c(String field, String predicate, String value) {
        return new Condition(field, predicate, value);
    }

    @Nested
    @DisplayName("Reference scenarios")
    class Scenarios {

        @Test
        @DisplayName("A: all conditions hold for a recent interview mail")
        void scenarioA() {
            Rule rule = Rule.all("Interview mails", List.of(
                    c("from_address", "contains", "tenmiles.com"),
                    c("subject", "contains", "Interview"),
                    c("received_datetime", "less_than_days", "2")), ARCHIVE);

            assertThat(evaluator.evaluate(interview, rule)).isTrue();
        }

        @Test
        @DisplayName("B: one failing condition fails an ALL rule")
        void scenarioB() {
            Rule rule = Rule.all("Python jobs", List.of(
                    c("from_address", "contains", "tenmiles.com"),
                    c("subject", "contains", "Python Job")), ARCHIVE);

            assertThat(evaluator.evaluate(interview, rule)).isFalse();
        }

        @Test
        @DisplayName("C: does_not_equal fails when one recipient matches")
        void scenarioC() {
            Rule rule = Rule.all("Not user1", List.of(
                    c("to_addresses", "does_not_equal", "user1@test.com")), ARCHIVE);

            assertThat(evaluator.evaluate(recipients, rule)).isFalse();
        }

        @Test
        @DisplayName("D: does_not_equal holds when no recipient matches")
        void scenarioD() {
            Rule rule = Rule.all("Not nobody", List.of(
                    c("to_addresses", "does_not_equal", "nonexistent@example.com")), ARCHIVE);

            assertThat(evaluator.evaluate(recipients, rule)).isTrue();
        }
    }

    @Nested
    @DisplayName("Aggregation")
    class Aggregation {

        @Test
        @DisplayName("Should match an ANY rule when one condition holds")
        void anyRule() {
            Rule rule = Rule.any("Either", List.of(
                    c("subject", "contains", "Python Job"),
                    c("from", "contains", "tenmiles")), ARCHIVE);

            assertThat(evaluator.evaluate(interview, rule)).isTrue();
        }

        @Test
        @DisplayName("Should not match an ANY rule when no condition holds")
        void anyRuleNoMatch() {
            Rule rule = Rule.any("Neither", List.of(
                    c("subject", "contains", "Python Job"),
                    c("from", "contains", "example.org")), ARCHIVE);

            assertThat(evaluator.evaluate(interview, rule)).isFalse();
        }

        @ParameterizedTest
        @ValueSource(strings = {"all", "any", "ANY", "bogus"})
        @DisplayName("Should never match a rule without conditions")
        void emptyConditions(String policy) {
            Rule rule = new Rule("Empty", policy, List.of(), ARCHIVE);

            RuleEvaluation evaluation = evaluator.explain(interview, rule);

            assertThat(evaluation.matched()).isFalse();
            assertThat(evaluation.outcomes()).isEmpty();
            assertThat(evaluation.diagnostic()).contains("no conditions");
        }

        @Test
        @DisplayName("Should log a rule without conditions at FINE only")
        void emptyConditionsLoggedQuietly() {
            Logger logger = Logger.getLogger(RuleEvaluator.class.getName());
            List<LogRecord> records = new CopyOnWriteArrayList<>();
            Handler capture = new Handler() {
                @Override
                public void publish(LogRecord record) {
                    records.add(record);
                }

                @Override
                public void flush() {
                }

                @Override
                public void close() {
                }
            };
            capture.setLevel(Level.ALL);
            Level previous = logger.getLevel();
            logger.setLevel(Level.FINE);
            logger.addHandler(capture);
            try {
                evaluator.explain(interview, Rule.all("Empty", List.of(), ARCHIVE));
                evaluator.explain(recipients, Rule.all("Empty", List.of(), ARCHIVE));
            } finally {
                logger.removeHandler(capture);
                logger.setLevel(previous);
            }

            assertThat(records)
                    .filteredOn(r -> r.getMessage().contains("no conditions"))
                    .hasSize(2)
                    .allMatch(r -> r.getLevel() == Level.FINE);
        }

        @Test
        @DisplayName("Should fall back to ALL for an unknown policy")
        void unknownPolicy() {
            Rule rule = new Rule("Odd", "most", List.of(
                    c("subject", "contains", "Interview"),
                    c("subject", "contains", "Python")), ARCHIVE);

            RuleEvaluation evaluation = evaluator.explain(interview, rule);

            assertThat(evaluation.policy()).isEqualTo(ConditionsPredicate.ALL);
            assertThat(evaluation.matched()).isFalse();
            assertThat(evaluation.diagnostic()).contains("most");
        }

        @Test
        @DisplayName("Should default a missing policy to ALL")
        void missingPolicy() {
            Rule rule = new Rule("Default", null, List.of(c("subject", "contains", "Interview")), ARCHIVE);

            assertThat(evaluator.explain(interview, rule).policy()).isEqualTo(ConditionsPredicate.ALL);
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class Failures {

        @Test
        @DisplayName("Should demote only the failing condition in an ANY rule")
        void failingConditionInAnyRule() {
            Rule rule = Rule.any("Mixed", List.of(
                    c("attachment", "contains", "pdf"),
                    c("subject", "contains", "Interview")), ARCHIVE);

            RuleEvaluation evaluation = evaluator.explain(interview, rule);

            assertThat(evaluation.matched()).isTrue();
            assertThat(evaluation.errorCount()).isEqualTo(1);
            assertThat(evaluation.outcomes().get(0).hasError()).isTrue();
            assertThat(evaluation.outcomes().get(1).matched()).isTrue();
        }

        @Test
        @DisplayName("Should evaluate every condition even after a failure")
        void evaluatesAllConditions() {
            Rule rule = Rule.all("Trace", List.of(
                    c("subject", "contains", "Python"),
                    c("subject", "contains", "Interview"),
                    c("from", "contains", "tenmiles")), ARCHIVE);

            RuleEvaluation evaluation = evaluator.explain(interview, rule);

            assertThat(evaluation.outcomes()).hasSize(3);
            assertThat(evaluation.outcomes()).extracting(o -> o.matched()).containsExactly(false, true, true);
            assertThat(metrics.getCounterValue(MetricNames.CONDITIONS_EVALUATED)).isEqualTo(3);
        }
    }

    @Test
    @DisplayName("Should read the clock once per rule evaluation")
    void readsClockOnce() {
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(NOW);
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        RuleEvaluator withMockClock = new RuleEvaluator(clock, metrics);

        Rule rule = Rule.all("Two dates", List.of(
                c("received_datetime", "less_than_days", "2"),
                c("received_datetime", "greater_than_days", "0")), ARCHIVE);

        assertThat(withMockClock.evaluate(interview, rule)).isTrue();
        verify(clock, times(1)).instant();
    }

    @Test
    @DisplayName("Should return matching rules in order and count matches")
    void matchingRules() {
        Rule first = Rule.all("first", List.of(c("subject", "contains", "Interview")), ARCHIVE);
        Rule miss = Rule.all("miss", List.of(c("subject", "contains", "Invoice")), ARCHIVE);
        Rule second = Rule.any("second", List.of(c("from", "equals", "hr@tenmiles.com")), ARCHIVE);

        assertThat(evaluator.matchingRules(interview, List.of(first, miss, second)))
                .containsExactly(first, second);
        assertThat(metrics.getCounterValue(MetricNames.RULES_MATCHED)).isEqualTo(2);
    }
}
