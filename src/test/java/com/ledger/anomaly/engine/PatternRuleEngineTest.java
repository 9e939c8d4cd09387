package com.ledger.anomaly.engine;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.config.MetricsConfig;
import com.ledger.anomaly.engine.rules.DuplicateEntryRule;
import com.ledger.anomaly.engine.rules.RoundNumberPatternRule;
import com.ledger.anomaly.engine.rules.WeekendPostingRule;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.BehavioralMatch;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternRuleEngineTest {

    private SimpleMeterRegistry registry;
    private DetectionConfig config;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        config = TestDataFactory.createConfig();
    }

    @Test
    void evaluateAll_failingRuleIsolated_otherRulesStillRun() {
        PatternRule failing = new PatternRule() {
            @Override
            public AnomalyType getSupportedType() {
                return AnomalyType.AFTER_HOURS_POSTING;
            }

            @Override
            public boolean isEnabled(DetectionConfig config) {
                return true;
            }

            @Override
            public List<BehavioralMatch> evaluate(RuleContext context) {
                throw new IllegalStateException("boom");
            }
        };
        PatternRuleEngine engine = engine(List.of(failing, new DuplicateEntryRule()));

        AccountIndex index = AccountIndex.of(List.of(
                TestDataFactory.createLineItem("D1", "210000", 4200),
                TestDataFactory.createLineItem("D2", "210000", 4200)));

        PatternRuleEngine.Outcome outcome = engine.evaluateAll(index, config, CalendarContext.of(ZoneOffset.UTC));

        assertThat(outcome.getMatches()).extracting(BehavioralMatch::getAnomalyType)
                .containsExactly(AnomalyType.DUPLICATE_ENTRY);
        assertThat(outcome.getDiagnostics()).hasSize(1);
        assertThat(outcome.getDiagnostics().get(0).getSource()).isEqualTo("AFTER_HOURS_POSTING");
        assertThat(outcome.getDiagnostics().get(0).getGlAccount()).isEqualTo("210000");
        assertThat(registry.get("gl.detection.rule_failures").tag("rule", "AFTER_HOURS_POSTING").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void evaluateAll_emitsInFixedRuleOrder() {
        // Registered out of order
        PatternRuleEngine engine = engine(List.of(new DuplicateEntryRule(), new WeekendPostingRule()));
        LocalDate saturday = LocalDate.of(2024, 4, 13);
        List<LineItem> items = List.of(
                TestDataFactory.postedAt("D1", "210000", 4200, saturday, LocalTime.of(9, 0)),
                TestDataFactory.postedAt("D2", "210000", 4200, saturday, LocalTime.of(10, 0)));

        PatternRuleEngine.Outcome outcome = engine.evaluateAll(AccountIndex.of(items), config,
                CalendarContext.of(ZoneOffset.UTC));

        assertThat(outcome.getMatches()).extracting(BehavioralMatch::getAnomalyType)
                .containsExactly(AnomalyType.WEEKEND_POSTING, AnomalyType.DUPLICATE_ENTRY);
    }

    @Test
    void requiresCalendar_onlyWhenCalendarRuleEnabled() {
        PatternRuleEngine engine = engine(List.of(new RoundNumberPatternRule(), new WeekendPostingRule()));

        assertThat(engine.requiresCalendar(config)).isTrue();

        config.getBehavioralAnomalies().setEnabled(false);
        assertThat(engine.requiresCalendar(config)).isFalse();
    }

    @Test
    void evaluateAll_disabledRuleSkipped() {
        PatternRuleEngine engine = engine(List.of(new DuplicateEntryRule()));
        config.getDuplicateDetection().setEnabled(false);

        AccountIndex index = AccountIndex.of(List.of(
                TestDataFactory.createLineItem("D1", "210000", 4200),
                TestDataFactory.createLineItem("D2", "210000", 4200)));

        assertThat(engine.evaluateAll(index, config, null).getMatches()).isEmpty();
    }

    private PatternRuleEngine engine(List<PatternRule> rules) {
        return new PatternRuleEngine(rules, Tracer.NOOP, new MetricsConfig(registry));
    }
}
