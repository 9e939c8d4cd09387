package com.ledger.anomaly.engine;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.config.MetricsConfig;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.BehavioralMatch;
import com.ledger.anomaly.model.DetectionDiagnostic;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every enabled pattern rule over every account group.
 * Uses the Strategy pattern: each AnomalyType is handled by a registered PatternRule.
 * A rule that throws for one account is recorded as a diagnostic and the remaining
 * rules and accounts still run.
 */
@Component
public class PatternRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(PatternRuleEngine.class);

    // Emission order of the unified anomaly list
    private static final List<AnomalyType> EXECUTION_ORDER = List.of(
            AnomalyType.AFTER_HOURS_POSTING,
            AnomalyType.WEEKEND_POSTING,
            AnomalyType.SAME_DAY_REVERSAL,
            AnomalyType.ROUND_NUMBER_PATTERN,
            AnomalyType.DUPLICATE_ENTRY);

    private final Map<AnomalyType, PatternRule> rules;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public PatternRuleEngine(List<PatternRule> patternRules, Tracer tracer, MetricsConfig metricsConfig) {
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        Map<AnomalyType, PatternRule> byType = new EnumMap<>(AnomalyType.class);
        for (PatternRule rule : patternRules) {
            byType.put(rule.getSupportedType(), rule);
            log.info("Registered pattern rule: {} -> {}",
                    rule.getSupportedType(), rule.getClass().getSimpleName());
        }

        Map<AnomalyType, PatternRule> ordered = new LinkedHashMap<>();
        for (AnomalyType type : EXECUTION_ORDER) {
            if (byType.containsKey(type)) {
                ordered.put(type, byType.remove(type));
            }
        }
        ordered.putAll(byType);
        this.rules = ordered;
    }

    /**
     * True when any enabled rule needs a calendar context under this configuration.
     */
    public boolean requiresCalendar(DetectionConfig config) {
        return rules.values().stream()
                .anyMatch(rule -> rule.requiresCalendar() && rule.isEnabled(config));
    }

    public Outcome evaluateAll(AccountIndex index, DetectionConfig config, CalendarContext calendar) {
        Outcome outcome = new Outcome();

        for (PatternRule rule : rules.values()) {
            if (!rule.isEnabled(config)) {
                continue;
            }

            Span ruleSpan = tracer.nextSpan()
                    .name("pattern.evaluate." + rule.getSupportedType())
                    .tag("rule.type", rule.getSupportedType().name())
                    .tag("rule.accounts", String.valueOf(index.accounts().size()))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                int found = 0;
                for (String glAccount : index.accounts()) {
                    RuleContext context = RuleContext.builder()
                            .glAccount(glAccount)
                            .lineItems(index.items(glAccount))
                            .config(config)
                            .calendar(calendar)
                            .build();
                    try {
                        List<BehavioralMatch> matches = rule.evaluate(context);
                        outcome.matches.addAll(matches);
                        found += matches.size();
                    } catch (Exception e) {
                        ruleSpan.error(e);
                        metricsConfig.recordRuleFailure(rule.getSupportedType().name());
                        log.error("Error evaluating pattern rule {} for GL account {}: {}",
                                rule.getSupportedType(), glAccount, e.getMessage(), e);
                        outcome.diagnostics.add(DetectionDiagnostic.builder()
                                .source(rule.getSupportedType().name())
                                .glAccount(glAccount)
                                .message(e.getClass().getSimpleName() + ": " + e.getMessage())
                                .build());
                    }
                }
                ruleSpan.tag("rule.matches", String.valueOf(found));
            } finally {
                ruleSpan.end();
            }
        }

        return outcome;
    }

    /**
     * Matches from all rules in emission order, plus diagnostics for rules that failed.
     */
    public static class Outcome {
        private final List<BehavioralMatch> matches = new ArrayList<>();
        private final List<DetectionDiagnostic> diagnostics = new ArrayList<>();

        public List<BehavioralMatch> getMatches() {
            return matches;
        }

        public List<DetectionDiagnostic> getDiagnostics() {
            return diagnostics;
        }
    }
}
