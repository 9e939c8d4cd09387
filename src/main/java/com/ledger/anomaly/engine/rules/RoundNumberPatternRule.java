package com.ledger.anomaly.engine.rules;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.engine.PatternRule;
import com.ledger.anomaly.engine.RuleContext;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.BehavioralMatch;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detects an unusual share of round amounts in an account, a common sign of estimates
 * or fabricated entries. An amount is round when it is an exact multiple of one of
 * the configured thresholds.
 */
@Component
public class RoundNumberPatternRule implements PatternRule {

    private static final double CONFIDENCE = 75.0;
    private static final int MAX_EXAMPLES = 5;

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.ROUND_NUMBER_PATTERN;
    }

    @Override
    public boolean isEnabled(DetectionConfig config) {
        return config.getRoundNumbers().isEnabled();
    }

    @Override
    public boolean requiresCalendar() {
        return false;
    }

    @Override
    public List<BehavioralMatch> evaluate(RuleContext context) {
        DetectionConfig.RoundNumbers config = context.getConfig().getRoundNumbers();
        List<LineItem> all = context.getLineItems();

        List<LineItem> round = new ArrayList<>();
        for (LineItem item : all) {
            if (isRound(item.getAbsAmount(), config.getThresholds())) {
                round.add(item);
            }
        }
        if (round.isEmpty() || round.size() < config.getMinOccurrences()) {
            return List.of();
        }

        double total = UserGrouping.totalAbsAmount(round);
        double share = (double) round.size() / all.size() * 100.0;
        Severity severity = severity(share, round.size());

        List<Map<String, Object>> examples = new ArrayList<>();
        for (LineItem item : round.subList(0, Math.min(MAX_EXAMPLES, round.size()))) {
            Map<String, Object> example = new LinkedHashMap<>();
            example.put("documentNumber", item.getDocumentNumber());
            example.put("amount", item.getAmount());
            example.put("date", item.getPostingDate().toString());
            examples.add(example);
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("roundNumberCount", round.size());
        evidence.put("totalTransactions", all.size());
        evidence.put("percentage", share);
        evidence.put("totalAmount", total);
        evidence.put("thresholds", List.copyOf(config.getThresholds()));
        evidence.put("examples", examples);

        return List.of(BehavioralMatch.builder()
                .anomalyType(AnomalyType.ROUND_NUMBER_PATTERN)
                .key("ROUND")
                .glAccount(context.getGlAccount())
                .glAccountName(context.getGlAccountName())
                .lineItems(List.copyOf(round))
                .severity(severity)
                .score(Math.min(100.0, share * 2))
                .confidence(CONFIDENCE)
                .description(String.format(
                        "%d transactions (%.1f%%) have suspiciously round amounts (total: %,.2f %s)",
                        round.size(), share, total, context.getCurrency()))
                .recommendation(severity.isAtLeast(Severity.HIGH)
                        ? "URGENT: Investigate for potential estimation fraud or manipulation"
                        : "Review for legitimate business reasons (e.g., budget allocations)")
                .evidence(evidence)
                .build());
    }

    static boolean isRound(double absAmount, List<Double> thresholds) {
        if (absAmount == 0) return false;
        for (Double threshold : thresholds) {
            if (threshold != null && threshold > 0 && absAmount % threshold == 0) {
                return true;
            }
        }
        return false;
    }

    static Severity severity(double share, int count) {
        if (share > 30 && count > 20) return Severity.CRITICAL;
        if (share > 20 || count > 15) return Severity.HIGH;
        if (share > 10 || count > 10) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
