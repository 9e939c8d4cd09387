package com.ledger.anomaly.engine.rules;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.engine.CalendarContext;
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
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Clusters likely duplicate entries within an account.
 *
 * Greedy, in batch order: each unclaimed item seeds a cluster and claims every later
 * unclaimed item whose absolute amount is within amountTolerance of the seed's and
 * whose posting is within timeWindow hours. Only clusters of two or more are reported.
 */
@Component
public class DuplicateEntryRule implements PatternRule {

    private static final double CONFIDENCE = 90.0;

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.DUPLICATE_ENTRY;
    }

    @Override
    public boolean isEnabled(DetectionConfig config) {
        return config.getDuplicateDetection().isEnabled();
    }

    @Override
    public List<BehavioralMatch> evaluate(RuleContext context) {
        DetectionConfig.DuplicateDetection config = context.getConfig().getDuplicateDetection();
        CalendarContext calendar = context.getCalendar();
        List<LineItem> items = context.getLineItems();
        boolean[] claimed = new boolean[items.size()];

        List<BehavioralMatch> matches = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (claimed[i]) continue;
            LineItem seed = items.get(i);

            List<LineItem> cluster = new ArrayList<>();
            cluster.add(seed);
            for (int j = i + 1; j < items.size(); j++) {
                if (claimed[j]) continue;
                LineItem candidate = items.get(j);
                if (isDuplicate(seed, candidate, config, calendar)) {
                    cluster.add(candidate);
                    claimed[j] = true;
                }
            }
            if (cluster.size() < 2) continue;
            claimed[i] = true;

            double total = UserGrouping.totalAbsAmount(cluster);
            Severity severity = severity(cluster.size(), total);

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("duplicateCount", cluster.size());
            evidence.put("amount", seed.getAbsAmount());
            evidence.put("totalAmount", total);
            evidence.put("description", seed.getDescription());
            evidence.put("documentNumbers", cluster.stream()
                    .map(LineItem::getDocumentNumber)
                    .collect(Collectors.toList()));

            matches.add(BehavioralMatch.builder()
                    .anomalyType(AnomalyType.DUPLICATE_ENTRY)
                    .key(seed.getDocumentNumber() + "-" + seed.getLineItem())
                    .glAccount(context.getGlAccount())
                    .glAccountName(context.getGlAccountName())
                    .lineItems(List.copyOf(cluster))
                    .severity(severity)
                    .score(Math.min(100.0, cluster.size() * 25.0))
                    .confidence(CONFIDENCE)
                    .description(String.format("%d duplicate entries detected (total: %,.2f %s)",
                            cluster.size(), total, seed.getCurrency()))
                    .recommendation(severity == Severity.CRITICAL
                            ? "URGENT: Investigate for duplicate payment or data entry error"
                            : "Review and remove duplicate entries")
                    .evidence(evidence)
                    .build());
        }
        return matches;
    }

    static boolean isDuplicate(LineItem seed, LineItem candidate,
                               DetectionConfig.DuplicateDetection config, CalendarContext calendar) {
        double amountDiff = Math.abs(seed.getAbsAmount() - candidate.getAbsAmount());
        if (amountDiff > seed.getAbsAmount() * config.getAmountTolerance()) {
            return false;
        }
        if (calendar.hoursBetween(seed, candidate) > config.getTimeWindow()) {
            return false;
        }
        return !config.isRequireSameDescription()
                || Objects.equals(seed.getDescription(), candidate.getDescription());
    }

    static Severity severity(int size, double total) {
        if (size > 3 || total > 100_000) return Severity.CRITICAL;
        if (size > 2 || total > 50_000) return Severity.HIGH;
        return Severity.MEDIUM;
    }
}
