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
import java.util.stream.Collectors;

/**
 * Flags postings made outside business hours, one match per user within the account.
 *
 * The window runs from afterHoursStart (inclusive) to afterHoursEnd (exclusive) in the
 * business time zone and wraps midnight when start is later than end. Items without a
 * posting time are never after-hours.
 *
 * Severity: CRITICAL above 20 postings or 100k total, HIGH above 10 or 50k,
 * MEDIUM above 5 or 10k. Score is 5 per posting, capped at 100.
 */
@Component
public class AfterHoursPostingRule implements PatternRule {

    private static final double CONFIDENCE = 95.0;

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.AFTER_HOURS_POSTING;
    }

    @Override
    public boolean isEnabled(DetectionConfig config) {
        DetectionConfig.BehavioralAnomalies behavioral = config.getBehavioralAnomalies();
        return behavioral.isEnabled() && behavioral.isCheckAfterHours();
    }

    @Override
    public List<BehavioralMatch> evaluate(RuleContext context) {
        DetectionConfig.BehavioralAnomalies behavioral = context.getConfig().getBehavioralAnomalies();
        CalendarContext calendar = context.getCalendar();

        List<LineItem> afterHours = new ArrayList<>();
        for (LineItem item : context.getLineItems()) {
            int hour = calendar.businessHour(item);
            if (hour >= 0 && isAfterHours(hour, behavioral.getAfterHoursStart(), behavioral.getAfterHoursEnd())) {
                afterHours.add(item);
            }
        }
        if (afterHours.isEmpty()) {
            return List.of();
        }

        List<BehavioralMatch> matches = new ArrayList<>();
        for (Map.Entry<String, List<LineItem>> entry : UserGrouping.byUser(afterHours).entrySet()) {
            List<LineItem> items = entry.getValue();
            double total = UserGrouping.totalAbsAmount(items);
            Severity severity = severity(items.size(), total);
            String userName = UserGrouping.userName(items.get(0));

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("userId", entry.getKey());
            evidence.put("userName", userName);
            evidence.put("postingCount", items.size());
            evidence.put("totalAmount", total);
            evidence.put("postingTimes", items.stream()
                    .map(i -> i.getPostingTime().toString())
                    .collect(Collectors.toList()));

            matches.add(BehavioralMatch.builder()
                    .anomalyType(AnomalyType.AFTER_HOURS_POSTING)
                    .key(entry.getKey())
                    .glAccount(context.getGlAccount())
                    .glAccountName(context.getGlAccountName())
                    .lineItems(List.copyOf(items))
                    .severity(severity)
                    .score(Math.min(100.0, items.size() * 5.0))
                    .confidence(CONFIDENCE)
                    .description(String.format("User %s made %d posting(s) after hours (total: %,.2f %s)",
                            userName, items.size(), total, context.getCurrency()))
                    .recommendation(severity.isAtLeast(Severity.HIGH)
                            ? "Investigate urgently - high volume of after-hours activity may indicate unauthorized access"
                            : "Review with user to ensure legitimate business reason")
                    .evidence(evidence)
                    .build());
        }
        return matches;
    }

    static boolean isAfterHours(int hour, int start, int end) {
        if (start > end) {
            return hour >= start || hour < end;
        }
        return hour >= start && hour < end;
    }

    static Severity severity(int count, double total) {
        if (count > 20 || total > 100_000) return Severity.CRITICAL;
        if (count > 10 || total > 50_000) return Severity.HIGH;
        if (count > 5 || total > 10_000) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
