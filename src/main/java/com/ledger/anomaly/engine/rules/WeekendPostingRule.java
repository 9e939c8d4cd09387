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

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flags postings dated Saturday or Sunday in the business time zone, one match per user.
 *
 * Severity: HIGH above 15 postings or 100k total, MEDIUM above 8 or 50k, else LOW.
 * Score is 4 per posting, capped at 100.
 */
@Component
public class WeekendPostingRule implements PatternRule {

    private static final double CONFIDENCE = 90.0;

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.WEEKEND_POSTING;
    }

    @Override
    public boolean isEnabled(DetectionConfig config) {
        DetectionConfig.BehavioralAnomalies behavioral = config.getBehavioralAnomalies();
        return behavioral.isEnabled() && behavioral.isCheckWeekends();
    }

    @Override
    public List<BehavioralMatch> evaluate(RuleContext context) {
        CalendarContext calendar = context.getCalendar();

        List<LineItem> weekend = new ArrayList<>();
        for (LineItem item : context.getLineItems()) {
            if (isWeekend(calendar.businessDayOfWeek(item))) {
                weekend.add(item);
            }
        }
        if (weekend.isEmpty()) {
            return List.of();
        }

        List<BehavioralMatch> matches = new ArrayList<>();
        for (Map.Entry<String, List<LineItem>> entry : UserGrouping.byUser(weekend).entrySet()) {
            List<LineItem> items = entry.getValue();
            double total = UserGrouping.totalAbsAmount(items);
            Severity severity = severity(items.size(), total);
            String userName = UserGrouping.userName(items.get(0));

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("userId", entry.getKey());
            evidence.put("userName", userName);
            evidence.put("postingCount", items.size());
            evidence.put("totalAmount", total);
            evidence.put("dates", items.stream()
                    .map(i -> calendar.businessDate(i).toString())
                    .collect(Collectors.toList()));

            matches.add(BehavioralMatch.builder()
                    .anomalyType(AnomalyType.WEEKEND_POSTING)
                    .key(entry.getKey())
                    .glAccount(context.getGlAccount())
                    .glAccountName(context.getGlAccountName())
                    .lineItems(List.copyOf(items))
                    .severity(severity)
                    .score(Math.min(100.0, items.size() * 4.0))
                    .confidence(CONFIDENCE)
                    .description(String.format("User %s made %d posting(s) on weekends (total: %,.2f %s)",
                            userName, items.size(), total, context.getCurrency()))
                    .recommendation("Review weekend activity for business justification")
                    .evidence(evidence)
                    .build());
        }
        return matches;
    }

    static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }

    static Severity severity(int count, double total) {
        if (count > 15 || total > 100_000) return Severity.HIGH;
        if (count > 8 || total > 50_000) return Severity.MEDIUM;
        return Severity.LOW;
    }
}
