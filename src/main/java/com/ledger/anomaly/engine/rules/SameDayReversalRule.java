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
 * Detects documents reversed shortly after posting.
 *
 * A reversal item points at its original through reversalDocumentNumber; the original
 * must be a non-reversal item in the same account posted no more than
 * sameDayReversalWindow hours away. Reversals whose original is not in the batch are
 * ignored.
 */
@Component
public class SameDayReversalRule implements PatternRule {

    private static final double CONFIDENCE = 100.0;
    private static final double LARGE_AMOUNT = 50_000;

    @Override
    public AnomalyType getSupportedType() {
        return AnomalyType.SAME_DAY_REVERSAL;
    }

    @Override
    public boolean isEnabled(DetectionConfig config) {
        DetectionConfig.BehavioralAnomalies behavioral = config.getBehavioralAnomalies();
        return behavioral.isEnabled() && behavioral.isCheckReversals();
    }

    @Override
    public List<BehavioralMatch> evaluate(RuleContext context) {
        double window = context.getConfig().getBehavioralAnomalies().getSameDayReversalWindow();

        // First non-reversal item per document number
        Map<String, LineItem> originals = new LinkedHashMap<>();
        for (LineItem item : context.getLineItems()) {
            if (!item.isReversal() && item.getDocumentNumber() != null) {
                originals.putIfAbsent(item.getDocumentNumber(), item);
            }
        }

        List<BehavioralMatch> matches = new ArrayList<>();
        for (LineItem reversal : context.getLineItems()) {
            if (!reversal.isReversalEntry() || reversal.getReversalDocumentNumber() == null) {
                continue;
            }
            LineItem original = originals.get(reversal.getReversalDocumentNumber());
            if (original == null || original == reversal) {
                continue;
            }

            double hours = context.getCalendar().hoursBetween(original, reversal);
            if (hours > window) {
                continue;
            }

            Severity severity = Severity.MEDIUM;
            if (original.getAbsAmount() > LARGE_AMOUNT || hours < 1) {
                severity = Severity.HIGH;
            }

            Map<String, Object> evidence = new LinkedHashMap<>();
            evidence.put("originalDocument", original.getDocumentNumber());
            evidence.put("reversalDocument", reversal.getDocumentNumber());
            evidence.put("amount", original.getAbsAmount());
            evidence.put("hoursBetweenPostings", hours);
            evidence.put("userId", UserGrouping.userKey(original));
            evidence.put("userName", UserGrouping.userName(original));

            matches.add(BehavioralMatch.builder()
                    .anomalyType(AnomalyType.SAME_DAY_REVERSAL)
                    .key(original.getDocumentNumber() + "-" + reversal.getDocumentNumber())
                    .glAccount(context.getGlAccount())
                    .glAccountName(context.getGlAccountName())
                    .lineItems(List.of(original, reversal))
                    .severity(severity)
                    .score(Math.min(100.0, 70 + (window - hours) * 2))
                    .confidence(CONFIDENCE)
                    .description(String.format("Document %s reversed within %.1f hours (amount: %,.2f %s)",
                            original.getDocumentNumber(), hours, original.getAbsAmount(), original.getCurrency()))
                    .recommendation(hours < 1
                            ? "URGENT: Investigate immediate reversal - possible error or manipulation"
                            : "Review business reason for same-day reversal")
                    .evidence(evidence)
                    .build());
        }
        return matches;
    }
}
