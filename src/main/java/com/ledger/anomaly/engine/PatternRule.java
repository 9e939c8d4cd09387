package com.ledger.anomaly.engine;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.BehavioralMatch;

import java.util.List;

/**
 * Interface for rule-based posting pattern checks.
 * Each implementation emits matches of exactly one AnomalyType.
 */
public interface PatternRule {

    /**
     * The anomaly type this rule produces.
     */
    AnomalyType getSupportedType();

    /**
     * Whether the rule runs under the given configuration. Disabling one rule never
     * affects another.
     */
    boolean isEnabled(DetectionConfig config);

    /**
     * Whether the rule needs posting timestamps resolved through a {@link CalendarContext}.
     */
    default boolean requiresCalendar() {
        return true;
    }

    /**
     * Evaluate the rule against one account's line items.
     *
     * @param context the account's items, the run configuration and calendar
     * @return matches in a deterministic order, empty when nothing was found
     */
    List<BehavioralMatch> evaluate(RuleContext context);
}
