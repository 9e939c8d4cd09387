package com.ledger.anomaly.engine;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.model.LineItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a pattern rule sees for one account.
 */
@Value
@Builder
public class RuleContext {

    String glAccount;
    List<LineItem> lineItems;
    DetectionConfig config;

    // Null only when no enabled rule requires one
    CalendarContext calendar;

    public String getGlAccountName() {
        if (lineItems.isEmpty() || lineItems.get(0).getGlAccountName() == null) return "";
        return lineItems.get(0).getGlAccountName();
    }

    public String getCurrency() {
        return lineItems.isEmpty() ? "" : lineItems.get(0).getCurrency();
    }
}
