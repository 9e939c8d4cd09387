package com.ledger.anomaly.engine;

import com.ledger.anomaly.exception.MalformedLineItemException;
import com.ledger.anomaly.model.LineItem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects a fetched batch when any line item lacks a field the detectors key on.
 * All problems are collected before failing.
 */
@Component
public class LineItemValidator {

    private static final int MAX_REPORTED = 50;

    public void validate(List<LineItem> lineItems) {
        List<String> problems = new ArrayList<>();
        for (int i = 0; i < lineItems.size(); i++) {
            LineItem item = lineItems.get(i);
            if (item == null) {
                problems.add("#" + i + ": null line item");
                continue;
            }
            List<String> missing = new ArrayList<>();
            if (isBlank(item.getDocumentNumber())) missing.add("documentNumber");
            if (isBlank(item.getGlAccount())) missing.add("glAccount");
            if (isBlank(item.getFiscalYear())) missing.add("fiscalYear");
            if (isBlank(item.getFiscalPeriod())) missing.add("fiscalPeriod");
            if (item.getPostingDate() == null) missing.add("postingDate");
            if (isBlank(item.getCurrency())) missing.add("currency");
            if (Double.isNaN(item.getAmount()) || Double.isInfinite(item.getAmount())) missing.add("amount");

            if (!missing.isEmpty()) {
                String ref = isBlank(item.getDocumentNumber()) ? "#" + i : item.getDocumentNumber();
                problems.add(ref + ": missing or invalid " + String.join(", ", missing));
            }
        }

        if (!problems.isEmpty()) {
            int total = problems.size();
            List<String> reported = new ArrayList<>(problems.subList(0, Math.min(MAX_REPORTED, total)));
            if (total > MAX_REPORTED) {
                reported.add("... and " + (total - MAX_REPORTED) + " more");
            }
            throw new MalformedLineItemException(reported);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
