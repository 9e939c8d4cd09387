package com.ledger.anomaly.engine;

import com.ledger.anomaly.model.LineItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Line items partitioned by GL account in a single pass. Accounts keep first-seen
 * order and items keep batch order, so every detector sees the same partition.
 */
public final class AccountIndex {

    private final Map<String, List<LineItem>> byAccount;
    private final int totalItems;

    private AccountIndex(Map<String, List<LineItem>> byAccount, int totalItems) {
        this.byAccount = byAccount;
        this.totalItems = totalItems;
    }

    public static AccountIndex of(List<LineItem> lineItems) {
        Map<String, List<LineItem>> groups = new LinkedHashMap<>();
        for (LineItem item : lineItems) {
            groups.computeIfAbsent(item.getGlAccount(), k -> new ArrayList<>()).add(item);
        }
        Map<String, List<LineItem>> frozen = new LinkedHashMap<>();
        groups.forEach((account, items) -> frozen.put(account, Collections.unmodifiableList(items)));
        return new AccountIndex(Collections.unmodifiableMap(frozen), lineItems.size());
    }

    public Set<String> accounts() {
        return byAccount.keySet();
    }

    public List<LineItem> items(String glAccount) {
        return byAccount.getOrDefault(glAccount, Collections.emptyList());
    }

    public Map<String, List<LineItem>> asMap() {
        return byAccount;
    }

    public int totalItems() {
        return totalItems;
    }

    public boolean isEmpty() {
        return totalItems == 0;
    }
}
