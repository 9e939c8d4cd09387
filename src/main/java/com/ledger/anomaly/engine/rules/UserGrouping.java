package com.ledger.anomaly.engine.rules;

import com.ledger.anomaly.model.LineItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class UserGrouping {

    static final String UNKNOWN_USER = "UNKNOWN";

    private UserGrouping() {
    }

    /**
     * Groups items by user id in first-seen order. Items without a user share one group.
     */
    static Map<String, List<LineItem>> byUser(List<LineItem> items) {
        Map<String, List<LineItem>> byUser = new LinkedHashMap<>();
        for (LineItem item : items) {
            byUser.computeIfAbsent(userKey(item), k -> new ArrayList<>()).add(item);
        }
        return byUser;
    }

    static String userKey(LineItem item) {
        String userId = item.getUserId();
        return userId == null || userId.isBlank() ? UNKNOWN_USER : userId;
    }

    static String userName(LineItem item) {
        String name = item.getUserName();
        return name == null || name.isBlank() ? userKey(item) : name;
    }

    static double totalAbsAmount(List<LineItem> items) {
        double total = 0;
        for (LineItem item : items) {
            total += item.getAbsAmount();
        }
        return total;
    }
}
