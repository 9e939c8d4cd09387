package com.ledger.anomaly.engine.detectors;

import com.ledger.anomaly.engine.CalendarContext;
import com.ledger.anomaly.engine.statistics.Quartiles;
import com.ledger.anomaly.engine.statistics.Statistics;
import com.ledger.anomaly.model.AccountStats;
import com.ledger.anomaly.model.DebitCredit;
import com.ledger.anomaly.model.LineItem;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Baseline statistics for one GL account, computed for every account in a run
 * whether or not anomalies were found.
 */
@Component
public class AccountStatsCalculator {

    static final int TOP_N = 10;
    static final String UNKNOWN = "UNKNOWN";

    /**
     * @param calendar used to place postings on business days and hours; when null the
     *                 recorded posting date and time are used as-is
     */
    public AccountStats calculate(String glAccount, List<LineItem> items, CalendarContext calendar) {
        if (items.isEmpty()) {
            return AccountStats.builder()
                    .glAccount(glAccount)
                    .glAccountName("")
                    .currency("")
                    .postingsByDay(new EnumMap<>(DayOfWeek.class))
                    .postingsByHour(new TreeMap<>())
                    .topUsers(Collections.emptyList())
                    .topDocumentTypes(Collections.emptyList())
                    .build();
        }

        double[] amounts = OutlierDetector.absAmounts(items);
        double mean = Statistics.mean(amounts);
        Quartiles quartiles = Statistics.quartiles(amounts);

        double totalDebit = 0.0;
        double totalCredit = 0.0;
        Map<DayOfWeek, Long> byDay = new EnumMap<>(DayOfWeek.class);
        Map<Integer, Long> byHour = new TreeMap<>();
        Map<String, AccountStats.UserActivity> users = new LinkedHashMap<>();
        Map<String, Long> docTypes = new LinkedHashMap<>();

        for (LineItem item : items) {
            if (item.getDebitCredit() == DebitCredit.DEBIT) {
                totalDebit += item.getAmount();
            } else {
                totalCredit += item.getAmount();
            }

            DayOfWeek day = calendar != null
                    ? calendar.businessDayOfWeek(item)
                    : item.getPostingDate().getDayOfWeek();
            byDay.merge(day, 1L, Long::sum);

            if (item.hasPostingTime()) {
                int hour = calendar != null ? calendar.businessHour(item) : item.getPostingTime().getHour();
                byHour.merge(hour, 1L, Long::sum);
            }

            String userId = item.getUserId() != null ? item.getUserId() : UNKNOWN;
            AccountStats.UserActivity activity = users.computeIfAbsent(userId,
                    id -> new AccountStats.UserActivity(id, item.getUserName(), 0));
            activity.setTransactionCount(activity.getTransactionCount() + 1);

            String docType = item.getDocumentType() != null ? item.getDocumentType() : UNKNOWN;
            docTypes.merge(docType, 1L, Long::sum);
        }

        List<AccountStats.UserActivity> topUsers = new ArrayList<>(users.values());
        topUsers.sort((a, b) -> Long.compare(b.getTransactionCount(), a.getTransactionCount()));

        List<AccountStats.DocumentTypeCount> topDocTypes = new ArrayList<>();
        docTypes.forEach((type, count) -> topDocTypes.add(new AccountStats.DocumentTypeCount(type, count)));
        topDocTypes.sort((a, b) -> Long.compare(b.getCount(), a.getCount()));

        LineItem first = items.get(0);
        return AccountStats.builder()
                .glAccount(glAccount)
                .glAccountName(first.getGlAccountName() != null ? first.getGlAccountName() : "")
                .totalTransactions(items.size())
                .totalDebit(totalDebit)
                .totalCredit(totalCredit)
                .netBalance(totalDebit - totalCredit)
                .currency(first.getCurrency())
                .averageAmount(mean)
                .medianAmount(quartiles.getQ2())
                .stdDeviation(Statistics.standardDeviation(amounts, mean))
                .minAmount(Statistics.min(amounts))
                .maxAmount(Statistics.max(amounts))
                .firstQuartile(quartiles.getQ1())
                .thirdQuartile(quartiles.getQ3())
                .iqr(quartiles.getIqr())
                .postingsByDay(byDay)
                .postingsByHour(byHour)
                .topUsers(new ArrayList<>(topUsers.subList(0, Math.min(TOP_N, topUsers.size()))))
                .topDocumentTypes(new ArrayList<>(topDocTypes.subList(0, Math.min(TOP_N, topDocTypes.size()))))
                .build();
    }
}
