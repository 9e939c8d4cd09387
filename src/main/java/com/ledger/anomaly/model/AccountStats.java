package com.ledger.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountStats {

    private String glAccount;
    private String glAccountName;
    private long totalTransactions;
    private double totalDebit;
    private double totalCredit;
    private double netBalance;
    private String currency;

    // Central tendency and dispersion over absolute amounts
    private double averageAmount;
    private double medianAmount;
    private double stdDeviation;
    private double minAmount;
    private double maxAmount;
    private double firstQuartile;
    private double thirdQuartile;
    private double iqr;

    private Map<DayOfWeek, Long> postingsByDay;
    private Map<Integer, Long> postingsByHour;
    private List<UserActivity> topUsers;
    private List<DocumentTypeCount> topDocumentTypes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UserActivity {
        private String userId;
        private String userName;
        private long transactionCount;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DocumentTypeCount {
        private String documentType;
        private long count;
    }
}
