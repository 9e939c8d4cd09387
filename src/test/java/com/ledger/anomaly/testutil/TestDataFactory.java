package com.ledger.anomaly.testutil;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.config.MetricsConfig;
import com.ledger.anomaly.model.DebitCredit;
import com.ledger.anomaly.model.LineItem;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared test data builders to avoid repeating construction boilerplate across test classes.
 */
public final class TestDataFactory {

    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC);

    // A Wednesday
    public static final LocalDate WEEKDAY = LocalDate.of(2024, 4, 10);

    private static int sequence;

    private TestDataFactory() {}

    public static LineItem.LineItemBuilder lineItemBuilder(String documentNumber, String glAccount, double amount) {
        return LineItem.builder()
                .documentNumber(documentNumber)
                .lineItem("001")
                .glAccount(glAccount)
                .glAccountName("Account " + glAccount)
                .companyCode("1000")
                .fiscalYear("2024")
                .fiscalPeriod("004")
                .postingDate(WEEKDAY)
                .postingTime(LocalTime.of(10, 0))
                .documentDate(WEEKDAY)
                .amount(amount)
                .currency("USD")
                .debitCredit(amount < 0 ? DebitCredit.CREDIT : DebitCredit.DEBIT)
                .documentType("SA")
                .description("Posting " + documentNumber)
                .userId("U1")
                .userName("User One");
    }

    public static LineItem createLineItem(String documentNumber, String glAccount, double amount) {
        return lineItemBuilder(documentNumber, glAccount, amount).build();
    }

    public static LineItem createLineItem(String glAccount, double amount) {
        return createLineItem("DOC" + (++sequence), glAccount, amount);
    }

    public static LineItem postedAt(String documentNumber, String glAccount, double amount,
                                    LocalDate date, LocalTime time) {
        return lineItemBuilder(documentNumber, glAccount, amount)
                .postingDate(date)
                .postingTime(time)
                .build();
    }

    /**
     * Items with the given amounts in one account, with distinct document numbers.
     */
    public static List<LineItem> createLineItems(String glAccount, double... amounts) {
        List<LineItem> items = new ArrayList<>();
        for (int i = 0; i < amounts.length; i++) {
            items.add(createLineItem(glAccount + "-" + i, glAccount, amounts[i]));
        }
        return items;
    }

    /**
     * Configuration with every group enabled and the calendar set to UTC.
     */
    public static DetectionConfig createConfig() {
        DetectionConfig config = new DetectionConfig();
        config.getBehavioralAnomalies().setSourceTimeZone("UTC");
        return config;
    }

    /**
     * Configuration with every detector group switched off.
     */
    public static DetectionConfig createDisabledConfig() {
        DetectionConfig config = createConfig();
        config.getBenfordLaw().setEnabled(false);
        config.getStatisticalOutliers().setEnabled(false);
        config.getBehavioralAnomalies().setEnabled(false);
        config.getVelocityAnalysis().setEnabled(false);
        config.getRoundNumbers().setEnabled(false);
        config.getDuplicateDetection().setEnabled(false);
        return config;
    }

    public static MetricsConfig createMetricsConfig() {
        return new MetricsConfig(new SimpleMeterRegistry());
    }
}
