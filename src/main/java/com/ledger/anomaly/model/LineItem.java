package com.ledger.anomaly.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * A posted general-ledger line item as fetched from the source accounting system.
 * Posting date and time are wall-clock values in the source system's time zone.
 */
@Value
@Builder
@Jacksonized
public class LineItem {

    String documentNumber;
    String lineItem;
    String glAccount;
    String glAccountName;
    String companyCode;
    String fiscalYear;
    String fiscalPeriod;
    LocalDate postingDate;
    LocalTime postingTime;
    LocalDate documentDate;
    double amount;
    String currency;
    DebitCredit debitCredit;
    String documentType;
    String reference;
    String description;
    String costCenter;
    String profitCenter;
    String userId;
    String userName;
    String reversalDocumentNumber;
    boolean reversal;

    @JsonIgnore
    public double getAbsAmount() {
        return Math.abs(amount);
    }

    @JsonIgnore
    public boolean hasPostingTime() {
        return postingTime != null;
    }

    /**
     * Posting date combined with the posting time, or midnight when no time was recorded.
     */
    @JsonIgnore
    public LocalDateTime getPostingDateTime() {
        return postingDate.atTime(postingTime != null ? postingTime : LocalTime.MIDNIGHT);
    }

    @JsonIgnore
    public String getPeriodKey() {
        return fiscalYear + "-" + fiscalPeriod;
    }

    @JsonIgnore
    public boolean isReversalEntry() {
        return reversal || (reversalDocumentNumber != null && !reversalDocumentNumber.isBlank());
    }
}
