package com.ledger.anomaly.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * Selection passed to the data source. Only the fiscal year is mandatory; null or blank
 * criteria do not restrict the selection.
 */
@Value
@Builder(toBuilder = true)
public class GLFilter {

    List<String> glAccounts;
    String fiscalYear;
    String fiscalPeriod;
    LocalDate fromDate;
    LocalDate toDate;
    String companyCode;

    public static GLFilter forAccount(String glAccount, String fiscalYear, String fiscalPeriod) {
        return GLFilter.builder()
                .glAccounts(List.of(glAccount))
                .fiscalYear(fiscalYear)
                .fiscalPeriod(fiscalPeriod)
                .build();
    }

    public boolean matches(LineItem item) {
        if (isSet(fiscalYear) && !fiscalYear.equals(item.getFiscalYear())) return false;
        if (isSet(fiscalPeriod) && !fiscalPeriod.equals(item.getFiscalPeriod())) return false;
        if (hasAccounts() && !glAccounts.contains(item.getGlAccount())) return false;
        if (isSet(companyCode) && !companyCode.equals(item.getCompanyCode())) return false;
        if (fromDate != null && item.getPostingDate() != null && item.getPostingDate().isBefore(fromDate)) return false;
        if (toDate != null && item.getPostingDate() != null && item.getPostingDate().isAfter(toDate)) return false;
        return true;
    }

    // Blank criteria select everything, same as absent ones
    private boolean hasAccounts() {
        return glAccounts != null && glAccounts.stream().anyMatch(GLFilter::isSet);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
