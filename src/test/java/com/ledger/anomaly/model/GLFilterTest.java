package com.ledger.anomaly.model;

import com.ledger.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GLFilterTest {

    private final LineItem item = TestDataFactory.createLineItem("D1", "500000", 250);

    @Test
    void matches_blankCriteriaDoNotRestrict() {
        GLFilter filter = GLFilter.builder()
                .fiscalYear("2024")
                .fiscalPeriod("")
                .glAccounts(List.of(""))
                .companyCode(" ")
                .build();

        assertThat(filter.matches(item)).isTrue();
    }

    @Test
    void matches_setCriteriaStillRestrict() {
        assertThat(GLFilter.forAccount("500000", "2024", "004").matches(item)).isTrue();
        assertThat(GLFilter.forAccount("500000", "2024", "005").matches(item)).isFalse();
        assertThat(GLFilter.forAccount("700000", "2024", null).matches(item)).isFalse();
        assertThat(GLFilter.builder().fiscalYear("2023").build().matches(item)).isFalse();
    }
}
