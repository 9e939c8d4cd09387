package com.ledger.anomaly.engine.detectors;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.engine.AccountIndex;
import com.ledger.anomaly.model.BenfordResult;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.model.Severity;
import com.ledger.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BenfordAnalyzerTest {

    private BenfordAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new BenfordAnalyzer();
    }

    @Test
    void firstDigit_usesFirstSignificantDigit() {
        assertThat(BenfordAnalyzer.firstDigit(9876.5)).isEqualTo(9);
        assertThat(BenfordAnalyzer.firstDigit(-0.0042)).isEqualTo(4);
        assertThat(BenfordAnalyzer.firstDigit(1e-7)).isEqualTo(1);
        assertThat(BenfordAnalyzer.firstDigit(0)).isZero();
    }

    @Test
    void pValue_interpolatesAndFloors() {
        assertThat(BenfordAnalyzer.pValue(1.0)).isEqualTo(1.0);
        assertThat(BenfordAnalyzer.pValue(15.507)).isEqualTo(0.05);
        assertThat(BenfordAnalyzer.pValue(500)).isEqualTo(0.001);
    }

    @Test
    void analyze_allAmountsStartingWithNine_isAnomalous() {
        List<LineItem> items = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            items.add(TestDataFactory.createLineItem("B" + i, "600100", 9000 + i));
        }

        BenfordResult result = analyzer.analyze(items, "600100", 0.05);

        assertThat(result.isAnomalous()).isTrue();
        assertThat(result.getSeverity()).isIn(Severity.HIGH, Severity.CRITICAL);
        assertThat(result.getLargestDeviationDigit()).isEqualTo(9);
        assertThat(result.getFirstDigitCounts().get(9)).isEqualTo(100L);
    }

    @Test
    void analyze_allZeroAmounts_notAnomalous() {
        List<LineItem> items = TestDataFactory.createLineItems("600100", 0, 0, 0);

        BenfordResult result = analyzer.analyze(items, "600100", 0.05);

        assertThat(result.isAnomalous()).isFalse();
        assertThat(result.getPValue()).isEqualTo(1.0);
        assertThat(result.getTotalTransactions()).isZero();
    }

    @Test
    void analyzeAccounts_skipsAccountsBelowMinimum() {
        List<LineItem> items = new ArrayList<>();
        for (int i = 0; i < 99; i++) {
            items.add(TestDataFactory.createLineItem("S" + i, "600100", 9000 + i));
        }

        List<BenfordResult> results = analyzer.analyzeAccounts(AccountIndex.of(items), new DetectionConfig.BenfordLaw());

        assertThat(results).isEmpty();
    }
}
