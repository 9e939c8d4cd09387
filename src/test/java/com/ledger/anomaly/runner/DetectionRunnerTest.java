package com.ledger.anomaly.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledger.anomaly.exception.DetectionConfigurationException;
import com.ledger.anomaly.model.AccountRiskProfile;
import com.ledger.anomaly.model.Anomaly;
import com.ledger.anomaly.model.AnomalyType;
import com.ledger.anomaly.model.DetectionResult;
import com.ledger.anomaly.model.DetectionSummary;
import com.ledger.anomaly.model.GLFilter;
import com.ledger.anomaly.model.RiskLevel;
import com.ledger.anomaly.model.Severity;
import com.ledger.anomaly.service.AccountRiskProfileService;
import com.ledger.anomaly.service.GLAnomalyDetectionService;
import com.ledger.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectionRunnerTest {

    @Mock
    private GLAnomalyDetectionService detectionService;

    @Mock
    private AccountRiskProfileService riskProfileService;

    private RunProperties properties;
    private DetectionRunner runner;

    @BeforeEach
    void setUp() {
        properties = new RunProperties();
        properties.setEnabled(true);
        properties.setFiscalYear("2024");
        runner = new DetectionRunner(detectionService, riskProfileService, properties,
                new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void run_blankPeriodAndAccounts_leaveSelectionOpen() {
        properties.setFiscalPeriod("");
        properties.setGlAccounts(new ArrayList<>(List.of("", "  ")));
        when(detectionService.detectAnomalies(eq("default"), any(GLFilter.class))).thenReturn(result(List.of()));

        runner.run();

        ArgumentCaptor<GLFilter> captor = ArgumentCaptor.forClass(GLFilter.class);
        verify(detectionService).detectAnomalies(eq("default"), captor.capture());
        GLFilter filter = captor.getValue();
        assertThat(filter.getFiscalYear()).isEqualTo("2024");
        assertThat(filter.getFiscalPeriod()).isNull();
        assertThat(filter.getGlAccounts()).isNull();
        assertThat(filter.matches(TestDataFactory.createLineItem("D1", "500000", 250))).isTrue();
    }

    @Test
    void run_periodAndAccountsSet_passedThroughTrimmed() {
        properties.setFiscalPeriod(" 004 ");
        properties.setGlAccounts(new ArrayList<>(List.of("500000", " 700000", "")));
        when(detectionService.detectAnomalies(eq("default"), any(GLFilter.class))).thenReturn(result(List.of()));

        runner.run();

        ArgumentCaptor<GLFilter> captor = ArgumentCaptor.forClass(GLFilter.class);
        verify(detectionService).detectAnomalies(eq("default"), captor.capture());
        assertThat(captor.getValue().getFiscalPeriod()).isEqualTo("004");
        assertThat(captor.getValue().getGlAccounts()).containsExactly("500000", "700000");
    }

    @Test
    void run_missingFiscalYear_rejectedBeforeDetection() {
        properties.setFiscalYear(" ");

        assertThatThrownBy(() -> runner.run())
                .isInstanceOf(DetectionConfigurationException.class)
                .hasMessageContaining("gl.run.fiscal-year");
        verifyNoInteractions(detectionService, riskProfileService);
    }

    @Test
    void run_profilesMostFlaggedAccountsOnly() {
        properties.setProfileTopAccounts(1);
        when(detectionService.detectAnomalies(eq("default"), any(GLFilter.class))).thenReturn(result(List.of(
                anomaly("500000"), anomaly("700000"), anomaly("700000"))));
        when(riskProfileService.analyzeAccount("default", "700000", "2024", null)).thenReturn(profile("700000"));

        runner.run();

        verify(riskProfileService).analyzeAccount("default", "700000", "2024", null);
        verify(riskProfileService, never()).analyzeAccount(anyString(), eq("500000"), anyString(), isNull());
    }

    @Test
    void run_outputFile_writesResultAsJson(@TempDir Path dir) throws Exception {
        Path output = dir.resolve("result.json");
        properties.setOutputFile(output.toString());
        properties.setProfileTopAccounts(0);
        when(detectionService.detectAnomalies(eq("default"), any(GLFilter.class)))
                .thenReturn(result(List.of(anomaly("500000"))));

        runner.run();

        assertThat(output).exists();
        JsonNode json = new ObjectMapper().readTree(Files.readString(output));
        assertThat(json.get("analysisId").asText()).isEqualTo("RUN-1");
        assertThat(json.get("anomaliesDetected").asLong()).isEqualTo(1L);
        assertThat(json.get("anomalies").get(0).get("glAccount").asText()).isEqualTo("500000");
    }

    @Test
    void mostFlaggedAccounts_orderedByAnomalyCount() {
        List<Anomaly> anomalies = List.of(
                anomaly("100"), anomaly("200"), anomaly("200"), anomaly("300"), anomaly("200"), anomaly("300"));

        assertThat(DetectionRunner.mostFlaggedAccounts(anomalies, 2)).containsExactly("200", "300");
        assertThat(DetectionRunner.mostFlaggedAccounts(anomalies, 0)).isEmpty();
    }

    private static DetectionResult result(List<Anomaly> anomalies) {
        return DetectionResult.builder()
                .analysisId("RUN-1")
                .tenantId("default")
                .fiscalYear("2024")
                .totalLineItems(6)
                .anomaliesDetected(anomalies.size())
                .anomalies(anomalies)
                .accountStats(List.of())
                .benfordAnalysis(List.of())
                .velocityObservations(List.of())
                .diagnostics(List.of())
                .summary(DetectionSummary.builder().estimatedFraudRisk(8).build())
                .completedAt(TestDataFactory.FIXED_CLOCK.instant())
                .build();
    }

    private static AccountRiskProfile profile(String glAccount) {
        return AccountRiskProfile.builder()
                .glAccount(glAccount)
                .glAccountName("Acct X")
                .riskScore(40)
                .riskLevel(RiskLevel.MEDIUM)
                .controlWeaknesses(List.of())
                .recommendations(List.of())
                .build();
    }

    private static Anomaly anomaly(String glAccount) {
        return Anomaly.builder()
                .glAccount(glAccount)
                .anomalyType(AnomalyType.STATISTICAL_OUTLIER)
                .severity(Severity.MEDIUM)
                .build();
    }
}
