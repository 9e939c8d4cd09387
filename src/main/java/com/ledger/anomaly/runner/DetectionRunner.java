package com.ledger.anomaly.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ledger.anomaly.exception.DetectionConfigurationException;
import com.ledger.anomaly.model.AccountRiskProfile;
import com.ledger.anomaly.model.Anomaly;
import com.ledger.anomaly.model.DetectionResult;
import com.ledger.anomaly.model.GLFilter;
import com.ledger.anomaly.service.AccountRiskProfileService;
import com.ledger.anomaly.service.GLAnomalyDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs a single detection at startup and logs the summary plus risk profiles for the
 * most flagged accounts. Enabled with {@code gl.run.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "gl.run", name = "enabled", havingValue = "true")
public class DetectionRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DetectionRunner.class);

    private final GLAnomalyDetectionService detectionService;
    private final AccountRiskProfileService riskProfileService;
    private final RunProperties properties;
    private final ObjectMapper objectMapper;

    public DetectionRunner(GLAnomalyDetectionService detectionService,
                           AccountRiskProfileService riskProfileService,
                           RunProperties properties,
                           ObjectMapper objectMapper) {
        this.detectionService = detectionService;
        this.riskProfileService = riskProfileService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) {
        if (!StringUtils.hasText(properties.getFiscalYear())) {
            throw new DetectionConfigurationException("gl.run.fiscal-year must be set when gl.run.enabled=true");
        }

        GLFilter filter = buildFilter(properties);

        DetectionResult result = detectionService.detectAnomalies(properties.getTenantId(), filter);
        log.info("Analysis {}: {} line items, {} anomalies, estimated fraud risk {}",
                result.getAnalysisId(), result.getTotalLineItems(), result.getAnomaliesDetected(),
                result.getSummary().getEstimatedFraudRisk());
        result.getDiagnostics().forEach(d ->
                log.warn("Diagnostic from {} on GL account {}: {}", d.getSource(), d.getGlAccount(), d.getMessage()));

        for (String glAccount : mostFlaggedAccounts(result.getAnomalies(), properties.getProfileTopAccounts())) {
            AccountRiskProfile profile = riskProfileService.analyzeAccount(properties.getTenantId(), glAccount,
                    filter.getFiscalYear(), filter.getFiscalPeriod());
            log.info("GL account {} ({}): risk {} ({}), weaknesses={}, recommendations={}",
                    profile.getGlAccount(), profile.getGlAccountName(), profile.getRiskScore(),
                    profile.getRiskLevel(), profile.getControlWeaknesses(), profile.getRecommendations());
        }

        if (StringUtils.hasText(properties.getOutputFile())) {
            writeResult(result, Path.of(properties.getOutputFile()));
        }
    }

    /**
     * Unset environment placeholders bind as empty strings; those are dropped so they
     * widen the selection instead of matching nothing.
     */
    static GLFilter buildFilter(RunProperties properties) {
        List<String> accounts = properties.getGlAccounts() == null ? List.of()
                : properties.getGlAccounts().stream()
                        .filter(StringUtils::hasText)
                        .map(String::trim)
                        .collect(Collectors.toList());
        return GLFilter.builder()
                .glAccounts(accounts.isEmpty() ? null : accounts)
                .fiscalYear(properties.getFiscalYear().trim())
                .fiscalPeriod(StringUtils.hasText(properties.getFiscalPeriod())
                        ? properties.getFiscalPeriod().trim() : null)
                .build();
    }

    static List<String> mostFlaggedAccounts(List<Anomaly> anomalies, int limit) {
        Map<String, Long> counts = anomalies.stream()
                .collect(Collectors.groupingBy(Anomaly::getGlAccount, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(Math.max(0, limit))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private void writeResult(DetectionResult result, Path path) {
        try {
            objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValue(path.toFile(), result);
            log.info("Wrote detection result to {}", path.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write detection result to " + path, e);
        }
    }
}
