package com.ledger.anomaly.service;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.config.MetricsConfig;
import com.ledger.anomaly.datasource.GLDataSource;
import com.ledger.anomaly.datasource.GLDataSourceException;
import com.ledger.anomaly.engine.AccountIndex;
import com.ledger.anomaly.engine.AnomalyFactory;
import com.ledger.anomaly.engine.CalendarContext;
import com.ledger.anomaly.engine.IdGenerator;
import com.ledger.anomaly.engine.LineItemValidator;
import com.ledger.anomaly.engine.PatternRuleEngine;
import com.ledger.anomaly.engine.detectors.AccountStatsCalculator;
import com.ledger.anomaly.engine.detectors.BenfordAnalyzer;
import com.ledger.anomaly.engine.detectors.OutlierDetector;
import com.ledger.anomaly.engine.detectors.VelocityAnalyzer;
import com.ledger.anomaly.exception.DetectionConfigurationException;
import com.ledger.anomaly.model.AccountStats;
import com.ledger.anomaly.model.Anomaly;
import com.ledger.anomaly.model.BehavioralMatch;
import com.ledger.anomaly.model.BenfordResult;
import com.ledger.anomaly.model.DetectionResult;
import com.ledger.anomaly.model.DetectionSummary;
import com.ledger.anomaly.model.GLFilter;
import com.ledger.anomaly.model.LineItem;
import com.ledger.anomaly.model.OutlierObservation;
import com.ledger.anomaly.model.VelocityObservation;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Main orchestrator for GL anomaly detection.
 *
 * Flow:
 * 1. Validate the filter and resolve the calendar context
 * 2. Fetch line items from the GLDataSource and validate them
 * 3. Partition by GL account once
 * 4. Run Benford, outliers, pattern rules and velocity per account
 * 5. Compute account statistics and the run summary
 * 6. Return the anomalies ordered by severity (stable within a severity)
 */
@Service
public class GLAnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(GLAnomalyDetectionService.class);

    private static final Comparator<Anomaly> BY_SEVERITY_DESC =
            Comparator.comparing(Anomaly::getSeverity).reversed();

    private final GLDataSource dataSource;
    private final DetectionConfig defaultConfig;
    private final BenfordAnalyzer benfordAnalyzer;
    private final OutlierDetector outlierDetector;
    private final PatternRuleEngine patternRuleEngine;
    private final VelocityAnalyzer velocityAnalyzer;
    private final AccountStatsCalculator statsCalculator;
    private final AnomalyFactory anomalyFactory;
    private final LineItemValidator validator;
    private final DetectionSummaryService summaryService;
    private final MetricsConfig metricsConfig;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public GLAnomalyDetectionService(GLDataSource dataSource,
                                     DetectionConfig defaultConfig,
                                     BenfordAnalyzer benfordAnalyzer,
                                     OutlierDetector outlierDetector,
                                     PatternRuleEngine patternRuleEngine,
                                     VelocityAnalyzer velocityAnalyzer,
                                     AccountStatsCalculator statsCalculator,
                                     AnomalyFactory anomalyFactory,
                                     LineItemValidator validator,
                                     DetectionSummaryService summaryService,
                                     MetricsConfig metricsConfig,
                                     IdGenerator idGenerator,
                                     Clock clock) {
        this.dataSource = dataSource;
        this.defaultConfig = defaultConfig;
        this.benfordAnalyzer = benfordAnalyzer;
        this.outlierDetector = outlierDetector;
        this.patternRuleEngine = patternRuleEngine;
        this.velocityAnalyzer = velocityAnalyzer;
        this.statsCalculator = statsCalculator;
        this.anomalyFactory = anomalyFactory;
        this.validator = validator;
        this.summaryService = summaryService;
        this.metricsConfig = metricsConfig;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * Run detection with the application's configuration.
     */
    @Observed(name = "gl.detection", contextualName = "detect-gl-anomalies")
    public DetectionResult detectAnomalies(String tenantId, GLFilter filter) {
        return detectAnomalies(tenantId, filter, defaultConfig);
    }

    /**
     * Run detection with an explicit configuration.
     *
     * @throws DetectionConfigurationException when the filter or calendar settings are unusable
     * @throws com.ledger.anomaly.exception.MalformedLineItemException when fetched items lack required fields
     */
    public DetectionResult detectAnomalies(String tenantId, GLFilter filter, DetectionConfig config) {
        if (filter == null) {
            throw new DetectionConfigurationException("Filter is required");
        }
        if (filter.getFiscalYear() == null || filter.getFiscalYear().isBlank()) {
            throw new DetectionConfigurationException("Filter fiscal year is required");
        }
        if (config == null) {
            throw new DetectionConfigurationException("Detection configuration is required");
        }
        CalendarContext calendar = resolveCalendar(config);

        log.info("Starting GL anomaly detection: tenant={}, fiscalYear={}, fiscalPeriod={}, accounts={}",
                tenantId, filter.getFiscalYear(), filter.getFiscalPeriod(), filter.getGlAccounts());

        List<LineItem> lineItems = fetch(filter);
        if (lineItems.isEmpty()) {
            log.info("No line items matched the filter; returning empty result");
            metricsConfig.recordRun("empty", 0);
            return emptyResult(tenantId, filter);
        }

        validator.validate(lineItems);
        AccountIndex index = AccountIndex.of(lineItems);

        List<Anomaly> anomalies = new ArrayList<>();

        // 1. Benford's Law
        List<BenfordResult> benfordResults = Collections.emptyList();
        if (config.getBenfordLaw().isEnabled()) {
            benfordResults = benfordAnalyzer.analyzeAccounts(index, config.getBenfordLaw());
            for (BenfordResult result : benfordResults) {
                if (result.isAnomalous()) {
                    anomalies.add(anomalyFactory.fromBenford(result, index.items(result.getGlAccount())));
                }
            }
        }

        // 2. Statistical outliers
        DetectionConfig.StatisticalOutliers outlierConfig = config.getStatisticalOutliers();
        if (outlierConfig.isEnabled()) {
            for (Map.Entry<String, List<LineItem>> entry : index.asMap().entrySet()) {
                if (entry.getValue().size() < outlierConfig.getMinAccountTransactions()) {
                    continue;
                }
                List<OutlierObservation> outliers = outlierDetector.detect(entry.getValue(), outlierConfig);
                int limit = Math.min(outliers.size(), Math.max(0, outlierConfig.getMaxPerAccount()));
                for (OutlierObservation outlier : outliers.subList(0, limit)) {
                    anomalies.add(anomalyFactory.fromOutlier(outlier));
                }
                log.debug("GL account {}: {} outliers ({} reported)", entry.getKey(), outliers.size(), limit);
            }
        }

        // 3. Pattern rules
        PatternRuleEngine.Outcome patterns = patternRuleEngine.evaluateAll(index, config, calendar);
        for (BehavioralMatch match : patterns.getMatches()) {
            anomalies.add(anomalyFactory.fromBehavioral(match));
        }

        // 4. Velocity
        List<VelocityObservation> velocity = new ArrayList<>();
        if (config.getVelocityAnalysis().isEnabled()) {
            for (Map.Entry<String, List<LineItem>> entry : index.asMap().entrySet()) {
                List<VelocityObservation> observations =
                        velocityAnalyzer.analyze(entry.getValue(), entry.getKey(), config.getVelocityAnalysis());
                velocity.addAll(observations);
                for (VelocityObservation observation : observations) {
                    anomalies.add(anomalyFactory.fromVelocity(observation, entry.getValue()));
                }
            }
        }

        List<AccountStats> accountStats = new ArrayList<>();
        for (Map.Entry<String, List<LineItem>> entry : index.asMap().entrySet()) {
            accountStats.add(statsCalculator.calculate(entry.getKey(), entry.getValue(), calendar));
        }

        // List.sort is stable: detector emission order survives within a severity
        anomalies.sort(BY_SEVERITY_DESC);
        DetectionSummary summary = summaryService.summarize(anomalies, lineItems.size());

        metricsConfig.recordRun("completed", lineItems.size());
        metricsConfig.recordAnomalies(anomalies);
        metricsConfig.recordFraudRisk(summary.getEstimatedFraudRisk());

        if (summary.getEstimatedFraudRisk() >= config.getFraudRiskAlertThreshold()) {
            log.warn("Estimated fraud risk {} for tenant {} (fiscalYear={}) is at or above the alert threshold {}",
                    summary.getEstimatedFraudRisk(), tenantId, filter.getFiscalYear(),
                    config.getFraudRiskAlertThreshold());
        }
        log.info("GL anomaly detection complete: {} line items, {} accounts, {} anomalies "
                        + "(critical={}, high={}, medium={}, low={}), {} rule failures",
                lineItems.size(), index.accounts().size(), anomalies.size(),
                summary.getCriticalAnomalies(), summary.getHighAnomalies(),
                summary.getMediumAnomalies(), summary.getLowAnomalies(),
                patterns.getDiagnostics().size());

        return DetectionResult.builder()
                .analysisId(idGenerator.nextId())
                .tenantId(tenantId)
                .glAccount(firstAccount(filter))
                .fiscalYear(filter.getFiscalYear())
                .fiscalPeriod(filter.getFiscalPeriod())
                .totalLineItems(lineItems.size())
                .anomaliesDetected(anomalies.size())
                .anomalies(anomalies)
                .accountStats(accountStats)
                .benfordAnalysis(benfordResults)
                .velocityObservations(velocity)
                .diagnostics(patterns.getDiagnostics())
                .summary(summary)
                .completedAt(clock.instant())
                .build();
    }

    /**
     * Calendar context for the run. Required when an enabled rule needs posting times;
     * otherwise used for hour and day histograms only when a source zone is configured.
     */
    private CalendarContext resolveCalendar(DetectionConfig config) {
        DetectionConfig.BehavioralAnomalies behavioral = config.getBehavioralAnomalies();
        if (patternRuleEngine.requiresCalendar(config)) {
            return CalendarContext.from(behavioral);
        }
        if (behavioral.getSourceTimeZone() != null && !behavioral.getSourceTimeZone().isBlank()) {
            return CalendarContext.from(behavioral);
        }
        return null;
    }

    private List<LineItem> fetch(GLFilter filter) {
        CompletableFuture<List<LineItem>> future = dataSource.getGLLineItems(filter);
        if (future == null) {
            throw new GLDataSourceException("GL data source returned no result", null);
        }

        List<LineItem> lineItems;
        try {
            lineItems = future.join();
        } catch (CompletionException e) {
            metricsConfig.recordRun("failed", 0);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new GLDataSourceException("Failed to fetch GL line items: " + cause.getMessage(), cause);
        }

        if (lineItems == null) {
            throw new GLDataSourceException("GL data source returned no result", null);
        }
        return lineItems;
    }

    private DetectionResult emptyResult(String tenantId, GLFilter filter) {
        return DetectionResult.builder()
                .analysisId(idGenerator.nextId())
                .tenantId(tenantId)
                .glAccount(firstAccount(filter))
                .fiscalYear(filter.getFiscalYear())
                .fiscalPeriod(filter.getFiscalPeriod())
                .totalLineItems(0)
                .anomaliesDetected(0)
                .anomalies(new ArrayList<>())
                .accountStats(new ArrayList<>())
                .benfordAnalysis(new ArrayList<>())
                .velocityObservations(new ArrayList<>())
                .diagnostics(new ArrayList<>())
                .summary(summaryService.summarize(Collections.emptyList(), 0))
                .completedAt(clock.instant())
                .build();
    }

    private static String firstAccount(GLFilter filter) {
        List<String> accounts = filter.getGlAccounts();
        return accounts == null || accounts.isEmpty() ? null : accounts.get(0);
    }
}
