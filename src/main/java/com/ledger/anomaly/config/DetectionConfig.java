package com.ledger.anomaly.config;

import com.ledger.anomaly.model.OutlierMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Detector configuration. Every group can be switched off independently; thresholds
 * default to the values the detectors were tuned against.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "gl.detection")
public class DetectionConfig {

    private BenfordLaw benfordLaw = new BenfordLaw();
    private StatisticalOutliers statisticalOutliers = new StatisticalOutliers();
    private BehavioralAnomalies behavioralAnomalies = new BehavioralAnomalies();
    private VelocityAnalysis velocityAnalysis = new VelocityAnalysis();
    private RoundNumbers roundNumbers = new RoundNumbers();
    private DuplicateDetection duplicateDetection = new DuplicateDetection();

    // Estimated fraud risk at or above which a finished run is logged as a warning
    private double fraudRiskAlertThreshold = 50.0;

    @Data
    public static class BenfordLaw {
        private boolean enabled = true;
        private int minTransactions = 100;
        private double significanceLevel = 0.05;
    }

    @Data
    public static class StatisticalOutliers {
        private boolean enabled = true;
        private OutlierMethod method = OutlierMethod.IQR;
        private double zScoreThreshold = 3.0;
        private double iqrMultiplier = 1.5;
        private double madThreshold = 3.5;
        // Accounts with fewer line items are not tested
        private int minAccountTransactions = 10;
        // Highest-scoring outliers reported per account
        private int maxPerAccount = 10;
    }

    @Data
    public static class BehavioralAnomalies {
        private boolean enabled = true;
        private boolean checkAfterHours = true;
        private int afterHoursStart = 19;
        private int afterHoursEnd = 7;
        private boolean checkWeekends = true;
        private boolean checkReversals = true;
        private double sameDayReversalWindow = 24;

        // Zone the source system records posting dates and times in. No default.
        private String sourceTimeZone;

        // Zone business hours and weekends are judged in. Falls back to the source zone.
        private String businessTimeZone;

        public ZoneId sourceZone() {
            return sourceTimeZone == null || sourceTimeZone.isBlank() ? null : ZoneId.of(sourceTimeZone);
        }

        public ZoneId businessZone() {
            if (businessTimeZone == null || businessTimeZone.isBlank()) {
                return sourceZone();
            }
            return ZoneId.of(businessTimeZone);
        }
    }

    @Data
    public static class VelocityAnalysis {
        private boolean enabled = true;
        // Percent change from the trailing average
        private double deviationThreshold = 200.0;
        private int lookbackPeriods = 12;
    }

    @Data
    public static class RoundNumbers {
        private boolean enabled = true;
        private List<Double> thresholds = new ArrayList<>(List.of(1000.0, 5000.0, 10000.0));
        private int minOccurrences = 5;
    }

    @Data
    public static class DuplicateDetection {
        private boolean enabled = true;
        // Hours
        private double timeWindow = 24;
        // Fraction of the first amount
        private double amountTolerance = 0.01;
        private boolean requireSameDescription = false;
    }
}
