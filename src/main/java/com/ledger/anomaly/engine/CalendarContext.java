package com.ledger.anomaly.engine;

import com.ledger.anomaly.config.DetectionConfig;
import com.ledger.anomaly.exception.DetectionConfigurationException;
import com.ledger.anomaly.model.LineItem;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Time-zone context for calendar-sensitive checks. Posting timestamps are read in the
 * source zone; hour-of-day and day-of-week are judged in the business zone.
 */
public final class CalendarContext {

    private final ZoneId sourceZone;
    private final ZoneId businessZone;

    public CalendarContext(ZoneId sourceZone, ZoneId businessZone) {
        if (sourceZone == null || businessZone == null) {
            throw new DetectionConfigurationException("Source and business time zones are required");
        }
        this.sourceZone = sourceZone;
        this.businessZone = businessZone;
    }

    public static CalendarContext of(ZoneId zone) {
        return new CalendarContext(zone, zone);
    }

    /**
     * Builds the context from configuration, failing when no source time zone is set.
     */
    public static CalendarContext from(DetectionConfig.BehavioralAnomalies config) {
        ZoneId source;
        ZoneId business;
        try {
            source = config.sourceZone();
            business = config.businessZone();
        } catch (DateTimeException e) {
            throw new DetectionConfigurationException("Invalid time zone: " + e.getMessage(), e);
        }
        if (source == null) {
            throw new DetectionConfigurationException(
                    "gl.detection.behavioral-anomalies.source-time-zone must be set for calendar-based checks");
        }
        return new CalendarContext(source, business);
    }

    public ZoneId getSourceZone() {
        return sourceZone;
    }

    public ZoneId getBusinessZone() {
        return businessZone;
    }

    public Instant toInstant(LineItem item) {
        return item.getPostingDateTime().atZone(sourceZone).toInstant();
    }

    /**
     * Hour of day in the business zone, or -1 when the item carries no posting time.
     */
    public int businessHour(LineItem item) {
        if (!item.hasPostingTime()) return -1;
        return toBusinessTime(item).getHour();
    }

    public DayOfWeek businessDayOfWeek(LineItem item) {
        return businessDate(item).getDayOfWeek();
    }

    public LocalDate businessDate(LineItem item) {
        // Without a time there is nothing to convert; the recorded date stands.
        if (!item.hasPostingTime()) return item.getPostingDate();
        return toBusinessTime(item).toLocalDate();
    }

    public double hoursBetween(LineItem a, LineItem b) {
        Duration d = Duration.between(toInstant(a), toInstant(b)).abs();
        return d.toMillis() / 3_600_000.0;
    }

    private ZonedDateTime toBusinessTime(LineItem item) {
        return toInstant(item).atZone(businessZone);
    }
}
