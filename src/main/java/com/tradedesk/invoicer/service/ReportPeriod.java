package com.tradedesk.invoicer.service;

import com.tradedesk.invoicer.exception.ValidationException;
import com.tradedesk.invoicer.exception.ValidationFailure;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;

public enum ReportPeriod {
    DAILY(0),
    WEEKLY(7),
    MONTHLY(30);

    private final int daysBack;

    ReportPeriod(int daysBack) {
        this.daysBack = daysBack;
    }

    /**
     * Start of the window: midnight today for {@code DAILY}, otherwise midnight
     * {@code daysBack} days ago.
     */
    public LocalDateTime since(LocalDate today) {
        return today.minusDays(daysBack).atStartOfDay();
    }

    public static ReportPeriod fromPath(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        for (ReportPeriod period : values()) {
            if (period.name().equals(normalized)) {
                return period;
            }
        }
        throw new ValidationException(ValidationFailure.INVALID_PERIOD,
                "Invalid period '" + value + "', expected daily, weekly or monthly");
    }
}
