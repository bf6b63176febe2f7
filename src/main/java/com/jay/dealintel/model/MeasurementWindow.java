package com.jay.dealintel.model;

import java.time.LocalDate;

/** Inclusive date range used to select realization periods by their start date. */
public record MeasurementWindow(LocalDate start, LocalDate end) {

    public MeasurementWindow {
        if (start == null || end == null || end.isBefore(start)) {
            throw new IllegalArgumentException("Invalid measurement window: " + start + " .. " + end);
        }
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public static MeasurementWindow lastDays(int days) {
        LocalDate today = LocalDate.now();
        return new MeasurementWindow(today.minusDays(days), today);
    }

    public static MeasurementWindow nextDays(int days) {
        LocalDate today = LocalDate.now();
        return new MeasurementWindow(today, today.plusDays(days));
    }
}
