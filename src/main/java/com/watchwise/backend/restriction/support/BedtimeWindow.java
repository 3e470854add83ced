package com.watchwise.backend.restriction.support;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Device-local bedtime window. {@code start > end} wraps past midnight;
 * {@code start == end} is an empty window.
 */
public record BedtimeWindow(LocalTime start, LocalTime end, Set<DayOfWeek> enabledDays) {

    public BedtimeWindow {
        if (start == null || end == null) throw new IllegalArgumentException("start and end are required");
        enabledDays = (enabledDays == null || enabledDays.isEmpty())
                ? EnumSet.noneOf(DayOfWeek.class)
                : EnumSet.copyOf(enabledDays);
    }

    public boolean isOvernight() {
        return start.isAfter(end);
    }

    public static boolean isInWindow(LocalTime start, LocalTime end, LocalTime now) {
        if (start.equals(end)) return false;
        if (start.isBefore(end)) {
            return !now.isBefore(start) && now.isBefore(end);
        }
        return !now.isBefore(start) || now.isBefore(end);
    }

    /**
     * The early-morning part of an overnight window belongs to the night that began
     * the day before, so it is checked against the previous day's entry.
     */
    public boolean isBedtimeAt(LocalDateTime local) {
        LocalTime t = local.toLocalTime();
        if (!isInWindow(start, end, t)) return false;

        DayOfWeek night = local.getDayOfWeek();
        if (isOvernight() && t.isBefore(end)) night = night.minus(1);
        return enabledDays.contains(night);
    }
}
