package com.gnovoa.fantasy.schedule;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;

/** Maps 1-based league weeks onto Monday-to-Sunday calendar weeks. */
public final class WeekCalendar {

    /** Week 1 starts on the Monday on or after the day the draft completed. */
    public LocalDate firstWeekStart(LocalDate draftCompletedOn) {
        return draftCompletedOn.with(TemporalAdjusters.nextOrSame(DayOfWeek.MONDAY));
    }

    public LocalDate weekStart(int weekNumber, LocalDate firstWeekStart) {
        if (weekNumber < 1) throw new IllegalArgumentException("Week number must be >= 1, got " + weekNumber);
        return firstWeekStart.plusWeeks(weekNumber - 1L);
    }

    public LocalDate weekEnd(int weekNumber, LocalDate firstWeekStart) {
        return weekStart(weekNumber, firstWeekStart).plusDays(6);
    }

    /**
     * @return the league week containing {@code date}, or 0 if the season has not started yet
     */
    public int weekContaining(LocalDate date, LocalDate firstWeekStart) {
        if (date.isBefore(firstWeekStart)) return 0;
        return (int) (ChronoUnit.DAYS.between(firstWeekStart, date) / 7) + 1;
    }
}
