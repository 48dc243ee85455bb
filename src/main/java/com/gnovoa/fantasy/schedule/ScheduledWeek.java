package com.gnovoa.fantasy.schedule;

import com.gnovoa.fantasy.schedule.RoundRobinScheduler.WeekPairing;

import java.time.LocalDate;

public record ScheduledWeek(WeekPairing pairing, LocalDate startDate, LocalDate endDate) {
    public int weekNumber() { return pairing.weekNumber(); }
}
