package com.gnovoa.fantasy.schedule;

import com.gnovoa.fantasy.error.ScheduleIntegrityException;
import com.gnovoa.fantasy.model.Team;
import com.gnovoa.fantasy.schedule.RoundRobinScheduler.WeekPairing;
import com.gnovoa.fantasy.sim.LocalRandomSource;
import com.gnovoa.fantasy.sim.RandomSource;
import com.gnovoa.fantasy.sim.SeededRandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a whole season in memory and only returns it once every week has been validated.
 *
 * <p>The team list is shuffled exactly once per run and that order is kept for every week, which
 * is what keeps the circle method's guarantees intact across the season. With a configured seed,
 * running again on the same input reproduces the same schedule, so a caller can always regenerate
 * wholesale instead of patching weeks.
 */
public final class SeasonScheduleGenerator {

    private static final Logger log = LoggerFactory.getLogger(SeasonScheduleGenerator.class);

    private final RoundRobinScheduler scheduler;
    private final ScheduleValidator validator;
    private final WeekCalendar calendar;
    private final Long seed;

    /**
     * @param seed shuffle seed, or null for an unseeded shuffle per run
     */
    public SeasonScheduleGenerator(RoundRobinScheduler scheduler, ScheduleValidator validator, WeekCalendar calendar, Long seed) {
        this.scheduler = scheduler;
        this.validator = validator;
        this.calendar = calendar;
        this.seed = seed;
    }

    public SeasonSchedule generate(List<Team> teams, int weeks, LocalDate firstWeekStart) {
        RandomSource rnd = seed == null ? new LocalRandomSource() : new SeededRandomSource(seed);
        return generate(teams, weeks, firstWeekStart, rnd);
    }

    /**
     * Generates and validates {@code weeks} weeks of pairings.
     *
     * @param teams league teams in any order
     * @param weeks number of weeks to schedule
     * @param firstWeekStart Monday of week 1
     * @param rnd source for the one-time shuffle
     * @return the validated season
     *
     * @throws com.gnovoa.fantasy.error.InvalidTeamSetException if the team set is invalid
     * @throws ScheduleIntegrityException if any generated week is incomplete
     */
    public SeasonSchedule generate(List<Team> teams, int weeks, LocalDate firstWeekStart, RandomSource rnd) {
        TeamSetValidator.requireValid(teams);
        if (weeks < 1) throw new IllegalArgumentException("Season needs at least 1 week, got " + weeks);

        List<Team> order = new ArrayList<>(teams);
        rnd.shuffle(order);

        int cycle = RoundRobinScheduler.cycleLength(order.size());
        log.info("Generating {} weeks for {} teams ({} weeks per cycle)", weeks, order.size(), cycle);

        List<WeekPairing> pairings = new ArrayList<>(weeks);
        for (int week = 1; week <= weeks; week++) {
            WeekPairing wp = scheduler.pairingsForWeek(order, week, cycle);
            log.debug("Week {}: {}", week, wp.pairings());
            pairings.add(wp);
        }

        try {
            validator.validateAll(order, pairings);
        } catch (ScheduleIntegrityException e) {
            log.error("Discarding generated schedule: {}", e.getMessage());
            throw e;
        }

        List<ScheduledWeek> scheduled = new ArrayList<>(weeks);
        for (WeekPairing wp : pairings) {
            int w = wp.weekNumber();
            scheduled.add(new ScheduledWeek(wp, calendar.weekStart(w, firstWeekStart), calendar.weekEnd(w, firstWeekStart)));
        }
        return new SeasonSchedule(order, cycle, scheduled);
    }
}
