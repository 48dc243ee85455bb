package com.gnovoa.fantasy.schedule;

import com.gnovoa.fantasy.error.ScheduleIntegrityException;
import com.gnovoa.fantasy.model.Team;
import com.gnovoa.fantasy.schedule.RoundRobinScheduler.Pairing;
import com.gnovoa.fantasy.schedule.RoundRobinScheduler.WeekPairing;

import java.util.*;

/**
 * Post-hoc completeness check for generated weeks: every league team appears in exactly one
 * pairing, and nobody outside the league appears at all.
 */
public final class ScheduleValidator {

    /**
     * @throws ScheduleIntegrityException if the week misses, repeats or invents a team
     */
    public void validateWeek(List<Team> teams, WeekPairing week) {
        Set<String> expected = new LinkedHashSet<>();
        for (Team t : teams) expected.add(t.teamId());

        Set<String> seen = new HashSet<>();
        Set<String> repeated = new TreeSet<>();
        Set<String> unknown = new TreeSet<>();

        for (Pairing p : week.pairings()) {
            tally(p.teamA(), expected, seen, repeated, unknown);
            if (!p.isBye()) tally(p.teamB(), expected, seen, repeated, unknown);
        }

        Set<String> missing = new TreeSet<>(expected);
        missing.removeAll(seen);

        if (!missing.isEmpty() || !repeated.isEmpty() || !unknown.isEmpty()) {
            throw new ScheduleIntegrityException(week.weekNumber(), missing, repeated, unknown);
        }
    }

    public void validateAll(List<Team> teams, List<WeekPairing> weeks) {
        for (WeekPairing w : weeks) validateWeek(teams, w);
    }

    private void tally(Team team, Set<String> expected, Set<String> seen, Set<String> repeated, Set<String> unknown) {
        String id = team == null ? "null" : team.teamId();
        if (!expected.contains(id)) {
            unknown.add(id);
            return;
        }
        if (!seen.add(id)) repeated.add(id);
    }
}
