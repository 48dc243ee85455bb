package com.gnovoa.fantasy.schedule;

import com.gnovoa.fantasy.model.Team;

import java.util.List;

/**
 * A fully validated season.
 *
 * @param teamOrder the shuffled order held fixed for the whole season
 * @param cycleLength weeks per round-robin cycle
 * @param weeks all generated weeks, week 1 first
 */
public record SeasonSchedule(List<Team> teamOrder, int cycleLength, List<ScheduledWeek> weeks) {
    public SeasonSchedule {
        teamOrder = List.copyOf(teamOrder);
        weeks = List.copyOf(weeks);
    }

    public ScheduledWeek week(int weekNumber) {
        if (weekNumber < 1 || weekNumber > weeks.size()) {
            throw new IllegalArgumentException("No week " + weekNumber + " in a " + weeks.size() + "-week season");
        }
        return weeks.get(weekNumber - 1);
    }
}
