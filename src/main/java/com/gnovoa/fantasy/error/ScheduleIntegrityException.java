package com.gnovoa.fantasy.error;

import java.util.Set;

/**
 * A generated week does not cover every team exactly once. This is a scheduler defect, never a
 * recoverable condition: the whole generation run is abandoned.
 */
public class ScheduleIntegrityException extends LeagueEngineException {

    private final int weekNumber;

    public ScheduleIntegrityException(int weekNumber, Set<String> missing, Set<String> repeated, Set<String> unknown) {
        super(String.format("Week %d pairings are incomplete: missing=%s repeated=%s unknown=%s",
                weekNumber, missing, repeated, unknown));
        this.weekNumber = weekNumber;
    }

    public int weekNumber() { return weekNumber; }
}
