package com.gnovoa.fantasy.model;

import com.gnovoa.fantasy.error.InvalidTeamSetException;

/**
 * League-level sizing used when planning a season.
 *
 * @param teamCount number of teams (at least 2)
 * @param weeks number of scheduled weeks
 * @param rosterSize roster cap used by the draft
 * @param draftRounds number of rounds in the recorded snake order
 */
public record LeagueScheduleConfig(int teamCount, int weeks, int rosterSize, int draftRounds) {
    public LeagueScheduleConfig {
        if (teamCount < 2) throw new InvalidTeamSetException("A league needs at least 2 teams, got " + teamCount);
        if (weeks < 1) throw new IllegalArgumentException("weeks must be >= 1");
        if (rosterSize < 1) throw new IllegalArgumentException("rosterSize must be >= 1");
        if (draftRounds < 1) throw new IllegalArgumentException("draftRounds must be >= 1");
    }
}
