package com.gnovoa.fantasy.schedule;

import com.gnovoa.fantasy.error.InvalidTeamSetException;
import com.gnovoa.fantasy.model.Team;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Input checks shared by every entry point that takes a league's team list. */
public final class TeamSetValidator {

    private TeamSetValidator() {}

    /**
     * @throws InvalidTeamSetException if there are fewer than 2 teams or any id is null, blank or repeated
     */
    public static void requireValid(List<Team> teams) {
        if (teams == null || teams.size() < 2) {
            throw new InvalidTeamSetException("Need at least 2 teams, got " + (teams == null ? 0 : teams.size()));
        }
        Set<String> seen = new HashSet<>();
        for (Team t : teams) {
            if (t == null || t.teamId() == null || t.teamId().isBlank()) {
                throw new InvalidTeamSetException("Team list contains a null or blank team id");
            }
            if (!seen.add(t.teamId())) {
                throw new InvalidTeamSetException("Duplicate team id " + t.teamId());
            }
        }
    }
}
