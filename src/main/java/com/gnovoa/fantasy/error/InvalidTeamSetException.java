package com.gnovoa.fantasy.error;

/** Fewer than two teams, or null/duplicate team identifiers. */
public class InvalidTeamSetException extends LeagueEngineException {

    public InvalidTeamSetException(String message) {
        super(message);
    }
}
