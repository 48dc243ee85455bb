package com.gnovoa.fantasy.error;

/** An assignment would place more players than the roster actually holds. */
public class RosterOverflowException extends LeagueEngineException {

    public RosterOverflowException(String message) {
        super(message);
    }
}
