package com.gnovoa.fantasy.error;

/**
 * Base type for fatal engine failures.
 *
 * <p>The engine never retries or returns a partial result. Callers decide whether to surface the
 * message or to run again with corrected input.
 */
public abstract class LeagueEngineException extends RuntimeException {

    protected LeagueEngineException(String message) {
        super(message);
    }
}
