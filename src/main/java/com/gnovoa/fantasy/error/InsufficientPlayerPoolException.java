package com.gnovoa.fantasy.error;

import com.gnovoa.fantasy.model.Position;

/** The pool cannot cover a fixed per-team quota (in practice: goalies). */
public class InsufficientPlayerPoolException extends LeagueEngineException {

    private final Position position;
    private final int required;
    private final int available;

    public InsufficientPlayerPoolException(Position position, int required, int available) {
        super(String.format("Need %d players at %s but the pool has only %d", required, position, available));
        this.position = position;
        this.required = required;
        this.available = available;
    }

    public Position position() { return position; }
    public int required() { return required; }
    public int available() { return available; }
}
