package com.gnovoa.fantasy.model;

import java.util.Locale;
import java.util.Map;

/** Hockey roster positions. Goalies are drafted and slotted separately from skaters. */
public enum Position {
    C,
    LW,
    RW,
    D,
    G;

    /** Skater positions in the order the draft evaluates needs. */
    public static final Position[] SKATERS = {C, LW, RW, D};

    private static final Map<String, Position> ALIASES = Map.ofEntries(
            Map.entry("C", C), Map.entry("CENTRE", C), Map.entry("CENTER", C),
            Map.entry("LW", LW), Map.entry("L", LW), Map.entry("LEFT WING", LW), Map.entry("LEFTWING", LW),
            Map.entry("RW", RW), Map.entry("R", RW), Map.entry("RIGHT WING", RW), Map.entry("RIGHTWING", RW),
            Map.entry("D", D), Map.entry("LD", D), Map.entry("RD", D), Map.entry("DEFENCE", D), Map.entry("DEFENSE", D),
            Map.entry("G", G), Map.entry("GOALIE", G)
    );

    public boolean isGoalie() { return this == G; }

    /**
     * Resolves a position code as it arrives from the player feed ("Centre", "L", "RD", "Goalie", ...).
     *
     * @throws IllegalArgumentException if the code is blank or unknown
     */
    public static Position fromCode(String code) {
        if (code == null || code.isBlank()) throw new IllegalArgumentException("Position code is blank");
        Position p = ALIASES.get(code.trim().toUpperCase(Locale.ROOT));
        if (p == null) throw new IllegalArgumentException("Unknown position code " + code);
        return p;
    }
}
