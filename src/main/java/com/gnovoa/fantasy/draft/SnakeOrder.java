package com.gnovoa.fantasy.draft;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Serpentine pick order: odd rounds run first to last, even rounds last to first. */
public final class SnakeOrder {

    private SnakeOrder() {}

    /**
     * @param round 1-based round number
     */
    public static <T> List<T> forRound(List<T> teams, int round) {
        if (round < 1) throw new IllegalArgumentException("Round must be >= 1, got " + round);
        List<T> order = new ArrayList<>(teams);
        if (round % 2 == 0) Collections.reverse(order);
        return order;
    }

    /** Pick order of every round, round 1 first. */
    public static <T> List<List<T>> rounds(List<T> teams, int totalRounds) {
        List<List<T>> all = new ArrayList<>(totalRounds);
        for (int r = 1; r <= totalRounds; r++) all.add(List.copyOf(forRound(teams, r)));
        return all;
    }
}
