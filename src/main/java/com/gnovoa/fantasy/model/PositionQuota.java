package com.gnovoa.fantasy.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Roster-building targets for a drafted team.
 *
 * <p>{@code targets} holds the roster min/max per skater position, {@code startingMinimums} the
 * number of skaters a valid starting lineup needs at each position. Goalies are not part of
 * either map: every team receives exactly {@code goalieCount} of them before the snake draft.
 */
public record PositionQuota(
        Map<Position, PositionRange> targets,
        Map<Position, Integer> startingMinimums,
        int goalieCount
) {
    public PositionQuota {
        if (goalieCount < 0) throw new IllegalArgumentException("goalieCount must be >= 0");
        targets = copySkaters(targets, "targets");
        startingMinimums = copySkaters(startingMinimums, "startingMinimums");
    }

    /** The league default: 4-5 C/LW/RW, 5-6 D, a 2/2/2/4 starting core and 3 goalies. */
    public static PositionQuota standard() {
        Map<Position, PositionRange> targets = new EnumMap<>(Position.class);
        targets.put(Position.C, new PositionRange(4, 5));
        targets.put(Position.LW, new PositionRange(4, 5));
        targets.put(Position.RW, new PositionRange(4, 5));
        targets.put(Position.D, new PositionRange(5, 6));

        Map<Position, Integer> starting = new EnumMap<>(Position.class);
        starting.put(Position.C, 2);
        starting.put(Position.LW, 2);
        starting.put(Position.RW, 2);
        starting.put(Position.D, 4);

        return new PositionQuota(targets, starting, 3);
    }

    public PositionRange target(Position position) {
        return targets.getOrDefault(position, new PositionRange(0, 0));
    }

    public int startingMinimum(Position position) {
        return startingMinimums.getOrDefault(position, 0);
    }

    private static <V> Map<Position, V> copySkaters(Map<Position, V> source, String what) {
        Map<Position, V> copy = new EnumMap<>(Position.class);
        if (source == null) return Map.copyOf(copy);
        source.forEach((pos, v) -> {
            if (pos == null || v == null) {
                throw new IllegalArgumentException("Null position or value in " + what);
            }
            if (pos == Position.G) {
                throw new IllegalArgumentException("Goalies are set through goalieCount, not " + what);
            }
            copy.put(pos, v);
        });
        return Map.copyOf(copy);
    }
}
