package com.gnovoa.fantasy.lineup;

import com.gnovoa.fantasy.model.Position;

/**
 * Starting-lineup slot counts per position plus the flex {@code utility} slots any skater may fill.
 */
public record SlotQuotas(int center, int leftWing, int rightWing, int defense, int goalie, int utility) {
    public SlotQuotas {
        if (center < 0 || leftWing < 0 || rightWing < 0 || defense < 0 || goalie < 0 || utility < 0) {
            throw new IllegalArgumentException("Slot quotas must be >= 0");
        }
    }

    /** 2 C, 2 LW, 2 RW, 4 D, 2 G and 1 UTIL: 13 starters. */
    public static SlotQuotas standard() {
        return new SlotQuotas(2, 2, 2, 4, 2, 1);
    }

    public int forPosition(Position position) {
        return switch (position) {
            case C -> center;
            case LW -> leftWing;
            case RW -> rightWing;
            case D -> defense;
            case G -> goalie;
        };
    }

    public int total() {
        return center + leftWing + rightWing + defense + goalie + utility;
    }
}
