package com.gnovoa.fantasy.model;

public record PositionRange(int min, int max) {
    public PositionRange {
        if (min < 0 || max < min) {
            throw new IllegalArgumentException("Invalid position range " + min + ".." + max);
        }
    }
}
