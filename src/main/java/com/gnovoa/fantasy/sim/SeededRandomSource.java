package com.gnovoa.fantasy.sim;

import java.util.Random;

/** Replayable source: the same seed always produces the same sequence. */
public final class SeededRandomSource implements RandomSource {

    private final Random random;

    public SeededRandomSource(long seed) {
        this.random = new Random(seed);
    }

    @Override public int nextInt(int bound) {
        return random.nextInt(bound);
    }
}
