package com.gnovoa.fantasy.sim;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/** Unseeded source for production schedules. */
public final class LocalRandomSource implements RandomSource {
    @Override public int nextInt(int bound) {
        return ThreadLocalRandom.current().nextInt(bound);
    }
    @Override public <T> void shuffle(List<T> list) {
        Collections.shuffle(list, ThreadLocalRandom.current());
    }
}
