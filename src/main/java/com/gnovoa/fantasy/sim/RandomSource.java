package com.gnovoa.fantasy.sim;

import java.util.List;

/** Randomness behind the season shuffle. Tests and reproducible runs plug in a seeded source. */
public interface RandomSource {

    /** @return a value in {@code [0, bound)} */
    int nextInt(int bound);

    /** In-place Fisher-Yates shuffle driven by this source, so a seeded source yields a fixed order. */
    default <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i > 0; i--) {
            int j = nextInt(i + 1);
            T tmp = list.get(i);
            list.set(i, list.get(j));
            list.set(j, tmp);
        }
    }
}
