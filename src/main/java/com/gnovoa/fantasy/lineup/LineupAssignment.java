package com.gnovoa.fantasy.lineup;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A team's lineup split into three disjoint groups.
 *
 * @param starters player id to slot label ({@code C-1}, {@code D-3}, {@code UTIL}), in fill order
 * @param bench player ids not starting, best first
 * @param ir player id to IR label ({@code IR-1}, ...), in fill order
 */
public record LineupAssignment(Map<String, String> starters, List<String> bench, Map<String, String> ir) {

    public enum Placement { STARTER, BENCH, IR }

    public LineupAssignment {
        starters = Collections.unmodifiableMap(new LinkedHashMap<>(starters));
        bench = List.copyOf(bench);
        ir = Collections.unmodifiableMap(new LinkedHashMap<>(ir));
    }

    public int size() {
        return starters.size() + bench.size() + ir.size();
    }

    public Optional<Placement> placementOf(String playerId) {
        if (starters.containsKey(playerId)) return Optional.of(Placement.STARTER);
        if (ir.containsKey(playerId)) return Optional.of(Placement.IR);
        if (bench.contains(playerId)) return Optional.of(Placement.BENCH);
        return Optional.empty();
    }

    /** @return the starter or IR label of the player; empty for bench or unknown players */
    public Optional<String> slotOf(String playerId) {
        String slot = starters.get(playerId);
        if (slot == null) slot = ir.get(playerId);
        return Optional.ofNullable(slot);
    }

    /**
     * A lineup worth saving has a real starting group and someone on the bench.
     *
     * @param minStarters fewest acceptable starters
     */
    public boolean isPlayable(int minStarters) {
        return starters.size() >= minStarters && !bench.isEmpty();
    }
}
