package com.gnovoa.fantasy.lineup;

import com.gnovoa.fantasy.draft.PlayerValuation;
import com.gnovoa.fantasy.error.RosterOverflowException;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Position;

import java.util.*;

/**
 * Builds a default lineup from a roster.
 *
 * <p>Unavailable players (injured, suspended, IR) are parked on IR while slots last and on the bench
 * after that. Everyone else is taken best first: own-position slot if one is open, otherwise a
 * UTIL slot for skaters, otherwise the bench. Labels are handed out in fill order, so the best
 * centre is always {@code C-1}.
 *
 * <p>Lock state and game times are not considered here; who may move at a given moment is decided
 * by the caller.
 */
public final class LineupSlotAssigner {

    public static final String UTIL = "UTIL";

    private final PlayerValuation valuation;

    public LineupSlotAssigner(PlayerValuation valuation) {
        this.valuation = valuation;
    }

    /**
     * @param roster the team's players in any order
     * @param quotas starting slots per position
     * @param irCap number of IR slots
     * @return the lineup; every roster player appears in exactly one group
     *
     * @throws RosterOverflowException if the roster lists a player twice or placements do not add up
     */
    public LineupAssignment assign(List<Player> roster, SlotQuotas quotas, int irCap) {
        if (irCap < 0) throw new IllegalArgumentException("irCap must be >= 0, got " + irCap);
        requireDistinct(roster);

        List<Player> sorted = new ArrayList<>(roster);
        sorted.sort(valuation.ranking());

        Map<String, String> starters = new LinkedHashMap<>();
        List<String> bench = new ArrayList<>();
        Map<String, String> ir = new LinkedHashMap<>();

        Map<Position, Integer> filled = new EnumMap<>(Position.class);
        int utilFilled = 0;

        for (Player p : sorted) {
            String id = p.playerId();

            if (!p.isAvailable()) {
                if (ir.size() < irCap) ir.put(id, "IR-" + (ir.size() + 1));
                else bench.add(id);
                continue;
            }

            Position pos = p.position();
            int used = filled.getOrDefault(pos, 0);
            if (used < quotas.forPosition(pos)) {
                filled.put(pos, used + 1);
                starters.put(id, pos.name() + "-" + (used + 1));
            } else if (!pos.isGoalie() && utilFilled < quotas.utility()) {
                utilFilled++;
                starters.put(id, utilFilled == 1 ? UTIL : UTIL + "-" + utilFilled);
            } else {
                bench.add(id);
            }
        }

        LineupAssignment lineup = new LineupAssignment(starters, bench, ir);
        if (lineup.size() != roster.size() || starters.size() > quotas.total()) {
            throw new RosterOverflowException("Lineup places " + lineup.size() + " players (" + starters.size()
                    + " starting) for a roster of " + roster.size());
        }
        return lineup;
    }

    private void requireDistinct(List<Player> roster) {
        Set<String> seen = new HashSet<>();
        for (Player p : roster) {
            if (!seen.add(p.playerId())) {
                throw new RosterOverflowException("Player " + p.playerId() + " is listed twice on the roster");
            }
        }
    }
}
