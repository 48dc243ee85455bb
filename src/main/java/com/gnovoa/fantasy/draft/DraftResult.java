package com.gnovoa.fantasy.draft;

import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Team;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a simulated draft.
 *
 * @param rosters each team's players in acquisition order (fixed goalies first, then picks), in team order
 * @param picks snake-draft selections in pick order (the fixed goalie allocation is not a pick)
 * @param freeAgents undrafted players, best first
 */
public record DraftResult(Map<Team, List<Player>> rosters, List<DraftPick> picks, List<Player> freeAgents) {
    public DraftResult {
        Map<Team, List<Player>> copy = new LinkedHashMap<>();
        rosters.forEach((team, players) -> copy.put(team, List.copyOf(players)));
        rosters = Collections.unmodifiableMap(copy);
        picks = List.copyOf(picks);
        freeAgents = List.copyOf(freeAgents);
    }

    public List<Player> rosterOf(String teamId) {
        return rosters.entrySet().stream()
                .filter(e -> e.getKey().teamId().equals(teamId))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown team " + teamId));
    }

    public int draftedCount() {
        return rosters.values().stream().mapToInt(List::size).sum();
    }
}
