package com.gnovoa.fantasy.draft;

import com.gnovoa.fantasy.error.InsufficientPlayerPoolException;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Position;
import com.gnovoa.fantasy.model.PositionQuota;
import com.gnovoa.fantasy.model.Team;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/**
 * Simulates a position-aware snake draft for synthetic leagues.
 *
 * <p>Goalies are scarce, so each team receives a fixed number of them up front. The remaining pool
 * is then drafted serpentine, each team filling its most urgent {@link DraftNeedTier} with the best
 * available player. When every need is met, or the pool has nobody for the most urgent tier, the
 * team takes the best non-goalie instead.
 *
 * <p>This is a simulation tool. Live drafts are recorded pick by pick elsewhere.
 */
public final class DraftAllocator {

    private static final Logger log = LoggerFactory.getLogger(DraftAllocator.class);

    private final PlayerValuation valuation;

    public DraftAllocator(PlayerValuation valuation) {
        this.valuation = valuation;
    }

    /**
     * Drafts for {@code teamCount} synthetic teams named {@code Team 1..n} with ids {@code team-1..n}.
     */
    public DraftResult allocate(List<Player> players, int teamCount, PositionQuota quota, int rosterCap) {
        if (teamCount < 1) throw new IllegalArgumentException("teamCount must be >= 1, got " + teamCount);
        List<Team> teams = new ArrayList<>(teamCount);
        for (int i = 1; i <= teamCount; i++) teams.add(new Team("team-" + i, "Team " + i));
        return allocate(players, teams, quota, rosterCap);
    }

    /**
     * Runs the draft.
     *
     * @param players pool in any order
     * @param teams teams in round-1 pick order
     * @param quota goalie count and skater targets
     * @param rosterCap maximum players per team, goalies included
     * @return rosters, picks and leftover free agents
     *
     * @throws InsufficientPlayerPoolException if there are fewer than {@code teams * goalieCount} goalies
     * @throws IllegalArgumentException on empty team list, duplicate players or a cap below the goalie count
     */
    public DraftResult allocate(List<Player> players, List<Team> teams, PositionQuota quota, int rosterCap) {
        requireArguments(players, teams, quota, rosterCap);

        List<Player> ranked = new ArrayList<>(players);
        ranked.sort(valuation.ranking());

        Map<Team, List<Player>> rosters = new LinkedHashMap<>();
        for (Team t : teams) rosters.put(t, new ArrayList<>());

        List<Player> pool = allocateGoalies(ranked, teams, rosters, quota.goalieCount());
        List<DraftPick> picks = new ArrayList<>();

        int round = 1;
        while (!pool.isEmpty() && !allFull(rosters, rosterCap)) {
            boolean anyPick = false;

            for (Team team : SnakeOrder.forRound(teams, round)) {
                if (pool.isEmpty()) break;
                List<Player> roster = rosters.get(team);
                if (roster.size() >= rosterCap) continue;

                int idx = choosePick(roster, pool, quota);
                if (idx < 0) {
                    log.debug("Round {}: {} passes, nothing eligible left", round, team.teamId());
                    continue;
                }

                Player player = pool.remove(idx);
                roster.add(player);
                picks.add(new DraftPick(round, picks.size() + 1, team, player));
                anyPick = true;
                log.debug("Round {} pick {}: {} takes {} ({})", round, picks.size(), team.teamId(), player.playerId(), player.position());
            }

            if (!anyPick) break;
            round++;
        }

        log.info("Draft finished: {} teams, {} picks over {} rounds, {} free agents",
                teams.size(), picks.size(), picks.isEmpty() ? 0 : picks.get(picks.size() - 1).round(), pool.size());
        return new DraftResult(rosters, picks, pool);
    }

    /**
     * Gives every team {@code perTeam} goalies, best goalies to the first team, and returns the
     * ranked pool without them.
     */
    private List<Player> allocateGoalies(List<Player> ranked, List<Team> teams, Map<Team, List<Player>> rosters, int perTeam) {
        List<Player> goalies = ranked.stream().filter(p -> p.position().isGoalie()).toList();
        int required = teams.size() * perTeam;
        if (goalies.size() < required) {
            throw new InsufficientPlayerPoolException(Position.G, required, goalies.size());
        }

        Set<String> taken = new HashSet<>();
        int next = 0;
        for (Team team : teams) {
            for (int g = 0; g < perTeam; g++) {
                Player goalie = goalies.get(next++);
                rosters.get(team).add(goalie);
                taken.add(goalie.playerId());
            }
        }

        List<Player> pool = new ArrayList<>(ranked.size() - taken.size());
        for (Player p : ranked) {
            if (!taken.contains(p.playerId())) pool.add(p);
        }
        return pool;
    }

    /**
     * Picks from a pool already sorted best first.
     *
     * @return index in {@code pool}, or -1 if the team can take nobody
     */
    int choosePick(List<Player> roster, List<Player> pool, PositionQuota quota) {
        Map<Position, Integer> counts = new EnumMap<>(Position.class);
        for (Player p : roster) counts.merge(p.position(), 1, Integer::sum);

        // only the most urgent tier with an open position counts, even if the pool cannot fill it
        for (DraftNeedTier tier : DraftNeedTier.values()) {
            Set<Position> needs = tier.unmetPositions(quota, counts);
            if (needs.isEmpty()) continue;
            int idx = indexOfFirst(pool, p -> needs.contains(p.position()));
            if (idx >= 0) return idx;
            break;
        }
        return indexOfFirst(pool, p -> !p.position().isGoalie());
    }

    private int indexOfFirst(List<Player> pool, Predicate<Player> match) {
        for (int i = 0; i < pool.size(); i++) {
            if (match.test(pool.get(i))) return i;
        }
        return -1;
    }

    private boolean allFull(Map<Team, List<Player>> rosters, int rosterCap) {
        for (List<Player> r : rosters.values()) {
            if (r.size() < rosterCap) return false;
        }
        return true;
    }

    private void requireArguments(List<Player> players, List<Team> teams, PositionQuota quota, int rosterCap) {
        if (teams == null || teams.isEmpty()) throw new IllegalArgumentException("At least one team is required");
        if (players == null) throw new IllegalArgumentException("Player pool is null");
        if (rosterCap < quota.goalieCount()) {
            throw new IllegalArgumentException("Roster cap " + rosterCap + " cannot hold " + quota.goalieCount() + " goalies");
        }
        Set<String> teamIds = new HashSet<>();
        for (Team t : teams) {
            if (!teamIds.add(t.teamId())) throw new IllegalArgumentException("Duplicate team id " + t.teamId());
        }
        Set<String> ids = new HashSet<>();
        for (Player p : players) {
            if (!ids.add(p.playerId())) throw new IllegalArgumentException("Duplicate player id " + p.playerId());
        }
    }
}
