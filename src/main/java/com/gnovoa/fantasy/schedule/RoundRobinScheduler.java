package com.gnovoa.fantasy.schedule;

import com.gnovoa.fantasy.model.Team;

import java.util.*;

/**
 * Produces weekly head-to-head pairings for a league of any size using the circle method.
 *
 * <p>Provides:
 * <ul>
 *   <li>Per-week pairings for an even team count (no byes, {@code n-1} weeks per cycle)</li>
 *   <li>Per-week pairings for an odd team count (one bye per week, {@code n} weeks per cycle)</li>
 *   <li>Cycle repetition for weeks past the cycle length</li>
 * </ul>
 *
 * <p>The scheduler is fully deterministic for a given team order. Any randomisation (the one-time
 * season shuffle) happens in {@link SeasonScheduleGenerator} before the order is handed in here.
 */
public final class RoundRobinScheduler {

    /** A head-to-head pairing. {@code teamB} is null when {@code teamA} has a bye. */
    public record Pairing(Team teamA, Team teamB) {
        public static Pairing bye(Team team) { return new Pairing(team, null); }

        public boolean isBye() { return teamB == null; }

        public boolean involves(String teamId) {
            return teamA.teamId().equals(teamId) || (teamB != null && teamB.teamId().equals(teamId));
        }
    }

    /** All pairings of one week; every team appears in exactly one of them. */
    public record WeekPairing(int weekNumber, List<Pairing> pairings) {
        public WeekPairing {
            pairings = List.copyOf(pairings);
        }

        public Optional<Team> byeTeam() {
            return pairings.stream().filter(Pairing::isBye).map(Pairing::teamA).findFirst();
        }

        /** @return the opponent of the given team, or empty if it has a bye or does not play */
        public Optional<Team> opponentOf(String teamId) {
            for (Pairing p : pairings) {
                if (p.isBye()) continue;
                if (p.teamA().teamId().equals(teamId)) return Optional.of(p.teamB());
                if (p.teamB().teamId().equals(teamId)) return Optional.of(p.teamA());
            }
            return Optional.empty();
        }
    }

    /**
     * Weeks needed for every team to meet every other team once.
     *
     * @param teamCount number of teams
     * @return {@code teamCount - 1} when even, {@code teamCount} when odd
     */
    public static int cycleLength(int teamCount) {
        return teamCount % 2 == 0 ? teamCount - 1 : teamCount;
    }

    /**
     * Same as {@link #pairingsForWeek(List, int, int)} with the natural cycle length for the team count.
     */
    public WeekPairing pairingsForWeek(List<Team> teams, int weekNumber) {
        return pairingsForWeek(teams, weekNumber, cycleLength(teams == null ? 0 : teams.size()));
    }

    /**
     * Returns the pairings of one week using the circle method.
     *
     * <p>Weeks past {@code cycleLength} repeat the cycle: week {@code w} is played as round
     * {@code (w - 1) mod cycleLength}.
     *
     * @param teams teams in season order (index 0 is the fixed team)
     * @param weekNumber 1-based week
     * @param cycleLength weeks per cycle
     * @return the week's pairings
     *
     * @throws com.gnovoa.fantasy.error.InvalidTeamSetException if fewer than 2 teams or ids are null/duplicated
     * @throws IllegalArgumentException if week or cycle length is not positive
     */
    public WeekPairing pairingsForWeek(List<Team> teams, int weekNumber, int cycleLength) {
        TeamSetValidator.requireValid(teams);
        if (weekNumber < 1) throw new IllegalArgumentException("Week number must be >= 1, got " + weekNumber);
        if (cycleLength < 1) throw new IllegalArgumentException("Cycle length must be >= 1, got " + cycleLength);

        int round = (weekNumber - 1) % cycleLength;
        List<Pairing> pairings = teams.size() % 2 == 0
                ? evenRound(teams, round)
                : oddRound(teams, round);
        return new WeekPairing(weekNumber, pairings);
    }

    /**
     * Even count: team 0 stays put, the rest rotate left by {@code round}. The fixed team meets the
     * last rotated team and the remaining ones pair from the outside in.
     */
    private List<Pairing> evenRound(List<Team> teams, int round) {
        Team fixed = teams.get(0);
        List<Team> rotated = rotateLeft(teams.subList(1, teams.size()), round);

        List<Pairing> pairings = new ArrayList<>(teams.size() / 2);
        pairings.add(new Pairing(fixed, rotated.get(rotated.size() - 1)));
        pairInwards(rotated.subList(0, rotated.size() - 1), pairings);
        return pairings;
    }

    /**
     * Odd count: at offset 0 the fixed team sits out, otherwise the rotating team at
     * {@code offset - 1} does (which is season position {@code offset}). Everyone else, the fixed
     * team included, is read clockwise starting after the bye team and paired from the outside in,
     * so each round's pairs are mirror images around the team that sits out.
     */
    private List<Pairing> oddRound(List<Team> teams, int round) {
        int n = teams.size();
        int offset = round % n;

        List<Pairing> pairings = new ArrayList<>(n / 2 + 1);
        pairings.add(Pairing.bye(teams.get(offset)));

        List<Team> pool = rotateLeft(teams, offset + 1).subList(0, n - 1);
        pairInwards(pool, pairings);
        return pairings;
    }

    private void pairInwards(List<Team> teams, List<Pairing> out) {
        int size = teams.size();
        for (int i = 0; i < size / 2; i++) {
            out.add(new Pairing(teams.get(i), teams.get(size - 1 - i)));
        }
    }

    private List<Team> rotateLeft(List<Team> teams, int by) {
        int size = teams.size();
        int shift = Math.floorMod(by, size);
        List<Team> rotated = new ArrayList<>(size);
        rotated.addAll(teams.subList(shift, size));
        rotated.addAll(teams.subList(0, shift));
        return rotated;
    }
}
