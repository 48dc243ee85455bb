package com.gnovoa.fantasy;

import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Position;
import com.gnovoa.fantasy.model.Team;

import java.util.ArrayList;
import java.util.List;

/** Shared builders for test rosters and leagues. */
public final class Fixtures {

    private Fixtures() {}

    /** Teams with ids {@code T01..Tnn}, named after the same code. */
    public static List<Team> teams(int count) {
        List<Team> teams = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            String id = String.format("T%02d", i);
            teams.add(new Team(id, "Team " + id));
        }
        return teams;
    }

    public static List<Team> teams(String... ids) {
        List<Team> teams = new ArrayList<>(ids.length);
        for (String id : ids) teams.add(new Team(id, "Team " + id));
        return teams;
    }

    /**
     * {@code count} skaters at one position, ids {@code <prefix>-01..}, points descending from {@code topPoints}.
     */
    public static List<Player> skaters(Position position, String prefix, int count, double topPoints) {
        List<Player> players = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            players.add(Player.skater(String.format("%s-%02d", prefix, i), prefix + " " + i, position, topPoints - i));
        }
        return players;
    }

    /** {@code count} goalies with ids {@code <prefix>-01..}, wins descending from {@code topWins}. */
    public static List<Player> goalies(String prefix, int count, int topWins) {
        List<Player> players = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            players.add(Player.goalie(String.format("%s-%02d", prefix, i), prefix + " " + i, Math.max(1, topWins - i), 300));
        }
        return players;
    }
}
