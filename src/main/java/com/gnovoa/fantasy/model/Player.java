package com.gnovoa.fantasy.model;

/**
 * A rated player in the league pool.
 *
 * <p>{@code points} is the skater valuation score. Goalies are valued from {@code wins} and
 * {@code saves} instead (see {@code PlayerValuation}).
 */
public record Player(
        String playerId,
        String name,
        Position position,
        double points,
        int wins,
        int saves,
        PlayerStatus status
) {
    public Player {
        if (status == null) status = PlayerStatus.ACTIVE;
    }

    public static Player skater(String playerId, String name, Position position, double points) {
        return new Player(playerId, name, position, points, 0, 0, PlayerStatus.ACTIVE);
    }

    public static Player goalie(String playerId, String name, int wins, int saves) {
        return new Player(playerId, name, Position.G, 0, wins, saves, PlayerStatus.ACTIVE);
    }

    public boolean isAvailable() { return status.isAvailable(); }

    public Player withStatus(PlayerStatus newStatus) {
        return new Player(playerId, name, position, points, wins, saves, newStatus);
    }
}
