package com.gnovoa.fantasy.pool;

import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.PlayerStatus;
import com.gnovoa.fantasy.model.Position;
import java.util.List;

/**
 * JSON shape of a player pool file.
 *
 * <p>Positions and statuses are kept as the feed spells them ("Centre", "RD", "injured") and are
 * resolved in {@link #toPlayers()}.
 */
public record PlayerPool(String season, List<Entry> players) {

  public record Entry(
      String playerId,
      String name,
      String position,
      Double points,
      Integer wins,
      Integer saves,
      String status) {

    Player toPlayer() {
      return new Player(
          playerId,
          name,
          Position.fromCode(position),
          points == null ? 0 : points,
          wins == null ? 0 : wins,
          saves == null ? 0 : saves,
          PlayerStatus.fromCode(status));
    }
  }

  public List<Player> toPlayers() {
    return players.stream().map(Entry::toPlayer).toList();
  }
}
