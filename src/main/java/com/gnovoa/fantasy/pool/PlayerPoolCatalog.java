package com.gnovoa.fantasy.pool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.fantasy.model.Player;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Loads and validates player pools.
 *
 * <p>Locations are Spring resource strings, so both {@code classpath:pools/demo-pool.json} and
 * {@code file:/data/pool.json} work. Files are expected to be JSON matching {@link PlayerPool}.
 */
public final class PlayerPoolCatalog {

  private static final Logger log = LoggerFactory.getLogger(PlayerPoolCatalog.class);

  private final ObjectMapper mapper;
  private final ResourceLoader resourceLoader;

  public PlayerPoolCatalog(ObjectMapper mapper, ResourceLoader resourceLoader) {
    this.mapper = mapper;
    this.resourceLoader = resourceLoader;
  }

  /**
   * Reads a pool and resolves it into players.
   *
   * @param location Spring resource location of the JSON file
   * @return players in file order (never empty)
   * @throws IllegalStateException if the file cannot be read or parsed
   * @throws IllegalArgumentException if the content is invalid (no players, duplicate ids, unknown
   *     positions)
   */
  public List<Player> load(String location) {
    Resource resource = resourceLoader.getResource(location);
    PlayerPool pool;
    try (InputStream in = resource.getInputStream()) {
      pool = mapper.readValue(in, PlayerPool.class);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load player pool from " + location, e);
    }

    validate(pool, location);
    List<Player> players = pool.toPlayers();
    log.info("Loaded {} players for season {} from {}", players.size(), pool.season(), location);
    return players;
  }

  /**
   * Checks the parsed pool:
   *
   * <ul>
   *   <li>At least one player
   *   <li>Every player has a non-blank id and a position
   *   <li>No id appears twice
   * </ul>
   */
  private void validate(PlayerPool pool, String location) {
    if (pool.players() == null || pool.players().isEmpty()) {
      throw new IllegalArgumentException("Player pool " + location + " has no players");
    }
    Set<String> ids = new HashSet<>();
    pool.players()
        .forEach(
            p -> {
              if (p.playerId() == null || p.playerId().isBlank()) {
                throw new IllegalArgumentException("Player without id in " + location);
              }
              if (p.position() == null) {
                throw new IllegalArgumentException(
                    "Player " + p.playerId() + " has no position (file " + location + ")");
              }
              if (!ids.add(p.playerId())) {
                throw new IllegalArgumentException(
                    "Duplicate player " + p.playerId() + " (file " + location + ")");
              }
            });
  }
}
