package com.gnovoa.fantasy.pool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.PlayerStatus;
import com.gnovoa.fantasy.model.Position;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class PlayerPoolCatalogTest {

  private final PlayerPoolCatalog catalog =
      new PlayerPoolCatalog(
          new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false),
          new DefaultResourceLoader());

  @Test
  @DisplayName("The bundled demo pool loads with every position represented")
  void loadsDemoPool() {
    List<Player> players = catalog.load("classpath:pools/demo-pool.json");

    assertThat(players).hasSize(250);
    assertThat(players).filteredOn(p -> p.position() == Position.G).hasSize(36);
    assertThat(players).extracting(Player::position).contains(Position.C, Position.LW, Position.RW, Position.D);
    assertThat(players).anyMatch(p -> !p.isAvailable());
  }

  @Test
  @DisplayName("Feed aliases and missing fields resolve to model values")
  void resolvesFeedValues() {
    List<Player> players = catalog.load("classpath:pools/small-pool.json");

    assertThat(players)
        .extracting(Player::position)
        .containsExactly(Position.C, Position.LW, Position.D, Position.G, Position.G);
    assertThat(players.get(1).status()).isEqualTo(PlayerStatus.INJURED);
    assertThat(players.get(2).status()).isEqualTo(PlayerStatus.ACTIVE);
    assertThat(players.get(3).wins()).isEqualTo(12);
    assertThat(players.get(3).saves()).isEqualTo(410);
    assertThat(players.get(4).wins()).isZero();
    assertThat(players.get(4).points()).isZero();
  }

  @Test
  void duplicateIdsRejected() {
    assertThatThrownBy(() -> catalog.load("classpath:pools/duplicate-pool.json"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("p-c-001");
  }

  @Test
  void unknownPositionRejected() {
    assertThatThrownBy(() -> catalog.load("classpath:pools/unknown-position-pool.json"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Rover");
  }

  @Test
  void missingFileIsAnIllegalState() {
    assertThatThrownBy(() -> catalog.load("classpath:pools/no-such-pool.json"))
        .isInstanceOf(IllegalStateException.class);
  }
}
