package com.gnovoa.fantasy.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.gnovoa.fantasy.lineup.SlotQuotas;
import com.gnovoa.fantasy.model.Position;
import com.gnovoa.fantasy.model.PositionQuota;
import com.gnovoa.fantasy.model.PositionRange;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class EnginePropertiesTest {

  private static EngineProperties bind(Map<String, String> properties) {
    Binder binder = new Binder(new MapConfigurationPropertySource(properties));
    return binder.bindOrCreate("engine", EngineProperties.class);
  }

  @Test
  @DisplayName("No engine settings at all falls back to the league defaults")
  void emptyConfigurationUsesDefaults() {
    EngineProperties props = bind(Map.of());

    assertThat(props.schedule().seed()).isNull();
    assertThat(props.draft().rosterCap()).isEqualTo(21);
    assertThat(props.draft().goalieBaseline()).isEqualTo(100.0);
    assertThat(props.draft().quota().toPositionQuota()).isEqualTo(PositionQuota.standard());
    assertThat(props.lineup().slots().toSlotQuotas()).isEqualTo(SlotQuotas.standard());
    assertThat(props.lineup().irCap()).isEqualTo(3);
    assertThat(props.demo().enabled()).isFalse();
    assertThat(props.demo().poolResource()).isEqualTo("classpath:pools/demo-pool.json");
    assertThat(props.demo().teamNames()).isEmpty();
  }

  @Test
  @DisplayName("A partly set block keeps the defaults for everything it leaves out")
  void partialBlocksKeepDefaults() {
    EngineProperties props = bind(Map.of(
        "engine.draft.roster-cap", "18",
        "engine.lineup.slots.center", "3"));

    assertThat(props.draft().rosterCap()).isEqualTo(18);
    assertThat(props.draft().goalieBaseline()).isEqualTo(100.0);
    assertThat(props.draft().goalieWinWeight()).isEqualTo(4.0);
    assertThat(props.draft().goalieSaveWeight()).isEqualTo(0.2);
    assertThat(props.lineup().slots().toSlotQuotas()).isEqualTo(new SlotQuotas(3, 2, 2, 4, 2, 1));
    assertThat(props.lineup().irCap()).isEqualTo(3);
  }

  @Test
  @DisplayName("Quota overrides replace single positions and keep the rest")
  void quotaOverridesMergeWithDefaults() {
    EngineProperties props = bind(Map.of(
        "engine.draft.quota.goalie-count", "2",
        "engine.draft.quota.targets.d.min", "6",
        "engine.draft.quota.targets.d.max", "8"));

    PositionQuota quota = props.draft().quota().toPositionQuota();

    assertThat(quota.goalieCount()).isEqualTo(2);
    assertThat(quota.target(Position.D)).isEqualTo(new PositionRange(6, 8));
    assertThat(quota.target(Position.C)).isEqualTo(new PositionRange(4, 5));
    assertThat(quota.startingMinimum(Position.D)).isEqualTo(4);
  }
}
