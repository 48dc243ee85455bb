package com.gnovoa.fantasy.config;

import com.gnovoa.fantasy.lineup.SlotQuotas;
import com.gnovoa.fantasy.model.Position;
import com.gnovoa.fantasy.model.PositionQuota;
import com.gnovoa.fantasy.model.PositionRange;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;

/**
 * {@code engine.*} settings. Every value has a default, so a block may be set only in part.
 */
@ConfigurationProperties(prefix = "engine")
public record EngineProperties(
    @DefaultValue Schedule schedule,
    @DefaultValue Draft draft,
    @DefaultValue Lineup lineup,
    @DefaultValue Demo demo) {

  /** {@code seed} null means every schedule run shuffles differently. */
  public record Schedule(Long seed) {}

  public record Draft(
      @DefaultValue("21") int rosterCap,
      @DefaultValue("100") double goalieBaseline,
      @DefaultValue("4") double goalieWinWeight,
      @DefaultValue("0.2") double goalieSaveWeight,
      @DefaultValue Quota quota) {}

  /**
   * Draft targets. Positions left out of {@code targets} or {@code startingMinimums} keep the
   * league default from {@link PositionQuota#standard()}.
   */
  public record Quota(
      @DefaultValue("3") int goalieCount,
      @DefaultValue Map<Position, PositionRange> targets,
      @DefaultValue Map<Position, Integer> startingMinimums) {

    public PositionQuota toPositionQuota() {
      PositionQuota defaults = PositionQuota.standard();

      Map<Position, PositionRange> mergedTargets = new EnumMap<>(Position.class);
      mergedTargets.putAll(defaults.targets());
      mergedTargets.putAll(targets);

      Map<Position, Integer> mergedStarting = new EnumMap<>(Position.class);
      mergedStarting.putAll(defaults.startingMinimums());
      mergedStarting.putAll(startingMinimums);

      return new PositionQuota(mergedTargets, mergedStarting, goalieCount);
    }
  }

  public record Lineup(@DefaultValue Slots slots, @DefaultValue("3") int irCap) {}

  public record Slots(
      @DefaultValue("2") int center,
      @DefaultValue("2") int leftWing,
      @DefaultValue("2") int rightWing,
      @DefaultValue("4") int defense,
      @DefaultValue("2") int goalie,
      @DefaultValue("1") int utility) {

    public SlotQuotas toSlotQuotas() {
      return new SlotQuotas(center, leftWing, rightWing, defense, goalie, utility);
    }
  }

  /** {@code draftCompletedOn} unset means the demo league is drafted today. */
  public record Demo(
      @DefaultValue("false") boolean enabled,
      @DefaultValue("classpath:pools/demo-pool.json") String poolResource,
      @DefaultValue("20") int weeks,
      @DefaultValue List<String> teamNames,
      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate draftCompletedOn) {}
}
