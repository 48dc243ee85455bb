package com.gnovoa.fantasy.lineup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.gnovoa.fantasy.Fixtures;
import com.gnovoa.fantasy.draft.PlayerValuation;
import com.gnovoa.fantasy.error.RosterOverflowException;
import com.gnovoa.fantasy.lineup.LineupAssignment.Placement;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.PlayerStatus;
import com.gnovoa.fantasy.model.Position;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LineupSlotAssignerTest {

  private final LineupSlotAssigner assigner = new LineupSlotAssigner(new PlayerValuation(100, 4, 0.2));

  private static List<Player> fullRoster() {
    List<Player> roster = new ArrayList<>();
    roster.addAll(Fixtures.goalies("G", 3, 30));
    roster.addAll(Fixtures.skaters(Position.C, "C", 4, 80));
    roster.addAll(Fixtures.skaters(Position.LW, "LW", 4, 70));
    roster.addAll(Fixtures.skaters(Position.RW, "RW", 4, 60));
    roster.addAll(Fixtures.skaters(Position.D, "D", 6, 50));
    return roster;
  }

  @Test
  @DisplayName("A 21-player roster starts 13 and places everyone exactly once")
  void fullRosterPlacesEveryone() {
    List<Player> roster = fullRoster();

    LineupAssignment lineup = assigner.assign(roster, SlotQuotas.standard(), 3);

    assertThat(lineup.starters()).hasSize(13);
    assertThat(lineup.bench()).hasSize(8);
    assertThat(lineup.ir()).isEmpty();
    assertThat(lineup.size()).isEqualTo(21);
    assertThat(roster).allSatisfy(p -> assertThat(lineup.placementOf(p.playerId())).isPresent());
    assertThat(lineup.isPlayable(10)).isTrue();
  }

  @Test
  @DisplayName("Slots are labelled in fill order, best player first")
  void slotLabels() {
    LineupAssignment lineup = assigner.assign(fullRoster(), SlotQuotas.standard(), 3);

    assertThat(lineup.slotOf("C-01")).contains("C-1");
    assertThat(lineup.slotOf("C-02")).contains("C-2");
    assertThat(lineup.slotOf("D-04")).contains("D-4");
    assertThat(lineup.slotOf("G-01")).contains("G-1");
    // best leftover skater takes the flex slot
    assertThat(lineup.slotOf("C-03")).contains(LineupSlotAssigner.UTIL);
    assertThat(lineup.placementOf("C-04")).contains(Placement.BENCH);
  }

  @Test
  @DisplayName("The third goalie sits on the bench, never in UTIL")
  void extraGoalieBenched() {
    List<Player> roster = new ArrayList<>(Fixtures.goalies("G", 3, 60));
    roster.addAll(Fixtures.skaters(Position.C, "C", 2, 10));

    LineupAssignment lineup = assigner.assign(roster, SlotQuotas.standard(), 3);

    assertThat(lineup.placementOf("G-03")).contains(Placement.BENCH);
    assertThat(lineup.starters()).doesNotContainValue(LineupSlotAssigner.UTIL);
  }

  @Test
  @DisplayName("Unavailable players fill IR up to the cap, the rest go to the bench")
  void injuredOverflowToBench() {
    List<Player> roster = new ArrayList<>();
    for (Player p : fullRoster()) {
      boolean hurt = p.playerId().equals("C-01") || p.playerId().equals("LW-01")
          || p.playerId().equals("RW-01") || p.playerId().equals("D-06");
      roster.add(hurt ? p.withStatus(PlayerStatus.INJURED) : p);
    }

    LineupAssignment lineup = assigner.assign(roster, SlotQuotas.standard(), 3);

    assertThat(lineup.ir()).containsOnlyKeys("C-01", "LW-01", "RW-01");
    assertThat(lineup.ir().values()).containsExactly("IR-1", "IR-2", "IR-3");
    assertThat(lineup.placementOf("D-06")).contains(Placement.BENCH);
    assertThat(lineup.slotOf("C-02")).contains("C-1");
    assertThat(lineup.size()).isEqualTo(21);
  }

  @Test
  @DisplayName("Suspended and IR players are unavailable as well")
  void otherStatusesUnavailable() {
    List<Player> roster = List.of(
        Player.skater("a", "A", Position.C, 90).withStatus(PlayerStatus.SUSPENDED),
        Player.skater("b", "B", Position.C, 80).withStatus(PlayerStatus.IR),
        Player.skater("c", "C", Position.C, 70));

    LineupAssignment lineup = assigner.assign(roster, SlotQuotas.standard(), 1);

    assertThat(lineup.ir()).containsOnlyKeys("a");
    assertThat(lineup.bench()).containsExactly("b");
    assertThat(lineup.slotOf("c")).contains("C-1");
    assertThat(lineup.isPlayable(10)).isFalse();
  }

  @Test
  @DisplayName("Equal values are slotted by player id")
  void tiesBrokenById() {
    List<Player> roster = List.of(
        Player.skater("z", "Z", Position.RW, 30),
        Player.skater("m", "M", Position.RW, 30),
        Player.skater("a", "A", Position.RW, 30));

    LineupAssignment lineup = assigner.assign(roster, new SlotQuotas(0, 0, 2, 0, 0, 0), 0);

    assertThat(lineup.starters()).containsEntry("a", "RW-1").containsEntry("m", "RW-2");
    assertThat(lineup.bench()).containsExactly("z");
  }

  @Test
  @DisplayName("Extra UTIL slots get numbered labels")
  void multipleUtilitySlots() {
    List<Player> roster = Fixtures.skaters(Position.D, "D", 4, 40);

    LineupAssignment lineup = assigner.assign(roster, new SlotQuotas(0, 0, 0, 1, 0, 2), 0);

    assertThat(lineup.starters().values()).containsExactly("D-1", "UTIL", "UTIL-2");
    assertThat(lineup.bench()).containsExactly("D-04");
  }

  @Test
  void duplicatePlayerRejected() {
    Player p = Player.skater("dup", "Dup", Position.C, 10);

    assertThatThrownBy(() -> assigner.assign(List.of(p, p), SlotQuotas.standard(), 3))
        .isInstanceOf(RosterOverflowException.class);
  }

  @Test
  void negativeIrCapRejected() {
    assertThatThrownBy(() -> assigner.assign(fullRoster(), SlotQuotas.standard(), -1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
