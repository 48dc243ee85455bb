package com.gnovoa.fantasy.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WeekCalendarTest {

  private final WeekCalendar calendar = new WeekCalendar();

  @Test
  @DisplayName("Week 1 starts on the Monday after a Friday draft")
  void fridayDraftStartsNextMonday() {
    assertThat(calendar.firstWeekStart(LocalDate.of(2025, 12, 5))).isEqualTo(LocalDate.of(2025, 12, 8));
  }

  @Test
  @DisplayName("A draft completed on a Monday starts week 1 that same day")
  void mondayDraftStartsSameDay() {
    assertThat(calendar.firstWeekStart(LocalDate.of(2025, 12, 8))).isEqualTo(LocalDate.of(2025, 12, 8));
  }

  @Test
  void weekBoundaries() {
    LocalDate first = LocalDate.of(2025, 12, 8);

    assertThat(calendar.weekStart(1, first)).isEqualTo(first);
    assertThat(calendar.weekEnd(1, first)).isEqualTo(LocalDate.of(2025, 12, 14));
    assertThat(calendar.weekStart(4, first)).isEqualTo(LocalDate.of(2025, 12, 29));
    assertThat(calendar.weekEnd(4, first)).isEqualTo(LocalDate.of(2026, 1, 4));
    assertThatThrownBy(() -> calendar.weekStart(0, first)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Dates map back to their league week, 0 before the season")
  void weekContaining() {
    LocalDate first = LocalDate.of(2025, 12, 8);

    assertThat(calendar.weekContaining(LocalDate.of(2025, 12, 7), first)).isZero();
    assertThat(calendar.weekContaining(first, first)).isEqualTo(1);
    assertThat(calendar.weekContaining(LocalDate.of(2025, 12, 14), first)).isEqualTo(1);
    assertThat(calendar.weekContaining(LocalDate.of(2025, 12, 15), first)).isEqualTo(2);
  }
}
