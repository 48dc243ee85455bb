package com.gnovoa.fantasy.draft;

import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Team;

/** One snake-draft selection. {@code overallPick} counts from 1 across all rounds. */
public record DraftPick(int round, int overallPick, Team team, Player player) {}
