package com.gnovoa.fantasy.planner;

import com.gnovoa.fantasy.draft.DraftResult;
import com.gnovoa.fantasy.lineup.LineupAssignment;
import com.gnovoa.fantasy.model.Team;
import com.gnovoa.fantasy.schedule.SeasonSchedule;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to stand up a league: who drafted whom, default lineups and the season.
 * Produced in one go and handed to the persistence side as a whole.
 *
 * @param draftOrder the nominal snake order, one list per configured round, as a live draft
 *     board would show it. The simulated selections are in {@code draft.picks()}, which skip
 *     teams at their cap and stop once every roster is full, so they can cover fewer rounds.
 * @param draft simulated draft outcome
 * @param lineups default lineup per team, in team order
 * @param schedule the validated season
 */
public record LeaguePlan(
        List<List<Team>> draftOrder,
        DraftResult draft,
        Map<Team, LineupAssignment> lineups,
        SeasonSchedule schedule
) {}
