package com.gnovoa.fantasy.planner;

import com.gnovoa.fantasy.draft.DraftAllocator;
import com.gnovoa.fantasy.draft.DraftResult;
import com.gnovoa.fantasy.draft.SnakeOrder;
import com.gnovoa.fantasy.error.InvalidTeamSetException;
import com.gnovoa.fantasy.lineup.LineupAssignment;
import com.gnovoa.fantasy.lineup.LineupSlotAssigner;
import com.gnovoa.fantasy.lineup.SlotQuotas;
import com.gnovoa.fantasy.model.LeagueScheduleConfig;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.PositionQuota;
import com.gnovoa.fantasy.model.Team;
import com.gnovoa.fantasy.schedule.SeasonSchedule;
import com.gnovoa.fantasy.schedule.SeasonScheduleGenerator;
import com.gnovoa.fantasy.schedule.TeamSetValidator;
import com.gnovoa.fantasy.schedule.WeekCalendar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sets up a synthetic league in memory: simulated draft, a default lineup per team and a
 * validated season schedule. Nothing is stored; any failure aborts the whole plan.
 */
public final class LeaguePlanner {

    private static final Logger log = LoggerFactory.getLogger(LeaguePlanner.class);

    private final DraftAllocator draftAllocator;
    private final LineupSlotAssigner lineupAssigner;
    private final SeasonScheduleGenerator scheduleGenerator;
    private final WeekCalendar calendar;
    private final PositionQuota quota;
    private final SlotQuotas slots;
    private final int irCap;

    public LeaguePlanner(
            DraftAllocator draftAllocator,
            LineupSlotAssigner lineupAssigner,
            SeasonScheduleGenerator scheduleGenerator,
            WeekCalendar calendar,
            PositionQuota quota,
            SlotQuotas slots,
            int irCap
    ) {
        this.draftAllocator = draftAllocator;
        this.lineupAssigner = lineupAssigner;
        this.scheduleGenerator = scheduleGenerator;
        this.calendar = calendar;
        this.quota = quota;
        this.slots = slots;
        this.irCap = irCap;
    }

    /**
     * @param teams league teams in draft order
     * @param pool available players
     * @param config league sizing; {@code teamCount} must match {@code teams}
     * @param draftCompletedOn day the draft finished; week 1 starts the Monday on or after it
     */
    public LeaguePlan plan(List<Team> teams, List<Player> pool, LeagueScheduleConfig config, LocalDate draftCompletedOn) {
        TeamSetValidator.requireValid(teams);
        if (teams.size() != config.teamCount()) {
            throw new InvalidTeamSetException("Config expects " + config.teamCount() + " teams, got " + teams.size());
        }

        // nominal board order; the simulated selections are in draft.picks()
        List<List<Team>> draftOrder = SnakeOrder.rounds(teams, config.draftRounds());
        DraftResult draft = draftAllocator.allocate(pool, teams, quota, config.rosterSize());

        Map<Team, LineupAssignment> lineups = new LinkedHashMap<>();
        draft.rosters().forEach((team, roster) -> {
            LineupAssignment lineup = lineupAssigner.assign(roster, slots, irCap);
            log.debug("Lineup for {}: {} starters, {} bench, {} IR",
                    team.teamId(), lineup.starters().size(), lineup.bench().size(), lineup.ir().size());
            lineups.put(team, lineup);
        });

        SeasonSchedule schedule = scheduleGenerator.generate(teams, config.weeks(), calendar.firstWeekStart(draftCompletedOn));

        log.info("Planned league of {} teams: {} drafted, {} free agents, {} weeks from {}",
                teams.size(), draft.draftedCount(), draft.freeAgents().size(),
                schedule.weeks().size(), schedule.week(1).startDate());
        return new LeaguePlan(draftOrder, draft, lineups, schedule);
    }
}
