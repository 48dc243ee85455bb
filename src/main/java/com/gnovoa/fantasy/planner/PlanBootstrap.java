package com.gnovoa.fantasy.planner;

import com.gnovoa.fantasy.config.EngineProperties;
import com.gnovoa.fantasy.model.LeagueScheduleConfig;
import com.gnovoa.fantasy.model.Player;
import com.gnovoa.fantasy.model.Team;
import com.gnovoa.fantasy.pool.PlayerPoolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Builds the demo league on startup when {@code engine.demo.enabled} is set and logs a summary. */
@Component
public final class PlanBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PlanBootstrap.class);

    private final EngineProperties props;
    private final PlayerPoolCatalog catalog;
    private final LeaguePlanner planner;

    public PlanBootstrap(EngineProperties props, PlayerPoolCatalog catalog, LeaguePlanner planner) {
        this.props = props;
        this.catalog = catalog;
        this.planner = planner;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!props.demo().enabled()) return;
        LeaguePlan plan = buildDemoPlan();
        plan.schedule().week(1).pairing().pairings()
                .forEach(p -> log.info("Week 1: {} vs {}", p.teamA().name(), p.isBye() ? "BYE" : p.teamB().name()));
    }

    public LeaguePlan buildDemoPlan() {
        EngineProperties.Demo demo = props.demo();
        List<Player> pool = catalog.load(demo.poolResource());
        List<Team> teams = demoTeams(demo.teamNames());
        var config = new LeagueScheduleConfig(teams.size(), demo.weeks(), props.draft().rosterCap(), props.draft().rosterCap());
        LocalDate draftDay = demo.draftCompletedOn() == null ? LocalDate.now() : demo.draftCompletedOn();
        return planner.plan(teams, pool, config, draftDay);
    }

    private List<Team> demoTeams(List<String> names) {
        List<Team> teams = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            teams.add(new Team("demo-team-" + (i + 1), names.get(i)));
        }
        return teams;
    }
}
