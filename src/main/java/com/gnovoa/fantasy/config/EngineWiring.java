package com.gnovoa.fantasy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.fantasy.draft.DraftAllocator;
import com.gnovoa.fantasy.draft.PlayerValuation;
import com.gnovoa.fantasy.lineup.LineupSlotAssigner;
import com.gnovoa.fantasy.planner.LeaguePlanner;
import com.gnovoa.fantasy.pool.PlayerPoolCatalog;
import com.gnovoa.fantasy.schedule.RoundRobinScheduler;
import com.gnovoa.fantasy.schedule.ScheduleValidator;
import com.gnovoa.fantasy.schedule.SeasonScheduleGenerator;
import com.gnovoa.fantasy.schedule.WeekCalendar;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class EngineWiring {

    @Bean
    public RoundRobinScheduler roundRobinScheduler() {
        return new RoundRobinScheduler();
    }

    @Bean
    public ScheduleValidator scheduleValidator() {
        return new ScheduleValidator();
    }

    @Bean
    public WeekCalendar weekCalendar() {
        return new WeekCalendar();
    }

    @Bean
    public SeasonScheduleGenerator seasonScheduleGenerator(RoundRobinScheduler scheduler, ScheduleValidator validator, WeekCalendar calendar, EngineProperties props) {
        return new SeasonScheduleGenerator(scheduler, validator, calendar, props.schedule().seed());
    }

    @Bean
    public PlayerValuation playerValuation(EngineProperties props) {
        var draft = props.draft();
        return new PlayerValuation(draft.goalieBaseline(), draft.goalieWinWeight(), draft.goalieSaveWeight());
    }

    @Bean
    public DraftAllocator draftAllocator(PlayerValuation valuation) {
        return new DraftAllocator(valuation);
    }

    @Bean
    public LineupSlotAssigner lineupSlotAssigner(PlayerValuation valuation) {
        return new LineupSlotAssigner(valuation);
    }

    @Bean
    public PlayerPoolCatalog playerPoolCatalog(ObjectMapper mapper, ResourceLoader resourceLoader) {
        return new PlayerPoolCatalog(mapper, resourceLoader);
    }

    @Bean
    public LeaguePlanner leaguePlanner(DraftAllocator draft, LineupSlotAssigner lineup, SeasonScheduleGenerator schedule, WeekCalendar calendar, EngineProperties props) {
        return new LeaguePlanner(draft, lineup, schedule, calendar,
                props.draft().quota().toPositionQuota(), props.lineup().slots().toSlotQuotas(), props.lineup().irCap());
    }
}
