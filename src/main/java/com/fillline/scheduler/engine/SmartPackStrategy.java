package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scored packing: every placement is chosen by a {@link BeamSearch} over the lots not yet placed,
 * trading window slack against changeovers and avoidable cleans.
 */
@Slf4j
@Component
@Order(4)
public class SmartPackStrategy extends AbstractPackingStrategy {

    public static final String NAME = "smart-pack";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected void pack(List<Lot> lots, ScheduleBuilder builder, SchedulerConfig config, ProgressListener progress) {
        BeamSearch search = new BeamSearch(config);
        List<Lot> remaining = new ArrayList<>(lots);
        remaining.sort(Comparator.comparing(Lot::getId));

        int placed = 0;
        while (!remaining.isEmpty()) {
            Lot next = search.selectNext(builder.getState(), remaining);
            Placement p = builder.place(next);
            remaining.remove(next);
            if (p.isForcedClean()) {
                log.debug("{}: clean forced before lot {}", NAME, next.getId());
            }
            report(progress, ++placed, lots.size());
        }
    }
}
