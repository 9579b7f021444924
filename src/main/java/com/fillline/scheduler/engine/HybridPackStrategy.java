package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Cluster order from {@link CfsPackStrategy}, lot order inside each cluster from the
 * {@link BeamSearch} of {@link SmartPackStrategy}. The window state runs on across clusters.
 */
@Component
@Order(5)
public class HybridPackStrategy extends AbstractPackingStrategy {

    public static final String NAME = "hybrid-pack";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected void pack(List<Lot> lots, ScheduleBuilder builder, SchedulerConfig config, ProgressListener progress) {
        BeamSearch search = new BeamSearch(config);
        int placed = 0;
        for (List<Lot> cluster : CfsPackStrategy.clusters(lots)) {
            List<Lot> remaining = new ArrayList<>(cluster);
            while (!remaining.isEmpty()) {
                Lot next = search.selectNext(builder.getState(), remaining);
                builder.place(next);
                remaining.remove(next);
                report(progress, ++placed, lots.size());
            }
        }
    }
}
