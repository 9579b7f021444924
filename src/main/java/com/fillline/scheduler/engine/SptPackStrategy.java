package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shortest processing time first, ties by lot id.
 */
@Component
@Order(1)
public class SptPackStrategy extends OrderedPackingStrategy {

    public static final String NAME = "spt-pack";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<Lot> order(List<Lot> lots, SchedulerConfig config) {
        return lots.stream()
                .sorted(Comparator.comparingDouble(Lot::getFillHours).thenComparing(Lot::getId))
                .collect(Collectors.toList());
    }
}
