package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Longest processing time first, ties by lot id.
 */
@Component
@Order(2)
public class LptPackStrategy extends OrderedPackingStrategy {

    public static final String NAME = "lpt-pack";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<Lot> order(List<Lot> lots, SchedulerConfig config) {
        return lots.stream()
                .sorted(Comparator.comparingDouble(Lot::getFillHours).reversed().thenComparing(Lot::getId))
                .collect(Collectors.toList());
    }
}
