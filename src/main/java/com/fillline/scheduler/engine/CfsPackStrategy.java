package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Cluster first, sequence second: lots of one type run back to back so the line changes type as
 * rarely as possible.
 */
@Component
@Order(3)
public class CfsPackStrategy extends OrderedPackingStrategy {

    public static final String NAME = "cfs-pack";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected List<Lot> order(List<Lot> lots, SchedulerConfig config) {
        List<Lot> ordered = new ArrayList<>(lots.size());
        clusters(lots).forEach(ordered::addAll);
        return ordered;
    }

    /**
     * Groups lots by type. Groups come in descending order of total vial count (ties by type),
     * lots inside a group by id.
     */
    static List<List<Lot>> clusters(List<Lot> lots) {
        Map<String, List<Lot>> byType = lots.stream()
                .collect(Collectors.groupingBy(Lot::getType, TreeMap::new, Collectors.toList()));

        Comparator<Map.Entry<String, List<Lot>>> byVolume = Comparator.comparingLong(
                (Map.Entry<String, List<Lot>> e) -> e.getValue().stream().mapToLong(Lot::getVialCount).sum())
                .reversed()
                .thenComparing(Map.Entry::getKey);

        return byType.entrySet().stream()
                .sorted(byVolume)
                .map(e -> e.getValue().stream()
                        .sorted(Comparator.comparing(Lot::getId))
                        .collect(Collectors.toList()))
                .collect(Collectors.toList());
    }
}
