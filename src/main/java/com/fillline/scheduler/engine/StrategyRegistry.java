package com.fillline.scheduler.engine;

import com.fillline.scheduler.solver.SolverBackend;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Name to strategy lookup. Canonical names are {@code spt-pack, lpt-pack, cfs-pack, smart-pack,
 * hybrid-pack, milp-opt}; underscores, a missing dash and the bare prefix ({@code spt},
 * {@code milp}, ...) are accepted as aliases.
 */
@Component
public class StrategyRegistry {

    private final Map<String, SequencingStrategy> strategies = new LinkedHashMap<>();
    private final Map<String, String> aliases = new HashMap<>();

    public StrategyRegistry(List<SequencingStrategy> available) {
        for (SequencingStrategy strategy : available) {
            String name = strategy.name();
            if (strategies.putIfAbsent(name, strategy) != null) {
                throw new IllegalArgumentException("Strategy registered twice: " + name);
            }
            aliases.put(name, name);
            aliases.put(name.replace("-", ""), name);
            aliases.putIfAbsent(name.substring(0, name.indexOf('-') < 0 ? name.length() : name.indexOf('-')), name);
        }
    }

    /** The six built-in strategies, for callers outside a Spring context. */
    public static StrategyRegistry withDefaults(SolverBackend backend) {
        return new StrategyRegistry(List.of(
                new SptPackStrategy(),
                new LptPackStrategy(),
                new CfsPackStrategy(),
                new SmartPackStrategy(),
                new HybridPackStrategy(),
                new MilpOptStrategy(backend)));
    }

    public SequencingStrategy get(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Strategy name cannot be empty");
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        String canonical = aliases.get(key);
        if (canonical == null) {
            throw new IllegalArgumentException("Unknown strategy: " + name + " (available: " + names() + ")");
        }
        return strategies.get(canonical);
    }

    public List<String> names() {
        return new ArrayList<>(strategies.keySet());
    }
}
