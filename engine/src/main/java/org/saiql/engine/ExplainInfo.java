package org.saiql.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * What the optimizer decided.
 *
 * @param joinOrder     scan aliases in final join order
 * @param accessPaths   alias to chosen access path, in join order
 * @param rulesApplied  names of rules that changed the plan, in first-applied order
 * @param iterations    optimizer passes run
 * @param estimatedCost cost model estimate for the final plan, in abstract
 *                      units; 0 for data modification
 */
public record ExplainInfo(List<String> joinOrder, Map<String, String> accessPaths, List<String> rulesApplied,
                          int iterations, double estimatedCost) {

    public ExplainInfo {
        joinOrder = List.copyOf(joinOrder);
        Objects.requireNonNull(accessPaths, "Access paths cannot be null");
        accessPaths = Collections.unmodifiableMap(new LinkedHashMap<>(accessPaths));
        rulesApplied = List.copyOf(rulesApplied);
    }

    public static ExplainInfo empty() {
        return new ExplainInfo(List.of(), Map.of(), List.of(), 0, 0);
    }

    /**
     * Human readable lines, one per decision.
     */
    public List<String> describe() {
        List<String> lines = new ArrayList<>();
        lines.add("join order: " + (joinOrder.isEmpty() ? "-" : String.join(" -> ", joinOrder)));
        accessPaths.forEach((alias, path) -> lines.add("access " + alias + ": " + path));
        lines.add("rules: " + (rulesApplied.isEmpty() ? "-" : String.join(", ", rulesApplied)));
        lines.add("iterations: " + iterations);
        lines.add(String.format(Locale.ROOT, "estimated cost: %.2f", estimatedCost));
        return lines;
    }
}
