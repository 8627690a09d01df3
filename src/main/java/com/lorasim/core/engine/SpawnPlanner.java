package com.lorasim.core.engine;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Decides when each node is started, relative to simulation start.
 */
@Component
public class SpawnPlanner {

    /**
     * @param node          node name
     * @param offsetSeconds seconds after simulation start
     */
    public record ScheduledSpawn(String node, double offsetSeconds) {}

    /**
     * Computes spawn times in ascending offset order; equal offsets keep configuration order.
     *
     * @param nodeNames       configured nodes
     * @param explicitOffsets one offset per node, or empty to draw offsets at random
     * @param spawnMaxSeconds upper bound (exclusive) of random offsets
     * @param seed            seed for random offsets
     * @throws IllegalArgumentException if explicit offsets do not match the node count, or an
     *                                  offset or the random bound is negative or not finite
     */
    public List<ScheduledSpawn> plan(List<String> nodeNames, List<Double> explicitOffsets,
                                     double spawnMaxSeconds, long seed) {
        List<Double> offsets;
        if (explicitOffsets != null && !explicitOffsets.isEmpty()) {
            if (explicitOffsets.size() != nodeNames.size()) {
                throw new IllegalArgumentException("spawn offsets length " + explicitOffsets.size()
                        + " != number of nodes " + nodeNames.size());
            }
            for (Double offset : explicitOffsets) {
                if (offset == null || !Double.isFinite(offset) || offset < 0) {
                    throw new IllegalArgumentException("spawn offsets must be finite and >= 0, got " + offset);
                }
            }
            offsets = explicitOffsets;
        } else {
            if (!Double.isFinite(spawnMaxSeconds)) {
                throw new IllegalArgumentException("spawn max must be finite, got " + spawnMaxSeconds);
            }
            var random = new Random(seed);
            double bound = Math.max(spawnMaxSeconds, 0.0);
            offsets = new ArrayList<>();
            for (int i = 0; i < nodeNames.size(); i++) {
                offsets.add(random.nextDouble() * bound);
            }
        }

        var schedule = new ArrayList<ScheduledSpawn>();
        for (int i = 0; i < nodeNames.size(); i++) {
            schedule.add(new ScheduledSpawn(nodeNames.get(i), offsets.get(i)));
        }
        schedule.sort(Comparator.comparingDouble(ScheduledSpawn::offsetSeconds));
        return schedule;
    }
}
