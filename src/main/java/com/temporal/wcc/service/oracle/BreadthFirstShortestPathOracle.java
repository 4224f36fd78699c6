package com.temporal.wcc.service.oracle;

import com.temporal.wcc.service.engine.MicroProjection;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Breadth-first single-source shortest paths over the undirected projection.
 */
@Component
public class BreadthFirstShortestPathOracle implements ShortestPathOracle {

    @Override
    public Map<String, Integer> shortestPathLengths(MicroProjection projection, String source) {
        if (!projection.contains(source)) {
            throw new IllegalArgumentException("Source " + source + " is not part of the projection");
        }
        final Map<String, Integer> distance = new HashMap<>();
        final Deque<String> queue = new ArrayDeque<>();
        distance.put(source, 0);
        queue.add(source);

        while (!queue.isEmpty()) {
            final String current = queue.poll();
            final int next = distance.get(current) + 1;
            for (final String neighbor : projection.neighbors(current)) {
                if (distance.putIfAbsent(neighbor, next) == null)
                    queue.add(neighbor);
            }
        }
        return distance;
    }
}
