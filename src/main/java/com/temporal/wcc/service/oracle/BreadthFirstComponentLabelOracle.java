package com.temporal.wcc.service.oracle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Single-pass WCC labelling by breadth-first search, treating links as undirected.
 *
 * A component's label is the first node id reached for it, in input order.
 */
@Slf4j
@Component
public class BreadthFirstComponentLabelOracle implements ComponentLabelOracle {

    @Override
    public Map<String, String> label(Collection<String> nodes, Collection<Link> links) {
        final Map<String, List<String>> adjacency = new HashMap<>(nodes.size() * 2);
        for (final String node : nodes)
            adjacency.put(node, new ArrayList<>());
        for (final Link link : links) {
            final List<String> sourceNeighbors = adjacency.get(link.source());
            final List<String> targetNeighbors = adjacency.get(link.target());
            if (sourceNeighbors == null || targetNeighbors == null)
                continue;
            sourceNeighbors.add(link.target());
            targetNeighbors.add(link.source());
        }

        final Map<String, String> labels = new LinkedHashMap<>(nodes.size() * 2);
        int components = 0;
        for (final String start : nodes) {
            if (labels.containsKey(start))
                continue;

            final Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            labels.put(start, start);
            components++;

            while (!queue.isEmpty()) {
                final String current = queue.poll();
                for (final String neighbor : adjacency.get(current)) {
                    if (labels.containsKey(neighbor))
                        continue;
                    labels.put(neighbor, start);
                    queue.add(neighbor);
                }
            }
        }
        log.debug("Labelled {} nodes into {} components", labels.size(), components);
        return labels;
    }
}
