package com.temporal.wcc.service.oracle;

import com.temporal.wcc.service.engine.MicroProjection;

import java.util.Map;

/**
 * Unweighted shortest paths inside a bounded micro-projection.
 */
public interface ShortestPathOracle {

    /**
     * Hop counts from the source to every node reachable from it, the source included at 0.
     *
     * @throws OracleUnavailableException if the oracle cannot answer
     */
    Map<String, Integer> shortestPathLengths(MicroProjection projection, String source);
}
