package com.temporal.wcc.service.oracle;

import java.util.Collection;
import java.util.Map;

/**
 * Bulk weakly-connected-component labelling.
 *
 * Used only to plan merge groups; it never decides forest structure.
 */
public interface ComponentLabelOracle {

    /**
     * Labels every node with the id of its weak component. Link direction is ignored.
     *
     * @param nodes node ids to label
     * @param links pairs of node ids; endpoints outside {@code nodes} are ignored
     * @return label per node
     * @throws OracleUnavailableException if the oracle cannot answer
     */
    Map<String, String> label(Collection<String> nodes, Collection<Link> links);

    /**
     * An undirected link between two node ids.
     */
    record Link(String source, String target) {}
}
