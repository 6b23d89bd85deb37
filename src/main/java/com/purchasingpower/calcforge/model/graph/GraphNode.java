package com.purchasingpower.calcforge.model.graph;

import com.purchasingpower.calcforge.model.classification.CellRole;
import lombok.Builder;
import lombok.Value;

/**
 * Node of the dependency graph. Nodes are identified by address only; edges refer
 * to addresses, never to node objects.
 */
@Value
@Builder(toBuilder = true)
public class GraphNode {

    String address;

    String sheet;

    CellRole role;

    String formula;

    /**
     * Number of cells this node's formula reads.
     */
    int inDegree;

    /**
     * Number of formulas reading this node.
     */
    int outDegree;

    /**
     * Longest path from a root; -1 for nodes caught in a circular reference.
     */
    @Builder.Default
    int depth = -1;

    String clusterId;

    /**
     * True for referenced cells that were empty in the workbook.
     */
    boolean synthesized;

    /**
     * True for a range kept whole because it exceeds the expansion cap.
     */
    boolean opaqueRange;

    public boolean hasFormula() {
        return formula != null;
    }
}
