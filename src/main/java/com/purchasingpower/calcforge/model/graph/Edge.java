package com.purchasingpower.calcforge.model.graph;

import lombok.Value;

/**
 * The formula at {@code target} reads the value at {@code source}.
 */
@Value
public class Edge {

    String source;

    String target;
}
