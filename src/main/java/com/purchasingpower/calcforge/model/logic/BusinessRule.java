package com.purchasingpower.calcforge.model.logic;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Named, typed description of one cluster's calculation.
 */
@Value
@Builder
public class BusinessRule {

    String id;

    String name;

    String description;

    @Builder.Default
    List<RuleField> inputs = List.of();

    @Builder.Default
    List<RuleField> outputs = List.of();

    LogicRepresentation logic;

    /**
     * Human-readable caveats, one per problem found.
     */
    @Builder.Default
    List<String> constraints = List.of();

    @Builder.Default
    List<TestCase> testCases = List.of();

    /**
     * False when generated code for this rule must be a runtime-error stub.
     */
    boolean executable;
}
