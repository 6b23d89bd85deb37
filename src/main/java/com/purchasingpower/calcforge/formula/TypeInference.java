package com.purchasingpower.calcforge.formula;

import com.purchasingpower.calcforge.model.logic.ValueType;

import java.util.Map;

/**
 * Types inferred for one cluster.
 *
 * @param referenceTypes type of every referenced address, UNKNOWN when uses disagree or say nothing
 * @param outputTypes    result type of every formula, keyed by target address
 */
public record TypeInference(Map<String, ValueType> referenceTypes, Map<String, ValueType> outputTypes) {

    public TypeInference {
        referenceTypes = Map.copyOf(referenceTypes);
        outputTypes = Map.copyOf(outputTypes);
    }

    public ValueType referenceType(String address) {
        return referenceTypes.getOrDefault(address, ValueType.UNKNOWN);
    }

    public ValueType outputType(String address) {
        return outputTypes.getOrDefault(address, ValueType.UNKNOWN);
    }
}
