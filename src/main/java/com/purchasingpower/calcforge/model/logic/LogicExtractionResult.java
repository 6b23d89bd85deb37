package com.purchasingpower.calcforge.model.logic;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class LogicExtractionResult {

    @Builder.Default
    List<BusinessRule> businessRules = List.of();

    @Builder.Default
    List<CalculationUnit> calculations = List.of();

    @Builder.Default
    List<UnsupportedFeature> unsupportedFeatures = List.of();

    @Builder.Default
    List<TestCase> testSuite = List.of();

    public Optional<BusinessRule> findRule(String id) {
        return businessRules.stream().filter(rule -> rule.getId().equals(id)).findFirst();
    }
}
