package com.purchasingpower.calcforge.model.logic;

import lombok.Value;

@Value
public class RuleField {

    String address;

    ValueType type;
}
