package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;


public enum MilestoneType {
    PICKED_UP,
    IN_TRANSIT,
    AT_CHECKPOINT,
    DELIVERED,
    DELAYED,
    INCIDENT;

    @JsonValue
    public String wireName() {
        return EnumNames.snake(this);
    }

    @JsonCreator
    public static MilestoneType fromWire(String value) {
        return EnumNames.parse(MilestoneType.class, value);
    }
}
