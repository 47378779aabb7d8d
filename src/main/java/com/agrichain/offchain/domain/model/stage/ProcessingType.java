package com.agrichain.offchain.domain.model.stage;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;


public enum ProcessingType {
    CLEANING,
    DRYING,
    MILLING,
    EXTRACTION,
    REFINING,
    BLENDING;

    @JsonValue
    public String wireName() {
        return EnumNames.snake(this);
    }

    /** Name used inside hash inputs, e.g. {@code Milling}. */
    public String variantName() {
        return EnumNames.pascal(this);
    }

    @JsonCreator
    public static ProcessingType fromWire(String value) {
        return EnumNames.parse(ProcessingType.class, value);
    }
}
