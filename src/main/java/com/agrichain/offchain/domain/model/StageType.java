package com.agrichain.offchain.domain.model;


/**
 * Custody stages of a produce batch, in the order they usually occur.  The
 * type only names the kind of record; no session state is attached to it.
 */
public enum StageType {
    REGISTRATION("farmer registration"),
    PURCHASE("FPO purchase"),
    WAREHOUSE("warehouse update"),
    LOGISTICS("logistics milestone"),
    PROCESSING("process batch"),
    PACKAGING("SKU creation"),
    AI_SCORE("AI score");

    private final String label;

    StageType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
