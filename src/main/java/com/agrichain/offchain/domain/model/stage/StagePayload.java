package com.agrichain.offchain.domain.model.stage;


/**
 * Marker for the validated business data of one custody stage.  Payloads are
 * immutable once accepted by the pipeline.
 */
public interface StagePayload {
}
