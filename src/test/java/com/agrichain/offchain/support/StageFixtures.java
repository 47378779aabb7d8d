package com.agrichain.offchain.support;

import com.agrichain.offchain.app.IdGenerator;
import com.agrichain.offchain.app.StagePipeline;
import com.agrichain.offchain.app.stage.StageHashing;
import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.hash.CommitRevealCodec;
import com.agrichain.offchain.domain.hash.HashInputEncoding;
import com.agrichain.offchain.domain.model.stage.AiScoreRequest;
import com.agrichain.offchain.domain.model.stage.CreateSkuRequest;
import com.agrichain.offchain.domain.model.stage.FarmerRegistrationRequest;
import com.agrichain.offchain.domain.model.stage.FpoPurchaseRequest;
import com.agrichain.offchain.domain.model.stage.GpsCoordinates;
import com.agrichain.offchain.domain.model.stage.LogisticsMilestoneRequest;
import com.agrichain.offchain.domain.model.stage.MilestoneType;
import com.agrichain.offchain.domain.model.stage.ProcessBatchRequest;
import com.agrichain.offchain.domain.model.stage.ProcessingType;
import com.agrichain.offchain.domain.model.stage.WarehouseUpdateRequest;
import com.agrichain.offchain.domain.ports.StorageGateway;
import jakarta.validation.Validation;
import jakarta.validation.Validator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;


/** Sample payloads and a pipeline with a frozen clock and a fixed DID. */
public final class StageFixtures {

    public static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");
    public static final String NOW_TEXT = "2024-05-01 08:00:00 UTC";
    public static final String FARMER_DID = "did:farmer:0b7f6c1e-2f4a-4c57-9d43-0c1a2b3c4d5e";

    public static final CanonicalJson JSON = new CanonicalJson();
    public static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

    private StageFixtures() {}

    public static IdGenerator fixedIds() {
        return method -> FARMER_DID;
    }

    public static StageHashing hashing(HashInputEncoding encoding) {
        return new StageHashing(encoding, CommitRevealCodec.withDrbg(JSON));
    }

    public static StagePipeline pipeline(StorageGateway storage) {
        return pipeline(storage, HashInputEncoding.DELIMITED);
    }

    public static StagePipeline pipeline(StorageGateway storage, HashInputEncoding encoding) {
        return new StagePipeline(storage, hashing(encoding), JSON, VALIDATOR,
                Clock.fixed(NOW, ZoneOffset.UTC), fixedIds());
    }

    public static FarmerRegistrationRequest registration() {
        return new FarmerRegistrationRequest("Asha Patil", "wheat", 2.5, "Nashik, Maharashtra",
                new GpsCoordinates(19.99, 73.79, null), "https://docs.example/kyc.pdf",
                List.of("https://docs.example/land.pdf"), null, null, "+91-9000000000", null);
    }

    public static FpoPurchaseRequest purchase() {
        return new FpoPurchaseRequest(FARMER_DID, "Green Valley FPO", "BATCH-001", 500.0, 21.5, "A",
                null, null, null, 11.2, 0.5, "UTR123");
    }

    public static WarehouseUpdateRequest warehouse() {
        return new WarehouseUpdateRequest("WH-9", "BATCH-001", "Bay 4", 22.0, 65.5, 410.0,
                null, null, null, null);
    }

    public static LogisticsMilestoneRequest milestone() {
        return new LogisticsMilestoneRequest("SHIP-42", "Pune", new GpsCoordinates(18.52, 73.85, null),
                MilestoneType.IN_TRANSIT, null, "RoadCo", "MH12AB1234", "Ravi", null, null, null, false);
    }

    public static ProcessBatchRequest processing() {
        return new ProcessBatchRequest("BATCH-001", "Mill One", ProcessingType.MILLING, 500.0, 450.0,
                90.0, 10.0, null, List.of("FSSAI"), List.of("OUT-1", "OUT-2"), null);
    }

    public static CreateSkuRequest sku(List<String> merkleProof) {
        return new CreateSkuRequest("SKU-001", "OUT-1", "Atta 1kg", "FarmFresh", 1000.0, 450L, "pouch",
                null, null, null, null, null, null, null, merkleProof);
    }

    public static AiScoreRequest aiScore() {
        return new AiScoreRequest("BATCH-001", 0.92, 0.81, 0.97, "quality-net", "1.4.0",
                Map.of("moisture", 11.2, "impurity", 0.5), List.of(0.1, 0.9), 0.88, null, null);
    }
}
