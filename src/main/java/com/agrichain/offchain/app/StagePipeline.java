package com.agrichain.offchain.app;

import com.agrichain.offchain.app.stage.AiScoreStage;
import com.agrichain.offchain.app.stage.LogisticsStage;
import com.agrichain.offchain.app.stage.PackagingStage;
import com.agrichain.offchain.app.stage.ProcessingStage;
import com.agrichain.offchain.app.stage.PurchaseStage;
import com.agrichain.offchain.app.stage.RegistrationStage;
import com.agrichain.offchain.app.stage.StageDefinition;
import com.agrichain.offchain.app.stage.StageHashing;
import com.agrichain.offchain.app.stage.WarehouseStage;
import com.agrichain.offchain.domain.error.PinFailedException;
import com.agrichain.offchain.domain.error.ProvenanceException;
import com.agrichain.offchain.domain.error.StorageUnavailableException;
import com.agrichain.offchain.domain.error.ValidationException;
import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.receipt.AiScoreReceipt;
import com.agrichain.offchain.domain.model.receipt.CreateSkuReceipt;
import com.agrichain.offchain.domain.model.receipt.FarmerRegistrationReceipt;
import com.agrichain.offchain.domain.model.receipt.FpoPurchaseReceipt;
import com.agrichain.offchain.domain.model.receipt.LogisticsMilestoneReceipt;
import com.agrichain.offchain.domain.model.receipt.ProcessBatchReceipt;
import com.agrichain.offchain.domain.model.receipt.Receipt;
import com.agrichain.offchain.domain.model.receipt.WarehouseUpdateReceipt;
import com.agrichain.offchain.domain.model.stage.AiScoreRequest;
import com.agrichain.offchain.domain.model.stage.CreateSkuRequest;
import com.agrichain.offchain.domain.model.stage.FarmerRegistrationRequest;
import com.agrichain.offchain.domain.model.stage.FpoPurchaseRequest;
import com.agrichain.offchain.domain.model.stage.LogisticsMilestoneRequest;
import com.agrichain.offchain.domain.model.stage.ProcessBatchRequest;
import com.agrichain.offchain.domain.model.stage.StagePayload;
import com.agrichain.offchain.domain.model.stage.WarehouseUpdateRequest;
import com.agrichain.offchain.domain.ports.StorageGateway;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;


/**
 * Runs one custody stage end to end:
 * <ol>
 *   <li>validate the payload (bean constraints plus stage checks)</li>
 *   <li>mint identifiers and compute the digests known up front</li>
 *   <li>upload the canonical record</li>
 *   <li>compute digests that cover the content address</li>
 *   <li>pin the record</li>
 *   <li>build the receipt</li>
 * </ol>
 * Nothing touches storage before validation passes, and a receipt is only
 * built once the record is stored and pinned, so no failure path ever hands
 * out a digest.  The returned {@link Mono} is lazy; each subscription is a
 * fresh invocation.
 */
@Slf4j
@Service
public class StagePipeline {

    private final StorageGateway storage;
    private final StageHashing hashing;
    private final CanonicalJson json;
    private final Validator validator;
    private final Clock clock;
    private final IdGenerator ids;

    private final RegistrationStage registration = new RegistrationStage();
    private final PurchaseStage purchase = new PurchaseStage();
    private final WarehouseStage warehouse = new WarehouseStage();
    private final LogisticsStage logistics = new LogisticsStage();
    private final ProcessingStage processing = new ProcessingStage();
    private final PackagingStage packaging = new PackagingStage();
    private final AiScoreStage aiScore = new AiScoreStage();

    public StagePipeline(StorageGateway storage, StageHashing hashing, CanonicalJson json,
                         Validator validator, Clock clock, IdGenerator ids) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.hashing = Objects.requireNonNull(hashing, "hashing");
        this.json = Objects.requireNonNull(json, "json");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    public Mono<FarmerRegistrationReceipt> registerFarmer(FarmerRegistrationRequest request) {
        return run(registration, request);
    }

    public Mono<FpoPurchaseReceipt> recordPurchase(FpoPurchaseRequest request) {
        return run(purchase, request);
    }

    public Mono<WarehouseUpdateReceipt> updateWarehouse(WarehouseUpdateRequest request) {
        return run(warehouse, request);
    }

    public Mono<LogisticsMilestoneReceipt> recordMilestone(LogisticsMilestoneRequest request) {
        return run(logistics, request);
    }

    public Mono<ProcessBatchReceipt> processBatch(ProcessBatchRequest request) {
        return run(processing, request);
    }

    public Mono<CreateSkuReceipt> createSku(CreateSkuRequest request) {
        return run(packaging, request);
    }

    public Mono<AiScoreReceipt> recordAiScore(AiScoreRequest request) {
        return run(aiScore, request);
    }

    public <P extends StagePayload, R extends Receipt> Mono<R> run(StageDefinition<P, R> stage, P payload) {
        return Mono.defer(() -> {
            validate(stage, payload);
            log.info("Running {} for {}", stage.type().label(), stage.describe(payload));

            Instant now = clock.instant();
            RecordEnvelope<P> draft = RecordEnvelope.create(stage.type(), payload, stage.identify(payload, ids), now);
            RecordEnvelope<P> hashed = draft.withDerived(stage.preHash(draft, hashing));
            byte[] record = json.toBytes(stage.toRecord(hashed, json));

            return storage.upload(record)
                    .switchIfEmpty(Mono.error(() -> new StorageUnavailableException("Storage returned no address")))
                    .onErrorMap(e -> !(e instanceof ProvenanceException),
                            e -> new StorageUnavailableException("Failed to store " + stage.type().label() + " record", e))
                    .map(stored -> {
                        log.info("Stored {} record at {} ({} bytes)", stage.type().label(), stored.address(), stored.size());
                        RecordEnvelope<P> persisted = hashed.persistedAt(stored.address());
                        return persisted.withDerived(stage.postHash(persisted, hashing));
                    })
                    .flatMap(complete -> pin(complete.requireContentAddress()).thenReturn(complete))
                    .map(stage::receipt);
        });
    }

    private Mono<Void> pin(ContentAddress address) {
        return storage.pin(address)
                .doOnError(e -> log.warn("Pinning {} failed: {}", address, e.toString()))
                .onErrorMap(e -> !(e instanceof PinFailedException), e -> new PinFailedException(address, e));
    }

    private <P extends StagePayload> void validate(StageDefinition<P, ?> stage, P payload) {
        if (payload == null) {
            throw new ValidationException("request body is required");
        }
        Set<String> errors = new LinkedHashSet<>();
        for (ConstraintViolation<P> v : validator.validate(payload)) {
            errors.add(WirePaths.message(v));
        }
        errors.addAll(stage.check(payload));
        if (!errors.isEmpty()) {
            log.debug("Rejected {} request: {}", stage.type().label(), errors);
            throw new ValidationException(errors);
        }
    }
}
