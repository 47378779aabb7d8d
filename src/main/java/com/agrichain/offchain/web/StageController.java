package com.agrichain.offchain.web;

import com.agrichain.offchain.app.ScoreVerificationService;
import com.agrichain.offchain.app.StagePipeline;
import com.agrichain.offchain.domain.model.receipt.AiScoreReceipt;
import com.agrichain.offchain.domain.model.receipt.CreateSkuReceipt;
import com.agrichain.offchain.domain.model.receipt.FarmerRegistrationReceipt;
import com.agrichain.offchain.domain.model.receipt.FpoPurchaseReceipt;
import com.agrichain.offchain.domain.model.receipt.LogisticsMilestoneReceipt;
import com.agrichain.offchain.domain.model.receipt.ProcessBatchReceipt;
import com.agrichain.offchain.domain.model.receipt.WarehouseUpdateReceipt;
import com.agrichain.offchain.domain.model.stage.AiScoreRequest;
import com.agrichain.offchain.domain.model.stage.CreateSkuRequest;
import com.agrichain.offchain.domain.model.stage.FarmerRegistrationRequest;
import com.agrichain.offchain.domain.model.stage.FpoPurchaseRequest;
import com.agrichain.offchain.domain.model.stage.LogisticsMilestoneRequest;
import com.agrichain.offchain.domain.model.stage.ProcessBatchRequest;
import com.agrichain.offchain.domain.model.stage.WarehouseUpdateRequest;
import com.agrichain.offchain.web.dto.AiScoreVerifyRequest;
import com.agrichain.offchain.web.dto.VerifyResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;


/**
 * One route per custody stage.  Each call blocks until the record is stored
 * and pinned; validation and storage failures surface through
 * {@link GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class StageController {

    private final StagePipeline pipeline;
    private final ScoreVerificationService verification;

    @PostMapping("/farmer/register")
    @ResponseStatus(HttpStatus.CREATED)
    public FarmerRegistrationReceipt register(@RequestBody FarmerRegistrationRequest request) {
        return pipeline.registerFarmer(request).block();
    }

    @PostMapping("/fpo/purchase")
    @ResponseStatus(HttpStatus.CREATED)
    public FpoPurchaseReceipt purchase(@RequestBody FpoPurchaseRequest request) {
        return pipeline.recordPurchase(request).block();
    }

    @PostMapping("/warehouse/update")
    @ResponseStatus(HttpStatus.CREATED)
    public WarehouseUpdateReceipt warehouse(@RequestBody WarehouseUpdateRequest request) {
        return pipeline.updateWarehouse(request).block();
    }

    @PostMapping("/logistics/milestone")
    @ResponseStatus(HttpStatus.CREATED)
    public LogisticsMilestoneReceipt milestone(@RequestBody LogisticsMilestoneRequest request) {
        return pipeline.recordMilestone(request).block();
    }

    @PostMapping("/processing/batch")
    @ResponseStatus(HttpStatus.CREATED)
    public ProcessBatchReceipt process(@RequestBody ProcessBatchRequest request) {
        return pipeline.processBatch(request).block();
    }

    @PostMapping("/packaging/sku")
    @ResponseStatus(HttpStatus.CREATED)
    public CreateSkuReceipt sku(@RequestBody CreateSkuRequest request) {
        return pipeline.createSku(request).block();
    }

    @PostMapping("/ai/score")
    @ResponseStatus(HttpStatus.CREATED)
    public AiScoreReceipt score(@RequestBody AiScoreRequest request) {
        return pipeline.recordAiScore(request).block();
    }

    @PostMapping("/ai/score/verify")
    public VerifyResult verify(@RequestBody AiScoreVerifyRequest request) {
        return new VerifyResult(verification.verify(
                request.nonce(), request.revealHash(), request.commitHash(), request.scoreData()));
    }
}
