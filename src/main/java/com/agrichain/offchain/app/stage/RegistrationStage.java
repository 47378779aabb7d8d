package com.agrichain.offchain.app.stage;

import com.agrichain.offchain.app.IdGenerator;
import com.agrichain.offchain.domain.hash.AnchorFieldFormat;
import com.agrichain.offchain.domain.hash.CanonicalJson;
import com.agrichain.offchain.domain.model.DerivedHashes;
import com.agrichain.offchain.domain.model.RecordEnvelope;
import com.agrichain.offchain.domain.model.StageType;
import com.agrichain.offchain.domain.model.receipt.FarmerRegistrationReceipt;
import com.agrichain.offchain.domain.model.stage.FarmerRegistrationRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

import static com.agrichain.offchain.app.stage.StageRecords.*;


/**
 * Farmer registration.  Mints the farmer DID and anchors
 * {@code keccak(did-cropType-registeredAt)}.
 */
public class RegistrationStage implements StageDefinition<FarmerRegistrationRequest, FarmerRegistrationReceipt> {

    public static final String FARMER_DID = "farmer_did";
    public static final String CROP_ID_HASH = "crop_id_hash";

    @Override
    public StageType type() {
        return StageType.REGISTRATION;
    }

    @Override
    public Map<String, String> identify(FarmerRegistrationRequest payload, IdGenerator ids) {
        return Map.of(FARMER_DID, ids.did("farmer"));
    }

    @Override
    public DerivedHashes preHash(RecordEnvelope<FarmerRegistrationRequest> draft, StageHashing hashing) {
        var input = hashing.input()
                .add(draft.identifier(FARMER_DID))
                .add(draft.payload().cropType())
                .add(AnchorFieldFormat.timestamp(draft.createdAt()));
        return DerivedHashes.empty().with(CROP_ID_HASH, hashing.solidity(input));
    }

    @Override
    public ObjectNode toRecord(RecordEnvelope<FarmerRegistrationRequest> envelope, CanonicalJson json) {
        ObjectNode node = json.newObject();
        node.put(FARMER_DID, envelope.identifier(FARMER_DID));
        node.set("registration_data", json.toTree(envelope.payload()));
        node.put("registered_at", timestamp(envelope));
        node.put(IPFS_CID, cidOrEmpty(envelope));
        node.put(CROP_ID_HASH, hashOrEmpty(envelope, CROP_ID_HASH));
        return node;
    }

    @Override
    public FarmerRegistrationReceipt receipt(RecordEnvelope<FarmerRegistrationRequest> envelope) {
        return new FarmerRegistrationReceipt(
                envelope.identifier(FARMER_DID),
                envelope.derivedHashes().digest(CROP_ID_HASH),
                envelope.requireContentAddress(),
                envelope.createdAt());
    }

    @Override
    public String describe(FarmerRegistrationRequest payload) {
        return "farmer " + payload.farmerName();
    }
}
