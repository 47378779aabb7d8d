package com.agrichain.offchain.web;

import com.agrichain.offchain.app.StorageService;
import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.receipt.FetchedContent;
import com.agrichain.offchain.domain.model.receipt.PinStatus;
import com.agrichain.offchain.domain.model.receipt.UploadReceipt;
import com.agrichain.offchain.web.dto.IpfsUploadRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;


@RestController
@RequestMapping("/api/v1/ipfs")
@RequiredArgsConstructor
public class StorageController {

    private final StorageService storage;

    @PostMapping("/upload")
    @ResponseStatus(HttpStatus.CREATED)
    public UploadReceipt upload(@RequestBody IpfsUploadRequest request) {
        return storage.upload(request.data(), request.pinOrDefault()).block();
    }

    @GetMapping("/get/{cid}")
    public FetchedContent get(@PathVariable("cid") String cid) {
        return storage.fetch(ContentAddress.of(cid)).block();
    }

    @PostMapping("/pin/{cid}")
    public PinStatus pin(@PathVariable("cid") String cid) {
        return storage.pin(ContentAddress.of(cid)).block();
    }

    @PostMapping("/unpin/{cid}")
    public PinStatus unpin(@PathVariable("cid") String cid) {
        return storage.unpin(ContentAddress.of(cid)).block();
    }

    @GetMapping("/pinned/{cid}")
    public PinStatus pinned(@PathVariable("cid") String cid) {
        return storage.pinStatus(ContentAddress.of(cid)).block();
    }
}
