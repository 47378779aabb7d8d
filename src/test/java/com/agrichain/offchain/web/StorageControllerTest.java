package com.agrichain.offchain.web;

import com.agrichain.offchain.adapters.storage.InMemoryStorageGateway;
import com.agrichain.offchain.app.StorageService;
import com.agrichain.offchain.domain.error.PinFailedException;
import com.agrichain.offchain.domain.model.ContentAddress;
import com.agrichain.offchain.domain.model.StoredContent;
import com.agrichain.offchain.domain.ports.StorageGateway;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import reactor.core.publisher.Mono;

import static com.agrichain.offchain.support.StageFixtures.JSON;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class StorageControllerTest {

    private static MockMvc mvc(StorageGateway storage) {
        return StageControllerTest.mvc(new StorageController(new StorageService(storage, JSON)));
    }

    private final MockMvc mvc = mvc(new InMemoryStorageGateway());

    private String upload(boolean pin) throws Exception {
        String body = mvc.perform(post("/api/v1/ipfs/upload")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{\"lot\":\"L-7\"},\"pin\":" + pin + "}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.pinned").value(pin))
                .andReturn().getResponse().getContentAsString();
        return StageControllerTest.MAPPER.readTree(body).get("cid").asText();
    }

    @Test
    void uploadThenGet() throws Exception {
        String cid = upload(true);

        mvc.perform(get("/api/v1/ipfs/get/{cid}", cid))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cid").value(cid))
                .andExpect(jsonPath("$.data.lot").value("L-7"));
    }

    @Test
    void pinUnpinAndStatus() throws Exception {
        String cid = upload(false);

        mvc.perform(get("/api/v1/ipfs/pinned/{cid}", cid))
                .andExpect(jsonPath("$.pinned").value(false));
        mvc.perform(post("/api/v1/ipfs/pin/{cid}", cid))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pinned").value(true));
        mvc.perform(get("/api/v1/ipfs/pinned/{cid}", cid))
                .andExpect(jsonPath("$.pinned").value(true));
        mvc.perform(post("/api/v1/ipfs/unpin/{cid}", cid))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pinned").value(false));
    }

    @Test
    void unknownCidIsNotFound() throws Exception {
        mvc.perform(get("/api/v1/ipfs/get/{cid}", "mem:nothing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void missingDataIsBadRequest() throws Exception {
        mvc.perform(post("/api/v1/ipfs/upload")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pin\":true}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));
    }

    @Test
    void pinFailureIsBadGateway() throws Exception {
        ContentAddress cid = ContentAddress.of("QmStuck");
        StorageGateway gateway = Mockito.mock(StorageGateway.class);
        when(gateway.upload(any())).thenReturn(Mono.just(new StoredContent(cid, 5)));
        when(gateway.pin(cid)).thenReturn(Mono.error(new PinFailedException(cid, null)));

        mvc(gateway).perform(post("/api/v1/ipfs/upload")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"data\":{\"a\":1}}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("pin_failed"))
                .andExpect(jsonPath("$.cid").value("QmStuck"));
    }
}
