package com.agrichain.offchain;

import com.agrichain.offchain.adapters.storage.InMemoryStorageGateway;
import com.agrichain.offchain.domain.ports.StorageGateway;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "provenance.storage.backend=memory",
        "provenance.environment=test"
})
@AutoConfigureMockMvc
class OffchainApplicationTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    StorageGateway storage;

    @Test
    void wiresInMemoryBackend() {
        assertThat(storage).isInstanceOf(InMemoryStorageGateway.class);
    }

    @Test
    void healthEndpoint() throws Exception {
        mvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.environment").value("test"));
    }

    @Test
    void crossOriginPreflightIsAllowed() throws Exception {
        mvc.perform(options("/api/v1/farmer/register")
                        .header(HttpHeaders.ORIGIN, "https://dashboard.example.org")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "content-type"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"))
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, containsString("POST")));
    }

    @Test
    void logisticsMilestoneEndToEnd() throws Exception {
        String body = """
                {"shipment_id":"SHIP-1","current_location":"Pune",
                 "gps_coordinates":{"latitude":18.52,"longitude":73.85},
                 "milestone_type":"in_transit","carrier_name":"RoadCo","vehicle_id":"MH12"}
                """;
        mvc.perform(post("/api/v1/logistics/milestone").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.shipment_id").value("SHIP-1"))
                .andExpect(jsonPath("$.location_hash").isNotEmpty())
                .andExpect(jsonPath("$.ipfs_cid").value(org.hamcrest.Matchers.startsWith("mem:")));
    }
}
