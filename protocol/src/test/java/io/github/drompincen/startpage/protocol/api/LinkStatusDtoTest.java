package io.github.drompincen.startpage.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LinkStatusDtoTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void onlineCarriesLatencyOnly() throws Exception {
        JsonNode json = mapper.valueToTree(LinkStatusDto.online(42));

        assertThat(json.get("status").asText()).isEqualTo("online");
        assertThat(json.get("latency_ms").asLong()).isEqualTo(42);
        assertThat(json.has("code")).isFalse();
        assertThat(json.has("message")).isFalse();
        assertThat(json.has("linkStatus")).isFalse();
    }

    @Test
    void offlineCarriesHttpCode() {
        JsonNode json = mapper.valueToTree(LinkStatusDto.offline(503));

        assertThat(json.get("status").asText()).isEqualTo("offline");
        assertThat(json.get("code").asInt()).isEqualTo(503);
        assertThat(json.has("latency_ms")).isFalse();
    }

    @Test
    void errorCarriesMessage() {
        JsonNode json = mapper.valueToTree(LinkStatusDto.error("URL is required"));

        assertThat(json.get("status").asText()).isEqualTo("error");
        assertThat(json.get("message").asText()).isEqualTo("URL is required");
    }
}
