package io.github.drompincen.startpage.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Result of a reachability check. Absent components are left out of the JSON body. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LinkStatusDto(
        @JsonIgnore LinkStatus linkStatus,
        @JsonProperty("latency_ms") Long latencyMs,
        Integer code,
        String message
) {
    public static LinkStatusDto online(long latencyMs) {
        return new LinkStatusDto(LinkStatus.ONLINE, latencyMs, null, null);
    }

    public static LinkStatusDto offline(int code) {
        return new LinkStatusDto(LinkStatus.OFFLINE, null, code, null);
    }

    public static LinkStatusDto unreachable(String message) {
        return new LinkStatusDto(LinkStatus.OFFLINE, null, null, message);
    }

    public static LinkStatusDto error(String message) {
        return new LinkStatusDto(LinkStatus.ERROR, null, null, message);
    }

    @JsonProperty("status")
    public String status() {
        return linkStatus.wireName();
    }
}
