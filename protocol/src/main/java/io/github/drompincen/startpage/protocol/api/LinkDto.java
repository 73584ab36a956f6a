package io.github.drompincen.startpage.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record LinkDto(
        long id,
        String title,
        String url,
        String icon,
        @JsonProperty("icon_url") String iconUrl,
        String description,
        String category,
        @JsonProperty("is_favorite") boolean favorite,
        @JsonProperty("sort_index") int sortIndex,
        @JsonProperty("usage_count") long usageCount,
        @JsonProperty("created_at") Instant createdAt
) {}
