package io.github.drompincen.startpage.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateLinkRequest(
        String title,
        String url,
        String icon,
        @JsonProperty("icon_url") String iconUrl,
        String description,
        String category,
        @JsonProperty("is_favorite") Boolean favorite
) {
    public static final String DEFAULT_CATEGORY = "Uncategorized";

    public String categoryOrDefault() {
        return category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
    }

    public boolean favoriteOrDefault() {
        return Boolean.TRUE.equals(favorite);
    }
}
