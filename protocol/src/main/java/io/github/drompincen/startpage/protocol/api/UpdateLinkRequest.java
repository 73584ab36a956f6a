package io.github.drompincen.startpage.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Partial update of a link. A {@code null} component means "leave the stored value alone";
 * it never clears a field.
 */
public record UpdateLinkRequest(
        String title,
        String url,
        String icon,
        @JsonProperty("icon_url") String iconUrl,
        String description,
        String category,
        @JsonProperty("is_favorite") Boolean favorite
) {
    public boolean isEmpty() {
        return title == null && url == null && icon == null && iconUrl == null
                && description == null && category == null && favorite == null;
    }
}
