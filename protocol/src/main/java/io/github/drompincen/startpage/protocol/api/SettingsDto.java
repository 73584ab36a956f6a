package io.github.drompincen.startpage.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SettingsDto(
        @JsonProperty("site_title") String siteTitle,
        @JsonProperty("site_logo") String siteLogo,
        @JsonProperty("hidden_categories") List<String> hiddenCategories,
        @JsonProperty("category_order") List<String> categoryOrder
) {
    public static final String DEFAULT_TITLE = "Aesthetic Nav";
    public static final String DEFAULT_LOGO =
            "https://www.gstatic.com/images/branding/product/1x/keep_2020q4_48dp.png";

    public static SettingsDto defaults() {
        return new SettingsDto(DEFAULT_TITLE, DEFAULT_LOGO, List.of(), List.of());
    }

    public boolean isComplete() {
        return siteTitle != null && siteLogo != null && hiddenCategories != null && categoryOrder != null;
    }
}
