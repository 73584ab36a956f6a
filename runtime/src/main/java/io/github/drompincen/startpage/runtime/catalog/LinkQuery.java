package io.github.drompincen.startpage.runtime.catalog;

/** Optional filters for listing links; {@code null} (or a blank category) means "any". */
public record LinkQuery(String category, Boolean favorite) {

    public static LinkQuery all() {
        return new LinkQuery(null, null);
    }

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }
}
