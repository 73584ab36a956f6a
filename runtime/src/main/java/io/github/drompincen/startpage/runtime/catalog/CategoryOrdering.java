package io.github.drompincen.startpage.runtime.catalog;

import io.github.drompincen.startpage.persistence.document.LinkDocument;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Display-order rules for categories and the links inside them.
 *
 * <p>Categories named in the preferred order come first, in that order; the rest follow
 * alphabetically. Preferred names with no links are dropped. Within a category links sort by
 * sort index, then newest first, then by id so the result is always deterministic.</p>
 */
public final class CategoryOrdering {

    private CategoryOrdering() {}

    public static List<String> arrange(Collection<String> present, List<String> preferred) {
        Set<String> presentSet = new LinkedHashSet<>(present);
        Set<String> ordered = new LinkedHashSet<>();
        if (preferred != null) {
            for (String category : preferred) {
                if (presentSet.contains(category)) {
                    ordered.add(category);
                }
            }
        }
        Set<String> remaining = new TreeSet<>(presentSet);
        remaining.removeAll(ordered);

        List<String> result = new ArrayList<>(ordered);
        result.addAll(remaining);
        return result;
    }

    public static Comparator<LinkDocument> displayOrder(List<String> arrangedCategories) {
        Map<String, Integer> rank = new HashMap<>();
        for (int i = 0; i < arrangedCategories.size(); i++) {
            rank.put(arrangedCategories.get(i), i);
        }
        Comparator<LinkDocument> byCategory = Comparator
                .comparing((LinkDocument l) -> rank.getOrDefault(l.getCategory(), Integer.MAX_VALUE))
                .thenComparing(LinkDocument::getCategory, Comparator.nullsLast(Comparator.naturalOrder()));
        return byCategory
                .thenComparing(LinkDocument::getSortIndex, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(LinkDocument::getCreatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                .thenComparing(LinkDocument::getId, Comparator.nullsLast(Comparator.naturalOrder()));
    }
}
