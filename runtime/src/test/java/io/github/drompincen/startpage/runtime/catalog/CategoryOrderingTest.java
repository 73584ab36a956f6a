package io.github.drompincen.startpage.runtime.catalog;

import io.github.drompincen.startpage.persistence.document.LinkDocument;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryOrderingTest {

    @Test
    void preferredCategoriesComeFirstThenAlphabetical() {
        assertThat(CategoryOrdering.arrange(List.of("A", "B", "C"), List.of("B", "A")))
                .containsExactly("B", "A", "C");
    }

    @Test
    void unorderedCategoriesAreAlphabetical() {
        assertThat(CategoryOrdering.arrange(List.of("News", "Design", "Social"), List.of()))
                .containsExactly("Design", "News", "Social");
    }

    @Test
    void preferredNamesWithoutLinksAreDropped() {
        assertThat(CategoryOrdering.arrange(List.of("A", "C"), List.of("Orphan", "C")))
                .containsExactly("C", "A");
    }

    @Test
    void duplicatesInPreferredOrderCollapse() {
        assertThat(CategoryOrdering.arrange(List.of("A", "B"), List.of("B", "B", "A", "B")))
                .containsExactly("B", "A");
    }

    @Test
    void nullPreferredOrderIsTreatedAsEmpty() {
        assertThat(CategoryOrdering.arrange(List.of("b", "a"), null)).containsExactly("a", "b");
    }

    @Test
    void linksSortByCategoryRankThenIndexThenNewestThenId() {
        Instant t0 = Instant.parse("2024-01-01T00:00:00Z");
        LinkDocument a2 = link(1L, "A", 2, t0);
        LinkDocument a1 = link(2L, "A", 1, t0);
        LinkDocument b1 = link(3L, "B", 1, t0);
        LinkDocument tieOld = link(4L, "A", 3, t0);
        LinkDocument tieNew = link(5L, "A", 3, t0.plusSeconds(10));
        LinkDocument tieSameTime = link(6L, "A", 3, t0);

        List<LinkDocument> links = new ArrayList<>(List.of(a2, a1, b1, tieOld, tieNew, tieSameTime));
        links.sort(CategoryOrdering.displayOrder(List.of("B", "A")));

        assertThat(links).extracting(LinkDocument::getId).containsExactly(3L, 2L, 1L, 5L, 4L, 6L);
    }

    private LinkDocument link(Long id, String category, Integer sortIndex, Instant createdAt) {
        LinkDocument doc = new LinkDocument();
        doc.setId(id);
        doc.setCategory(category);
        doc.setSortIndex(sortIndex);
        doc.setCreatedAt(createdAt);
        return doc;
    }
}
