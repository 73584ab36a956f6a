package io.github.drompincen.startpage.runtime.catalog;

import io.github.drompincen.startpage.persistence.document.LinkDocument;
import io.github.drompincen.startpage.persistence.repository.LinkRepository;
import io.github.drompincen.startpage.protocol.api.CreateLinkRequest;
import io.github.drompincen.startpage.protocol.api.LinkDto;
import io.github.drompincen.startpage.protocol.api.ReorderItem;
import io.github.drompincen.startpage.protocol.api.UpdateLinkRequest;
import io.github.drompincen.startpage.runtime.InvalidArgumentException;
import io.github.drompincen.startpage.runtime.settings.SettingsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * CRUD and manual ordering of links.
 *
 * <p>Every link carries a sort index that is meaningful only inside its category. New links, and
 * links moved to another category through {@link #update}, are appended after the current
 * maximum of the destination category. {@link #reorder} is a trusted bulk overwrite: the
 * caller supplies final positions and nothing checks them for gaps or duplicates.</p>
 *
 * <p>Writers hold the write lock for the whole read-compute-write of a sort index, so two
 * concurrent creates in one category cannot get the same position and readers never see half
 * of a reorder batch.</p>
 */
@Service
public class LinkCatalogService {

    private static final Logger log = LoggerFactory.getLogger(LinkCatalogService.class);

    private final LinkRepository linkRepository;
    private final MongoTemplate mongoTemplate;
    private final SequenceService sequenceService;
    private final SettingsService settingsService;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public LinkCatalogService(LinkRepository linkRepository,
                              MongoTemplate mongoTemplate,
                              SequenceService sequenceService,
                              SettingsService settingsService,
                              Clock clock) {
        this.linkRepository = linkRepository;
        this.mongoTemplate = mongoTemplate;
        this.sequenceService = sequenceService;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    // ---- Reads ----

    /**
     * Links matching {@code query}. Unless {@code revealHidden} is set, links in hidden
     * categories are left out entirely.
     */
    public List<LinkDto> list(LinkQuery query, boolean revealHidden) {
        Set<String> hidden = revealHidden ? Set.of() : settingsService.getHiddenCategories();
        List<String> preferred = settingsService.getCategoryOrder();

        Query mongoQuery = new Query();
        if (query.hasCategory()) {
            if (hidden.contains(query.category())) {
                return List.of();
            }
            mongoQuery.addCriteria(where("category").is(query.category()));
        } else if (!hidden.isEmpty()) {
            mongoQuery.addCriteria(where("category").nin(hidden));
        }
        if (query.favorite() != null) {
            mongoQuery.addCriteria(where("favorite").is(query.favorite()));
        }

        lock.readLock().lock();
        try {
            List<LinkDocument> docs = mongoTemplate.find(mongoQuery, LinkDocument.class);
            Set<String> categories = docs.stream()
                    .map(LinkDocument::getCategory)
                    .collect(Collectors.toCollection(TreeSet::new));
            return docs.stream()
                    .sorted(CategoryOrdering.displayOrder(CategoryOrdering.arrange(categories, preferred)))
                    .map(LinkCatalogService::toDto)
                    .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Distinct categories in display order: preferred ones first, the rest alphabetically. */
    public List<String> listCategories(boolean revealHidden) {
        Set<String> hidden = revealHidden ? Set.of() : settingsService.getHiddenCategories();
        List<String> preferred = settingsService.getCategoryOrder();

        lock.readLock().lock();
        try {
            List<String> present = mongoTemplate.findDistinct(new Query(), "category", LinkDocument.class, String.class)
                    .stream()
                    .filter(c -> c != null && !hidden.contains(c))
                    .collect(Collectors.toList());
            return CategoryOrdering.arrange(present, preferred);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ---- Writes ----

    public LinkDto create(CreateLinkRequest request) {
        requireText(request.title(), "title");
        requireText(request.url(), "url");
        String category = request.categoryOrDefault();

        lock.writeLock().lock();
        try {
            LinkDocument doc = new LinkDocument();
            doc.setId(sequenceService.next(SequenceService.LINK_IDS));
            doc.setTitle(request.title());
            doc.setUrl(request.url());
            doc.setIcon(request.icon());
            doc.setIconUrl(request.iconUrl());
            doc.setDescription(request.description());
            doc.setCategory(category);
            doc.setFavorite(request.favoriteOrDefault());
            doc.setSortIndex(nextSortIndex(category));
            doc.setUsageCount(0);
            doc.setCreatedAt(clock.instant());
            LinkDocument saved = linkRepository.save(doc);
            log.info("Created link {} in '{}' at position {}", saved.getId(), category, saved.getSortIndex());
            return toDto(saved);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies the non-null fields of {@code request}. Changing the category moves the link to
     * the end of the destination category; an unchanged category keeps its position.
     */
    public LinkDto update(long id, UpdateLinkRequest request) {
        lock.writeLock().lock();
        try {
            LinkDocument doc = linkRepository.findById(id).orElseThrow(() -> new LinkNotFoundException(id));
            if (request.isEmpty()) {
                throw new InvalidArgumentException("No fields to update");
            }
            if (request.title() != null) {
                requireText(request.title(), "title");
                doc.setTitle(request.title());
            }
            if (request.url() != null) {
                requireText(request.url(), "url");
                doc.setUrl(request.url());
            }
            if (request.icon() != null) doc.setIcon(request.icon());
            if (request.iconUrl() != null) doc.setIconUrl(request.iconUrl());
            if (request.description() != null) doc.setDescription(request.description());
            if (request.favorite() != null) doc.setFavorite(request.favorite());
            if (request.category() != null) {
                requireText(request.category(), "category");
                if (!request.category().equals(doc.getCategory())) {
                    doc.setSortIndex(nextSortIndex(request.category()));
                    log.info("Moved link {} from '{}' to '{}' at position {}",
                            id, doc.getCategory(), request.category(), doc.getSortIndex());
                    doc.setCategory(request.category());
                }
            }
            return toDto(linkRepository.save(doc));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Overwrites category and sort index of every listed link in one ordered bulk write.
     * Ids that do not exist are skipped.
     */
    public void reorder(List<ReorderItem> items) {
        if (items == null || items.isEmpty()) {
            throw new InvalidArgumentException("No items to reorder");
        }
        for (ReorderItem item : items) {
            if (item == null || item.id() == null || item.sortIndex() == null) {
                throw new InvalidArgumentException("Each item needs id, category and sort_index");
            }
            requireText(item.category(), "category");
        }

        lock.writeLock().lock();
        try {
            BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, LinkDocument.class);
            for (ReorderItem item : items) {
                bulk.updateOne(query(where("_id").is(item.id())),
                        new Update().set("category", item.category()).set("sortIndex", item.sortIndex()));
            }
            int matched = bulk.execute().getMatchedCount();
            log.info("Reordered {} links ({} requested)", matched, items.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Best-effort usage counter; an unknown id is silently ignored. */
    public void trackClick(long id) {
        mongoTemplate.updateFirst(query(where("_id").is(id)), new Update().inc("usageCount", 1), LinkDocument.class);
    }

    public void delete(long id) {
        lock.writeLock().lock();
        try {
            if (!linkRepository.existsById(id)) {
                throw new LinkNotFoundException(id);
            }
            linkRepository.deleteById(id);
            log.info("Deleted link {}", id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> setCategoryOrder(List<String> order) {
        return settingsService.putCategoryOrder(order);
    }

    // ---- Migration ----

    /**
     * Gives links stored without a sort index a position: per category, after any indexed
     * links, oldest first. Returns the number of links updated.
     */
    public int backfillSortIndexes() {
        lock.writeLock().lock();
        try {
            Set<String> categories = linkRepository.findBySortIndexIsNull().stream()
                    .map(LinkDocument::getCategory)
                    .collect(Collectors.toCollection(TreeSet::new));
            int updated = 0;
            for (String category : categories) {
                int next = nextSortIndex(category);
                for (LinkDocument doc : linkRepository.findByCategoryOrderByCreatedAtAscIdAsc(category)) {
                    if (doc.getSortIndex() == null) {
                        doc.setSortIndex(next++);
                        linkRepository.save(doc);
                        updated++;
                    }
                }
            }
            if (updated > 0) {
                log.info("Backfilled sort index for {} links in {} categories", updated, categories.size());
            }
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isEmpty() {
        return linkRepository.count() == 0;
    }

    public long maxId() {
        return linkRepository.findTopByOrderByIdDesc().map(LinkDocument::getId).orElse(0L);
    }

    // caller holds the write lock
    private int nextSortIndex(String category) {
        return linkRepository.findTopByCategoryOrderBySortIndexDesc(category)
                .map(LinkDocument::getSortIndex)
                .map(max -> max + 1)
                .orElse(1);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(field + " must not be empty");
        }
    }

    public static LinkDto toDto(LinkDocument doc) {
        return new LinkDto(doc.getId(), doc.getTitle(), doc.getUrl(), doc.getIcon(), doc.getIconUrl(),
                doc.getDescription(), doc.getCategory(), doc.isFavorite(),
                doc.getSortIndex() == null ? 0 : doc.getSortIndex(),
                doc.getUsageCount(), doc.getCreatedAt());
    }
}
