package io.github.drompincen.startpage.runtime.settings;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.startpage.persistence.document.SettingDocument;
import io.github.drompincen.startpage.persistence.repository.SettingRepository;
import io.github.drompincen.startpage.protocol.api.SettingsDto;
import io.github.drompincen.startpage.runtime.InvalidArgumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Key/value store for branding and category preferences. A {@link #put} replaces all four
 * values under the write lock, so readers see either the old or the new settings, never a mix.
 */
@Service
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final SettingRepository settingRepository;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public SettingsService(SettingRepository settingRepository, ObjectMapper objectMapper) {
        this.settingRepository = settingRepository;
        this.objectMapper = objectMapper;
    }

    /** Inserts any missing key with its default; existing values are never touched. */
    public void seedDefaults() {
        lock.writeLock().lock();
        try {
            SettingsDto defaults = SettingsDto.defaults();
            int seeded = 0;
            for (SettingDocument doc : toDocuments(defaults)) {
                if (!settingRepository.existsById(doc.getKey())) {
                    settingRepository.save(doc);
                    seeded++;
                }
            }
            if (seeded > 0) {
                log.info("Seeded {} default settings", seeded);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public SettingsDto get() {
        lock.readLock().lock();
        try {
            Map<String, String> values = settingRepository.findAll().stream()
                    .filter(doc -> doc.getValue() != null)
                    .collect(Collectors.toMap(SettingDocument::getKey, SettingDocument::getValue));
            SettingsDto defaults = SettingsDto.defaults();
            return new SettingsDto(
                    values.getOrDefault(SettingDocument.SITE_TITLE, defaults.siteTitle()),
                    values.getOrDefault(SettingDocument.SITE_LOGO, defaults.siteLogo()),
                    readList(SettingDocument.HIDDEN_CATEGORIES, values.get(SettingDocument.HIDDEN_CATEGORIES)),
                    readList(SettingDocument.CATEGORY_ORDER, values.get(SettingDocument.CATEGORY_ORDER)));
        } finally {
            lock.readLock().unlock();
        }
    }

    public SettingsDto put(SettingsDto settings) {
        if (settings == null || !settings.isComplete()) {
            throw new InvalidArgumentException(
                    "site_title, site_logo, hidden_categories and category_order are all required");
        }
        lock.writeLock().lock();
        try {
            settingRepository.saveAll(toDocuments(settings));
            log.info("Settings replaced (title='{}', hidden={}, ordered={})",
                    settings.siteTitle(), settings.hiddenCategories().size(), settings.categoryOrder().size());
            return settings;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> getCategoryOrder() {
        return get().categoryOrder();
    }

    public List<String> putCategoryOrder(List<String> order) {
        if (order == null) {
            throw new InvalidArgumentException("order is required");
        }
        lock.writeLock().lock();
        try {
            settingRepository.save(new SettingDocument(SettingDocument.CATEGORY_ORDER, writeList(order)));
            return order;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Set<String> getHiddenCategories() {
        return new LinkedHashSet<>(get().hiddenCategories());
    }

    private List<SettingDocument> toDocuments(SettingsDto settings) {
        return List.of(
                new SettingDocument(SettingDocument.SITE_TITLE, settings.siteTitle()),
                new SettingDocument(SettingDocument.SITE_LOGO, settings.siteLogo()),
                new SettingDocument(SettingDocument.HIDDEN_CATEGORIES, writeList(settings.hiddenCategories())),
                new SettingDocument(SettingDocument.CATEGORY_ORDER, writeList(settings.categoryOrder())));
    }

    private List<String> readList(String key, String json) {
        if (json == null) {
            return List.of();
        }
        try {
            List<String> values = objectMapper.readValue(json, STRING_LIST);
            return values == null ? List.of() : values;
        } catch (JsonProcessingException e) {
            log.warn("Setting '{}' holds malformed JSON, using an empty list: {}", key, e.getOriginalMessage());
            return List.of();
        }
    }

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize setting value", e);
        }
    }
}
