package io.github.drompincen.startpage.runtime.settings;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.startpage.persistence.document.SettingDocument;
import io.github.drompincen.startpage.persistence.repository.SettingRepository;
import io.github.drompincen.startpage.protocol.api.SettingsDto;
import io.github.drompincen.startpage.runtime.InvalidArgumentException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SettingsServiceTest {

    @Mock private SettingRepository settingRepository;

    private SettingsService settingsService;

    @BeforeEach
    void setUp() {
        settingsService = new SettingsService(settingRepository, new ObjectMapper());
    }

    @Test
    void getAppliesDefaultsForMissingKeys() {
        when(settingRepository.findAll()).thenReturn(List.of(
                new SettingDocument(SettingDocument.SITE_TITLE, "My Start Page")));

        SettingsDto settings = settingsService.get();

        assertThat(settings.siteTitle()).isEqualTo("My Start Page");
        assertThat(settings.siteLogo()).isEqualTo(SettingsDto.DEFAULT_LOGO);
        assertThat(settings.hiddenCategories()).isEmpty();
        assertThat(settings.categoryOrder()).isEmpty();
    }

    @Test
    void getDecodesJsonLists() {
        when(settingRepository.findAll()).thenReturn(List.of(
                new SettingDocument(SettingDocument.HIDDEN_CATEGORIES, "[\"Work\",\"Private\"]"),
                new SettingDocument(SettingDocument.CATEGORY_ORDER, "[\"B\",\"A\"]")));

        SettingsDto settings = settingsService.get();

        assertThat(settings.hiddenCategories()).containsExactly("Work", "Private");
        assertThat(settingsService.getCategoryOrder()).containsExactly("B", "A");
        assertThat(settingsService.getHiddenCategories()).containsExactly("Work", "Private");
    }

    @Test
    void malformedListFallsBackToEmpty() {
        when(settingRepository.findAll()).thenReturn(List.of(
                new SettingDocument(SettingDocument.HIDDEN_CATEGORIES, "not-json")));

        assertThat(settingsService.get().hiddenCategories()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void putWritesAllFourKeysInOneBatch() {
        SettingsDto update = new SettingsDto("Team Links", "logo.svg", List.of("Ops"), List.of("Docs", "Ops"));

        SettingsDto result = settingsService.put(update);

        ArgumentCaptor<Iterable<SettingDocument>> captor = ArgumentCaptor.forClass(Iterable.class);
        verify(settingRepository).saveAll(captor.capture());
        assertThat(captor.getValue())
                .extracting(SettingDocument::getKey, SettingDocument::getValue)
                .containsExactly(
                        tuple("site_title", "Team Links"),
                        tuple("site_logo", "logo.svg"),
                        tuple("hidden_categories", "[\"Ops\"]"),
                        tuple("category_order", "[\"Docs\",\"Ops\"]"));
        assertThat(result).isEqualTo(update);
    }

    @Test
    void putRejectsIncompleteSettings() {
        assertThatThrownBy(() -> settingsService.put(new SettingsDto("t", "l", null, List.of())))
                .isInstanceOf(InvalidArgumentException.class);
        verify(settingRepository, never()).saveAll(any());
    }

    @Test
    void putCategoryOrderOnlyTouchesThatKey() {
        settingsService.putCategoryOrder(List.of("News", "Design"));

        ArgumentCaptor<SettingDocument> captor = ArgumentCaptor.forClass(SettingDocument.class);
        verify(settingRepository).save(captor.capture());
        assertThat(captor.getValue().getKey()).isEqualTo("category_order");
        assertThat(captor.getValue().getValue()).isEqualTo("[\"News\",\"Design\"]");
    }

    @Test
    void seedDefaultsSkipsExistingKeys() {
        when(settingRepository.existsById(SettingDocument.SITE_TITLE)).thenReturn(true);
        when(settingRepository.existsById(SettingDocument.SITE_LOGO)).thenReturn(false);
        when(settingRepository.existsById(SettingDocument.HIDDEN_CATEGORIES)).thenReturn(false);
        when(settingRepository.existsById(SettingDocument.CATEGORY_ORDER)).thenReturn(false);

        settingsService.seedDefaults();

        ArgumentCaptor<SettingDocument> captor = ArgumentCaptor.forClass(SettingDocument.class);
        verify(settingRepository, times(3)).save(captor.capture());
        assertThat(captor.getAllValues()).extracting(SettingDocument::getKey)
                .containsExactly("site_logo", "hidden_categories", "category_order");
    }
}
