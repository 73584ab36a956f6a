package io.github.drompincen.startpage.runtime.bootstrap;

import io.github.drompincen.startpage.protocol.api.CreateLinkRequest;
import io.github.drompincen.startpage.runtime.auth.CredentialService;
import io.github.drompincen.startpage.runtime.catalog.LinkCatalogService;
import io.github.drompincen.startpage.runtime.catalog.SequenceService;
import io.github.drompincen.startpage.runtime.settings.SettingsService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Brings the store to a servable state before the web server accepts requests: default
 * settings, the admin account, sort-index migration, id sequence and the starter links.
 */
@Service
public class StoreBootstrapService {

    private static final Logger log = LoggerFactory.getLogger(StoreBootstrapService.class);

    static final List<CreateLinkRequest> DEFAULT_LINKS = List.of(
            link("Instagram", "https://instagram.com", "instagram", "Social Media",
                    "Visual inspiration and photo sharing platform."),
            link("Twitter (X)", "https://twitter.com", "twitter", "Social Media",
                    "Real-time news and public conversation."),
            link("LinkedIn", "https://linkedin.com", "linkedin", "Social Media",
                    "Professional networking and career development."),
            link("Figma", "https://figma.com", "figma", "Design Tools",
                    "Collaborative interface design tool."),
            link("Dribbble", "https://dribbble.com", "dribbble", "Design Tools",
                    "World's leading destination for design inspiration."),
            link("Behance", "https://behance.net", "behance", "Design Tools",
                    "Showcase and discover creative work."),
            link("The Verge", "https://theverge.com", "theverge", "News & Media",
                    "Tech news, reviews, and futuristic features."),
            link("Medium", "https://medium.com", "medium", "News & Media",
                    "A place to read, write, and deepen understanding."),
            link("YouTube", "https://youtube.com", "youtube", "News & Media",
                    "World's most popular video hosting service.")
    );

    private final SettingsService settingsService;
    private final CredentialService credentialService;
    private final LinkCatalogService catalogService;
    private final SequenceService sequenceService;
    private final boolean seedDefaultLinks;

    public StoreBootstrapService(SettingsService settingsService,
                                 CredentialService credentialService,
                                 LinkCatalogService catalogService,
                                 SequenceService sequenceService,
                                 @Value("${startpage.seed.default-links:true}") boolean seedDefaultLinks) {
        this.settingsService = settingsService;
        this.credentialService = credentialService;
        this.catalogService = catalogService;
        this.sequenceService = sequenceService;
        this.seedDefaultLinks = seedDefaultLinks;
    }

    @PostConstruct
    public void bootstrap() {
        settingsService.seedDefaults();
        credentialService.ensureAdmin();

        catalogService.backfillSortIndexes();
        sequenceService.ensureAtLeast(SequenceService.LINK_IDS, catalogService.maxId());

        if (seedDefaultLinks && catalogService.isEmpty()) {
            DEFAULT_LINKS.forEach(catalogService::create);
            log.info("Seeded {} default links", DEFAULT_LINKS.size());
        }
    }

    private static CreateLinkRequest link(String title, String url, String icon, String category, String description) {
        return new CreateLinkRequest(title, url, icon, null, description, category, false);
    }
}
