package uk.gegc.xpeconomy.features.store.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureBundle;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureCatalogEntry;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureCategory;
import uk.gegc.xpeconomy.features.store.infra.repository.FeatureBundleRepository;
import uk.gegc.xpeconomy.features.store.infra.repository.FeatureCatalogRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Seeds the default catalog and bundles at startup. Existing rows are left alone so operator price
 * changes survive restarts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureCatalogInitializer implements CommandLineRunner {

    private final FeatureCatalogRepository catalogRepository;
    private final FeatureBundleRepository bundleRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void run(String... args) {
        long before = catalogRepository.count();

        seedFeature("font_opensans", "Open Sans", "Clean sans-serif reading font", 25, FeatureCategory.FONTS);
        seedFeature("font_opendyslexic", "OpenDyslexic", "Font designed for readers with dyslexia", 50, FeatureCategory.FONTS);
        seedFeature("font_roboto", "Roboto", "Modern sans-serif font", 25, FeatureCategory.FONTS);
        seedFeature("font_merriweather", "Merriweather", "Serif font tuned for screens", 30, FeatureCategory.FONTS);
        seedFeature("font_playfair", "Playfair Display", "High-contrast display serif", 35, FeatureCategory.FONTS);

        seedFeature("2word_chunking", "2-Word Chunking", "Show words in pairs", 75, FeatureCategory.CHUNKING);
        seedFeature("3word_chunking", "3-Word Chunking", "Show words in groups of three", 100, FeatureCategory.CHUNKING,
                "2word_chunking");
        seedFeature("4word_chunking", "4-Word Chunking", "Show words in groups of four", 125, FeatureCategory.CHUNKING,
                "2word_chunking", "3word_chunking");
        seedFeature("5word_chunking", "5-Word Chunking", "Show words in groups of five", 150, FeatureCategory.CHUNKING,
                "2word_chunking", "3word_chunking", "4word_chunking");

        seedFeature("smart_connector_grouping", "Smart Connector Grouping",
                "Keeps short connector words with their neighbours", 75, FeatureCategory.SMART_FEATURES);
        seedFeature("smart_symbol_handling", "Smart Symbol Handling",
                "Pauses sensibly on numbers and punctuation", 50, FeatureCategory.SMART_FEATURES);

        seedFeature("theme_dark", "Dark Theme", "Light text on a dark background", 40, FeatureCategory.THEMES);
        seedFeature("theme_sepia", "Sepia Theme", "Warm paper-like colours", 40, FeatureCategory.THEMES);
        seedFeature("theme_high_contrast", "High Contrast Theme", "Maximum contrast for accessibility", 60,
                FeatureCategory.THEMES);

        seedBundle("font_starter_pack", "Font Starter Pack", "Open Sans and Roboto", 40,
                List.of("font_opensans", "font_roboto"));
        seedBundle("chunking_progression", "Chunking Progression Pack", "2-word and 3-word chunking", 150,
                List.of("2word_chunking", "3word_chunking"));
        seedBundle("smart_reading_combo", "Smart Reading Combo", "Both smart reading features", 100,
                List.of("smart_connector_grouping", "smart_symbol_handling"));

        log.info("FeatureCatalogInitializer: feature_catalog count before={} after={}, bundles={}",
                before, catalogRepository.count(), bundleRepository.count());
    }

    private void seedFeature(String id, String name, String description, long price, FeatureCategory category,
                             String... prerequisites) {
        if (catalogRepository.existsById(id)) {
            return;
        }
        FeatureCatalogEntry entry = new FeatureCatalogEntry();
        entry.setId(id);
        entry.setDisplayName(name);
        entry.setDescription(description);
        entry.setPrice(price);
        entry.setCategory(category);
        entry.setPrerequisites(new LinkedHashSet<>(List.of(prerequisites)));
        entry.setUpdatedAt(LocalDateTime.now(clock));
        catalogRepository.save(entry);
        log.debug("Seeded feature {} at {} XP", id, price);
    }

    private void seedBundle(String id, String name, String description, long price, List<String> featureIds) {
        if (bundleRepository.existsById(id)) {
            return;
        }
        FeatureBundle bundle = new FeatureBundle();
        bundle.setId(id);
        bundle.setDisplayName(name);
        bundle.setDescription(description);
        bundle.setPrice(price);
        bundle.setFeatureIds(new LinkedHashSet<>(featureIds));
        bundleRepository.save(bundle);
        log.debug("Seeded bundle {} at {} XP", id, price);
    }
}
