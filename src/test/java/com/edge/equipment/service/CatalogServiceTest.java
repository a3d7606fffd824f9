package com.edge.equipment.service;

import com.edge.equipment.SyntheticImages;
import com.edge.equipment.config.NativeLibraryLoader;
import com.edge.equipment.config.YamlConfig;
import com.edge.equipment.core.cache.HistogramExtractor;
import com.edge.equipment.core.cache.TemplateCache;
import com.edge.equipment.core.feature.DescriptorExtractor;
import com.edge.equipment.core.model.ReferenceTemplate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CatalogServiceTest {

    @TempDir
    Path tempDir;

    private Path catalogDir;
    private TemplateCache templateCache;
    private CatalogService catalogService;

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @BeforeEach
    void setUp() throws Exception {
        catalogDir = Files.createDirectories(tempDir.resolve("base_equipment"));
        templateCache = new TemplateCache(tempDir.resolve("cache"), new HistogramExtractor(),
            new DescriptorExtractor(1000, 116));
        YamlConfig yamlConfig = new YamlConfig();
        yamlConfig.getCatalog().setDirectory(catalogDir.toString());

        catalogService = new CatalogService();
        ReflectionTestUtils.setField(catalogService, "templateCache", templateCache);
        ReflectionTestUtils.setField(catalogService, "yamlConfig", yamlConfig);

        SyntheticImages.writePng(catalogDir, "gray_square.png", SyntheticImages.grayIconOnPurple());
        SyntheticImages.writePng(catalogDir, "red_square.png", SyntheticImages.squareOnPurple(SyntheticImages.RED));
        Files.write(catalogDir.resolve("broken.png"), new byte[]{0x42, 0x41, 0x44});
        Files.writeString(catalogDir.resolve("notes.txt"), "not an image");
    }

    @Test
    @DisplayName("Unreadable files are reported and non-images are ignored")
    void loadsCatalogAndReportsFailures() {
        CatalogService.CatalogLoad load = catalogService.loadCatalog(catalogDir, false);
        try {
            CatalogService.BuildReport report = load.getReport();
            assertThat(report.getTotal()).isEqualTo(3);
            assertThat(report.getSucceeded()).isEqualTo(2);
            assertThat(report.getFailed()).isEqualTo(1);
            assertThat(report.getFailures()).containsOnlyKeys("broken.png");
            assertThat(report.getRecomputed()).isEqualTo(2);
            assertThat(report.getReused()).isZero();
            assertThat(load.getTemplates()).extracting(ReferenceTemplate::getId)
                .containsExactly("gray_square", "red_square");
            assertThat(load.getTemplates()).allSatisfy(t -> assertThat(t.getPerceptualHistogram()).isNotNull());
        } finally {
            load.release();
        }
    }

    @Test
    void secondLoadReusesCache() {
        catalogService.loadCatalog(catalogDir, false).release();

        CatalogService.CatalogLoad second = catalogService.loadCatalog(catalogDir, false);
        second.release();

        assertThat(second.getReport().getReused()).isEqualTo(2);
        assertThat(second.getReport().getRecomputed()).isZero();
    }

    @Test
    void forceRecomputeIgnoresCache() {
        catalogService.loadCatalog(catalogDir, false).release();

        CatalogService.CatalogLoad forced = catalogService.loadCatalog(catalogDir, true);
        forced.release();

        assertThat(forced.getReport().getRecomputed()).isEqualTo(2);
        assertThat(forced.getReport().getReused()).isZero();
    }

    @Test
    @DisplayName("Modified files are recomputed and deleted files leave the cache")
    void tracksCatalogChanges() throws Exception {
        Files.delete(catalogDir.resolve("broken.png"));
        catalogService.loadCatalog(catalogDir, false).release();
        SyntheticImages.writePng(catalogDir, "gray_square.png", SyntheticImages.texturedIcon(9));
        Files.delete(catalogDir.resolve("red_square.png"));
        SyntheticImages.writePng(catalogDir, "new_icon.png", SyntheticImages.texturedIcon(10));

        CatalogService.UpdateReport updates = catalogService.checkForUpdates(catalogDir);
        assertThat(updates.hasUpdates()).isTrue();
        assertThat(updates.getAdded()).containsExactly("new_icon");
        assertThat(updates.getModified()).containsExactly("gray_square");
        assertThat(updates.getRemoved()).containsExactly("red_square");

        CatalogService.CatalogLoad reloaded = catalogService.loadCatalog(catalogDir, false);
        reloaded.release();
        assertThat(reloaded.getReport().getRecomputed()).isEqualTo(2);
        assertThat(reloaded.getReport().getRemoved()).containsExactly("red_square");
        assertThat(templateCache.indexedIds()).containsExactlyInAnyOrder("gray_square", "new_icon");
        assertThat(catalogService.checkForUpdates(catalogDir).hasUpdates()).isFalse();
    }

    @Test
    void duplicateIdIsReportedOnce() throws Exception {
        Files.copy(catalogDir.resolve("gray_square.png"), catalogDir.resolve("gray_square.jpg"));

        CatalogService.CatalogLoad load = catalogService.loadCatalog(catalogDir, false);
        load.release();

        assertThat(load.getTemplates()).filteredOn(t -> t.getId().equals("gray_square")).hasSize(1);
        assertThat(load.getReport().getFailures()).containsKey("gray_square.png");
    }

    @Test
    void missingDirectoryIsConfigurationError() {
        Path missing = tempDir.resolve("does-not-exist");

        assertThatThrownBy(() -> catalogService.loadCatalog(missing, false))
            .isInstanceOf(CatalogConfigurationException.class)
            .hasMessageContaining("does not exist");
        assertThatThrownBy(() -> catalogService.listImages(catalogDir.resolve("notes.txt"), "Probe"))
            .isInstanceOf(CatalogConfigurationException.class)
            .hasMessageContaining("not a directory");
    }

    @Test
    void blankDirectoryFallsBackToConfiguredCatalog() {
        assertThat(catalogService.resolveCatalogDirectory(" ")).isEqualTo(catalogDir);
        assertThat(catalogService.resolveCatalogDirectory("/tmp/other")).isEqualTo(Path.of("/tmp/other"));
    }
}
