package com.edge.equipment.core.match;

import com.edge.equipment.SyntheticImages;
import com.edge.equipment.config.NativeLibraryLoader;
import com.edge.equipment.core.cache.HistogramExtractor;
import com.edge.equipment.core.cache.TemplateCache;
import com.edge.equipment.core.feature.DescriptorExtractor;
import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.core.model.MatchedBy;
import com.edge.equipment.core.model.ProbeIcon;
import com.edge.equipment.core.model.ReferenceTemplate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.Mat;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DescriptorGeometricMatcherTest {

    @TempDir
    Path cacheDir;

    private final HistogramExtractor histogramExtractor = new HistogramExtractor();
    private TemplateCache templateCache;
    private DescriptorGeometricMatcher matcher;

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @BeforeEach
    void setUp() {
        DescriptorExtractor extractor = new DescriptorExtractor(1000, 116);
        templateCache = new TemplateCache(cacheDir, histogramExtractor, extractor);
        matcher = new DescriptorGeometricMatcher(extractor, templateCache, 10, 0.75f, 10, 8, 5.0, 60.0);
    }

    private ReferenceTemplate template(String id, Mat pixels) {
        return new ReferenceTemplate(id, pixels, TemplateCache.contentHash(SyntheticImages.encodePng(pixels)),
            histogramExtractor.extract(pixels), Instant.now(), null);
    }

    @Test
    @DisplayName("Featureless probe fails at keypoint extraction")
    void uniformProbeHasTooFewKeyPoints() {
        ProbeIcon probe = new ProbeIcon("blank", SyntheticImages.uniform(116, SyntheticImages.GRAY));

        MatchResult result = matcher.match(probe, List.of(template("t", SyntheticImages.texturedIcon(1))), false);

        assertThat(result.getMatchedBy()).isEqualTo(MatchedBy.DESCRIPTOR_GEOMETRIC);
        assertThat(result.hasMatch()).isFalse();
        assertThat(result.getCompositeScore()).isZero();
        assertThat(result.getDescriptorOutcome().getStatus()).isEqualTo(DescriptorMatchOutcome.Status.FAILED);
        assertThat(result.getDescriptorOutcome().getFailureReason())
            .isEqualTo(DescriptorMatchOutcome.FailureReason.INSUFFICIENT_KEYPOINTS);
        assertThat(result.getDescriptorOutcome().getConfidence()).isZero();
    }

    @Test
    void identicalIconIsVerified() {
        Mat icon = SyntheticImages.texturedIcon(1);

        DescriptorMatchOutcome outcome = matcher.attempt(new ProbeIcon("probe", icon.clone()), template("t", icon));

        assertThat(outcome.isVerified()).isTrue();
        assertThat(outcome.getInliers()).isGreaterThanOrEqualTo(8);
        assertThat(outcome.getConfidence()).isGreaterThanOrEqualTo(60.0).isLessThanOrEqualTo(100.0);
        assertThat(outcome.isValidMatch()).isTrue();
    }

    @Test
    void confidenceCombinesRatiosAndCount() {
        // 0.4 × 50 + 0.4 × 80 + 0.2 × 100
        assertThat(matcher.confidence(100, 50, 40)).isCloseTo(72.0, within(1e-9));
        // 数量分 10 / 50 = 20
        assertThat(matcher.confidence(10, 10, 10)).isCloseTo(84.0, within(1e-9));
        assertThat(matcher.confidence(0, 0, 0)).isZero();
    }

    @Test
    @DisplayName("Best verified template wins and its descriptors are cached")
    void picksMatchingTemplateFromCatalog() {
        List<ReferenceTemplate> catalog = List.of(
            template("seed1", SyntheticImages.texturedIcon(1)),
            template("seed2", SyntheticImages.texturedIcon(2)));
        ProbeIcon probe = new ProbeIcon("probe", SyntheticImages.texturedIcon(1));

        MatchResult result = matcher.match(probe, catalog, true);

        assertThat(result.getBestTemplateId()).isEqualTo("seed1");
        assertThat(result.getBestCandidate().getCompositeScore())
            .isEqualTo(result.getDescriptorOutcome().getConfidence());
        assertThat(result.getCandidates()).hasSize(2);
        assertThat(templateCache.getCachedFeatures("seed1")).isPresent();
        assertThat(templateCache.getCachedFeatures("seed2")).isPresent();
    }
}
