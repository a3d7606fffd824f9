package com.edge.equipment.core.match;

import com.edge.equipment.SyntheticImages;
import com.edge.equipment.config.NativeLibraryLoader;
import com.edge.equipment.core.cache.HistogramExtractor;
import com.edge.equipment.core.cache.TemplateCache;
import com.edge.equipment.core.mask.BackgroundColorFamily;
import com.edge.equipment.core.mask.CircularRoi;
import com.edge.equipment.core.mask.ForegroundMaskGenerator;
import com.edge.equipment.core.model.MatchCandidate;
import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.core.model.MatchedBy;
import com.edge.equipment.core.model.ProbeIcon;
import com.edge.equipment.core.model.ReferenceTemplate;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternColorMatcherTest {

    private final HistogramExtractor histogramExtractor = new HistogramExtractor();
    private ForegroundMaskGenerator maskGenerator;
    private ProbeIcon probe;

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @BeforeEach
    void setUp() throws Exception {
        maskGenerator = new ForegroundMaskGenerator(List.of(
            BackgroundColorFamily.of("dark-purple", 46, 33, 46, 20),
            BackgroundColorFamily.of("muted-purple", 79, 53, 103, 50)), new CircularRoi(0.475), 0.05);
        probe = new ProbeIcon("probe",
            SyntheticImages.pngRoundTrip(SyntheticImages.withBorder(SyntheticImages.grayIconOnPurple(), 5)));
    }

    private PatternColorMatcher matcher(double patternThreshold) {
        return new PatternColorMatcher(new PatternMatcher(), new ColorVerifier(maskGenerator, 116, 300.0),
            new CompositeScorer(patternThreshold, 0.65, 0.35, 60.0, false), histogramExtractor);
    }

    private ReferenceTemplate template(String id, Mat pixels) {
        return new ReferenceTemplate(id, pixels, TemplateCache.contentHash(SyntheticImages.encodePng(pixels)),
            histogramExtractor.extract(pixels), Instant.now(), null);
    }

    private static Mat grayCircle() {
        Mat circle = new Mat(50, 50, CvType.CV_8UC3, SyntheticImages.DARK_PURPLE);
        Imgproc.circle(circle, new Point(25, 25), 12, SyntheticImages.GRAY, -1);
        Imgproc.line(circle, new Point(5, 45), new Point(45, 5), SyntheticImages.GRAY, 3);
        return circle;
    }

    @Test
    @DisplayName("Same-color template beats an equally shaped template in another color")
    void colorDecidesBetweenShapeTwins() {
        List<ReferenceTemplate> catalog = List.of(
            template("gray_square", SyntheticImages.grayIconOnPurple()),
            template("red_square", SyntheticImages.squareOnPurple(SyntheticImages.RED)));

        MatchResult result = matcher(70.0).match(probe, catalog, false);

        assertThat(result.getMatchedBy()).isEqualTo(MatchedBy.PATTERN_AND_COLOR);
        assertThat(result.getBestTemplateId()).isEqualTo("gray_square");
        assertThat(result.getBestCandidate().getPatternScore()).isGreaterThanOrEqualTo(99.0);
        assertThat(result.getBestCandidate().getColorScore()).isGreaterThanOrEqualTo(0.95);
        assertThat(result.getCompositeScore()).isGreaterThan(95.0);
        assertThat(result.isAcceptedByThreshold()).isTrue();
        assertThat(result.getCandidates()).isEmpty();
    }

    @Test
    @DisplayName("Without pattern candidates the best pattern score is reported as-is")
    void fallsBackToPatternOnly() {
        List<ReferenceTemplate> catalog = List.of(
            template("gray_square", SyntheticImages.grayIconOnPurple()),
            template("gray_circle", grayCircle()));

        MatchResult result = matcher(101.0).match(probe, catalog, false);

        assertThat(result.getMatchedBy()).isEqualTo(MatchedBy.PATTERN_ONLY);
        assertThat(result.getBestTemplateId()).isEqualTo("gray_square");
        assertThat(result.getBestCandidate().getColorScore()).isNull();
        assertThat(result.getCompositeScore()).isEqualTo(result.getBestCandidate().getPatternScore());
    }

    @Test
    void emptyCatalogIsNoMatch() {
        MatchResult result = matcher(70.0).match(probe, List.of(), false);

        assertThat(result.hasMatch()).isFalse();
        assertThat(result.getCompositeScore()).isZero();
        assertThat(result.isAcceptedByThreshold()).isFalse();
    }

    @Test
    @DisplayName("Diagnostics list every template, best first")
    void diagnosticsListAllCandidates() {
        List<ReferenceTemplate> catalog = List.of(
            template("gray_circle", grayCircle()),
            template("gray_square", SyntheticImages.grayIconOnPurple()),
            template("red_square", SyntheticImages.squareOnPurple(SyntheticImages.RED)));

        MatchResult result = matcher(70.0).match(probe, catalog, true);

        List<MatchCandidate> candidates = result.getCandidates();
        assertThat(candidates).hasSize(3);
        assertThat(candidates.get(0).getTemplateId()).isEqualTo(result.getBestTemplateId());
        assertThat(candidates).isSortedAccordingTo(CompositeScorer.BY_COMPOSITE);
        assertThat(candidates).allSatisfy(c -> assertThat(c.getPerceptualSimilarity()).isNotNull());
    }
}
