package com.edge.equipment.core.match;

import com.edge.equipment.core.cache.TemplateCache;
import com.edge.equipment.core.feature.DescriptorExtractor;
import com.edge.equipment.core.feature.DescriptorSet;
import com.edge.equipment.core.model.MatchCandidate;
import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.core.model.MatchedBy;
import com.edge.equipment.core.model.ProbeIcon;
import com.edge.equipment.core.model.ReferenceTemplate;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.DMatch;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.features2d.BFMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 描述子回退匹配
 * <p>
 * 1. 提取 ORB 关键点（模板优先取缓存）
 * 2. BFMatcher Hamming k=2 + 比率测试
 * 3. RANSAC 单应性，统计内点
 * 4. 置信度 = 0.4 × 优质匹配率 + 0.4 × 内点率 + 0.2 × 匹配数量分，各项封顶 100
 */
public class DescriptorGeometricMatcher implements IconMatcher {
    private static final Logger logger = LoggerFactory.getLogger(DescriptorGeometricMatcher.class);

    private static final double WEIGHT_GOOD_RATIO = 0.4;
    private static final double WEIGHT_INLIER_RATIO = 0.4;
    private static final double WEIGHT_MATCH_COUNT = 0.2;
    // 优质匹配数达到该值时数量分满分
    private static final double FULL_SCORE_MATCH_COUNT = 50.0;

    private final DescriptorExtractor extractor;
    private final TemplateCache templateCache;
    private final int minKeyPoints;
    private final float ratioThreshold;
    private final int minGoodMatches;
    private final int minInliers;
    private final double ransacThreshold;
    private final double validConfidence;

    public DescriptorGeometricMatcher(DescriptorExtractor extractor, TemplateCache templateCache,
                                      int minKeyPoints, float ratioThreshold, int minGoodMatches,
                                      int minInliers, double ransacThreshold, double validConfidence) {
        this.extractor = extractor;
        this.templateCache = templateCache;
        this.minKeyPoints = minKeyPoints;
        this.ratioThreshold = ratioThreshold;
        this.minGoodMatches = minGoodMatches;
        this.minInliers = minInliers;
        this.ransacThreshold = ransacThreshold;
        this.validConfidence = validConfidence;
    }

    @Override
    public MatchStrategy strategy() {
        return MatchStrategy.DESCRIPTOR_GEOMETRIC;
    }

    @Override
    public MatchResult match(ProbeIcon probe, List<ReferenceTemplate> catalog, boolean diagnostics) {
        if (catalog.isEmpty()) {
            logger.warn("Empty catalog, probe {} cannot be matched", probe.getId());
            return MatchResult.noMatch(probe.getId(), MatchedBy.DESCRIPTOR_GEOMETRIC);
        }

        DescriptorSet probeSet = extractor.extract(probe.getPixels());
        if (probeSet.keyPointCount() < minKeyPoints) {
            logger.info("{}: only {} keypoints, descriptor matching not possible", probe.getId(), probeSet.keyPointCount());
            MatchResult result = MatchResult.noMatch(probe.getId(), MatchedBy.DESCRIPTOR_GEOMETRIC);
            result.setDescriptorOutcome(DescriptorMatchOutcome.failed(
                DescriptorMatchOutcome.FailureReason.INSUFFICIENT_KEYPOINTS, probeSet.keyPointCount(), 0, 0, 0, 0));
            return result;
        }

        List<DescriptorMatchOutcome> outcomes = new ArrayList<>(catalog.size());
        for (ReferenceTemplate template : catalog) {
            DescriptorSet templateSet = templateCache.getOrComputeFeatures(template);
            DescriptorMatchOutcome outcome = matchDescriptors(probeSet, templateSet).forTemplate(template.getId());
            outcomes.add(outcome);
            logger.debug("{} vs {}: {}", probe.getId(), template.getId(), outcome);
        }

        DescriptorMatchOutcome best = outcomes.stream()
            .filter(DescriptorMatchOutcome::isVerified)
            .min(Comparator.comparingDouble(DescriptorMatchOutcome::getConfidence).reversed()
                .thenComparing(DescriptorMatchOutcome::getTemplateId))
            .orElse(null);

        MatchResult result;
        if (best == null) {
            // 全部失败：报告走得最远的那次尝试
            DescriptorMatchOutcome furthest = outcomes.stream()
                .max(Comparator.comparing(DescriptorMatchOutcome::getFailureReason)
                    .thenComparingInt(DescriptorMatchOutcome::getGoodMatches))
                .orElse(null);
            logger.info("{}: descriptor matching failed for all {} templates (furthest: {})",
                probe.getId(), catalog.size(), furthest);
            result = MatchResult.noMatch(probe.getId(), MatchedBy.DESCRIPTOR_GEOMETRIC);
            result.setDescriptorOutcome(furthest);
        } else {
            logger.info("{}: descriptor match {} (confidence={}, valid={})", probe.getId(), best.getTemplateId(),
                String.format("%.2f", best.getConfidence()), best.isValidMatch());
            result = MatchResult.of(probe.getId(),
                MatchCandidate.descriptor(best.getTemplateId(), best.getConfidence()),
                MatchedBy.DESCRIPTOR_GEOMETRIC, best.isValidMatch());
            result.setDescriptorOutcome(best);
        }

        if (diagnostics) {
            List<MatchCandidate> candidates = new ArrayList<>();
            for (DescriptorMatchOutcome outcome : outcomes) {
                candidates.add(MatchCandidate.descriptor(outcome.getTemplateId(), outcome.getConfidence()));
            }
            candidates.sort(CompositeScorer.BY_COMPOSITE);
            result.setCandidates(candidates);
        }
        return result;
    }

    /**
     * 单个探针 / 模板的完整尝试
     */
    public DescriptorMatchOutcome attempt(ProbeIcon probe, ReferenceTemplate template) {
        DescriptorSet probeSet = extractor.extract(probe.getPixels());
        DescriptorSet templateSet = templateCache.getOrComputeFeatures(template);
        return matchDescriptors(probeSet, templateSet).forTemplate(template.getId());
    }

    /**
     * probe 为 query，template 为 train
     */
    public DescriptorMatchOutcome matchDescriptors(DescriptorSet probe, DescriptorSet template) {
        int probeKeyPoints = probe.keyPointCount();
        int templateKeyPoints = template.keyPointCount();

        // EXTRACT
        if (probe.isEmpty() || template.isEmpty()
            || probeKeyPoints < minKeyPoints || templateKeyPoints < minKeyPoints) {
            return DescriptorMatchOutcome.failed(DescriptorMatchOutcome.FailureReason.INSUFFICIENT_KEYPOINTS,
                probeKeyPoints, templateKeyPoints, 0, 0, 0);
        }

        // MATCH
        Mat probeDescriptors = probe.toDescriptorMat();
        Mat templateDescriptors = template.toDescriptorMat();
        List<MatOfDMatch> knnMatches = new ArrayList<>();
        List<DMatch> goodMatches = new ArrayList<>();
        int knnPairs = 0;
        try {
            BFMatcher matcher = BFMatcher.create(Core.NORM_HAMMING, false);
            matcher.knnMatch(probeDescriptors, templateDescriptors, knnMatches, 2);

            for (MatOfDMatch match : knnMatches) {
                DMatch[] pair = match.toArray();
                if (pair.length >= 2) {
                    knnPairs++;
                    if (pair[0].distance < ratioThreshold * pair[1].distance) {
                        goodMatches.add(pair[0]);
                    }
                }
            }
        } finally {
            probeDescriptors.release();
            templateDescriptors.release();
            knnMatches.forEach(Mat::release);
        }

        int good = goodMatches.size();
        if (good < minGoodMatches) {
            return DescriptorMatchOutcome.failed(DescriptorMatchOutcome.FailureReason.INSUFFICIENT_MATCHES,
                probeKeyPoints, templateKeyPoints, knnPairs, good, 0);
        }

        // VERIFY
        int inliers = countHomographyInliers(probe.getKeyPoints(), template.getKeyPoints(), goodMatches);
        if (inliers < 0) {
            return DescriptorMatchOutcome.failed(DescriptorMatchOutcome.FailureReason.NO_HOMOGRAPHY,
                probeKeyPoints, templateKeyPoints, knnPairs, good, 0);
        }
        if (inliers < minInliers) {
            return DescriptorMatchOutcome.failed(DescriptorMatchOutcome.FailureReason.INSUFFICIENT_INLIERS,
                probeKeyPoints, templateKeyPoints, knnPairs, good, inliers);
        }

        double confidence = confidence(knnPairs, good, inliers);
        return DescriptorMatchOutcome.verified(probeKeyPoints, templateKeyPoints, knnPairs, good, inliers,
            confidence, validConfidence);
    }

    /**
     * @return 内点数；无法估计单应性时返回 -1
     */
    private int countHomographyInliers(KeyPoint[] probeKeyPoints, KeyPoint[] templateKeyPoints, List<DMatch> goodMatches) {
        List<Point> probePoints = new ArrayList<>(goodMatches.size());
        List<Point> templatePoints = new ArrayList<>(goodMatches.size());
        for (DMatch match : goodMatches) {
            probePoints.add(probeKeyPoints[match.queryIdx].pt);
            templatePoints.add(templateKeyPoints[match.trainIdx].pt);
        }

        MatOfPoint2f src = new MatOfPoint2f();
        MatOfPoint2f dst = new MatOfPoint2f();
        Mat inlierMask = new Mat();
        Mat homography = null;
        try {
            src.fromList(probePoints);
            dst.fromList(templatePoints);
            homography = Calib3d.findHomography(src, dst, Calib3d.RANSAC, ransacThreshold, inlierMask);
            if (homography == null || homography.empty() || inlierMask.empty()) {
                return -1;
            }
            return Core.countNonZero(inlierMask);
        } finally {
            src.release();
            dst.release();
            inlierMask.release();
            if (homography != null) {
                homography.release();
            }
        }
    }

    double confidence(int knnPairs, int goodMatches, int inliers) {
        double goodRatioScore = knnPairs > 0 ? Math.min(100.0, (double) goodMatches / knnPairs * 100.0) : 0.0;
        double inlierRatioScore = goodMatches > 0 ? Math.min(100.0, (double) inliers / goodMatches * 100.0) : 0.0;
        double countScore = Math.min(100.0, goodMatches / FULL_SCORE_MATCH_COUNT * 100.0);
        return WEIGHT_GOOD_RATIO * goodRatioScore
            + WEIGHT_INLIER_RATIO * inlierRatioScore
            + WEIGHT_MATCH_COUNT * countScore;
    }

    public double getValidConfidence() { return validConfidence; }
}
