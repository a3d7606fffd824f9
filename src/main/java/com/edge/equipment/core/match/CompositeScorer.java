package com.edge.equipment.core.match;

import com.edge.equipment.core.model.MatchCandidate;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 综合评分
 * <p>
 * - 图案得分 ≥ patternThreshold 的模板成为候选，只有候选才做颜色复核
 * - composite = pattern × patternWeight + color × 100 × colorWeight
 * - 综合分最高者胜出，依次以图案分、模板 ID 打破平局
 * - 无候选时取图案分最高者，composite = pattern
 */
public class CompositeScorer {

    // 低分降权参数
    static final double PENALTY_PATTERN_BELOW = 60.0;
    static final double PENALTY_PATTERN_FACTOR = 0.5;
    static final double PENALTY_COLOR_BELOW = 0.5;
    static final double PENALTY_COLOR_FACTOR = 0.3;

    /** 综合分降序，图案分降序，模板 ID 升序 */
    public static final Comparator<MatchCandidate> BY_COMPOSITE = Comparator
        .comparingDouble(MatchCandidate::getCompositeScore).reversed()
        .thenComparing(Comparator.comparingDouble(MatchCandidate::getPatternScore).reversed())
        .thenComparing(MatchCandidate::getTemplateId);

    /** 图案分降序，模板 ID 升序 */
    public static final Comparator<MatchCandidate> BY_PATTERN = Comparator
        .comparingDouble(MatchCandidate::getPatternScore).reversed()
        .thenComparing(MatchCandidate::getTemplateId);

    private final double patternThreshold;
    private final double patternWeight;
    private final double colorWeight;
    private final double acceptThreshold;
    private final boolean lowScorePenalty;

    public CompositeScorer(double patternThreshold, double patternWeight, double colorWeight,
                           double acceptThreshold, boolean lowScorePenalty) {
        this.patternThreshold = patternThreshold;
        this.patternWeight = patternWeight;
        this.colorWeight = colorWeight;
        this.acceptThreshold = acceptThreshold;
        this.lowScorePenalty = lowScorePenalty;
    }

    public boolean isCandidate(double patternScore) {
        return patternScore >= patternThreshold;
    }

    public List<MatchCandidate> selectCandidates(List<MatchCandidate> patternScored) {
        return patternScored.stream()
            .filter(c -> isCandidate(c.getPatternScore()))
            .collect(Collectors.toList());
    }

    /**
     * @param patternScore    0–100
     * @param colorSimilarity 0–1
     */
    public double composite(double patternScore, double colorSimilarity) {
        double pattern = patternScore;
        double color = colorSimilarity;
        if (lowScorePenalty) {
            if (pattern < PENALTY_PATTERN_BELOW) {
                pattern *= PENALTY_PATTERN_FACTOR;
            }
            if (color < PENALTY_COLOR_BELOW) {
                color *= PENALTY_COLOR_FACTOR;
            }
        }
        return pattern * patternWeight + color * 100.0 * colorWeight;
    }

    public MatchCandidate refine(MatchCandidate candidate, ColorVerification verification) {
        double composite = composite(candidate.getPatternScore(), verification.getSimilarity());
        return MatchCandidate.withColor(candidate, verification, composite);
    }

    /**
     * 已复核候选中的最佳者
     */
    public MatchCandidate best(List<MatchCandidate> refined) {
        return refined.stream().min(BY_COMPOSITE)
            .orElseThrow(() -> new IllegalArgumentException("No refined candidates to choose from"));
    }

    /**
     * 无候选时的回退：图案分最高者，不做颜色复核
     */
    public MatchCandidate fallback(List<MatchCandidate> patternScored) {
        return patternScored.stream().min(BY_PATTERN)
            .orElseThrow(() -> new IllegalArgumentException("No pattern scores to fall back on"));
    }

    public boolean accepts(double compositeScore) {
        return compositeScore >= acceptThreshold;
    }

    public double getPatternThreshold() { return patternThreshold; }

    public double getPatternWeight() { return patternWeight; }

    public double getColorWeight() { return colorWeight; }

    public double getAcceptThreshold() { return acceptThreshold; }

    public boolean isLowScorePenalty() { return lowScorePenalty; }
}
