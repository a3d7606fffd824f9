package com.edge.equipment.core.model;

import com.edge.equipment.core.match.ColorVerification;

/**
 * 单个模板对探针的评分
 * <p>
 * colorScore 为 null 表示未做颜色复核（未进入候选或走描述子路径）
 */
public class MatchCandidate {
    private String templateId;
    private double patternScore;
    private Double colorScore;
    private double compositeScore;

    // 颜色诊断信息
    private Double sharedForegroundRatio;
    private Double meanLabDistance;
    private Double histogramSimilarity;
    private Double perceptualSimilarity;
    private boolean lowConfidence;

    public MatchCandidate() {
    }

    /**
     * 仅有图案得分，综合分等于图案分
     */
    public static MatchCandidate patternOnly(String templateId, double patternScore) {
        MatchCandidate candidate = new MatchCandidate();
        candidate.templateId = templateId;
        candidate.patternScore = patternScore;
        candidate.compositeScore = patternScore;
        return candidate;
    }

    public static MatchCandidate withColor(MatchCandidate patternCandidate, ColorVerification verification,
                                           double compositeScore) {
        MatchCandidate candidate = new MatchCandidate();
        candidate.templateId = patternCandidate.templateId;
        candidate.patternScore = patternCandidate.patternScore;
        candidate.perceptualSimilarity = patternCandidate.perceptualSimilarity;
        candidate.colorScore = verification.getSimilarity();
        candidate.compositeScore = compositeScore;
        candidate.sharedForegroundRatio = verification.getSharedRatio();
        candidate.meanLabDistance = verification.getMeanDistance();
        candidate.histogramSimilarity = verification.getHistogramSimilarity();
        candidate.lowConfidence = verification.isLowConfidence();
        return candidate;
    }

    /**
     * 描述子路径：综合分即置信度
     */
    public static MatchCandidate descriptor(String templateId, double confidence) {
        MatchCandidate candidate = new MatchCandidate();
        candidate.templateId = templateId;
        candidate.compositeScore = confidence;
        return candidate;
    }

    public boolean hasColorScore() {
        return colorScore != null;
    }

    public String getTemplateId() { return templateId; }
    public void setTemplateId(String templateId) { this.templateId = templateId; }

    public double getPatternScore() { return patternScore; }
    public void setPatternScore(double patternScore) { this.patternScore = patternScore; }

    public Double getColorScore() { return colorScore; }
    public void setColorScore(Double colorScore) { this.colorScore = colorScore; }

    public double getCompositeScore() { return compositeScore; }
    public void setCompositeScore(double compositeScore) { this.compositeScore = compositeScore; }

    public Double getSharedForegroundRatio() { return sharedForegroundRatio; }
    public void setSharedForegroundRatio(Double sharedForegroundRatio) { this.sharedForegroundRatio = sharedForegroundRatio; }

    public Double getMeanLabDistance() { return meanLabDistance; }
    public void setMeanLabDistance(Double meanLabDistance) { this.meanLabDistance = meanLabDistance; }

    public Double getHistogramSimilarity() { return histogramSimilarity; }
    public void setHistogramSimilarity(Double histogramSimilarity) { this.histogramSimilarity = histogramSimilarity; }

    public Double getPerceptualSimilarity() { return perceptualSimilarity; }
    public void setPerceptualSimilarity(Double perceptualSimilarity) { this.perceptualSimilarity = perceptualSimilarity; }

    public boolean isLowConfidence() { return lowConfidence; }
    public void setLowConfidence(boolean lowConfidence) { this.lowConfidence = lowConfidence; }

    @Override
    public String toString() {
        return String.format("MatchCandidate{%s, pattern=%.2f, color=%s, composite=%.2f}",
            templateId, patternScore, colorScore == null ? "-" : String.format("%.4f", colorScore), compositeScore);
    }
}
