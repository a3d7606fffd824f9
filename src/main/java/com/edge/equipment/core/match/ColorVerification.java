package com.edge.equipment.core.match;

/**
 * 颜色复核结果
 * <p>
 * similarity 参与综合评分；histogramSimilarity 只作诊断
 */
public class ColorVerification {
    private final double similarity;
    private final double meanDistance;
    private final double sharedRatio;
    private final double histogramSimilarity;
    private final boolean lowConfidence;

    public ColorVerification(double similarity, double meanDistance, double sharedRatio,
                             double histogramSimilarity, boolean lowConfidence) {
        this.similarity = similarity;
        this.meanDistance = meanDistance;
        this.sharedRatio = sharedRatio;
        this.histogramSimilarity = histogramSimilarity;
        this.lowConfidence = lowConfidence;
    }

    /**
     * 共享前景为空
     */
    public static ColorVerification noSharedForeground(double maxDistance) {
        return new ColorVerification(0.0, maxDistance, 0.0, 0.0, true);
    }

    public double getSimilarity() { return similarity; }

    public double getMeanDistance() { return meanDistance; }

    public double getSharedRatio() { return sharedRatio; }

    public double getHistogramSimilarity() { return histogramSimilarity; }

    public boolean isLowConfidence() { return lowConfidence; }

    @Override
    public String toString() {
        return String.format("ColorVerification{similarity=%.4f, meanDistance=%.2f, shared=%.3f, hist=%.3f%s}",
            similarity, meanDistance, sharedRatio, histogramSimilarity, lowConfidence ? ", LOW" : "");
    }
}
