package com.edge.equipment.core.cache;

import java.util.Arrays;

/**
 * LAB 三通道直方图（L、a、b 依次拼接，每通道 256 bin，各自 L1 归一化）
 */
public class PerceptualHistogram {
    public static final int BINS_PER_CHANNEL = 256;
    public static final int CHANNELS = 3;
    public static final int LENGTH = BINS_PER_CHANNEL * CHANNELS;

    private final float[] bins;

    public PerceptualHistogram(float[] bins) {
        if (bins == null || bins.length != LENGTH) {
            throw new IllegalArgumentException("Perceptual histogram needs " + LENGTH + " bins, got "
                + (bins == null ? "null" : bins.length));
        }
        this.bins = bins.clone();
    }

    public float[] getBins() {
        return bins.clone();
    }

    public float bin(int index) {
        return bins[index];
    }

    /**
     * 相关系数（与 HISTCMP_CORREL 一致），范围 [-1, 1]
     */
    public double correlation(PerceptualHistogram other) {
        double meanA = 0;
        double meanB = 0;
        for (int i = 0; i < LENGTH; i++) {
            meanA += bins[i];
            meanB += other.bins[i];
        }
        meanA /= LENGTH;
        meanB /= LENGTH;

        double cov = 0;
        double varA = 0;
        double varB = 0;
        for (int i = 0; i < LENGTH; i++) {
            double da = bins[i] - meanA;
            double db = other.bins[i] - meanB;
            cov += da * db;
            varA += da * da;
            varB += db * db;
        }
        double denominator = Math.sqrt(varA * varB);
        return denominator > 0 ? cov / denominator : 1.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PerceptualHistogram)) return false;
        return Arrays.equals(bins, ((PerceptualHistogram) o).bins);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bins);
    }
}
