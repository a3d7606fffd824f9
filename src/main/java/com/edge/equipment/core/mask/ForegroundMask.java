package com.edge.equipment.core.mask;

import org.opencv.core.Mat;

/**
 * 前景掩码（CV_8UC1，前景 255 / 背景 0）
 */
public class ForegroundMask {
    private final Mat mask;
    private final double foregroundRatio;
    private final boolean lowConfidence;

    public ForegroundMask(Mat mask, double foregroundRatio, boolean lowConfidence) {
        this.mask = mask;
        this.foregroundRatio = foregroundRatio;
        this.lowConfidence = lowConfidence;
    }

    public Mat getMask() { return mask; }

    public double getForegroundRatio() { return foregroundRatio; }

    public boolean isLowConfidence() { return lowConfidence; }

    public void release() {
        mask.release();
    }
}
