package com.edge.equipment.core.match;

import com.edge.equipment.core.mask.ForegroundMask;
import com.edge.equipment.core.mask.ForegroundMaskGenerator;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfFloat;
import org.opencv.core.MatOfInt;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * 颜色复核
 * <p>
 * 两张图统一缩放到比较尺寸，在共享前景内计算逐像素 LAB 欧氏距离均值，
 * similarity = max(0, 1 - mean / maxDistance)
 */
public class ColorVerifier {

    private static final int HIST_BINS = 8;

    private final ForegroundMaskGenerator maskGenerator;
    private final int comparisonSize;
    private final double maxDistance;

    public ColorVerifier(ForegroundMaskGenerator maskGenerator, int comparisonSize, double maxDistance) {
        this.maskGenerator = maskGenerator;
        this.comparisonSize = comparisonSize;
        this.maxDistance = maxDistance;
    }

    /**
     * 分别生成两张图的前景掩码，取交集后比较
     */
    public ColorVerification verify(Mat probe, Mat template) {
        Mat probeResized = resizeToComparison(probe);
        Mat templateResized = resizeToComparison(template);
        ForegroundMask probeMask = maskGenerator.computeForegroundMask(probeResized);
        ForegroundMask templateMask = maskGenerator.computeForegroundMask(templateResized);
        ForegroundMask shared = maskGenerator.intersect(probeMask, templateMask);
        try {
            return compare(probeResized, templateResized, shared.getMask());
        } finally {
            probeResized.release();
            templateResized.release();
            probeMask.release();
            templateMask.release();
            shared.release();
        }
    }

    /**
     * @param sharedMask 共享前景（CV_8UC1），尺寸不同时按最近邻缩放到比较尺寸
     */
    public ColorVerification colorSimilarity(Mat probe, Mat template, Mat sharedMask) {
        Mat probeResized = resizeToComparison(probe);
        Mat templateResized = resizeToComparison(template);
        Mat mask = sharedMask;
        if (sharedMask.cols() != comparisonSize || sharedMask.rows() != comparisonSize) {
            mask = new Mat();
            Imgproc.resize(sharedMask, mask, new Size(comparisonSize, comparisonSize), 0, 0, Imgproc.INTER_NEAREST);
        }
        try {
            return compare(probeResized, templateResized, mask);
        } finally {
            probeResized.release();
            templateResized.release();
            if (mask != sharedMask) {
                mask.release();
            }
        }
    }

    private ColorVerification compare(Mat probe, Mat template, Mat mask) {
        int sharedPixels = Core.countNonZero(mask);
        double sharedRatio = (double) sharedPixels / mask.total();
        if (sharedPixels == 0) {
            return ColorVerification.noSharedForeground(maxDistance);
        }
        boolean lowConfidence = sharedRatio < maskGenerator.getMinForegroundRatio();

        Mat probeLab = new Mat();
        Mat templateLab = new Mat();
        Mat probeLabF = new Mat();
        Mat templateLabF = new Mat();
        Mat diff = new Mat();
        Mat squared = new Mat();
        Mat distance = new Mat();
        List<Mat> channels = new ArrayList<>();
        try {
            Imgproc.cvtColor(probe, probeLab, Imgproc.COLOR_BGR2Lab);
            Imgproc.cvtColor(template, templateLab, Imgproc.COLOR_BGR2Lab);
            probeLab.convertTo(probeLabF, CvType.CV_32FC3);
            templateLab.convertTo(templateLabF, CvType.CV_32FC3);

            Core.subtract(probeLabF, templateLabF, diff);
            Core.multiply(diff, diff, squared);
            Core.split(squared, channels);
            Core.add(channels.get(0), channels.get(1), distance);
            Core.add(distance, channels.get(2), distance);
            Core.sqrt(distance, distance);

            double meanDistance = Core.mean(distance, mask).val[0];
            double similarity = Math.max(0.0, 1.0 - meanDistance / maxDistance);
            double histogramSimilarity = histogramCorrelation(probeLab, templateLab, mask);

            return new ColorVerification(similarity, meanDistance, sharedRatio, histogramSimilarity, lowConfidence);
        } finally {
            probeLab.release();
            templateLab.release();
            probeLabF.release();
            templateLabF.release();
            diff.release();
            squared.release();
            distance.release();
            channels.forEach(Mat::release);
        }
    }

    /**
     * 共享前景内 8×8×8 LAB 直方图的相关系数
     */
    private double histogramCorrelation(Mat probeLab, Mat templateLab, Mat mask) {
        Mat probeHist = labHistogram(probeLab, mask);
        Mat templateHist = labHistogram(templateLab, mask);
        try {
            return Imgproc.compareHist(probeHist, templateHist, Imgproc.HISTCMP_CORREL);
        } finally {
            probeHist.release();
            templateHist.release();
        }
    }

    private static Mat labHistogram(Mat lab, Mat mask) {
        Mat hist = new Mat();
        Imgproc.calcHist(List.of(lab), new MatOfInt(0, 1, 2), mask, hist,
            new MatOfInt(HIST_BINS, HIST_BINS, HIST_BINS), new MatOfFloat(0f, 256f, 0f, 256f, 0f, 256f));
        Core.normalize(hist, hist, 0, 1, Core.NORM_MINMAX);
        return hist;
    }

    private Mat resizeToComparison(Mat image) {
        Mat bgr = new Mat();
        if (image.channels() == 1) {
            Imgproc.cvtColor(image, bgr, Imgproc.COLOR_GRAY2BGR);
        } else if (image.channels() == 4) {
            Imgproc.cvtColor(image, bgr, Imgproc.COLOR_BGRA2BGR);
        } else {
            image.copyTo(bgr);
        }
        if (bgr.cols() != comparisonSize || bgr.rows() != comparisonSize) {
            Imgproc.resize(bgr, bgr, new Size(comparisonSize, comparisonSize));
        }
        return bgr;
    }

    public int getComparisonSize() { return comparisonSize; }

    public double getMaxDistance() { return maxDistance; }
}
