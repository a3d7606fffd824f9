package com.edge.equipment.core.mask;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 前景掩码生成器
 * <p>
 * 处理流程：
 * 1. 逐个背景色族做 inRange，合并为背景掩码，取反得到前景
 * 2. 可选：与圆形 ROI 相交，圆外一律置 0
 * 3. 3×3 矩形核先闭运算再开运算，去掉细小噪点
 * 4. 高斯模糊（σ=0.5）后在中值 127 处重新二值化
 * <p>
 * 纯函数，同一输入多次调用得到完全相同的掩码
 */
public class ForegroundMaskGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ForegroundMaskGenerator.class);

    private static final double BLUR_SIGMA = 0.5;
    private static final double BINARIZE_THRESHOLD = 127;

    private final List<BackgroundColorFamily> defaultFamilies;
    private final CircularRoi defaultRoi;
    private final double minForegroundRatio;

    public ForegroundMaskGenerator(List<BackgroundColorFamily> defaultFamilies, CircularRoi defaultRoi,
                                   double minForegroundRatio) {
        this.defaultFamilies = List.copyOf(defaultFamilies);
        this.defaultRoi = defaultRoi;
        this.minForegroundRatio = minForegroundRatio;
    }

    /**
     * 使用配置的背景色族和 ROI
     */
    public ForegroundMask computeForegroundMask(Mat image) {
        return computeForegroundMask(image, defaultFamilies, defaultRoi);
    }

    /**
     * @param image    BGR 图像（灰度或 BGRA 会先转换为 BGR）
     * @param families 背景色族，容差随色族携带
     * @param roi      圆形 ROI，为 null 时不裁剪
     */
    public ForegroundMask computeForegroundMask(Mat image, List<BackgroundColorFamily> families, CircularRoi roi) {
        if (image == null || image.empty()) {
            throw new IllegalArgumentException("Cannot compute foreground mask of an empty image");
        }

        Mat bgr = toBgr(image);
        Mat background = Mat.zeros(bgr.size(), CvType.CV_8UC1);
        Mat band = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(3, 3));
        Mat mask = new Mat();
        try {
            for (BackgroundColorFamily family : families) {
                Core.inRange(bgr, family.lowerBound(), family.upperBound(), band);
                Core.bitwise_or(background, band, background);
            }
            Core.bitwise_not(background, mask);

            if (roi != null) {
                applyCircularRoi(mask, roi);
            }

            Imgproc.morphologyEx(mask, mask, Imgproc.MORPH_CLOSE, kernel);
            Imgproc.morphologyEx(mask, mask, Imgproc.MORPH_OPEN, kernel);

            Imgproc.GaussianBlur(mask, mask, new Size(3, 3), BLUR_SIGMA);
            Imgproc.threshold(mask, mask, BINARIZE_THRESHOLD, 255, Imgproc.THRESH_BINARY);

            double ratio = (double) Core.countNonZero(mask) / mask.total();
            boolean lowConfidence = ratio < minForegroundRatio;
            if (lowConfidence) {
                logger.warn("Foreground ratio {} below {}, mask flagged low-confidence ({}x{})",
                    String.format("%.4f", ratio), minForegroundRatio, mask.cols(), mask.rows());
            }
            return new ForegroundMask(mask, ratio, lowConfidence);
        } finally {
            if (bgr != image) {
                bgr.release();
            }
            background.release();
            band.release();
            kernel.release();
        }
    }

    /**
     * 两个同尺寸掩码的交集
     */
    public ForegroundMask intersect(ForegroundMask first, ForegroundMask second) {
        Mat shared = new Mat();
        Core.bitwise_and(first.getMask(), second.getMask(), shared);
        double ratio = (double) Core.countNonZero(shared) / shared.total();
        return new ForegroundMask(shared, ratio, ratio < minForegroundRatio);
    }

    private void applyCircularRoi(Mat mask, CircularRoi roi) {
        Mat circle = Mat.zeros(mask.size(), CvType.CV_8UC1);
        try {
            Point center = new Point(mask.cols() / 2, mask.rows() / 2);
            int radius = roi.radiusFor(mask.cols(), mask.rows());
            Imgproc.circle(circle, center, radius, new Scalar(255), -1);
            Core.bitwise_and(mask, circle, mask);
        } finally {
            circle.release();
        }
    }

    static Mat toBgr(Mat image) {
        if (image.channels() == 3) {
            return image;
        }
        Mat bgr = new Mat();
        if (image.channels() == 1) {
            Imgproc.cvtColor(image, bgr, Imgproc.COLOR_GRAY2BGR);
        } else {
            Imgproc.cvtColor(image, bgr, Imgproc.COLOR_BGRA2BGR);
        }
        return bgr;
    }

    public List<BackgroundColorFamily> getDefaultFamilies() { return defaultFamilies; }

    public CircularRoi getDefaultRoi() { return defaultRoi; }

    public double getMinForegroundRatio() { return minForegroundRatio; }
}
