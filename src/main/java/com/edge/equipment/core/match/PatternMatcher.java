package com.edge.equipment.core.match;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 图案匹配：灰度 TM_CCOEFF_NORMED，取峰值映射到 0–100
 * <p>
 * 模板比探针大时等比缩小（INTER_AREA）到能放进探针，探针本身从不缩放。
 * 任意一侧为空或方差为 0 时直接返回 0
 */
public class PatternMatcher {
    private static final Logger logger = LoggerFactory.getLogger(PatternMatcher.class);

    private static final double MIN_STD_DEV = 1e-6;

    public double matchPattern(Mat probe, Mat template) {
        if (probe == null || template == null || probe.empty() || template.empty()) {
            return 0.0;
        }

        Mat probeGray = toGray(probe);
        Mat templateGray = toGray(template);
        Mat result = new Mat();
        try {
            if (templateGray.cols() > probeGray.cols() || templateGray.rows() > probeGray.rows()) {
                Mat scaled = fitInside(templateGray, probeGray.cols(), probeGray.rows());
                templateGray.release();
                templateGray = scaled;
            }

            if (isFlat(probeGray) || isFlat(templateGray)) {
                return 0.0;
            }

            Imgproc.matchTemplate(probeGray, templateGray, result, Imgproc.TM_CCOEFF_NORMED);
            Core.patchNaNs(result, 0.0);
            double peak = Core.minMaxLoc(result).maxVal;

            return Math.max(0.0, Math.min(1.0, peak)) * 100.0;
        } finally {
            probeGray.release();
            templateGray.release();
            result.release();
        }
    }

    private Mat fitInside(Mat template, int maxWidth, int maxHeight) {
        double scale = Math.min((double) maxWidth / template.cols(), (double) maxHeight / template.rows());
        int width = Math.max(1, Math.min(maxWidth, (int) Math.floor(template.cols() * scale)));
        int height = Math.max(1, Math.min(maxHeight, (int) Math.floor(template.rows() * scale)));
        logger.debug("Downscaling template {}x{} -> {}x{} to fit probe", template.cols(), template.rows(), width, height);

        Mat scaled = new Mat();
        Imgproc.resize(template, scaled, new Size(width, height), 0, 0, Imgproc.INTER_AREA);
        return scaled;
    }

    private static boolean isFlat(Mat gray) {
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stdDev = new MatOfDouble();
        try {
            Core.meanStdDev(gray, mean, stdDev);
            return stdDev.toArray()[0] < MIN_STD_DEV;
        } finally {
            mean.release();
            stdDev.release();
        }
    }

    private static Mat toGray(Mat image) {
        Mat gray = new Mat();
        switch (image.channels()) {
            case 1 -> image.copyTo(gray);
            case 4 -> Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
            default -> Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        }
        return gray;
    }
}
