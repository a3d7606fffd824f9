package com.edge.equipment.core.feature;

import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.Size;
import org.opencv.features2d.ORB;
import org.opencv.imgproc.Imgproc;

/**
 * ORB 特征提取
 * <p>
 * 预处理：灰度 → 缩放到标准尺寸 → 直方图均衡 → 3×3 高斯模糊
 */
public class DescriptorExtractor {

    // 图标很小，边界阈值和金字塔比例都要比默认值小
    private static final float SCALE_FACTOR = 1.1f;
    private static final int LEVELS = 8;
    private static final int EDGE_THRESHOLD = 15;
    private static final int PATCH_SIZE = 31;
    private static final int FAST_THRESHOLD = 20;

    private final int maxFeatures;
    private final int standardSize;

    public DescriptorExtractor(int maxFeatures, int standardSize) {
        this.maxFeatures = maxFeatures;
        this.standardSize = standardSize;
    }

    public DescriptorSet extract(Mat image) {
        Mat prepared = preprocess(image);
        MatOfKeyPoint keyPoints = new MatOfKeyPoint();
        Mat descriptors = new Mat();
        try {
            // ORB 实例非线程安全，每次调用单独创建
            ORB orb = ORB.create(maxFeatures, SCALE_FACTOR, LEVELS, EDGE_THRESHOLD, 0, 2,
                ORB.HARRIS_SCORE, PATCH_SIZE, FAST_THRESHOLD);
            orb.detectAndCompute(prepared, new Mat(), keyPoints, descriptors);
            return DescriptorSet.from(keyPoints, descriptors);
        } finally {
            prepared.release();
            keyPoints.release();
            descriptors.release();
        }
    }

    Mat preprocess(Mat image) {
        Mat gray = new Mat();
        if (image.channels() == 1) {
            image.copyTo(gray);
        } else if (image.channels() == 4) {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGRA2GRAY);
        } else {
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        }

        Imgproc.resize(gray, gray, new Size(standardSize, standardSize), 0, 0, Imgproc.INTER_AREA);
        Imgproc.equalizeHist(gray, gray);
        Imgproc.GaussianBlur(gray, gray, new Size(3, 3), 0);
        return gray;
    }

    public int getMaxFeatures() { return maxFeatures; }

    public int getStandardSize() { return standardSize; }
}
