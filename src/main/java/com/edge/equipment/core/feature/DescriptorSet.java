package com.edge.equipment.core.feature;

import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;

/**
 * ORB 关键点 + 描述子
 * <p>
 * 以纯 Java 数组保存，不持有 native 内存，可在线程间共享；
 * 需要参与匹配时通过 {@link #toDescriptorMat()} 生成临时 Mat，用完由调用方释放。
 * 构造和 getter 都做拷贝，缓存中的实例不会被调用方修改
 */
public class DescriptorSet {
    private static final DescriptorSet EMPTY = new DescriptorSet(new KeyPoint[0], new byte[0], 0, 0, 0);

    private final KeyPoint[] keyPoints;
    private final byte[] descriptorData;
    private final int rows;
    private final int cols;
    private final int type;

    public DescriptorSet(KeyPoint[] keyPoints, byte[] descriptorData, int rows, int cols, int type) {
        this.keyPoints = copyOf(keyPoints);
        this.descriptorData = descriptorData.clone();
        this.rows = rows;
        this.cols = cols;
        this.type = type;
    }

    public static DescriptorSet empty() {
        return EMPTY;
    }

    /**
     * 从 OpenCV 结果复制数据
     */
    public static DescriptorSet from(MatOfKeyPoint keyPoints, Mat descriptors) {
        if (descriptors == null || descriptors.empty()) {
            return empty();
        }
        Mat continuous = descriptors.isContinuous() ? descriptors : descriptors.clone();
        byte[] data = new byte[(int) (continuous.total() * continuous.elemSize())];
        continuous.get(0, 0, data);
        if (continuous != descriptors) {
            continuous.release();
        }
        return new DescriptorSet(keyPoints.toArray(), data, descriptors.rows(), descriptors.cols(), descriptors.type());
    }

    public Mat toDescriptorMat() {
        Mat mat = new Mat(rows, cols, type);
        mat.put(0, 0, descriptorData);
        return mat;
    }

    public boolean isEmpty() {
        return rows == 0;
    }

    public int keyPointCount() {
        return keyPoints.length;
    }

    public KeyPoint[] getKeyPoints() { return copyOf(keyPoints); }

    public byte[] getDescriptorData() { return descriptorData.clone(); }

    public int getRows() { return rows; }

    public int getCols() { return cols; }

    public int getType() { return type; }

    // KeyPoint 字段可变，逐个复制
    private static KeyPoint[] copyOf(KeyPoint[] source) {
        KeyPoint[] copy = new KeyPoint[source.length];
        for (int i = 0; i < source.length; i++) {
            KeyPoint kp = source[i];
            copy[i] = new KeyPoint((float) kp.pt.x, (float) kp.pt.y, kp.size, kp.angle, kp.response,
                kp.octave, kp.class_id);
        }
        return copy;
    }

    @Override
    public String toString() {
        return "DescriptorSet{keyPoints=" + keyPoints.length + ", descriptors=" + rows + "x" + cols + "}";
    }
}
