package com.edge.equipment.core.mask;

/**
 * 以图像中心为圆心的圆形感兴趣区域
 * <p>
 * 半径 = radiusRatio × 较短边，并限制在较短边的一半以内
 */
public class CircularRoi {
    private final double radiusRatio;

    public CircularRoi(double radiusRatio) {
        if (radiusRatio <= 0) {
            throw new IllegalArgumentException("ROI radius ratio must be positive: " + radiusRatio);
        }
        this.radiusRatio = radiusRatio;
    }

    public int radiusFor(int width, int height) {
        int shorter = Math.min(width, height);
        double radius = Math.min(radiusRatio * shorter, shorter / 2.0);
        return (int) Math.round(radius);
    }

    public double getRadiusRatio() { return radiusRatio; }

    @Override
    public String toString() {
        return "CircularRoi{ratio=" + radiusRatio + "}";
    }
}
