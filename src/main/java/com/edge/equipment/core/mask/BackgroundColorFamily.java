package com.edge.equipment.core.mask;

import org.opencv.core.Scalar;

import java.util.Arrays;

/**
 * 背景色族：BGR 参考色 + 每通道独立容差
 * <p>
 * 落在 [color - tolerance, color + tolerance] 内的像素视为背景
 */
public class BackgroundColorFamily {
    private final String name;
    private final int[] bgr;
    private final int[] tolerance;

    public BackgroundColorFamily(String name, int[] bgr, int[] tolerance) {
        if (bgr == null || bgr.length != 3 || tolerance == null || tolerance.length != 3) {
            throw new IllegalArgumentException("Background family '" + name + "' needs 3 BGR values and 3 tolerances");
        }
        this.name = name;
        this.bgr = bgr.clone();
        this.tolerance = tolerance.clone();
    }

    /**
     * 三通道使用同一容差
     */
    public static BackgroundColorFamily of(String name, int b, int g, int r, int tolerance) {
        return new BackgroundColorFamily(name, new int[]{b, g, r}, new int[]{tolerance, tolerance, tolerance});
    }

    public Scalar lowerBound() {
        return new Scalar(clamp(bgr[0] - tolerance[0]), clamp(bgr[1] - tolerance[1]), clamp(bgr[2] - tolerance[2]));
    }

    public Scalar upperBound() {
        return new Scalar(clamp(bgr[0] + tolerance[0]), clamp(bgr[1] + tolerance[1]), clamp(bgr[2] + tolerance[2]));
    }

    private static int clamp(int value) {
        return Math.max(0, Math.min(255, value));
    }

    public String getName() { return name; }

    public int[] getBgr() { return bgr.clone(); }

    public int[] getTolerance() { return tolerance.clone(); }

    @Override
    public String toString() {
        return name + Arrays.toString(bgr) + "±" + Arrays.toString(tolerance);
    }
}
