package com.edge.equipment.util;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 图片读取工具
 * <p>
 * 统一输出 8 位 BGR 三通道；带透明通道的 PNG 按 alpha 合成到白底上
 */
public final class ImageLoader {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "webp", "bmp");

    private ImageLoader() {
    }

    public static boolean isSupportedImage(Path path) {
        String extension = extensionOf(path.getFileName().toString());
        return SUPPORTED_EXTENSIONS.contains(extension);
    }

    /**
     * 文件名去掉扩展名，作为模板 / 探针 ID
     */
    public static String idOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public static byte[] readBytes(Path path) throws ImageDecodeException {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ImageDecodeException("Cannot read image file: " + path, e);
        }
    }

    public static Mat read(Path path) throws ImageDecodeException {
        return decode(readBytes(path), path.toString());
    }

    /**
     * 从内存字节解码
     *
     * @param bytes  图片文件内容
     * @param source 用于错误信息的来源描述
     */
    public static Mat decode(byte[] bytes, String source) throws ImageDecodeException {
        if (bytes == null || bytes.length == 0) {
            throw new ImageDecodeException("Empty image data: " + source);
        }

        MatOfByte buffer = new MatOfByte(bytes);
        Mat raw;
        try {
            raw = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_UNCHANGED);
        } finally {
            buffer.release();
        }
        if (raw == null || raw.empty()) {
            throw new ImageDecodeException("Cannot decode image: " + source);
        }

        try {
            return toBgr8(raw);
        } finally {
            raw.release();
        }
    }

    private static Mat toBgr8(Mat raw) {
        Mat eightBit = raw;
        if (raw.depth() != CvType.CV_8U) {
            // 16 位 PNG 等
            eightBit = new Mat();
            raw.convertTo(eightBit, CvType.CV_8U, raw.depth() == CvType.CV_16U ? 1.0 / 257.0 : 1.0);
        }

        Mat bgr = new Mat();
        try {
            switch (eightBit.channels()) {
                case 1 -> Imgproc.cvtColor(eightBit, bgr, Imgproc.COLOR_GRAY2BGR);
                case 4 -> flattenAlpha(eightBit, bgr);
                default -> eightBit.copyTo(bgr);
            }
        } finally {
            if (eightBit != raw) {
                eightBit.release();
            }
        }
        return bgr;
    }

    /**
     * result = bgr * alpha + 255 * (1 - alpha)
     */
    private static void flattenAlpha(Mat bgra, Mat dst) {
        List<Mat> channels = new ArrayList<>();
        Core.split(bgra, channels);
        Mat alpha = new Mat();
        Mat inverse = new Mat();
        Mat color = new Mat();
        Mat alpha3 = new Mat();
        Mat inverse3 = new Mat();
        try {
            channels.get(3).convertTo(alpha, CvType.CV_32F, 1.0 / 255.0);
            Core.subtract(Mat.ones(alpha.size(), CvType.CV_32F), alpha, inverse);
            Core.merge(List.of(alpha, alpha, alpha), alpha3);
            Core.merge(List.of(inverse, inverse, inverse), inverse3);

            Core.merge(channels.subList(0, 3), color);
            color.convertTo(color, CvType.CV_32FC3);
            Core.multiply(color, alpha3, color);
            Core.multiply(inverse3, new Scalar(255, 255, 255), inverse3);
            Core.add(color, inverse3, color);
            color.convertTo(dst, CvType.CV_8UC3);
        } finally {
            channels.forEach(Mat::release);
            alpha.release();
            inverse.release();
            color.release();
            alpha3.release();
            inverse3.release();
        }
    }

    private static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
