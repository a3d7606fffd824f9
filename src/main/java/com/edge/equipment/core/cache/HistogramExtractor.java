package com.edge.equipment.core.cache;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.MatOfFloat;
import org.opencv.core.MatOfInt;
import org.opencv.imgproc.Imgproc;

import java.util.List;

/**
 * 计算整幅图像的 LAB 感知直方图
 */
public class HistogramExtractor {

    public PerceptualHistogram extract(Mat bgr) {
        if (bgr == null || bgr.empty()) {
            throw new IllegalArgumentException("Cannot compute histogram of an empty image");
        }

        Mat lab = new Mat();
        Mat hist = new Mat();
        float[] bins = new float[PerceptualHistogram.LENGTH];
        try {
            Imgproc.cvtColor(bgr, lab, Imgproc.COLOR_BGR2Lab);
            for (int channel = 0; channel < PerceptualHistogram.CHANNELS; channel++) {
                Imgproc.calcHist(List.of(lab), new MatOfInt(channel), new Mat(), hist,
                    new MatOfInt(PerceptualHistogram.BINS_PER_CHANNEL), new MatOfFloat(0f, 256f));
                Core.normalize(hist, hist, 1.0, 0.0, Core.NORM_L1);

                float[] channelBins = new float[PerceptualHistogram.BINS_PER_CHANNEL];
                hist.get(0, 0, channelBins);
                System.arraycopy(channelBins, 0, bins, channel * PerceptualHistogram.BINS_PER_CHANNEL,
                    PerceptualHistogram.BINS_PER_CHANNEL);
            }
            return new PerceptualHistogram(bins);
        } finally {
            lab.release();
            hist.release();
        }
    }
}
