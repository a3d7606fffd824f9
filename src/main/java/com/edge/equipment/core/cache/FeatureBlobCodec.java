package com.edge.equipment.core.cache;

import com.edge.equipment.core.feature.DescriptorSet;
import org.opencv.core.KeyPoint;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.time.Instant;

/**
 * 缓存 blob 的二进制格式
 * <pre>
 * int     magic ("EQFC")
 * int     version
 * UTF     contentHash
 * long    cachedAt (epoch millis)
 * int     histogram length, float[] bins
 * boolean hasDescriptors
 *   int   keypoint count, 每个: x, y, size, angle, response (float), octave, classId (int)
 *   int   rows, cols, type, byte length, byte[] data
 * </pre>
 */
public final class FeatureBlobCodec {

    static final int MAGIC = 0x45514643;
    static final int VERSION = 1;

    private FeatureBlobCodec() {
    }

    public static byte[] encode(FeatureCacheEntry entry) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);
            out.writeUTF(entry.getContentHash());
            out.writeLong(entry.getCachedAt().toEpochMilli());

            float[] bins = entry.getHistogram().getBins();
            out.writeInt(bins.length);
            for (float bin : bins) {
                out.writeFloat(bin);
            }

            DescriptorSet descriptors = entry.getDescriptorSet();
            out.writeBoolean(descriptors != null);
            if (descriptors != null) {
                KeyPoint[] keyPoints = descriptors.getKeyPoints();
                out.writeInt(keyPoints.length);
                for (KeyPoint kp : keyPoints) {
                    out.writeFloat((float) kp.pt.x);
                    out.writeFloat((float) kp.pt.y);
                    out.writeFloat(kp.size);
                    out.writeFloat(kp.angle);
                    out.writeFloat(kp.response);
                    out.writeInt(kp.octave);
                    out.writeInt(kp.class_id);
                }
                out.writeInt(descriptors.getRows());
                out.writeInt(descriptors.getCols());
                out.writeInt(descriptors.getType());
                byte[] data = descriptors.getDescriptorData();
                out.writeInt(data.length);
                out.write(data);
            }
        }
        return bytes.toByteArray();
    }

    /**
     * @throws IOException 魔数、版本不符或数据被截断
     */
    public static FeatureCacheEntry decode(byte[] blob) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(blob))) {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new IOException("Not a feature cache blob (magic=" + Integer.toHexString(magic) + ")");
            }
            int version = in.readInt();
            if (version != VERSION) {
                throw new IOException("Unsupported feature cache blob version: " + version);
            }

            String contentHash = in.readUTF();
            Instant cachedAt = Instant.ofEpochMilli(in.readLong());

            int binCount = in.readInt();
            if (binCount != PerceptualHistogram.LENGTH) {
                throw new IOException("Unexpected histogram length: " + binCount);
            }
            float[] bins = new float[binCount];
            for (int i = 0; i < binCount; i++) {
                bins[i] = in.readFloat();
            }

            DescriptorSet descriptors = null;
            if (in.readBoolean()) {
                int count = in.readInt();
                if (count < 0) {
                    throw new IOException("Negative keypoint count: " + count);
                }
                KeyPoint[] keyPoints = new KeyPoint[count];
                for (int i = 0; i < count; i++) {
                    float x = in.readFloat();
                    float y = in.readFloat();
                    float size = in.readFloat();
                    float angle = in.readFloat();
                    float response = in.readFloat();
                    int octave = in.readInt();
                    int classId = in.readInt();
                    keyPoints[i] = new KeyPoint(x, y, size, angle, response, octave, classId);
                }
                int rows = in.readInt();
                int cols = in.readInt();
                int type = in.readInt();
                int length = in.readInt();
                if (length < 0 || length > blob.length) {
                    throw new IOException("Corrupt descriptor length: " + length);
                }
                byte[] data = new byte[length];
                in.readFully(data);
                descriptors = new DescriptorSet(keyPoints, data, rows, cols, type);
            }

            return new FeatureCacheEntry(contentHash, cachedAt, new PerceptualHistogram(bins), descriptors);
        }
    }
}
