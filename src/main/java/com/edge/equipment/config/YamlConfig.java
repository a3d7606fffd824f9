package com.edge.equipment.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "equipment-matcher")
public class YamlConfig {
    private CatalogConfig catalog = new CatalogConfig();
    private CacheConfig cache = new CacheConfig();
    private MaskConfig mask = new MaskConfig();
    private MatchingConfig matching = new MatchingConfig();
    private DescriptorConfig descriptor = new DescriptorConfig();

    @Data
    public static class CatalogConfig {
        // 基准装备图目录，文件名（去扩展名）即模板ID
        private String directory = "images/base_equipment";
    }

    @Data
    public static class CacheConfig {
        private String directory = "images/cache";
        // 启动后自动构建缓存
        private boolean autoBuild = false;
        private boolean forceRecompute = false;
    }

    @Data
    public static class MaskConfig {
        // 背景色族（BGR）及各通道容差
        private List<ColorFamilyConfig> backgroundFamilies = defaultFamilies();
        private boolean roiEnabled = true;
        // 圆形 ROI 半径 / 较短边，最终会被限制到较短边的一半
        private double roiRadiusRatio = 0.475;
        // 前景占比低于该值视为低置信度
        private double minForegroundRatio = 0.05;

        private static List<ColorFamilyConfig> defaultFamilies() {
            List<ColorFamilyConfig> families = new ArrayList<>();
            families.add(new ColorFamilyConfig("dark-purple", new int[]{46, 33, 46}, new int[]{20, 20, 20}));
            families.add(new ColorFamilyConfig("light-lavender", new int[]{244, 245, 244}, new int[]{3, 5, 3}));
            families.add(new ColorFamilyConfig("muted-purple", new int[]{79, 53, 103}, new int[]{50, 50, 50}));
            return families;
        }
    }

    @Data
    public static class ColorFamilyConfig {
        private String name;
        private int[] bgr;
        private int[] tolerance;

        public ColorFamilyConfig() {
        }

        public ColorFamilyConfig(String name, int[] bgr, int[] tolerance) {
            this.name = name;
            this.bgr = bgr;
            this.tolerance = tolerance;
        }
    }

    @Data
    public static class MatchingConfig {
        private double patternThreshold = 70.0;
        private double patternWeight = 0.65;
        private double colorWeight = 0.35;
        // 下游接受阈值（综合得分）
        private double acceptThreshold = 60.0;
        private double maxColorDistance = 300.0;
        // 颜色比对前统一缩放到的边长
        private int comparisonSize = 116;
        // 批量匹配线程数，<=0 时使用 CPU 核数
        private int parallelism = 0;
        // 低分降权（默认关闭）
        private boolean lowScorePenalty = false;
    }

    @Data
    public static class DescriptorConfig {
        private int maxFeatures = 1000;
        private int standardSize = 116;
        private int minKeypoints = 10;
        private float ratioThreshold = 0.75f;
        private int minGoodMatches = 10;
        private int minInliers = 8;
        private double ransacThreshold = 5.0;
        private double validConfidence = 60.0;
    }
}
