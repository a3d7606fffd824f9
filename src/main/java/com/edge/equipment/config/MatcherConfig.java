package com.edge.equipment.config;

import com.edge.equipment.core.cache.HistogramExtractor;
import com.edge.equipment.core.cache.TemplateCache;
import com.edge.equipment.core.feature.DescriptorExtractor;
import com.edge.equipment.core.mask.BackgroundColorFamily;
import com.edge.equipment.core.mask.CircularRoi;
import com.edge.equipment.core.mask.ForegroundMaskGenerator;
import com.edge.equipment.core.match.ColorVerifier;
import com.edge.equipment.core.match.CompositeScorer;
import com.edge.equipment.core.match.DescriptorGeometricMatcher;
import com.edge.equipment.core.match.PatternColorMatcher;
import com.edge.equipment.core.match.PatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * 匹配引擎配置
 * <p>
 * 从 application.yml 读取参数并构建各个引擎组件
 */
@Configuration
public class MatcherConfig {
    private static final Logger logger = LoggerFactory.getLogger(MatcherConfig.class);

    static {
        // 以测试或其他入口启动上下文时同样需要 native 库
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public ForegroundMaskGenerator foregroundMaskGenerator() {
        YamlConfig.MaskConfig maskConfig = yamlConfig.getMask();

        List<BackgroundColorFamily> families = new ArrayList<>();
        for (YamlConfig.ColorFamilyConfig family : maskConfig.getBackgroundFamilies()) {
            families.add(new BackgroundColorFamily(family.getName(), family.getBgr(), family.getTolerance()));
        }
        CircularRoi roi = maskConfig.isRoiEnabled() ? new CircularRoi(maskConfig.getRoiRadiusRatio()) : null;

        logger.info("ForegroundMaskGenerator 配置: families={}, roi={}, minForegroundRatio={}",
            families, roi, maskConfig.getMinForegroundRatio());
        return new ForegroundMaskGenerator(families, roi, maskConfig.getMinForegroundRatio());
    }

    @Bean
    public HistogramExtractor histogramExtractor() {
        return new HistogramExtractor();
    }

    @Bean
    public DescriptorExtractor descriptorExtractor() {
        YamlConfig.DescriptorConfig descriptorConfig = yamlConfig.getDescriptor();
        return new DescriptorExtractor(descriptorConfig.getMaxFeatures(), descriptorConfig.getStandardSize());
    }

    @Bean
    public TemplateCache templateCache(HistogramExtractor histogramExtractor, DescriptorExtractor descriptorExtractor) {
        String directory = yamlConfig.getCache().getDirectory();
        logger.info("TemplateCache 配置: directory={}", directory);
        return new TemplateCache(Paths.get(directory), histogramExtractor, descriptorExtractor);
    }

    @Bean
    public PatternMatcher patternMatcher() {
        return new PatternMatcher();
    }

    @Bean
    public ColorVerifier colorVerifier(ForegroundMaskGenerator foregroundMaskGenerator) {
        YamlConfig.MatchingConfig matchingConfig = yamlConfig.getMatching();
        return new ColorVerifier(foregroundMaskGenerator, matchingConfig.getComparisonSize(),
            matchingConfig.getMaxColorDistance());
    }

    @Bean
    public CompositeScorer compositeScorer() {
        YamlConfig.MatchingConfig matchingConfig = yamlConfig.getMatching();
        if (Math.abs(matchingConfig.getPatternWeight() + matchingConfig.getColorWeight() - 1.0) > 1e-6) {
            logger.warn("Pattern weight {} + color weight {} != 1, composite scores exceed the 0-100 range",
                matchingConfig.getPatternWeight(), matchingConfig.getColorWeight());
        }

        logger.info("CompositeScorer 配置: patternThreshold={}, weights={}/{}, acceptThreshold={}, lowScorePenalty={}",
            matchingConfig.getPatternThreshold(), matchingConfig.getPatternWeight(), matchingConfig.getColorWeight(),
            matchingConfig.getAcceptThreshold(), matchingConfig.isLowScorePenalty());
        return new CompositeScorer(matchingConfig.getPatternThreshold(), matchingConfig.getPatternWeight(),
            matchingConfig.getColorWeight(), matchingConfig.getAcceptThreshold(), matchingConfig.isLowScorePenalty());
    }

    @Bean
    public PatternColorMatcher patternColorMatcher(PatternMatcher patternMatcher, ColorVerifier colorVerifier,
                                                   CompositeScorer compositeScorer,
                                                   HistogramExtractor histogramExtractor) {
        return new PatternColorMatcher(patternMatcher, colorVerifier, compositeScorer, histogramExtractor);
    }

    @Bean
    public DescriptorGeometricMatcher descriptorGeometricMatcher(DescriptorExtractor descriptorExtractor,
                                                                 TemplateCache templateCache) {
        YamlConfig.DescriptorConfig descriptorConfig = yamlConfig.getDescriptor();

        logger.info("DescriptorGeometricMatcher 配置: maxFeatures={}, minKeypoints={}, ratio={}, minMatches={}, "
                + "minInliers={}, ransac={}, validConfidence={}",
            descriptorConfig.getMaxFeatures(), descriptorConfig.getMinKeypoints(), descriptorConfig.getRatioThreshold(),
            descriptorConfig.getMinGoodMatches(), descriptorConfig.getMinInliers(),
            descriptorConfig.getRansacThreshold(), descriptorConfig.getValidConfidence());
        return new DescriptorGeometricMatcher(descriptorExtractor, templateCache,
            descriptorConfig.getMinKeypoints(), descriptorConfig.getRatioThreshold(),
            descriptorConfig.getMinGoodMatches(), descriptorConfig.getMinInliers(),
            descriptorConfig.getRansacThreshold(), descriptorConfig.getValidConfidence());
    }
}
