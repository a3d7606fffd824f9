package com.edge.equipment.core.match;

/**
 * 匹配策略枚举
 */
public enum MatchStrategy {
    /**
     * 图案 + 颜色两阶段评分
     * 优点：对同形不同色的装备区分度高，速度快
     * 缺点：依赖背景色配置，探针与模板尺度差异过大时图案得分下降
     */
    PATTERN_COLOR,

    /**
     * ORB 描述子 + RANSAC 单应性校验
     * 优点：对平移、旋转、缩放有一定容忍度
     * 缺点：小图标纹理少时关键点不足，直接判定失败
     * 适用场景：作为图案匹配的回退路径
     */
    DESCRIPTOR_GEOMETRIC
}
