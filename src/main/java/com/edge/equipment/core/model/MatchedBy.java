package com.edge.equipment.core.model;

/**
 * 最终结果由哪条路径产生
 */
public enum MatchedBy {
    /** 没有候选通过图案阈值，直接取图案得分最高者 */
    PATTERN_ONLY,
    /** 图案初筛 + 颜色复核 */
    PATTERN_AND_COLOR,
    /** ORB 描述子 + 单应性校验 */
    DESCRIPTOR_GEOMETRIC
}
