package com.edge.equipment.core.match;

import com.edge.equipment.core.model.MatchResult;
import com.edge.equipment.core.model.ProbeIcon;
import com.edge.equipment.core.model.ReferenceTemplate;

import java.util.List;

/**
 * 将一个探针与整个模板目录比对，返回恰好一条结果
 * <p>
 * 实现不得修改或释放模板像素
 */
public interface IconMatcher {

    MatchStrategy strategy();

    /**
     * @param diagnostics 为 true 时结果中附带所有模板的评分
     */
    MatchResult match(ProbeIcon probe, List<ReferenceTemplate> catalog, boolean diagnostics);
}
