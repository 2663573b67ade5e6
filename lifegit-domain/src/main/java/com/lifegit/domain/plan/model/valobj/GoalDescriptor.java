package com.lifegit.domain.plan.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 计划生成输入：目标标题、描述与可选的时间预期。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalDescriptor {

    private String title;

    private String description;

    /**
     * 预期完成时间提示，如 "3个月"
     */
    private String timeframe;
}
