package com.lifegit.domain.plan.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 模型返回的原始计划结构，未经校验。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AIGeneratedTaskPlan {

    private String totalDuration;

    private List<AIGeneratedTask> tasks;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AIGeneratedTask {

        private String title;

        private String description;

        /**
         * 原始取值，未识别时按 daily 处理
         */
        private String timeScope;

        private Integer estimatedDuration;

        private Integer orderIndex;

        private String executionTips;
    }
}
