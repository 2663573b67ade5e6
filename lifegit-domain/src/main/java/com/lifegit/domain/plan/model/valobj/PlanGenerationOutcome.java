package com.lifegit.domain.plan.model.valobj;

import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 带失败策略的计划生成结果。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanGenerationOutcome {

    /**
     * 生成的计划，兜底时为手动计划
     */
    private TaskPlanEntity plan;

    /**
     * 实际调用生成器的次数
     */
    private int attempts;

    /**
     * 每次重试前的等待时长
     */
    @Builder.Default
    private List<Duration> delays = new ArrayList<>();

    private boolean fallbackUsed;

    /**
     * 触发兜底的失败分类 (可空)
     */
    private AIServiceErrorCategoryEnum fallbackReason;

    private String lastErrorMessage;
}
