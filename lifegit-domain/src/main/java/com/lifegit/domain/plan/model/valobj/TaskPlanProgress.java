package com.lifegit.domain.plan.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 计划进度汇总。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPlanProgress {

    private Integer totalTasks;

    private Integer completedTasks;

    private Double progress;

    private Integer totalDuration;

    private Integer completedDuration;

    private Integer remainingDuration;
}
