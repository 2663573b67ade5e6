package com.lifegit.domain.branch.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 分支统计。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchStatistics {

    private Long branchId;

    /**
     * 提交数
     */
    private Long commitCount;

    /**
     * 任务总数
     */
    private Integer totalTasks;

    /**
     * 已完成任务数
     */
    private Integer completedTasks;

    /**
     * 完成比例 [0, 1]
     */
    private Double progress;

    /**
     * 预计总时长（分钟）
     */
    private Integer totalEstimatedDuration;

    /**
     * 已完成任务时长（分钟）
     */
    private Integer completedDuration;

    /**
     * 剩余预计时长（分钟）
     */
    private Integer remainingEstimatedDuration;
}
