package com.lifegit.api.dto;

import lombok.Data;

/**
 * 分支统计 DTO，时长单位为分钟。
 */
@Data
public class BranchStatisticsDTO {

    private Long branchId;
    private Long commitCount;
    private Integer totalTasks;
    private Integer completedTasks;
    private Double progress;
    private Integer totalEstimatedDuration;
    private Integer completedDuration;
    private Integer remainingEstimatedDuration;
}
