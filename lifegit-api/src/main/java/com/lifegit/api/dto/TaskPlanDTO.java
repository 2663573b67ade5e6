package com.lifegit.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务计划 DTO，tasks 按 orderIndex 升序。
 */
@Data
public class TaskPlanDTO {

    private Long planId;
    private Long branchId;
    private String totalDuration;
    private Boolean aiGenerated;
    private Integer totalTasks;
    private Integer completedTasks;
    private Double progress;
    private Integer remainingDuration;
    private LocalDateTime createdAt;
    private LocalDateTime lastModifiedAt;
    private List<TaskItemDTO> tasks;
}
