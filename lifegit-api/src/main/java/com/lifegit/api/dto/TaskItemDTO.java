package com.lifegit.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 任务项 DTO。
 */
@Data
public class TaskItemDTO {

    private Long taskId;
    private Long planId;
    private String title;
    private String description;
    private Integer estimatedDuration;
    private String timeScope;
    private Integer orderIndex;
    private Boolean completed;
    private LocalDateTime completedAt;
    private Boolean aiGenerated;
    private String executionTips;
    private LocalDateTime createdAt;
    private LocalDateTime lastModifiedAt;
}
