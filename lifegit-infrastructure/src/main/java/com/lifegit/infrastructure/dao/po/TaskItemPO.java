package com.lifegit.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 任务项 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskItemPO {

    private Long id;
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
