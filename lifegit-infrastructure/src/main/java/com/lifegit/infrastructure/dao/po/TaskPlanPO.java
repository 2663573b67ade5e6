package com.lifegit.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 任务计划 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPlanPO {

    private Long id;
    private Long branchId;
    private String totalDuration;
    private Boolean aiGenerated;
    private LocalDateTime createdAt;
    private LocalDateTime lastModifiedAt;
}
