package com.lifegit.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 目标分支 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BranchPO {

    private Long id;
    private String name;
    private String description;
    private String status;
    private Double progress;
    private LocalDate expectedCompletionDate;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
    private LocalDateTime abandonedAt;
    private LocalDateTime mergedAt;
}
