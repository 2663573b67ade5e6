package com.lifegit.api.dto;

import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 目标分支 DTO。
 */
@Data
public class BranchDTO {

    private Long branchId;
    private String name;
    private String description;
    private String status;
    private Double progress;
    private Boolean master;
    private Boolean merged;
    private Boolean hasPlan;
    private LocalDate expectedCompletionDate;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
    private LocalDateTime abandonedAt;
    private LocalDateTime mergedAt;
}
