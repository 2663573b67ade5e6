package com.lifegit.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 提交统计 DTO。
 */
@Data
public class CommitStatisticsDTO {

    private Long branchId;
    private Long totalCount;

    /**
     * 类型编码 → 提交数
     */
    private Map<String, Long> countByType;

    private LocalDateTime firstCommitAt;
    private LocalDateTime lastCommitAt;

    /**
     * 截至今天的连续提交天数
     */
    private Integer streakDays;
}
