package com.lifegit.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 提交记录 DTO。
 */
@Data
public class CommitDTO {

    private Long commitId;
    private Long branchId;
    private String message;
    private String type;
    private String typeDisplayName;
    private String emoji;
    private Long relatedTaskId;
    private LocalDateTime timestamp;
}
