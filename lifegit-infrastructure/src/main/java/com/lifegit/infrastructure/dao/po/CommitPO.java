package com.lifegit.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 提交记录 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommitPO {

    private Long id;
    private Long branchId;
    private String message;
    private String type;
    private Long relatedTaskId;
    private LocalDateTime commitTime;
}
