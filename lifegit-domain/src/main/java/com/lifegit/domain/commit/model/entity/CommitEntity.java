package com.lifegit.domain.commit.model.entity;

import com.lifegit.types.enums.CommitTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 提交记录领域实体，只追加不修改。
 *
 * @author lifegit
 * @since 2025-01-29
 */
@Data
public class CommitEntity {

    /**
     * 主键 ID，同一时间戳下按 ID 升序
     */
    private Long id;

    private Long branchId;

    private String message;

    private CommitTypeEnum type;

    /**
     * 关联任务项 ID (可空)
     */
    private Long relatedTaskId;

    private LocalDateTime timestamp;

    public static CommitEntity of(Long branchId, String message, CommitTypeEnum type,
                                  Long relatedTaskId, LocalDateTime timestamp) {
        CommitEntity commit = new CommitEntity();
        commit.setBranchId(branchId);
        commit.setMessage(message);
        commit.setType(type);
        commit.setRelatedTaskId(relatedTaskId);
        commit.setTimestamp(timestamp);
        return commit;
    }
}
