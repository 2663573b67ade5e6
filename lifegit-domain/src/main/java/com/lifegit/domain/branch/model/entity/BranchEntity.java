package com.lifegit.domain.branch.model.entity;

import com.lifegit.types.enums.BranchStatusEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;
import lombok.Data;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 目标分支领域实体
 *
 * @author lifegit
 * @since 2025-01-29
 */
@Data
public class BranchEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 目标名称
     */
    private String name;

    /**
     * 目标描述
     */
    private String description;

    /**
     * 状态
     */
    private BranchStatusEnum status;

    /**
     * 进度 [0, 1]，由任务计划推导
     */
    private Double progress;

    /**
     * 预期完成日期 (可空)
     */
    private LocalDate expectedCompletionDate;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime completedAt;

    private LocalDateTime abandonedAt;

    /**
     * 合并到主线的时间，非空即已合并
     */
    private LocalDateTime mergedAt;

    /**
     * 新建进行中的分支
     */
    public static BranchEntity active(String name, String description, LocalDateTime now) {
        BranchEntity branch = new BranchEntity();
        branch.setName(name);
        branch.setDescription(description);
        branch.setStatus(BranchStatusEnum.ACTIVE);
        branch.setProgress(0D);
        branch.setCreatedAt(now);
        branch.setUpdatedAt(now);
        return branch;
    }

    public boolean isMaster() {
        return this.status == BranchStatusEnum.MASTER;
    }

    public boolean isActive() {
        return this.status == BranchStatusEnum.ACTIVE;
    }

    public boolean isMerged() {
        return this.mergedAt != null;
    }

    /**
     * 完成目标
     */
    public void complete(LocalDateTime now) {
        if (this.status != BranchStatusEnum.ACTIVE) {
            throw invalidState("只有进行中的目标才能完成");
        }
        this.status = BranchStatusEnum.COMPLETED;
        this.completedAt = now;
        this.updatedAt = now;
    }

    /**
     * 废弃目标
     */
    public void abandon(LocalDateTime now) {
        if (this.status != BranchStatusEnum.ACTIVE) {
            throw invalidState("只有进行中的目标才能废弃");
        }
        this.status = BranchStatusEnum.ABANDONED;
        this.abandonedAt = now;
        this.updatedAt = now;
    }

    /**
     * 重新激活已废弃的目标
     */
    public void reactivate(LocalDateTime now) {
        if (this.status != BranchStatusEnum.ABANDONED) {
            throw invalidState("只有已废弃的目标才能重新激活");
        }
        this.status = BranchStatusEnum.ACTIVE;
        this.abandonedAt = null;
        this.updatedAt = now;
    }

    /**
     * 标记为已合并
     */
    public void markMerged(LocalDateTime now) {
        if (this.status != BranchStatusEnum.COMPLETED) {
            throw invalidState("只有已完成的目标才能合并");
        }
        if (isMerged()) {
            throw invalidState("目标已合并到主线");
        }
        this.mergedAt = now;
        this.updatedAt = now;
    }

    /**
     * 复制一份当前状态，用于失败时回滚。
     */
    public BranchEntity snapshot() {
        BranchEntity copy = new BranchEntity();
        copy.restoreFrom(this);
        copy.setId(this.id);
        copy.setName(this.name);
        copy.setDescription(this.description);
        copy.setCreatedAt(this.createdAt);
        copy.setExpectedCompletionDate(this.expectedCompletionDate);
        return copy;
    }

    /**
     * 恢复生命周期相关字段。
     */
    public void restoreFrom(BranchEntity snapshot) {
        this.status = snapshot.getStatus();
        this.progress = snapshot.getProgress();
        this.updatedAt = snapshot.getUpdatedAt();
        this.completedAt = snapshot.getCompletedAt();
        this.abandonedAt = snapshot.getAbandonedAt();
        this.mergedAt = snapshot.getMergedAt();
    }

    private AppException invalidState(String message) {
        return new AppException(ResponseCode.INVALID_STATE, message + "，当前状态: " + status);
    }
}
