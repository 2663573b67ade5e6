package com.lifegit.domain.plan.model.entity;

import com.lifegit.types.common.Constants;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.enums.TaskTimeScopeEnum;
import com.lifegit.types.exception.AppException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;

/**
 * 任务项领域实体
 *
 * @author lifegit
 * @since 2025-01-29
 */
@Data
public class TaskItemEntity {

    private Long id;

    /**
     * 所属计划 ID
     */
    private Long planId;

    private String title;

    private String description;

    /**
     * 预计时长（分钟）
     */
    private Integer estimatedDuration;

    private TaskTimeScopeEnum timeScope;

    /**
     * 排序索引，升序
     */
    private Integer orderIndex;

    private Boolean completed;

    private LocalDateTime completedAt;

    private Boolean aiGenerated;

    /**
     * 执行建议 (可空)
     */
    private String executionTips;

    private LocalDateTime createdAt;

    private LocalDateTime lastModifiedAt;

    public boolean isDone() {
        return Boolean.TRUE.equals(completed);
    }

    public int durationOrZero() {
        return estimatedDuration == null ? 0 : estimatedDuration;
    }

    public int orderOrZero() {
        return orderIndex == null ? 0 : orderIndex;
    }

    /**
     * 校验用户输入的任务项
     */
    public void validate() {
        if (StringUtils.isBlank(title)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "任务标题不能为空");
        }
        if (title.trim().length() > Constants.TASK_TITLE_MAX_LENGTH) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "任务标题不能超过" + Constants.TASK_TITLE_MAX_LENGTH + "个字符");
        }
        if (estimatedDuration == null || estimatedDuration <= 0) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "任务预计时长必须大于0");
        }
    }

    public void markCompleted(LocalDateTime now) {
        this.completed = Boolean.TRUE;
        this.completedAt = now;
        this.lastModifiedAt = now;
    }

    public void markIncomplete(LocalDateTime now) {
        this.completed = Boolean.FALSE;
        this.completedAt = null;
        this.lastModifiedAt = now;
    }
}
