package com.lifegit.domain.plan.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 任务计划领域实体，与分支一对一。
 *
 * @author lifegit
 * @since 2025-01-29
 */
@Data
public class TaskPlanEntity {

    private Long id;

    private Long branchId;

    /**
     * 总时长描述，如 "2周"
     */
    private String totalDuration;

    private Boolean aiGenerated;

    private LocalDateTime createdAt;

    private LocalDateTime lastModifiedAt;

    /**
     * 任务项，按 orderIndex 升序
     */
    private List<TaskItemEntity> tasks = new ArrayList<>();

    public boolean isAiPlan() {
        return Boolean.TRUE.equals(aiGenerated);
    }

    /**
     * 按 orderIndex 稳定排序后的任务项
     */
    public List<TaskItemEntity> sortedTasks() {
        List<TaskItemEntity> sorted = new ArrayList<>(tasks == null ? List.of() : tasks);
        sorted.sort(Comparator.comparingInt(TaskItemEntity::orderOrZero));
        return sorted;
    }

    public TaskItemEntity findTask(Long taskId) {
        if (taskId == null || tasks == null) {
            return null;
        }
        for (TaskItemEntity task : tasks) {
            if (taskId.equals(task.getId())) {
                return task;
            }
        }
        return null;
    }

    public int totalCount() {
        return tasks == null ? 0 : tasks.size();
    }

    public int completedCount() {
        if (tasks == null) {
            return 0;
        }
        int count = 0;
        for (TaskItemEntity task : tasks) {
            if (task.isDone()) {
                count++;
            }
        }
        return count;
    }

    public void touch(LocalDateTime now) {
        this.lastModifiedAt = now;
    }
}
