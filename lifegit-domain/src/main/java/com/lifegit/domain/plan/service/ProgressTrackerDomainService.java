package com.lifegit.domain.plan.service;

import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.model.valobj.TaskPlanProgress;
import org.springframework.stereotype.Service;

/**
 * 进度领域服务：根据任务计划计算完成比例与时长。
 */
@Service
public class ProgressTrackerDomainService {

    /**
     * 完成比例，空计划为 0.0
     */
    public double progress(TaskPlanEntity plan) {
        if (plan == null || plan.totalCount() == 0) {
            return 0D;
        }
        return (double) plan.completedCount() / plan.totalCount();
    }

    /**
     * 未完成任务的预计时长之和（分钟）
     */
    public int remainingDuration(TaskPlanEntity plan) {
        int remaining = 0;
        if (plan == null || plan.getTasks() == null) {
            return remaining;
        }
        for (TaskItemEntity task : plan.getTasks()) {
            if (!task.isDone()) {
                remaining += task.durationOrZero();
            }
        }
        return remaining;
    }

    public int totalDuration(TaskPlanEntity plan) {
        int total = 0;
        if (plan == null || plan.getTasks() == null) {
            return total;
        }
        for (TaskItemEntity task : plan.getTasks()) {
            total += task.durationOrZero();
        }
        return total;
    }

    public int completedDuration(TaskPlanEntity plan) {
        return totalDuration(plan) - remainingDuration(plan);
    }

    public TaskPlanProgress summarize(TaskPlanEntity plan) {
        return TaskPlanProgress.builder()
                .totalTasks(plan == null ? 0 : plan.totalCount())
                .completedTasks(plan == null ? 0 : plan.completedCount())
                .progress(progress(plan))
                .totalDuration(totalDuration(plan))
                .completedDuration(completedDuration(plan))
                .remainingDuration(remainingDuration(plan))
                .build();
    }
}
