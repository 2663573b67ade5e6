package com.lifegit.domain.plan.service;

import com.lifegit.domain.branch.adapter.repository.IBranchRepository;
import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.domain.commit.model.entity.CommitEntity;
import com.lifegit.domain.commit.service.CommitLedgerDomainService;
import com.lifegit.domain.plan.adapter.repository.ITaskPlanRepository;
import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.types.common.Constants;
import com.lifegit.types.enums.CommitTypeEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.enums.TaskTimeScopeEnum;
import com.lifegit.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * 任务计划编辑领域服务：增删改任务项、调整顺序、切换完成状态。
 * <p>
 * 切换为完成时追加一条 TASK_COMPLETE 提交，之后重新计算并保存分支进度。
 * </p>
 */
@Slf4j
@Service
public class TaskPlanEditingDomainService {

    private final IBranchRepository branchRepository;
    private final ITaskPlanRepository taskPlanRepository;
    private final CommitLedgerDomainService commitLedgerDomainService;
    private final ProgressTrackerDomainService progressTrackerDomainService;

    public TaskPlanEditingDomainService(IBranchRepository branchRepository,
                                        ITaskPlanRepository taskPlanRepository,
                                        CommitLedgerDomainService commitLedgerDomainService,
                                        ProgressTrackerDomainService progressTrackerDomainService) {
        this.branchRepository = branchRepository;
        this.taskPlanRepository = taskPlanRepository;
        this.commitLedgerDomainService = commitLedgerDomainService;
        this.progressTrackerDomainService = progressTrackerDomainService;
    }

    /**
     * 追加手动任务，排在最后。
     */
    public TaskItemEntity addTaskItem(Long branchId, TaskItemEntity draft) {
        if (draft == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "任务不能为空");
        }
        draft.validate();
        TaskPlanEntity plan = requirePlan(branchId);
        LocalDateTime now = LocalDateTime.now();

        TaskItemEntity item = new TaskItemEntity();
        item.setPlanId(plan.getId());
        item.setTitle(draft.getTitle().trim());
        item.setDescription(StringUtils.trimToEmpty(draft.getDescription()));
        item.setEstimatedDuration(draft.getEstimatedDuration());
        item.setTimeScope(draft.getTimeScope() == null ? TaskTimeScopeEnum.DAILY : draft.getTimeScope());
        item.setOrderIndex(plan.totalCount());
        item.setCompleted(Boolean.FALSE);
        item.setAiGenerated(Boolean.FALSE);
        item.setExecutionTips(StringUtils.trimToNull(draft.getExecutionTips()));
        item.setCreatedAt(now);
        item.setLastModifiedAt(now);
        plan.getTasks().add(item);
        plan.touch(now);

        TaskPlanEntity saved = taskPlanRepository.update(plan);
        syncBranchProgress(branchId, saved);
        log.info("TASK_ITEM_ADDED branchId={}, planId={}, orderIndex={}", branchId, plan.getId(), item.getOrderIndex());
        return lastOf(saved);
    }

    /**
     * 修改任务内容，为空的字段保持原值。
     */
    public TaskItemEntity updateTaskItem(Long branchId, Long taskId, TaskItemEntity changes) {
        TaskPlanEntity plan = requirePlan(branchId);
        TaskItemEntity item = requireTask(plan, taskId);
        if (changes == null) {
            return item;
        }
        TaskItemEntity merged = new TaskItemEntity();
        merged.setTitle(changes.getTitle() == null ? item.getTitle() : changes.getTitle());
        merged.setEstimatedDuration(changes.getEstimatedDuration() == null
                ? item.getEstimatedDuration() : changes.getEstimatedDuration());
        merged.validate();

        LocalDateTime now = LocalDateTime.now();
        item.setTitle(merged.getTitle().trim());
        item.setEstimatedDuration(merged.getEstimatedDuration());
        if (changes.getDescription() != null) {
            item.setDescription(changes.getDescription().trim());
        }
        if (changes.getTimeScope() != null) {
            item.setTimeScope(changes.getTimeScope());
        }
        if (changes.getExecutionTips() != null) {
            item.setExecutionTips(StringUtils.trimToNull(changes.getExecutionTips()));
        }
        item.setLastModifiedAt(now);
        plan.touch(now);
        taskPlanRepository.update(plan);
        log.info("TASK_ITEM_UPDATED branchId={}, taskId={}", branchId, taskId);
        return item;
    }

    /**
     * 删除任务项，剩余任务重新编号。
     */
    public TaskPlanEntity removeTaskItem(Long branchId, Long taskId) {
        TaskPlanEntity plan = requirePlan(branchId);
        TaskItemEntity item = requireTask(plan, taskId);
        List<TaskItemEntity> remaining = plan.sortedTasks();
        remaining.remove(item);
        for (int i = 0; i < remaining.size(); i++) {
            remaining.get(i).setOrderIndex(i);
        }
        plan.setTasks(remaining);
        plan.touch(LocalDateTime.now());

        TaskPlanEntity saved = taskPlanRepository.update(plan);
        syncBranchProgress(branchId, saved);
        log.info("TASK_ITEM_REMOVED branchId={}, taskId={}, remaining={}", branchId, taskId, remaining.size());
        return saved;
    }

    /**
     * 按给定顺序重排，必须恰好包含计划内全部任务。
     */
    public TaskPlanEntity reorderTaskItems(Long branchId, List<Long> orderedTaskIds) {
        TaskPlanEntity plan = requirePlan(branchId);
        if (orderedTaskIds == null || orderedTaskIds.size() != plan.totalCount()
                || new HashSet<>(orderedTaskIds).size() != orderedTaskIds.size()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "排序必须包含计划内全部任务且不能重复");
        }
        List<TaskItemEntity> reordered = new ArrayList<>();
        for (Long taskId : orderedTaskIds) {
            reordered.add(requireTask(plan, taskId));
        }
        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < reordered.size(); i++) {
            reordered.get(i).setOrderIndex(i);
            reordered.get(i).setLastModifiedAt(now);
        }
        plan.setTasks(reordered);
        plan.touch(now);
        log.info("TASK_ITEMS_REORDERED branchId={}, planId={}", branchId, plan.getId());
        return taskPlanRepository.update(plan);
    }

    /**
     * 切换任务完成状态。
     */
    public TaskItemEntity toggleTaskCompletion(Long branchId, Long taskId) {
        BranchEntity branch = requireBranch(branchId);
        TaskPlanEntity plan = requirePlan(branchId);
        TaskItemEntity item = requireTask(plan, taskId);
        LocalDateTime now = LocalDateTime.now();
        boolean completing = !item.isDone();
        if (completing) {
            item.markCompleted(now);
        } else {
            item.markIncomplete(now);
        }
        plan.touch(now);
        taskPlanRepository.update(plan);

        if (completing) {
            try {
                commitLedgerDomainService.append(CommitEntity.of(branchId,
                        Constants.TASK_COMPLETE_COMMIT_PREFIX + item.getTitle(),
                        CommitTypeEnum.TASK_COMPLETE,
                        item.getId(),
                        now));
            } catch (RuntimeException ex) {
                log.warn("TASK_TOGGLE_ROLLBACK branchId={}, taskId={}, reason={}", branchId, taskId, ex.getMessage());
                item.markIncomplete(now);
                try {
                    taskPlanRepository.update(plan);
                } catch (RuntimeException restoreEx) {
                    log.error("TASK_TOGGLE_RESTORE_FAILED branchId={}, taskId={}, reason={}",
                            branchId, taskId, restoreEx.getMessage(), restoreEx);
                    ex.addSuppressed(restoreEx);
                }
                throw ex;
            }
        }
        branch.setProgress(progressTrackerDomainService.progress(plan));
        branch.setUpdatedAt(now);
        branchRepository.update(branch);
        log.info("TASK_TOGGLED branchId={}, taskId={}, completed={}, progress={}",
                branchId, taskId, item.isDone(), branch.getProgress());
        return item;
    }

    private void syncBranchProgress(Long branchId, TaskPlanEntity plan) {
        BranchEntity branch = requireBranch(branchId);
        branch.setProgress(progressTrackerDomainService.progress(plan));
        branch.setUpdatedAt(LocalDateTime.now());
        branchRepository.update(branch);
    }

    private BranchEntity requireBranch(Long branchId) {
        BranchEntity branch = branchId == null ? null : branchRepository.findById(branchId);
        if (branch == null) {
            throw new AppException(ResponseCode.BRANCH_NOT_FOUND, "分支不存在: " + branchId);
        }
        return branch;
    }

    private TaskPlanEntity requirePlan(Long branchId) {
        requireBranch(branchId);
        TaskPlanEntity plan = taskPlanRepository.findByBranchId(branchId);
        if (plan == null) {
            throw new AppException(ResponseCode.NO_TASK_PLAN, "分支没有任务计划: " + branchId);
        }
        if (plan.getTasks() == null) {
            plan.setTasks(new ArrayList<>());
        }
        return plan;
    }

    private TaskItemEntity requireTask(TaskPlanEntity plan, Long taskId) {
        TaskItemEntity item = plan.findTask(taskId);
        if (item == null) {
            throw new AppException(ResponseCode.TASK_ITEM_NOT_FOUND, "任务不存在: " + taskId);
        }
        return item;
    }

    private TaskItemEntity lastOf(TaskPlanEntity plan) {
        List<TaskItemEntity> sorted = plan.sortedTasks();
        return sorted.get(sorted.size() - 1);
    }
}
