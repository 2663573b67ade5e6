package com.lifegit.trigger.application.command;

import com.google.common.cache.Cache;
import com.lifegit.api.dto.TaskItemDTO;
import com.lifegit.api.dto.TaskItemRequestDTO;
import com.lifegit.api.dto.TaskPlanDTO;
import com.lifegit.domain.branch.adapter.repository.IBranchRepository;
import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.domain.branch.model.valobj.BranchStatistics;
import com.lifegit.domain.branch.service.BranchLifecycleDomainService;
import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.service.TaskPlanEditingDomainService;
import com.lifegit.trigger.application.common.BranchViewAssembler;
import com.lifegit.trigger.event.BranchEventPublisher;
import com.lifegit.types.enums.BranchEventTypeEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.enums.TaskTimeScopeEnum;
import com.lifegit.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 任务计划写用例：重新生成、编辑任务项、切换完成状态。
 */
@Service
public class TaskPlanCommandService {

    private final IBranchRepository branchRepository;
    private final BranchLifecycleDomainService branchLifecycleDomainService;
    private final TaskPlanEditingDomainService taskPlanEditingDomainService;
    private final BranchEventPublisher branchEventPublisher;
    private final BranchViewAssembler branchViewAssembler;
    private final Cache<Long, BranchStatistics> branchStatisticsCache;

    public TaskPlanCommandService(IBranchRepository branchRepository,
                                  BranchLifecycleDomainService branchLifecycleDomainService,
                                  TaskPlanEditingDomainService taskPlanEditingDomainService,
                                  BranchEventPublisher branchEventPublisher,
                                  BranchViewAssembler branchViewAssembler,
                                  @Qualifier("branchStatisticsCache") Cache<Long, BranchStatistics> branchStatisticsCache) {
        this.branchRepository = branchRepository;
        this.branchLifecycleDomainService = branchLifecycleDomainService;
        this.taskPlanEditingDomainService = taskPlanEditingDomainService;
        this.branchEventPublisher = branchEventPublisher;
        this.branchViewAssembler = branchViewAssembler;
        this.branchStatisticsCache = branchStatisticsCache;
    }

    /**
     * 重新生成计划。AI 失败直接抛出，旧计划保持不变。
     */
    public TaskPlanDTO regenerate(Long branchId) {
        BranchEntity branch = branchRepository.findById(requireId(branchId));
        if (branch == null) {
            throw new AppException(ResponseCode.BRANCH_NOT_FOUND, "分支不存在: " + branchId);
        }
        TaskPlanEntity plan = branchLifecycleDomainService.regenerateTaskPlan(branch);
        Map<String, Object> payload = new HashMap<>();
        payload.put("planId", plan.getId());
        payload.put("tasks", plan.totalCount());
        afterChange(branchId, BranchEventTypeEnum.PLAN_REGENERATED, payload);
        return branchViewAssembler.toTaskPlanDTO(plan);
    }

    @Transactional(rollbackFor = Exception.class)
    public TaskItemDTO addTask(Long branchId, TaskItemRequestDTO request) {
        TaskItemEntity item = taskPlanEditingDomainService.addTaskItem(requireId(branchId), toDraft(request));
        afterChange(branchId, BranchEventTypeEnum.PLAN_UPDATED, taskPayload("added", item.getId()));
        return branchViewAssembler.toTaskItemDTO(item);
    }

    @Transactional(rollbackFor = Exception.class)
    public TaskItemDTO updateTask(Long branchId, Long taskId, TaskItemRequestDTO request) {
        TaskItemEntity item = taskPlanEditingDomainService.updateTaskItem(requireId(branchId), taskId, toDraft(request));
        afterChange(branchId, BranchEventTypeEnum.PLAN_UPDATED, taskPayload("updated", taskId));
        return branchViewAssembler.toTaskItemDTO(item);
    }

    @Transactional(rollbackFor = Exception.class)
    public TaskPlanDTO removeTask(Long branchId, Long taskId) {
        TaskPlanEntity plan = taskPlanEditingDomainService.removeTaskItem(requireId(branchId), taskId);
        afterChange(branchId, BranchEventTypeEnum.PLAN_UPDATED, taskPayload("removed", taskId));
        return branchViewAssembler.toTaskPlanDTO(plan);
    }

    @Transactional(rollbackFor = Exception.class)
    public TaskPlanDTO reorderTasks(Long branchId, List<Long> taskIds) {
        TaskPlanEntity plan = taskPlanEditingDomainService.reorderTaskItems(requireId(branchId), taskIds);
        afterChange(branchId, BranchEventTypeEnum.PLAN_UPDATED, taskPayload("reordered", null));
        return branchViewAssembler.toTaskPlanDTO(plan);
    }

    @Transactional(rollbackFor = Exception.class)
    public TaskItemDTO toggleTask(Long branchId, Long taskId) {
        TaskItemEntity item = taskPlanEditingDomainService.toggleTaskCompletion(requireId(branchId), taskId);
        Map<String, Object> payload = taskPayload("toggled", taskId);
        payload.put("completed", item.isDone());
        afterChange(branchId, BranchEventTypeEnum.PLAN_UPDATED, payload);
        if (item.isDone()) {
            branchEventPublisher.publish(BranchEventTypeEnum.COMMIT_CREATED, branchId, taskPayload("task_complete", taskId));
        }
        return branchViewAssembler.toTaskItemDTO(item);
    }

    private TaskItemEntity toDraft(TaskItemRequestDTO request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "请求体不能为空");
        }
        TaskItemEntity draft = new TaskItemEntity();
        draft.setTitle(request.getTitle());
        draft.setDescription(request.getDescription());
        draft.setEstimatedDuration(request.getEstimatedDuration());
        draft.setExecutionTips(request.getExecutionTips());
        if (StringUtils.isNotBlank(request.getTimeScope())) {
            try {
                draft.setTimeScope(TaskTimeScopeEnum.fromCode(request.getTimeScope().trim()));
            } catch (IllegalArgumentException ex) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "不支持的时间维度: " + request.getTimeScope());
            }
        }
        return draft;
    }

    private Map<String, Object> taskPayload(String action, Long taskId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("action", action);
        if (taskId != null) {
            payload.put("taskId", taskId);
        }
        return payload;
    }

    private void afterChange(Long branchId, BranchEventTypeEnum eventType, Map<String, Object> payload) {
        branchStatisticsCache.invalidate(branchId);
        branchEventPublisher.publish(eventType, branchId, payload);
    }

    private Long requireId(Long branchId) {
        if (branchId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "分支 ID 不能为空");
        }
        return branchId;
    }
}
