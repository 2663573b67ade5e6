package com.lifegit.trigger.application.common;

import com.lifegit.api.dto.BranchDTO;
import com.lifegit.api.dto.BranchStatisticsDTO;
import com.lifegit.api.dto.CommitDTO;
import com.lifegit.api.dto.CommitStatisticsDTO;
import com.lifegit.api.dto.TaskItemDTO;
import com.lifegit.api.dto.TaskPlanDTO;
import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.domain.branch.model.valobj.BranchStatistics;
import com.lifegit.domain.commit.model.entity.CommitEntity;
import com.lifegit.domain.commit.model.valobj.CommitStatistics;
import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.service.ProgressTrackerDomainService;
import com.lifegit.types.enums.CommitTypeEnum;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分支视图组装器：领域实体到 DTO 的统一映射。
 */
@Component
public class BranchViewAssembler {

    private final ProgressTrackerDomainService progressTrackerDomainService;

    public BranchViewAssembler(ProgressTrackerDomainService progressTrackerDomainService) {
        this.progressTrackerDomainService = progressTrackerDomainService;
    }

    public BranchDTO toBranchDTO(BranchEntity branch, boolean hasPlan) {
        if (branch == null) {
            return null;
        }
        BranchDTO dto = new BranchDTO();
        dto.setBranchId(branch.getId());
        dto.setName(branch.getName());
        dto.setDescription(branch.getDescription());
        dto.setStatus(branch.getStatus() == null ? null : branch.getStatus().getCode());
        dto.setProgress(branch.getProgress());
        dto.setMaster(branch.isMaster());
        dto.setMerged(branch.isMerged());
        dto.setHasPlan(hasPlan);
        dto.setExpectedCompletionDate(branch.getExpectedCompletionDate());
        dto.setCreatedAt(branch.getCreatedAt());
        dto.setUpdatedAt(branch.getUpdatedAt());
        dto.setCompletedAt(branch.getCompletedAt());
        dto.setAbandonedAt(branch.getAbandonedAt());
        dto.setMergedAt(branch.getMergedAt());
        return dto;
    }

    public TaskPlanDTO toTaskPlanDTO(TaskPlanEntity plan) {
        if (plan == null) {
            return null;
        }
        TaskPlanDTO dto = new TaskPlanDTO();
        dto.setPlanId(plan.getId());
        dto.setBranchId(plan.getBranchId());
        dto.setTotalDuration(plan.getTotalDuration());
        dto.setAiGenerated(plan.isAiPlan());
        dto.setTotalTasks(plan.totalCount());
        dto.setCompletedTasks(plan.completedCount());
        dto.setProgress(progressTrackerDomainService.progress(plan));
        dto.setRemainingDuration(progressTrackerDomainService.remainingDuration(plan));
        dto.setCreatedAt(plan.getCreatedAt());
        dto.setLastModifiedAt(plan.getLastModifiedAt());
        List<TaskItemDTO> tasks = new ArrayList<>();
        for (TaskItemEntity task : plan.sortedTasks()) {
            tasks.add(toTaskItemDTO(task));
        }
        dto.setTasks(tasks);
        return dto;
    }

    public TaskItemDTO toTaskItemDTO(TaskItemEntity task) {
        if (task == null) {
            return null;
        }
        TaskItemDTO dto = new TaskItemDTO();
        dto.setTaskId(task.getId());
        dto.setPlanId(task.getPlanId());
        dto.setTitle(task.getTitle());
        dto.setDescription(task.getDescription());
        dto.setEstimatedDuration(task.getEstimatedDuration());
        dto.setTimeScope(task.getTimeScope() == null ? null : task.getTimeScope().getCode());
        dto.setOrderIndex(task.getOrderIndex());
        dto.setCompleted(task.isDone());
        dto.setCompletedAt(task.getCompletedAt());
        dto.setAiGenerated(Boolean.TRUE.equals(task.getAiGenerated()));
        dto.setExecutionTips(task.getExecutionTips());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setLastModifiedAt(task.getLastModifiedAt());
        return dto;
    }

    public CommitDTO toCommitDTO(CommitEntity commit) {
        if (commit == null) {
            return null;
        }
        CommitDTO dto = new CommitDTO();
        dto.setCommitId(commit.getId());
        dto.setBranchId(commit.getBranchId());
        dto.setMessage(commit.getMessage());
        CommitTypeEnum type = commit.getType();
        if (type != null) {
            dto.setType(type.getCode());
            dto.setTypeDisplayName(type.getDisplayName());
            dto.setEmoji(type.getEmoji());
        }
        dto.setRelatedTaskId(commit.getRelatedTaskId());
        dto.setTimestamp(commit.getTimestamp());
        return dto;
    }

    public List<CommitDTO> toCommitDTOs(List<CommitEntity> commits) {
        List<CommitDTO> result = new ArrayList<>();
        if (commits == null) {
            return result;
        }
        for (CommitEntity commit : commits) {
            result.add(toCommitDTO(commit));
        }
        return result;
    }

    public BranchStatisticsDTO toStatisticsDTO(BranchStatistics statistics) {
        if (statistics == null) {
            return null;
        }
        BranchStatisticsDTO dto = new BranchStatisticsDTO();
        dto.setBranchId(statistics.getBranchId());
        dto.setCommitCount(statistics.getCommitCount());
        dto.setTotalTasks(statistics.getTotalTasks());
        dto.setCompletedTasks(statistics.getCompletedTasks());
        dto.setProgress(statistics.getProgress());
        dto.setTotalEstimatedDuration(statistics.getTotalEstimatedDuration());
        dto.setCompletedDuration(statistics.getCompletedDuration());
        dto.setRemainingEstimatedDuration(statistics.getRemainingEstimatedDuration());
        return dto;
    }

    public CommitStatisticsDTO toCommitStatisticsDTO(CommitStatistics statistics, int streakDays) {
        if (statistics == null) {
            return null;
        }
        CommitStatisticsDTO dto = new CommitStatisticsDTO();
        dto.setBranchId(statistics.getBranchId());
        dto.setTotalCount(statistics.getTotalCount());
        Map<String, Long> countByType = new LinkedHashMap<>();
        if (statistics.getCountByType() != null) {
            for (Map.Entry<CommitTypeEnum, Long> entry : statistics.getCountByType().entrySet()) {
                countByType.put(entry.getKey().getCode(), entry.getValue());
            }
        }
        dto.setCountByType(countByType);
        dto.setFirstCommitAt(statistics.getFirstCommitAt());
        dto.setLastCommitAt(statistics.getLastCommitAt());
        dto.setStreakDays(streakDays);
        return dto;
    }
}
