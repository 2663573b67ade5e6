package com.lifegit.domain.plan.service;

import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.model.valobj.AIGeneratedTaskPlan;
import com.lifegit.domain.plan.model.valobj.GoalDescriptor;
import com.lifegit.types.common.Constants;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.enums.TaskTimeScopeEnum;
import com.lifegit.types.exception.AIServiceException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 计划装配领域服务：校验模型返回的计划、归一化并转换为任务计划实体，以及构造手动兜底计划。
 */
@Service
public class TaskPlanAssemblyDomainService {

    static final int FALLBACK_TASK_DURATION_MINUTES = 60;

    static final String FALLBACK_TASK_TIPS = "这是一个手动创建的任务，请根据实际情况修改任务内容和时间安排";

    /**
     * 校验 + 转换。
     *
     * @throws AIServiceException VALIDATION 分类
     */
    public TaskPlanEntity assemble(AIGeneratedTaskPlan raw, LocalDateTime now) {
        validate(raw);
        return toTaskPlan(raw, now);
    }

    public void validate(AIGeneratedTaskPlan raw) {
        if (raw == null || raw.getTasks() == null || raw.getTasks().isEmpty()) {
            throw invalid("Task plan must contain at least one task");
        }
        if (StringUtils.isBlank(raw.getTotalDuration())) {
            throw invalid("Task plan total duration must not be blank");
        }
        if (raw.getTotalDuration().trim().length() > Constants.PLAN_TOTAL_DURATION_MAX_LENGTH) {
            throw invalid("Task plan total duration must not exceed " + Constants.PLAN_TOTAL_DURATION_MAX_LENGTH + " characters");
        }
        for (int i = 0; i < raw.getTasks().size(); i++) {
            AIGeneratedTaskPlan.AIGeneratedTask task = raw.getTasks().get(i);
            if (task == null) {
                throw invalid("Task " + i + " must not be null");
            }
            if (StringUtils.isBlank(task.getTitle())) {
                throw invalid("Task " + i + " title must not be blank");
            }
            if (task.getTitle().trim().length() > Constants.TASK_TITLE_MAX_LENGTH) {
                throw invalid("Task " + i + " title must not exceed " + Constants.TASK_TITLE_MAX_LENGTH + " characters");
            }
            if (StringUtils.isBlank(task.getDescription())) {
                throw invalid("Task " + i + " description must not be blank");
            }
            if (task.getEstimatedDuration() == null || task.getEstimatedDuration() <= 0) {
                throw invalid("Task " + i + " estimated duration must be positive");
            }
        }
    }

    /**
     * 未识别的 timeScope 按 DAILY 处理，大小写不敏感。
     */
    public TaskTimeScopeEnum normalizeTimeScope(String timeScope) {
        return TaskTimeScopeEnum.fromCodeOrDaily(timeScope);
    }

    /**
     * 转换为 AI 计划，任务按 orderIndex 稳定排序。
     */
    public TaskPlanEntity toTaskPlan(AIGeneratedTaskPlan raw, LocalDateTime now) {
        List<AIGeneratedTaskPlan.AIGeneratedTask> ordered = new ArrayList<>(raw.getTasks());
        ordered.sort(Comparator.comparingInt(task -> task.getOrderIndex() == null ? 0 : task.getOrderIndex()));

        TaskPlanEntity plan = new TaskPlanEntity();
        plan.setTotalDuration(raw.getTotalDuration().trim());
        plan.setAiGenerated(Boolean.TRUE);
        plan.setCreatedAt(now);
        plan.setLastModifiedAt(now);
        List<TaskItemEntity> items = new ArrayList<>();
        for (AIGeneratedTaskPlan.AIGeneratedTask task : ordered) {
            TaskItemEntity item = new TaskItemEntity();
            item.setTitle(task.getTitle().trim());
            item.setDescription(task.getDescription().trim());
            item.setEstimatedDuration(task.getEstimatedDuration());
            item.setTimeScope(normalizeTimeScope(task.getTimeScope()));
            item.setOrderIndex(task.getOrderIndex() == null ? 0 : task.getOrderIndex());
            item.setCompleted(Boolean.FALSE);
            item.setAiGenerated(Boolean.TRUE);
            item.setExecutionTips(StringUtils.trimToNull(task.getExecutionTips()));
            item.setCreatedAt(now);
            item.setLastModifiedAt(now);
            items.add(item);
        }
        plan.setTasks(items);
        return plan;
    }

    /**
     * AI 不可用时的手动计划，确定性构造，不会失败。
     */
    public TaskPlanEntity manualFallbackPlan(GoalDescriptor goal, LocalDateTime now) {
        String title = goal == null ? "" : StringUtils.defaultString(goal.getTitle());
        String description = goal == null ? "" : StringUtils.defaultString(goal.getDescription());

        TaskItemEntity item = new TaskItemEntity();
        item.setTitle("开始执行：" + title);
        item.setDescription("请根据目标描述制定具体的执行步骤：" + description);
        item.setTimeScope(TaskTimeScopeEnum.DAILY);
        item.setEstimatedDuration(FALLBACK_TASK_DURATION_MINUTES);
        item.setOrderIndex(0);
        item.setCompleted(Boolean.FALSE);
        item.setAiGenerated(Boolean.FALSE);
        item.setExecutionTips(FALLBACK_TASK_TIPS);
        item.setCreatedAt(now);
        item.setLastModifiedAt(now);

        TaskPlanEntity plan = new TaskPlanEntity();
        plan.setTotalDuration(Constants.MANUAL_PLAN_DURATION);
        plan.setAiGenerated(Boolean.FALSE);
        plan.setCreatedAt(now);
        plan.setLastModifiedAt(now);
        List<TaskItemEntity> items = new ArrayList<>();
        items.add(item);
        plan.setTasks(items);
        return plan;
    }

    private AIServiceException invalid(String message) {
        return new AIServiceException(AIServiceErrorCategoryEnum.VALIDATION, message);
    }
}
