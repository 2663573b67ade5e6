package com.lifegit.domain.branch.model.valobj;

import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;

import java.util.Optional;

/**
 * 分支的计划状态：无计划或持有一个计划。
 */
public final class BranchPlanState {

    public enum Kind {
        NO_PLAN,
        PLAN
    }

    private static final BranchPlanState NO_PLAN = new BranchPlanState(Kind.NO_PLAN, null);

    private final Kind kind;
    private final TaskPlanEntity plan;

    private BranchPlanState(Kind kind, TaskPlanEntity plan) {
        this.kind = kind;
        this.plan = plan;
    }

    public static BranchPlanState noPlan() {
        return NO_PLAN;
    }

    public static BranchPlanState of(TaskPlanEntity plan) {
        return plan == null ? NO_PLAN : new BranchPlanState(Kind.PLAN, plan);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean hasPlan() {
        return kind == Kind.PLAN;
    }

    public Optional<TaskPlanEntity> getPlan() {
        return Optional.ofNullable(plan);
    }

    /**
     * 取出计划，无计划时抛出 NO_TASK_PLAN。
     */
    public TaskPlanEntity requirePlan(Long branchId) {
        if (plan == null) {
            throw new AppException(ResponseCode.NO_TASK_PLAN, "分支没有任务计划: " + branchId);
        }
        return plan;
    }
}
