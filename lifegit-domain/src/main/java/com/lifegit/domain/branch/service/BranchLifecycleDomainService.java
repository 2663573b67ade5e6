package com.lifegit.domain.branch.service;

import com.lifegit.domain.branch.adapter.repository.IBranchRepository;
import com.lifegit.domain.branch.model.entity.BranchEntity;
import com.lifegit.domain.branch.model.valobj.BranchPlanState;
import com.lifegit.domain.branch.model.valobj.BranchStatistics;
import com.lifegit.domain.commit.model.entity.CommitEntity;
import com.lifegit.domain.commit.service.CommitLedgerDomainService;
import com.lifegit.domain.plan.adapter.gateway.ITaskPlanGenerator;
import com.lifegit.domain.plan.adapter.repository.ITaskPlanRepository;
import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.model.valobj.GoalDescriptor;
import com.lifegit.domain.plan.model.valobj.PlanGenerationOutcome;
import com.lifegit.domain.plan.service.AIFailurePolicyDomainService;
import com.lifegit.domain.plan.service.ProgressTrackerDomainService;
import com.lifegit.types.common.Constants;
import com.lifegit.types.enums.BranchStatusEnum;
import com.lifegit.types.enums.CommitTypeEnum;
import com.lifegit.types.enums.ResponseCode;
import com.lifegit.types.exception.AppException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * 分支生命周期领域服务。
 * <p>
 * 状态机：创建 → ACTIVE；ACTIVE → COMPLETED / ABANDONED；ABANDONED → ACTIVE；
 * COMPLETED 合并后写入 mergedAt，不可再迁移。MASTER 全局唯一，不参与迁移。
 * </p>
 * <p>
 * 状态变更与对应的生命周期提交要么都生效要么都不生效：先持久化分支，再追加提交，
 * 提交失败时把分支字段恢复为变更前的快照并再次持久化。
 * </p>
 */
@Slf4j
@Service
public class BranchLifecycleDomainService {

    static final String METRIC_BRANCH_TRANSITION_TOTAL = "lifegit.branch.transition.total";

    private final IBranchRepository branchRepository;
    private final ITaskPlanRepository taskPlanRepository;
    private final CommitLedgerDomainService commitLedgerDomainService;
    private final AIFailurePolicyDomainService aiFailurePolicyDomainService;
    private final ITaskPlanGenerator taskPlanGenerator;
    private final ProgressTrackerDomainService progressTrackerDomainService;
    private final int nameMaxLength;
    private final int descriptionMaxLength;
    private final MeterRegistry meterRegistry;

    public BranchLifecycleDomainService(IBranchRepository branchRepository,
                                        ITaskPlanRepository taskPlanRepository,
                                        CommitLedgerDomainService commitLedgerDomainService,
                                        AIFailurePolicyDomainService aiFailurePolicyDomainService,
                                        ITaskPlanGenerator taskPlanGenerator,
                                        ProgressTrackerDomainService progressTrackerDomainService,
                                        @Value("${lifegit.branch.name-max-length:100}") int nameMaxLength,
                                        @Value("${lifegit.branch.description-max-length:500}") int descriptionMaxLength) {
        this.branchRepository = branchRepository;
        this.taskPlanRepository = taskPlanRepository;
        this.commitLedgerDomainService = commitLedgerDomainService;
        this.aiFailurePolicyDomainService = aiFailurePolicyDomainService;
        this.taskPlanGenerator = taskPlanGenerator;
        this.progressTrackerDomainService = progressTrackerDomainService;
        this.nameMaxLength = nameMaxLength;
        this.descriptionMaxLength = descriptionMaxLength;
        this.meterRegistry = Metrics.globalRegistry;
    }

    /**
     * 确保主线分支存在，幂等。
     */
    public BranchEntity ensureMasterBranch() {
        BranchEntity master = branchRepository.findMaster();
        if (master != null) {
            return master;
        }
        LocalDateTime now = LocalDateTime.now();
        master = new BranchEntity();
        master.setName(Constants.MASTER_BRANCH_NAME);
        master.setDescription(Constants.MASTER_BRANCH_DESCRIPTION);
        master.setStatus(BranchStatusEnum.MASTER);
        master.setProgress(0D);
        master.setCreatedAt(now);
        master.setUpdatedAt(now);
        BranchEntity saved = branchRepository.save(master);
        log.info("MASTER_BRANCH_CREATED branchId={}", saved.getId());
        return saved;
    }

    public BranchEntity createBranch(String name, String description, String timeframe) {
        return createBranch(name, description, timeframe, null);
    }

    /**
     * 同步创建，等待 {@link #createBranchAsync} 完成。
     */
    public BranchEntity createBranch(String name,
                                     String description,
                                     String timeframe,
                                     LocalDate expectedCompletionDate) {
        try {
            return createBranchAsync(name, description, timeframe, expectedCompletionDate).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    /**
     * 创建进行中的分支并安装计划：AI 计划或手动兜底计划。
     * <p>
     * 名称与描述在调用线程上校验，失败直接抛出；计划生成及其退避等待不占用调用线程，
     * 生成结束后在完成回调里写库。AI 失败不会让创建失败；持久化失败时删除已写入的分支与计划，
     * 返回的 future 以 REPOSITORY_ERROR 异常完成。
     * </p>
     */
    public CompletableFuture<BranchEntity> createBranchAsync(String name,
                                                             String description,
                                                             String timeframe,
                                                             LocalDate expectedCompletionDate) {
        String normalizedName = validateName(name);
        String normalizedDescription = validateDescription(description);

        GoalDescriptor goal = GoalDescriptor.builder()
                .title(normalizedName)
                .description(normalizedDescription)
                .timeframe(StringUtils.trimToNull(timeframe))
                .build();
        return aiFailurePolicyDomainService.generateWithFallbackAsync(goal)
                .thenApply(outcome -> installBranch(normalizedName, normalizedDescription, expectedCompletionDate, outcome));
    }

    private BranchEntity installBranch(String normalizedName,
                                       String normalizedDescription,
                                       LocalDate expectedCompletionDate,
                                       PlanGenerationOutcome outcome) {
        TaskPlanEntity plan = outcome.getPlan();
        BranchEntity branch = BranchEntity.active(normalizedName, normalizedDescription, LocalDateTime.now());
        branch.setExpectedCompletionDate(expectedCompletionDate);
        BranchEntity savedBranch = null;
        TaskPlanEntity savedPlan = null;
        try {
            savedBranch = branchRepository.save(branch);
            plan.setBranchId(savedBranch.getId());
            savedPlan = taskPlanRepository.save(plan);
        } catch (RuntimeException ex) {
            log.warn("BRANCH_CREATE_ROLLBACK name={}, branchId={}, planId={}, reason={}",
                    normalizedName,
                    savedBranch == null ? null : savedBranch.getId(),
                    plan.getId(),
                    ex.getMessage());
            // 计划写到一半失败时 savedPlan 为空，按已分配的 ID 补偿
            compensateCreation(savedBranch, savedPlan != null ? savedPlan : plan, ex);
            throw repositoryError("创建目标失败", ex);
        }
        recordTransition("created");
        log.info("BRANCH_CREATED branchId={}, name={}, planId={}, aiGenerated={}, attempts={}, fallbackReason={}",
                savedBranch.getId(), normalizedName, savedPlan.getId(), savedPlan.getAiGenerated(),
                outcome.getAttempts(), outcome.getFallbackReason());
        return savedBranch;
    }

    /**
     * 完成目标并追加里程碑提交。
     */
    public BranchEntity completeBranch(BranchEntity branch) {
        requireBranch(branch);
        BranchEntity before = branch.snapshot();
        branch.complete(LocalDateTime.now());
        persistTransition(branch, before);

        CommitEntity milestone = CommitEntity.of(branch.getId(),
                Constants.COMPLETE_COMMIT_PREFIX + branch.getName(),
                CommitTypeEnum.MILESTONE,
                null,
                branch.getCompletedAt());
        appendOrRevert(branch, before, milestone);
        recordTransition("completed");
        log.info("BRANCH_COMPLETED branchId={}, name={}", branch.getId(), branch.getName());
        return branch;
    }

    public BranchEntity abandonBranch(BranchEntity branch) {
        requireBranch(branch);
        if (branch.isMaster()) {
            throw new AppException(ResponseCode.INVALID_STATE, "主线分支不能废弃");
        }
        BranchEntity before = branch.snapshot();
        branch.abandon(LocalDateTime.now());
        persistTransition(branch, before);
        recordTransition("abandoned");
        log.info("BRANCH_ABANDONED branchId={}, name={}", branch.getId(), branch.getName());
        return branch;
    }

    public BranchEntity reactivateBranch(BranchEntity branch) {
        requireBranch(branch);
        BranchEntity before = branch.snapshot();
        branch.reactivate(LocalDateTime.now());
        persistTransition(branch, before);
        recordTransition("reactivated");
        log.info("BRANCH_REACTIVATED branchId={}, name={}", branch.getId(), branch.getName());
        return branch;
    }

    /**
     * 合并已完成的目标到主线：写入 mergedAt，并在主线追加一条里程碑提交。
     */
    public BranchEntity mergeBranch(BranchEntity branch) {
        requireBranch(branch);
        if (branch.isMaster()) {
            throw new AppException(ResponseCode.INVALID_STATE, "主线分支不能合并");
        }
        if (branch.getStatus() != BranchStatusEnum.COMPLETED || branch.isMerged()) {
            throw new AppException(ResponseCode.INVALID_STATE,
                    "只有已完成且未合并的目标才能合并，当前状态: " + branch.getStatus()
                            + (branch.isMerged() ? "（已合并）" : ""));
        }
        BranchEntity master = branchRepository.findMaster();
        if (master == null) {
            throw new AppException(ResponseCode.MASTER_NOT_FOUND);
        }
        TaskPlanEntity plan = taskPlanRepository.findByBranchId(branch.getId());
        int completedTasks = plan == null ? 0 : plan.completedCount();

        BranchEntity before = branch.snapshot();
        branch.markMerged(LocalDateTime.now());
        persistTransition(branch, before);

        CommitEntity mergeCommit = CommitEntity.of(master.getId(),
                Constants.MERGE_COMMIT_PREFIX + branch.getName() + "（达成 " + completedTasks + " 项任务）",
                CommitTypeEnum.MILESTONE,
                null,
                branch.getMergedAt());
        appendOrRevert(branch, before, mergeCommit);
        recordTransition("merged");
        log.info("BRANCH_MERGED branchId={}, masterId={}, completedTasks={}",
                branch.getId(), master.getId(), completedTasks);
        return branch;
    }

    /**
     * 重新生成任务计划：只调用一次生成器，不重试不兜底。
     * <p>
     * 先保存新计划再删除旧计划，任一步失败旧计划保持不变并向上抛出。
     * 手动添加的任务不会保留。
     * </p>
     */
    public TaskPlanEntity regenerateTaskPlan(BranchEntity branch) {
        requireBranch(branch);
        TaskPlanEntity oldPlan = planState(branch.getId()).requirePlan(branch.getId());

        GoalDescriptor goal = GoalDescriptor.builder()
                .title(branch.getName())
                .description(branch.getDescription())
                .timeframe(branch.getExpectedCompletionDate() == null
                        ? null : "在 " + branch.getExpectedCompletionDate() + " 之前")
                .build();
        TaskPlanEntity newPlan = taskPlanGenerator.generate(goal);
        newPlan.setBranchId(branch.getId());

        TaskPlanEntity savedPlan;
        try {
            savedPlan = taskPlanRepository.save(newPlan);
        } catch (RuntimeException ex) {
            log.warn("PLAN_REGENERATE_ROLLBACK branchId={}, oldPlanId={}, newPlanId={}, stage=save, reason={}",
                    branch.getId(), oldPlan.getId(), newPlan.getId(), ex.getMessage());
            discardPartialPlan(newPlan, ex);
            throw repositoryError("保存新任务计划失败", ex);
        }
        try {
            taskPlanRepository.deleteById(oldPlan.getId());
        } catch (RuntimeException ex) {
            log.warn("PLAN_REGENERATE_ROLLBACK branchId={}, oldPlanId={}, newPlanId={}, stage=delete-old, reason={}",
                    branch.getId(), oldPlan.getId(), savedPlan.getId(), ex.getMessage());
            try {
                taskPlanRepository.deleteById(savedPlan.getId());
            } catch (RuntimeException compensateEx) {
                log.error("PLAN_REGENERATE_COMPENSATE_FAILED branchId={}, newPlanId={}, reason={}",
                        branch.getId(), savedPlan.getId(), compensateEx.getMessage(), compensateEx);
                ex.addSuppressed(compensateEx);
            }
            throw repositoryError("替换任务计划失败", ex);
        }

        syncProgress(branch, savedPlan);
        recordTransition("plan_regenerated");
        log.info("PLAN_REGENERATED branchId={}, oldPlanId={}, newPlanId={}, tasks={}",
                branch.getId(), oldPlan.getId(), savedPlan.getId(), savedPlan.totalCount());
        return savedPlan;
    }

    /**
     * 删除非主线分支，级联删除计划、任务项与提交。
     */
    public void deleteBranch(BranchEntity branch) {
        requireBranch(branch);
        if (branch.isMaster()) {
            throw new AppException(ResponseCode.INVALID_STATE, "主线分支不能删除");
        }
        TaskPlanEntity plan = taskPlanRepository.findByBranchId(branch.getId());
        if (plan != null) {
            taskPlanRepository.deleteById(plan.getId());
        }
        commitLedgerDomainService.purge(branch.getId());
        branchRepository.deleteById(branch.getId());
        recordTransition("deleted");
        log.info("BRANCH_DELETED branchId={}, name={}", branch.getId(), branch.getName());
    }

    public BranchStatistics getStatistics(BranchEntity branch) {
        requireBranch(branch);
        TaskPlanEntity plan = taskPlanRepository.findByBranchId(branch.getId());
        return BranchStatistics.builder()
                .branchId(branch.getId())
                .commitCount(commitLedgerDomainService.count(branch.getId()))
                .totalTasks(plan == null ? 0 : plan.totalCount())
                .completedTasks(plan == null ? 0 : plan.completedCount())
                .progress(progressTrackerDomainService.progress(plan))
                .totalEstimatedDuration(progressTrackerDomainService.totalDuration(plan))
                .completedDuration(progressTrackerDomainService.completedDuration(plan))
                .remainingEstimatedDuration(progressTrackerDomainService.remainingDuration(plan))
                .build();
    }

    public BranchPlanState planState(Long branchId) {
        return BranchPlanState.of(taskPlanRepository.findByBranchId(branchId));
    }

    /**
     * 根据计划重新计算并保存分支进度。
     */
    public BranchEntity syncProgress(BranchEntity branch, TaskPlanEntity plan) {
        branch.setProgress(progressTrackerDomainService.progress(plan));
        branch.setUpdatedAt(LocalDateTime.now());
        return branchRepository.update(branch);
    }

    private void persistTransition(BranchEntity branch, BranchEntity before) {
        try {
            branchRepository.update(branch);
        } catch (RuntimeException ex) {
            branch.restoreFrom(before);
            throw repositoryError("保存分支状态失败", ex);
        }
    }

    private void appendOrRevert(BranchEntity branch, BranchEntity before, CommitEntity commit) {
        try {
            commitLedgerDomainService.append(commit);
        } catch (RuntimeException ex) {
            log.warn("BRANCH_TRANSITION_ROLLBACK branchId={}, revertTo={}, reason={}",
                    branch.getId(), before.getStatus(), ex.getMessage());
            branch.restoreFrom(before);
            try {
                branchRepository.update(branch);
            } catch (RuntimeException restoreEx) {
                log.error("BRANCH_TRANSITION_RESTORE_FAILED branchId={}, reason={}",
                        branch.getId(), restoreEx.getMessage(), restoreEx);
                ex.addSuppressed(restoreEx);
            }
            throw repositoryError("写入生命周期提交失败", ex);
        }
    }

    private void discardPartialPlan(TaskPlanEntity plan, RuntimeException cause) {
        if (plan.getId() == null) {
            return;
        }
        try {
            taskPlanRepository.deleteById(plan.getId());
        } catch (RuntimeException ex) {
            log.error("PLAN_REGENERATE_COMPENSATE_FAILED planId={}, reason={}", plan.getId(), ex.getMessage(), ex);
            cause.addSuppressed(ex);
        }
    }

    private void compensateCreation(BranchEntity savedBranch, TaskPlanEntity savedPlan, RuntimeException cause) {
        if (savedPlan != null && savedPlan.getId() != null) {
            try {
                taskPlanRepository.deleteById(savedPlan.getId());
            } catch (RuntimeException ex) {
                log.error("BRANCH_CREATE_COMPENSATE_FAILED planId={}, reason={}", savedPlan.getId(), ex.getMessage(), ex);
                cause.addSuppressed(ex);
            }
        }
        if (savedBranch != null && savedBranch.getId() != null) {
            try {
                branchRepository.deleteById(savedBranch.getId());
            } catch (RuntimeException ex) {
                log.error("BRANCH_CREATE_COMPENSATE_FAILED branchId={}, reason={}", savedBranch.getId(), ex.getMessage(), ex);
                cause.addSuppressed(ex);
            }
        }
    }

    private String validateName(String name) {
        String normalized = StringUtils.trimToEmpty(name);
        if (normalized.isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "目标名称不能为空");
        }
        if (normalized.length() > nameMaxLength) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "目标名称不能超过" + nameMaxLength + "个字符");
        }
        return normalized;
    }

    private String validateDescription(String description) {
        String normalized = StringUtils.trimToEmpty(description);
        if (normalized.length() > descriptionMaxLength) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "目标描述不能超过" + descriptionMaxLength + "个字符");
        }
        return normalized;
    }

    private void requireBranch(BranchEntity branch) {
        if (branch == null || branch.getId() == null) {
            throw new AppException(ResponseCode.BRANCH_NOT_FOUND);
        }
    }

    private AppException repositoryError(String message, RuntimeException cause) {
        if (cause instanceof AppException appException && appException.is(ResponseCode.REPOSITORY_ERROR)) {
            return appException;
        }
        return new AppException(ResponseCode.REPOSITORY_ERROR.getCode(), message + ": " + cause.getMessage(), cause);
    }

    private void recordTransition(String transition) {
        meterRegistry.counter(METRIC_BRANCH_TRANSITION_TOTAL, "transition", transition).increment();
    }
}
