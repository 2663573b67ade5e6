package com.lifegit.domain.plan.service;

import com.lifegit.domain.plan.adapter.gateway.IBackoffScheduler;
import com.lifegit.domain.plan.adapter.gateway.ITaskPlanGenerator;
import com.lifegit.domain.plan.model.entity.TaskPlanEntity;
import com.lifegit.domain.plan.model.valobj.GoalDescriptor;
import com.lifegit.domain.plan.model.valobj.PlanGenerationOutcome;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.exception.AIServiceException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * AI 失败策略领域服务：对可重试失败做指数退避重试，重试耗尽或遇到不可重试失败时返回手动兜底计划。
 * <p>
 * 第 n 次重试前等待 base × 2^(n-1)，重试计数只在单次调用内有效。
 * 退避通过 {@link IBackoffScheduler} 非阻塞等待。
 * </p>
 */
@Slf4j
@Service
public class AIFailurePolicyDomainService {

    static final String METRIC_PLAN_GENERATION_TOTAL = "lifegit.plan.generation.total";
    static final String METRIC_PLAN_FALLBACK_TOTAL = "lifegit.plan.fallback.total";

    private final ITaskPlanGenerator taskPlanGenerator;
    private final TaskPlanAssemblyDomainService taskPlanAssemblyDomainService;
    private final IBackoffScheduler backoffScheduler;
    private final int maxRetries;
    private final Duration baseDelay;
    private final MeterRegistry meterRegistry;

    @Autowired
    public AIFailurePolicyDomainService(ITaskPlanGenerator taskPlanGenerator,
                                        TaskPlanAssemblyDomainService taskPlanAssemblyDomainService,
                                        IBackoffScheduler backoffScheduler,
                                        @Value("${lifegit.ai.retry.max-retries:3}") int maxRetries,
                                        @Value("${lifegit.ai.retry.base-delay-ms:1000}") long baseDelayMs) {
        this.taskPlanGenerator = taskPlanGenerator;
        this.taskPlanAssemblyDomainService = taskPlanAssemblyDomainService;
        this.backoffScheduler = backoffScheduler;
        this.maxRetries = Math.max(maxRetries, 0);
        this.baseDelay = Duration.ofMillis(Math.max(baseDelayMs, 0L));
        this.meterRegistry = Metrics.globalRegistry;
    }

    /**
     * 异步生成，首次调用也在后台线程上发起，返回的 future 总是正常完成。
     */
    public CompletableFuture<PlanGenerationOutcome> generateWithFallbackAsync(GoalDescriptor goal) {
        List<Duration> delays = new ArrayList<>();
        return backoffScheduler.execute(() -> attempt(goal, 1, delays))
                .exceptionally(ex -> fallback(goal, delays.size() + 1, delays, classify(ex), ex));
    }

    /**
     * 第 attempt 次重试前的等待时长：base × 2^(attempt-1)。
     */
    public Duration backoffDelay(int attempt) {
        int exponent = Math.max(attempt - 1, 0);
        return baseDelay.multipliedBy(1L << Math.min(exponent, 30));
    }

    /**
     * 失败分类：AIServiceException 取自带分类，I/O 与超时视为网络失败，其余为 UNKNOWN。
     */
    public AIServiceErrorCategoryEnum classify(Throwable error) {
        Throwable cursor = error;
        while (cursor != null) {
            if (cursor instanceof AIServiceException aiServiceException) {
                return aiServiceException.getCategory();
            }
            if (cursor instanceof IOException || cursor instanceof TimeoutException) {
                return AIServiceErrorCategoryEnum.NETWORK;
            }
            if (cursor.getCause() == cursor) {
                break;
            }
            cursor = cursor.getCause();
        }
        return AIServiceErrorCategoryEnum.UNKNOWN;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private CompletableFuture<PlanGenerationOutcome> attempt(GoalDescriptor goal, int attempt, List<Duration> delays) {
        TaskPlanEntity plan;
        try {
            plan = taskPlanGenerator.generate(goal);
            if (plan == null) {
                throw new AIServiceException(AIServiceErrorCategoryEnum.EMPTY_RESPONSE, "Task plan generator returned nothing");
            }
        } catch (Exception ex) {
            AIServiceErrorCategoryEnum category = classify(ex);
            if (!category.isRetryable()) {
                log.warn("PLAN_GENERATION_FAILED goal={}, attempt={}, category={}, retryable=false, reason={}",
                        titleOf(goal), attempt, category, ex.getMessage());
                return CompletableFuture.completedFuture(fallback(goal, attempt, delays, category, ex));
            }
            if (attempt > maxRetries) {
                log.warn("PLAN_GENERATION_EXHAUSTED goal={}, attempts={}, category={}, reason={}",
                        titleOf(goal), attempt, category, ex.getMessage());
                return CompletableFuture.completedFuture(fallback(goal, attempt, delays, category, ex));
            }
            Duration delay = backoffDelay(attempt);
            delays.add(delay);
            log.warn("PLAN_GENERATION_RETRY goal={}, attempt={}/{}, category={}, delayMs={}, reason={}",
                    titleOf(goal), attempt, maxRetries + 1, category, delay.toMillis(), ex.getMessage());
            return backoffScheduler.delay(delay)
                    .thenCompose(ignored -> attempt(goal, attempt + 1, delays));
        }
        meterRegistry.counter(METRIC_PLAN_GENERATION_TOTAL, "result", "ai").increment();
        log.info("PLAN_GENERATED goal={}, attempts={}, tasks={}", titleOf(goal), attempt, plan.totalCount());
        return CompletableFuture.completedFuture(PlanGenerationOutcome.builder()
                .plan(plan)
                .attempts(attempt)
                .delays(new ArrayList<>(delays))
                .fallbackUsed(false)
                .build());
    }

    private PlanGenerationOutcome fallback(GoalDescriptor goal,
                                           int attempts,
                                           List<Duration> delays,
                                           AIServiceErrorCategoryEnum reason,
                                           Throwable error) {
        meterRegistry.counter(METRIC_PLAN_GENERATION_TOTAL, "result", "fallback").increment();
        meterRegistry.counter(METRIC_PLAN_FALLBACK_TOTAL, "reason", reason.name()).increment();
        log.warn("PLAN_FALLBACK goal={}, attempts={}, reason={}", titleOf(goal), attempts, reason);
        return PlanGenerationOutcome.builder()
                .plan(taskPlanAssemblyDomainService.manualFallbackPlan(goal, LocalDateTime.now()))
                .attempts(attempts)
                .delays(new ArrayList<>(delays))
                .fallbackUsed(true)
                .fallbackReason(reason)
                .lastErrorMessage(messageOf(error))
                .build();
    }

    private String messageOf(Throwable error) {
        Throwable cursor = error;
        if (cursor instanceof CompletionException && cursor.getCause() != null) {
            cursor = cursor.getCause();
        }
        return cursor == null ? null : StringUtils.defaultIfBlank(cursor.getMessage(), cursor.getClass().getSimpleName());
    }

    private String titleOf(GoalDescriptor goal) {
        return goal == null ? "-" : goal.getTitle();
    }
}
