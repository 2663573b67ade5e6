package com.lifegit.test.domain;

import com.lifegit.domain.plan.adapter.gateway.ITaskPlanGenerator;
import com.lifegit.domain.plan.model.entity.TaskItemEntity;
import com.lifegit.domain.plan.model.valobj.GoalDescriptor;
import com.lifegit.domain.plan.model.valobj.PlanGenerationOutcome;
import com.lifegit.domain.plan.service.AIFailurePolicyDomainService;
import com.lifegit.domain.plan.service.TaskPlanAssemblyDomainService;
import com.lifegit.infrastructure.planning.DelayedBackoffScheduler;
import com.lifegit.test.support.ImmediateBackoffScheduler;
import com.lifegit.test.support.LifeGitTestContext;
import com.lifegit.types.enums.AIServiceErrorCategoryEnum;
import com.lifegit.types.enums.TaskTimeScopeEnum;
import com.lifegit.types.exception.AIServiceException;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AIFailurePolicyDomainServiceTest {

    private ITaskPlanGenerator taskPlanGenerator;
    private ImmediateBackoffScheduler backoffScheduler;
    private AIFailurePolicyDomainService failurePolicy;
    private GoalDescriptor goal;

    @BeforeEach
    public void setUp() {
        taskPlanGenerator = mock(ITaskPlanGenerator.class);
        backoffScheduler = new ImmediateBackoffScheduler();
        failurePolicy = new AIFailurePolicyDomainService(taskPlanGenerator,
                new TaskPlanAssemblyDomainService(), backoffScheduler, 3, 1000);
        goal = GoalDescriptor.builder().title("学习 Rust").description("三个月入门").build();
    }

    @Test
    public void shouldRetryThreeTimesWithExponentialDelaysThenFallback() {
        when(taskPlanGenerator.generate(any()))
                .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.NETWORK, "connection reset"));

        PlanGenerationOutcome outcome = failurePolicy.generateWithFallbackAsync(goal).join();

        verify(taskPlanGenerator, times(4)).generate(any());
        Assertions.assertEquals(4, outcome.getAttempts());
        Assertions.assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4)),
                outcome.getDelays());
        Assertions.assertEquals(outcome.getDelays(), backoffScheduler.getRequested());
        Assertions.assertTrue(outcome.isFallbackUsed());
        Assertions.assertEquals(AIServiceErrorCategoryEnum.NETWORK, outcome.getFallbackReason());
        Assertions.assertEquals("connection reset", outcome.getLastErrorMessage());
    }

    @Test
    public void shouldBuildDeterministicManualPlanOnFallback() {
        when(taskPlanGenerator.generate(any()))
                .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.SERVER_ERROR, "503"));

        PlanGenerationOutcome outcome = failurePolicy.generateWithFallbackAsync(goal).join();

        Assertions.assertFalse(outcome.getPlan().isAiPlan());
        Assertions.assertEquals("手动创建的任务计划", outcome.getPlan().getTotalDuration());
        Assertions.assertEquals(1, outcome.getPlan().totalCount());
        TaskItemEntity task = outcome.getPlan().getTasks().get(0);
        Assertions.assertEquals("开始执行：学习 Rust", task.getTitle());
        Assertions.assertEquals("请根据目标描述制定具体的执行步骤：三个月入门", task.getDescription());
        Assertions.assertEquals(TaskTimeScopeEnum.DAILY, task.getTimeScope());
        Assertions.assertEquals(60, task.getEstimatedDuration());
        Assertions.assertEquals(0, task.getOrderIndex());
        Assertions.assertFalse(task.getAiGenerated());
        Assertions.assertNotNull(task.getExecutionTips());
    }

    @Test
    public void shouldFallbackImmediatelyOnNonRetryableError() {
        when(taskPlanGenerator.generate(any()))
                .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.UNAUTHORIZED, "invalid api key"));

        PlanGenerationOutcome outcome = failurePolicy.generateWithFallbackAsync(goal).join();

        verify(taskPlanGenerator, times(1)).generate(any());
        Assertions.assertEquals(1, outcome.getAttempts());
        Assertions.assertTrue(outcome.getDelays().isEmpty());
        Assertions.assertTrue(backoffScheduler.getRequested().isEmpty());
        Assertions.assertEquals(AIServiceErrorCategoryEnum.UNAUTHORIZED, outcome.getFallbackReason());
    }

    @Test
    public void shouldNotRetryParsingOrValidationFailures() {
        when(taskPlanGenerator.generate(any()))
                .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.VALIDATION, "Task plan must contain at least one task"));

        PlanGenerationOutcome outcome = failurePolicy.generateWithFallbackAsync(goal).join();

        verify(taskPlanGenerator, times(1)).generate(any());
        Assertions.assertEquals(AIServiceErrorCategoryEnum.VALIDATION, outcome.getFallbackReason());
        Assertions.assertEquals("Task plan must contain at least one task", outcome.getLastErrorMessage());
    }

    @Test
    public void shouldReturnAiPlanWhenRetrySucceeds() {
        when(taskPlanGenerator.generate(any()))
                .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.RATE_LIMITED, "429"))
                .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.EMPTY_RESPONSE, "empty"))
                .thenReturn(LifeGitTestContext.aiPlan("读完官方教程", "写一个 CLI"));

        PlanGenerationOutcome outcome = failurePolicy.generateWithFallbackAsync(goal).join();

        Assertions.assertFalse(outcome.isFallbackUsed());
        Assertions.assertNull(outcome.getFallbackReason());
        Assertions.assertEquals(3, outcome.getAttempts());
        Assertions.assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), outcome.getDelays());
        Assertions.assertTrue(outcome.getPlan().isAiPlan());
        Assertions.assertEquals(2, outcome.getPlan().totalCount());
    }

    @Test
    public void shouldTreatUnclassifiedErrorsAsRetryable() {
        when(taskPlanGenerator.generate(any()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(LifeGitTestContext.aiPlan("第一步"));

        PlanGenerationOutcome outcome = failurePolicy.generateWithFallbackAsync(goal).join();

        Assertions.assertFalse(outcome.isFallbackUsed());
        Assertions.assertEquals(2, outcome.getAttempts());
    }

    @Test
    public void shouldStartRetryCounterFreshForEachInvocation() {
        when(taskPlanGenerator.generate(any()))
                .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.NETWORK, "down"));

        failurePolicy.generateWithFallbackAsync(goal).join();
        PlanGenerationOutcome second = failurePolicy.generateWithFallbackAsync(goal).join();

        verify(taskPlanGenerator, times(8)).generate(any());
        Assertions.assertEquals(4, second.getAttempts());
        Assertions.assertEquals(3, second.getDelays().size());
    }

    @Test
    public void shouldClassifyWrappedErrors() {
        Assertions.assertEquals(AIServiceErrorCategoryEnum.NETWORK, failurePolicy.classify(new IOException("reset")));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.RATE_LIMITED, failurePolicy.classify(
                new CompletionException(new AIServiceException(AIServiceErrorCategoryEnum.RATE_LIMITED, "429"))));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.UNKNOWN, failurePolicy.classify(new RuntimeException("x")));
        Assertions.assertEquals(AIServiceErrorCategoryEnum.UNKNOWN, failurePolicy.classify(null));
    }

    @Test
    public void shouldComputeBackoffDelays() {
        Assertions.assertEquals(Duration.ofSeconds(1), failurePolicy.backoffDelay(1));
        Assertions.assertEquals(Duration.ofSeconds(2), failurePolicy.backoffDelay(2));
        Assertions.assertEquals(Duration.ofSeconds(4), failurePolicy.backoffDelay(3));
        Assertions.assertEquals(3, failurePolicy.getMaxRetries());
    }

    @Test
    public void shouldRecordGenerationAndFallbackMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        Metrics.addRegistry(registry);
        try {
            when(taskPlanGenerator.generate(any()))
                    .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.BAD_REQUEST, "400"))
                    .thenReturn(LifeGitTestContext.aiPlan("第一步"));

            failurePolicy.generateWithFallbackAsync(goal).join();
            failurePolicy.generateWithFallbackAsync(goal).join();

            Assertions.assertEquals(1.0D, registry.get("lifegit.plan.generation.total")
                    .tag("result", "fallback")
                    .counter()
                    .count(), 0.0001D);
            Assertions.assertEquals(1.0D, registry.get("lifegit.plan.generation.total")
                    .tag("result", "ai")
                    .counter()
                    .count(), 0.0001D);
            Assertions.assertEquals(1.0D, registry.get("lifegit.plan.fallback.total")
                    .tag("reason", "BAD_REQUEST")
                    .counter()
                    .count(), 0.0001D);
        } finally {
            Metrics.removeRegistry(registry);
        }
    }

    @Test
    public void shouldWaitWithoutBlockingCallerOnRealScheduler() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            AIFailurePolicyDomainService realPolicy = new AIFailurePolicyDomainService(taskPlanGenerator,
                    new TaskPlanAssemblyDomainService(), new DelayedBackoffScheduler(executor), 2, 10);
            when(taskPlanGenerator.generate(any()))
                    .thenThrow(new AIServiceException(AIServiceErrorCategoryEnum.SERVER_ERROR, "502"))
                    .thenReturn(LifeGitTestContext.aiPlan("第一步"));

            PlanGenerationOutcome outcome = realPolicy.generateWithFallbackAsync(goal).get(5, TimeUnit.SECONDS);

            Assertions.assertFalse(outcome.isFallbackUsed());
            Assertions.assertEquals(2, outcome.getAttempts());
            Assertions.assertEquals(List.of(Duration.ofMillis(10)), outcome.getDelays());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void shouldStartFirstAttemptOffCallerThread() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch release = new CountDownLatch(1);
        try {
            AIFailurePolicyDomainService realPolicy = new AIFailurePolicyDomainService(taskPlanGenerator,
                    new TaskPlanAssemblyDomainService(), new DelayedBackoffScheduler(executor), 0, 10);
            AtomicReference<Thread> generatingThread = new AtomicReference<>();
            when(taskPlanGenerator.generate(any())).thenAnswer(invocation -> {
                generatingThread.set(Thread.currentThread());
                release.await(5, TimeUnit.SECONDS);
                return LifeGitTestContext.aiPlan("第一步");
            });

            CompletableFuture<PlanGenerationOutcome> future = realPolicy.generateWithFallbackAsync(goal);

            Assertions.assertFalse(future.isDone());
            release.countDown();
            PlanGenerationOutcome outcome = future.get(5, TimeUnit.SECONDS);
            Assertions.assertNotSame(Thread.currentThread(), generatingThread.get());
            Assertions.assertFalse(outcome.isFallbackUsed());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }
}
