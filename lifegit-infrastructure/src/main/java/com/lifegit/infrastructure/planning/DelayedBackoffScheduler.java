package com.lifegit.infrastructure.planning;

import com.lifegit.domain.plan.adapter.gateway.IBackoffScheduler;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 基于 {@link CompletableFuture#delayedExecutor} 的退避等待，到期后在公共线程池继续。
 */
@Component
public class DelayedBackoffScheduler implements IBackoffScheduler {

    private final Executor executor;

    public DelayedBackoffScheduler(@Qualifier("commonThreadPoolExecutor") Executor executor) {
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return CompletableFuture.completedFuture(null);
        }
        Executor delayed = CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS, executor);
        return CompletableFuture.runAsync(() -> { }, delayed);
    }

    @Override
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> task) {
        return CompletableFuture.supplyAsync(task, executor).thenCompose(Function.identity());
    }
}
