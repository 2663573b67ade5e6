package com.lifegit.test.support;

import com.lifegit.domain.plan.adapter.gateway.IBackoffScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 记录退避时长并立即完成，任务在调用线程上执行，测试不真实等待。
 */
public class ImmediateBackoffScheduler implements IBackoffScheduler {

    private final List<Duration> requested = new ArrayList<>();

    @Override
    public CompletableFuture<Void> delay(Duration delay) {
        requested.add(delay);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> task) {
        return task.get();
    }

    public List<Duration> getRequested() {
        return requested;
    }
}
