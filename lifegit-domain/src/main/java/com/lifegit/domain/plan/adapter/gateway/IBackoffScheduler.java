package com.lifegit.domain.plan.adapter.gateway;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * 非阻塞退避等待。
 */
public interface IBackoffScheduler {

    /**
     * 返回在指定时长后完成的 future，不占用调用线程。
     */
    CompletableFuture<Void> delay(Duration delay);

    /**
     * 在后台线程上启动任务，调用线程立即返回。
     */
    <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> task);
}
