package com.lifegit.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 线程池配置属性，前缀 thread.pool.executor.config。
 * <p>
 * 任务计划的异步生成与重试退避都跑在这个线程池上。
 * </p>
 *
 * @author lifegit
 * @since 2025-01-29
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数，默认4 */
    private Integer corePoolSize = 4;

    /** 最大线程数，默认16 */
    private Integer maxPoolSize = 16;

    /** 空闲线程最大存活时间（秒），默认10L */
    private Long keepAliveTime = 10L;

    /** 阻塞队列最大容量，默认500 */
    private Integer blockQueueSize = 500;

    /**
     * 拒绝策略，默认CallerRunsPolicy。
     * <ul>
     *   <li>AbortPolicy：丢弃任务并抛出RejectedExecutionException异常</li>
     *   <li>DiscardPolicy：直接丢弃任务，不抛出异常</li>
     *   <li>DiscardOldestPolicy：将最早进入队列的任务删除，之后再尝试加入队列</li>
     *   <li>CallerRunsPolicy：如果任务添加线程池失败，调用线程自己执行该任务</li>
     * </ul>
     */
    private String policy = "CallerRunsPolicy";

}
