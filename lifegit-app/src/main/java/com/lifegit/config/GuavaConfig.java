package com.lifegit.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.lifegit.domain.branch.model.valobj.BranchStatistics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * 分支统计按分支 ID 缓存，写操作后由命令服务主动失效。
 * </p>
 *
 * @author lifegit
 * @since 2025-01-29
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "branchStatisticsCache")
    public Cache<Long, BranchStatistics> branchStatisticsCache(
            @Value("${lifegit.cache.statistics.expire-seconds:30}") long expireSeconds,
            @Value("${lifegit.cache.statistics.maximum-size:1000}") long maximumSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(expireSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(Math.max(maximumSize, 1L))
                .build();
    }

}
