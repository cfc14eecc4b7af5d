package com.phillippitts.openmusic.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes resolver executor metrics via Micrometer:
 * <ul>
 *   <li>resolver.pool.size - Current number of threads in the pool</li>
 *   <li>resolver.pool.active - Number of adapter calls currently executing</li>
 *   <li>resolver.pool.queued - Number of adapter calls waiting in the queue</li>
 *   <li>resolver.pool.completed - Cumulative count of completed adapter calls</li>
 * </ul>
 *
 * <p>Additionally logs a health summary every 5 minutes. A growing active count with a flat
 * completed count usually means a backend hangs past its deadline.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> resolverExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("resolverExecutor") ObjectProvider<ThreadPoolTaskExecutor> resolverExecutorProvider) {
        this.resolverExecutorProvider = resolverExecutorProvider;
    }

    @Bean
    public MeterBinder resolverExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = resolverExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("resolver.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the resolver pool")
                    .register(registry);

            Gauge.builder("resolver.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively executing adapter calls")
                    .register(registry);

            Gauge.builder("resolver.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of adapter calls waiting in the queue")
                    .register(registry);

            Gauge.builder("resolver.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed adapter calls")
                    .register(registry);

            LOG.info("Resolver thread pool metrics registered: resolver.pool.*");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = resolverExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Resolver Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount()
        );
    }
}
