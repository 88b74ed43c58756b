package com.recaprio.projection.config;

import com.recaprio.projection.repository.BaseRowRepository;
import com.recaprio.projection.repository.IndexedViewRepository;
import com.recaprio.projection.repository.SummaryRowRepository;
import com.recaprio.projection.rule.DerivationRule;
import com.recaprio.projection.rule.FreeCoresRule;
import com.recaprio.projection.store.IndexedViewProjectionStore;
import com.recaprio.projection.store.InlineProjectionStore;
import com.recaprio.projection.store.ProjectionStore;
import com.recaprio.projection.store.SummaryTableProjectionStore;
import com.recaprio.projection.sync.KeyedExecutor;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Slf4j
@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DerivationRule derivationRule(SyncProperties properties) {
        return new FreeCoresRule(properties.getRule().getGhzPerCore());
    }

    @Bean
    public ProjectionStore projectionStore(SyncProperties properties,
                                           BaseRowRepository baseRowRepository,
                                           IndexedViewRepository indexedViewRepository,
                                           SummaryRowRepository summaryRowRepository,
                                           Clock clock) {
        log.info("[SYNC] Projection mode {} with staleness window {}",
                properties.getMode(), properties.getStalenessWindow());
        return switch (properties.getMode()) {
            case INLINE -> new InlineProjectionStore(baseRowRepository, clock);
            case INDEXED_VIEW -> new IndexedViewProjectionStore(indexedViewRepository, clock);
            case SUMMARY_TABLE -> new SummaryTableProjectionStore(summaryRowRepository, clock);
        };
    }

    @Bean(destroyMethod = "shutdown")
    public KeyedExecutor syncWorkers(SyncProperties properties) {
        return new KeyedExecutor("sync-worker-", properties.getWorkers());
    }

    @Bean(name = "syncRetryScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService syncRetryScheduler() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("sync-retry-");
        threadFactory.setDaemon(true);
        return Executors.newSingleThreadScheduledExecutor(threadFactory);
    }

    @Bean(name = "projectionWriteExecutor", destroyMethod = "shutdown")
    public ExecutorService projectionWriteExecutor(SyncProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("projection-write-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.getWorkers(), threadFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeLimiterRegistry timeLimiterRegistry() {
        return TimeLimiterRegistry.ofDefaults();
    }

    /**
     * Deadline for one asynchronous projection write. A write that overruns is left to
     * finish on its own; its versioned write cannot overwrite anything newer.
     */
    @Bean
    public TimeLimiter projectionUpsertTimeLimiter(TimeLimiterRegistry registry, SyncProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getUpsertTimeout())
                .cancelRunningFuture(false)
                .build();
        return registry.timeLimiter("projection-upsert", config);
    }
}
