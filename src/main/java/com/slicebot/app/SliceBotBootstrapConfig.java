package com.slicebot.app;

import com.slicebot.aggregate.ForecastEstimator;
import com.slicebot.aggregate.TimeSeriesAggregator;
import com.slicebot.app.properties.DbProperties;
import com.slicebot.app.properties.RateLimitProperties;
import com.slicebot.app.properties.RetrievalProperties;
import com.slicebot.config.Config;
import com.slicebot.coverage.ContextRegistry;
import com.slicebot.coverage.CoverageAnalyzer;
import com.slicebot.coverage.InMemoryContextRegistry;
import com.slicebot.coverage.StalenessPolicy;
import com.slicebot.core.Sleeper;
import com.slicebot.data.RateLimiter;
import com.slicebot.db.CachedRecordDao;
import com.slicebot.db.Database;
import com.slicebot.db.MetadataDao;
import com.slicebot.db.MetadataRunLock;
import com.slicebot.db.MetadataSuccessMarkerStore;
import com.slicebot.db.MigrationRunner;
import com.slicebot.plan.ConfiguredConnectionCapabilities;
import com.slicebot.plan.ConnectionCapabilities;
import com.slicebot.plan.FetchPlanBuilder;
import com.slicebot.runner.FetchExecutor;
import com.slicebot.runner.ForecastHorizonRecomputer;
import com.slicebot.runner.HorizonRecomputer;
import com.slicebot.runner.ProcessRunLock;
import com.slicebot.runner.RetrievalOrchestrator;
import com.slicebot.runner.RunLock;
import com.slicebot.runner.SuccessMarkerStore;
import com.slicebot.slice.PinnedDslExploder;
import com.slicebot.slice.SliceResolver;
import com.slicebot.storage.CachedRecordStore;
import com.slicebot.storage.InMemoryCachedRecordStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Spring wiring for embedding the retrieval engine. Database beans are lazy so that
 * {@code store.mode=memory} never opens a connection.
 */
@Configuration
@EnableConfigurationProperties({DbProperties.class, RetrievalProperties.class, RateLimitProperties.class})
public class SliceBotBootstrapConfig {
    @Bean
    public Config sliceBotConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, rawProperties);
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                firstNonBlank(System.getenv("SLICEBOT_DB_URL"), dbProperties.getUrl()),
                firstNonBlank(System.getenv("SLICEBOT_DB_USER"), dbProperties.getUser()),
                firstNonBlank(System.getenv("SLICEBOT_DB_PASS"), dbProperties.getPass()),
                dbProperties.getSchema()
        );
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public MetadataDao metadataDao(Database database) {
        return new MetadataDao(database);
    }

    @Bean
    public CachedRecordStore cachedRecordStore(Config config, ObjectProvider<Database> database) {
        if (isMemoryStore(config)) {
            return new InMemoryCachedRecordStore();
        }
        return new CachedRecordDao(database.getObject());
    }

    @Bean
    public SuccessMarkerStore successMarkerStore(
            Config config,
            RetrievalProperties retrieval,
            ObjectProvider<MetadataDao> metadataDao
    ) {
        if (isMemoryStore(config)) {
            return new InMemorySuccessMarker();
        }
        return new MetadataSuccessMarkerStore(metadataDao.getObject(), retrieval.getSuccessMarkerKey());
    }

    @Bean
    public RunLock runLock(Config config, RetrievalProperties retrieval, ObjectProvider<MetadataDao> metadataDao) {
        if (isMemoryStore(config)) {
            return new ProcessRunLock();
        }
        return new MetadataRunLock(metadataDao.getObject(), retrieval.getLockName(),
                Duration.ofMinutes(Math.max(1, retrieval.getLockLeaseMinutes())));
    }

    @Bean
    public SliceResolver sliceResolver() {
        return new SliceResolver();
    }

    @Bean
    public TimeSeriesAggregator timeSeriesAggregator(SliceResolver resolver) {
        return new TimeSeriesAggregator(resolver);
    }

    @Bean
    public ContextRegistry contextRegistry() {
        return new InMemoryContextRegistry(List.of());
    }

    @Bean
    public CoverageAnalyzer coverageAnalyzer(
            SliceResolver resolver,
            ContextRegistry registry,
            ObjectProvider<StalenessPolicy> staleness,
            TimeSeriesAggregator aggregator
    ) {
        return new CoverageAnalyzer(resolver, registry, staleness.getIfAvailable(() -> StalenessPolicy.NEVER),
                aggregator);
    }

    @Bean
    public ConnectionCapabilities connectionCapabilities(Config config) {
        return new ConfiguredConnectionCapabilities(config);
    }

    @Bean
    public FetchPlanBuilder fetchPlanBuilder(
            SliceResolver resolver,
            CoverageAnalyzer coverage,
            ConnectionCapabilities connections,
            CachedRecordStore store
    ) {
        return new FetchPlanBuilder(resolver, coverage, connections, store);
    }

    @Bean
    public RateLimiter rateLimiter(RateLimitProperties rateLimit) {
        Config limits = Config.of(Map.of(
                "ratelimit.min_delay_ms", Long.toString(rateLimit.getMinDelayMs()),
                "ratelimit.initial_backoff_ms", Long.toString(rateLimit.getInitialBackoffMs()),
                "ratelimit.backoff_multiplier", Double.toString(rateLimit.getBackoffMultiplier()),
                "ratelimit.max_backoff_ms", Long.toString(rateLimit.getMaxBackoffMs())
        ));
        return new RateLimiter(limits);
    }

    @Bean
    public HorizonRecomputer horizonRecomputer(
            Config config,
            CachedRecordStore store,
            SliceResolver resolver,
            TimeSeriesAggregator aggregator
    ) {
        return new ForecastHorizonRecomputer(store, resolver, aggregator, new ForecastEstimator(config));
    }

    @Bean
    public RetrievalOrchestrator retrievalOrchestrator(
            Config config,
            FetchPlanBuilder planBuilder,
            TimeSeriesAggregator aggregator,
            CachedRecordStore store,
            ObjectProvider<FetchExecutor> executor,
            RateLimiter rateLimiter,
            SuccessMarkerStore successMarker,
            HorizonRecomputer horizon,
            RunLock runLock
    ) {
        return new RetrievalOrchestrator(
                config,
                new PinnedDslExploder(),
                planBuilder,
                aggregator,
                store,
                executor.getIfAvailable(),
                rateLimiter,
                successMarker,
                horizon,
                runLock,
                Sleeper.SYSTEM,
                Clock.systemUTC()
        );
    }

    static boolean isMemoryStore(Config config) {
        return "memory".equalsIgnoreCase(config.getString("store.mode", "postgres"));
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }
        return "";
    }

    static final class InMemorySuccessMarker implements SuccessMarkerStore {
        private volatile Instant last;

        @Override
        public void markSuccess(Instant finishedAt) {
            last = finishedAt;
        }

        @Override
        public Optional<Instant> lastSuccess() {
            return Optional.ofNullable(last);
        }
    }
}
