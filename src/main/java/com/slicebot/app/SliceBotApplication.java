package com.slicebot.app;

import com.slicebot.aggregate.ForecastEstimator;
import com.slicebot.aggregate.TimeSeriesAggregator;
import com.slicebot.config.Config;
import com.slicebot.core.Sleeper;
import com.slicebot.coverage.CoverageAnalyzer;
import com.slicebot.coverage.InMemoryContextRegistry;
import com.slicebot.coverage.StalenessPolicy;
import com.slicebot.data.RateLimiter;
import com.slicebot.db.CachedRecordDao;
import com.slicebot.db.Database;
import com.slicebot.db.MetadataDao;
import com.slicebot.db.MetadataRunLock;
import com.slicebot.db.MetadataSuccessMarkerStore;
import com.slicebot.db.MigrationRunner;
import com.slicebot.graph.GraphDocument;
import com.slicebot.graph.GraphJsonReader;
import com.slicebot.model.PlanSummary;
import com.slicebot.model.TimeBounds;
import com.slicebot.plan.ConfiguredConnectionCapabilities;
import com.slicebot.plan.FetchPlanBuilder;
import com.slicebot.plan.FetchPlanJson;
import com.slicebot.plan.FetchPlanResult;
import com.slicebot.plan.PlanOptions;
import com.slicebot.runner.FetchExecutor;
import com.slicebot.runner.ForecastHorizonRecomputer;
import com.slicebot.runner.ProcessRunLock;
import com.slicebot.runner.RetrievalOptions;
import com.slicebot.runner.RetrievalOrchestrator;
import com.slicebot.runner.RetrievalProgress;
import com.slicebot.runner.RetrievalResult;
import com.slicebot.runner.RunLock;
import com.slicebot.runner.SliceStat;
import com.slicebot.runner.SuccessMarkerStore;
import com.slicebot.slice.PinnedDslExploder;
import com.slicebot.slice.SliceExploder;
import com.slicebot.slice.SliceResolver;
import com.slicebot.storage.CachedRecordStore;
import com.slicebot.storage.InMemoryCachedRecordStore;
import com.slicebot.utils.DslDates;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * 模块说明：SliceBotApplication（class）。
 * 主要职责：命令行入口，解析参数、加载配置与图文件、按 store.mode 装配存储，
 * 然后执行「仅计划」或完整检索流程，并把结果映射为进程退出码。
 * 使用建议：退出码 0 表示干净完成，3 表示中止或存在错误，2 为参数问题，1 为致命错误。
 */
public final class SliceBotApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INCOMPLETE = 3;

    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new SliceBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("slicebot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("slicebot", options);
            return EXIT_OK;
        }

        String graphPath = cmd.getOptionValue("graph");
        String dsl = cmd.getOptionValue("dsl");
        if (isBlank(graphPath) || isBlank(dsl)) {
            new HelpFormatter().printHelp("slicebot", options);
            System.err.println("ERROR: --graph and --dsl are required.");
            return EXIT_USAGE;
        }

        Long cooldownMillis;
        TimeBounds window;
        try {
            cooldownMillis = parseCooldown(cmd.getOptionValue("cooldown-minutes"));
            window = parseWindow(cmd.getOptionValue("window"), LocalDate.now(ZoneOffset.UTC));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);

            GraphDocument document = new GraphJsonReader().read(workingDir.resolve(graphPath).normalize());
            Components components = wire(config, document);

            if (cmd.hasOption("plan-only")) {
                return printPlans(components, document, dsl, window, cmd.hasOption("bust-cache"));
            }

            boolean simulate = cmd.hasOption("simulate");
            FetchExecutor executor = findExecutor().orElse(null);
            if (!simulate && executor == null) {
                System.err.println("ERROR: live retrieval needs a FetchExecutor registered via META-INF/services/"
                        + FetchExecutor.class.getName() + ". Use --simulate for a dry trace.");
                return EXIT_USAGE;
            }

            RetrievalOrchestrator orchestrator = new RetrievalOrchestrator(
                    config,
                    components.exploder,
                    components.planBuilder,
                    components.aggregator,
                    components.store,
                    executor,
                    new RateLimiter(config),
                    components.successMarker,
                    new ForecastHorizonRecomputer(components.store, components.resolver, components.aggregator,
                            new ForecastEstimator(config)),
                    components.runLock,
                    Sleeper.SYSTEM,
                    Clock.systemUTC()
            );

            Path abortFile = cmd.hasOption("abort-file")
                    ? workingDir.resolve(cmd.getOptionValue("abort-file")).normalize()
                    : null;
            RetrievalResult result = orchestrator.execute(RetrievalOptions.builder()
                    .graph(document.graph)
                    .pinnedDsl(dsl)
                    .window(window)
                    .bustCache(cmd.hasOption("bust-cache"))
                    .simulate(simulate)
                    .automated(cmd.hasOption("automated"))
                    .cooldownMillis(cooldownMillis)
                    .progress(SliceBotApplication::printProgress)
                    .shouldAbort(() -> abortFile != null && Files.exists(abortFile))
                    .build());
            printResult(result);
            return result.isClean() ? EXIT_OK : EXIT_INCOMPLETE;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace(System.err);
            return EXIT_FATAL;
        }
    }

    private int printPlans(Components components, GraphDocument document, String dsl, TimeBounds window,
                           boolean bustCache) {
        Instant referenceNow = Instant.now();
        PlanOptions planOptions = PlanOptions.builder().referenceNow(referenceNow).bustCache(bustCache).build();
        int failures = 0;
        for (String slice : components.exploder.explode(dsl)) {
            try {
                FetchPlanResult result = components.planBuilder.build(document.graph, slice, window, planOptions);
                PlanSummary summary = result.plan.summarise();
                System.out.println(FetchPlanJson.toJson(result.plan));
                System.err.println(String.format(Locale.US,
                        "plan slice=%s covered=%d fetch=%d unfetchable=%d fetch_days=%d",
                        slice,
                        summary.coveredItems,
                        summary.fetchItems,
                        summary.unfetchableItems,
                        summary.totalFetchDays));
            } catch (IllegalArgumentException e) {
                failures++;
                System.err.println("WARN: cannot plan slice " + slice + ": " + e.getMessage());
            }
        }
        return failures == 0 ? EXIT_OK : EXIT_INCOMPLETE;
    }

    private Components wire(Config config, GraphDocument document) throws Exception {
        CachedRecordStore store;
        SuccessMarkerStore successMarker;
        RunLock runLock;
        String storeMode = config.getString("store.mode", "postgres").trim().toLowerCase(Locale.ROOT);
        if (storeMode.equals("memory")) {
            store = new InMemoryCachedRecordStore();
            successMarker = new SliceBotBootstrapConfig.InMemorySuccessMarker();
            runLock = new ProcessRunLock();
            System.out.println("Store mode=memory. cached records and success marker are not persisted.");
        } else if (storeMode.equals("postgres")) {
            Database database = new Database(
                    firstNonBlank(System.getenv("SLICEBOT_DB_URL"), config.getString("db.url", "")),
                    firstNonBlank(System.getenv("SLICEBOT_DB_USER"), config.getString("db.user", "")),
                    firstNonBlank(System.getenv("SLICEBOT_DB_PASS"), config.getString("db.pass", "")),
                    config.getString("db.schema", "slicebot")
            );
            System.out.println("DB url=" + database.maskedJdbcUrl() + ", schema=" + database.schema());
            new MigrationRunner().run(database);
            MetadataDao metadataDao = new MetadataDao(database);
            store = new CachedRecordDao(database);
            successMarker = new MetadataSuccessMarkerStore(metadataDao,
                    config.getString("retrieve.success_marker_key", "last_retrieve_all_slices_success_at_ms"));
            runLock = new MetadataRunLock(metadataDao,
                    config.getString("retrieve.lock_name", "retrieve_all_slices"),
                    Duration.ofMinutes(Math.max(1L, config.getLong("retrieve.lock_lease_minutes", 240L))));
        } else {
            throw new IllegalArgumentException("store.mode must be postgres or memory, got: " + storeMode);
        }

        SliceResolver resolver = new SliceResolver();
        TimeSeriesAggregator aggregator = new TimeSeriesAggregator(resolver);
        CoverageAnalyzer coverage = new CoverageAnalyzer(
                resolver,
                new InMemoryContextRegistry(document.contexts),
                StalenessPolicy.NEVER,
                aggregator
        );
        FetchPlanBuilder planBuilder = new FetchPlanBuilder(
                resolver,
                coverage,
                new ConfiguredConnectionCapabilities(config, document.requiresEventIds),
                store
        );
        return new Components(resolver, aggregator, store, successMarker, runLock, planBuilder,
                new PinnedDslExploder());
    }

    private Optional<FetchExecutor> findExecutor() {
        Iterator<FetchExecutor> it = ServiceLoader.load(FetchExecutor.class).iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        FetchExecutor first = it.next();
        if (it.hasNext()) {
            System.err.println("WARN: several FetchExecutor providers found, using " + first.getClass().getName());
        }
        return Optional.of(first);
    }

    private static void printProgress(RetrievalProgress event) {
        if (event.type == RetrievalProgress.Type.BEFORE_ITEM) {
            System.out.println(String.format(Locale.US,
                    "[%d/%d] %s %s cache=%s days_to_fetch=%d gaps=%d",
                    event.sliceIndex + 1,
                    event.sliceCount,
                    event.slice,
                    event.itemKey == null ? "" : event.itemKey.display(),
                    event.cacheHit ? "hit" : "miss",
                    event.daysToFetch,
                    event.gapCount));
        } else if (event.type == RetrievalProgress.Type.COOLDOWN) {
            System.out.println(String.format(Locale.US,
                    "Rate limited. cooling down %.1f min before retrying %s",
                    event.cooldownMs / 60_000.0,
                    event.itemKey == null ? "" : event.itemKey.display()));
        } else {
            System.out.println(String.format(Locale.US,
                    "  ok=%d err=%d cache_hits=%d api_fetches=%d days_fetched=%d",
                    event.totalSuccess,
                    event.totalErrors,
                    event.totalCacheHits,
                    event.totalApiFetches,
                    event.totalDaysFetched));
        }
    }

    private static void printResult(RetrievalResult result) {
        for (SliceStat stat : result.sliceStats) {
            System.out.println(String.format(Locale.US,
                    "slice=%s items=%d ok=%d err=%d cache_hits=%d api_fetches=%d skipped=%d days=%d completed=%s",
                    stat.slice,
                    stat.items,
                    stat.success,
                    stat.errors,
                    stat.cacheHits,
                    stat.apiFetches,
                    stat.skipped,
                    stat.daysFetched,
                    stat.completed));
        }
        System.out.println(String.format(Locale.US,
                "RETRIEVE %s slices=%d items=%d ok=%d err=%d cache_hits=%d api_fetches=%d days_fetched=%d"
                        + " simulated=%s marker_written=%s",
                result.aborted ? "ABORTED(" + result.abortReason + ")" : "COMPLETED",
                result.totalSlices,
                result.totalItems,
                result.totalSuccess,
                result.totalErrors,
                result.totalCacheHits,
                result.totalApiFetches,
                result.totalDaysFetched,
                result.simulated,
                result.successMarkerWritten));
        if (result.aborted) {
            System.err.println(String.format(Locale.US,
                    "WARN: run aborted. remaining_slices=%d remaining_items=%d",
                    result.remainingSlices,
                    result.remainingItems));
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (SliceBotApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("slicebot.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(SliceBotApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Long parseCooldown(String raw) {
        if (isBlank(raw)) {
            return null;
        }
        double minutes;
        try {
            minutes = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--cooldown-minutes must be a number: " + raw);
        }
        if (minutes < 0 || Double.isNaN(minutes) || Double.isInfinite(minutes)) {
            throw new IllegalArgumentException("--cooldown-minutes must be >= 0: " + raw);
        }
        return Math.round(minutes * 60_000.0);
    }

    static TimeBounds parseWindow(String raw, LocalDate referenceDate) {
        if (isBlank(raw)) {
            return null;
        }
        String text = raw.trim();
        int colon = text.indexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new IllegalArgumentException("--window must be start:end, got: " + raw);
        }
        LocalDate start = DslDates.parse(text.substring(0, colon).trim(), referenceDate);
        LocalDate end = DslDates.parse(text.substring(colon + 1).trim(), referenceDate);
        return TimeBounds.of(start, end);
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("graph").hasArg().argName("file").desc("graph JSON (nodes, edges, contexts, connections)").build());
        options.addOption(Option.builder().longOpt("dsl").hasArg().argName("pinned").desc("pinned query; slices separated by ';' or or(...)").build());
        options.addOption(Option.builder().longOpt("window").hasArg().argName("start:end").desc("explicit window overriding the DSL time clause").build());
        options.addOption(Option.builder().longOpt("plan-only").desc("print the plan JSON of each slice and exit").build());
        options.addOption(Option.builder().longOpt("simulate").desc("trace decisions without writing cache or success marker").build());
        options.addOption(Option.builder().longOpt("automated").desc("unattended run: cool down and retry on rate limits").build());
        options.addOption(Option.builder().longOpt("bust-cache").desc("refetch every fetchable item over the whole window").build());
        options.addOption(Option.builder().longOpt("cooldown-minutes").hasArg().argName("n").desc("override retrieve.cooldown_minutes").build());
        options.addOption(Option.builder().longOpt("abort-file").hasArg().argName("path").desc("stop cooperatively once this file exists").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value.trim();
            }
        }
        return "";
    }

    private static final class Components {
        private final SliceResolver resolver;
        private final TimeSeriesAggregator aggregator;
        private final CachedRecordStore store;
        private final SuccessMarkerStore successMarker;
        private final RunLock runLock;
        private final FetchPlanBuilder planBuilder;
        private final SliceExploder exploder;

        private Components(
                SliceResolver resolver,
                TimeSeriesAggregator aggregator,
                CachedRecordStore store,
                SuccessMarkerStore successMarker,
                RunLock runLock,
                FetchPlanBuilder planBuilder,
                SliceExploder exploder
        ) {
            this.resolver = resolver;
            this.aggregator = aggregator;
            this.store = store;
            this.successMarker = successMarker;
            this.runLock = runLock;
            this.planBuilder = planBuilder;
            this.exploder = exploder;
        }
    }
}
