package io.schedula.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.schedula.cli.CliContext;
import io.schedula.cli.EventsCommand;
import io.schedula.cli.InitCommand;
import io.schedula.cli.SchedulaCliCommand;
import io.schedula.cli.ServeCommand;
import io.schedula.cli.StatusCommand;
import io.schedula.core.api.GatewayServer;
import io.schedula.core.bus.InMemoryMessageBus;
import io.schedula.core.config.ConfigPaths;
import io.schedula.core.config.ConfigService;
import io.schedula.core.config.model.SchedulaConfig;
import io.schedula.core.cursor.CursorState;
import io.schedula.core.cursor.FileSchedulerStateStore;
import io.schedula.core.cursor.SchedulerState;
import io.schedula.core.event.EventDefaults;
import io.schedula.core.event.EventRegistry;
import io.schedula.core.event.RandomIdGenerator;
import io.schedula.core.identity.StaticPrincipalResolver;
import io.schedula.core.job.JobAbortCoordinator;
import io.schedula.core.job.JobHistoryService;
import io.schedula.core.job.JobLaunchMultiplexer;
import io.schedula.core.observability.ActivityService;
import io.schedula.core.observability.FileActivityStore;
import io.schedula.core.runner.JobRunnerClient;
import io.schedula.core.scheduler.CatchUpRetickTrigger;
import io.schedula.core.store.FileListStore;
import io.schedula.core.store.ListStore;
import io.schedula.core.store.SqliteListStore;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class SchedulaApplication {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulaApplication.class);

    private SchedulaApplication() {
    }

    public static void main(String[] args) {
        Clock clock = Clock.systemUTC();
        ConfigService configService = new ConfigService();
        Path configPath = resolveConfigPath();
        SchedulaConfig config = loadConfig(configService, configPath);
        Path dataDir = ConfigPaths.resolveDataDir(config.storage().dataDir());

        ListStore listStore = buildListStore(config, dataDir);
        InMemoryMessageBus messageBus = new InMemoryMessageBus();
        ActivityService activityService = new ActivityService(
            new FileActivityStore(dataDir.resolve("activity/activity.json")),
            clock
        );

        FileSchedulerStateStore stateStore = new FileSchedulerStateStore(dataDir.resolve("state/scheduler.json"));
        SchedulerState schedulerState = restoreSchedulerState(stateStore);
        CursorState cursorState = new CursorState(schedulerState, stateStore, messageBus, clock);

        OkHttpClient httpClient = new OkHttpClient.Builder()
            .callTimeout(Duration.ofSeconds(Math.max(1, config.runner().timeoutSeconds())))
            .build();
        JobRunnerClient runner = new JobRunnerClient(httpClient, new ObjectMapper(), config.runner().baseUrl());

        EventRegistry registry = new EventRegistry(
            listStore,
            cursorState,
            runner,
            new JobAbortCoordinator(runner, runner),
            new CatchUpRetickTrigger(runner, clock),
            new RandomIdGenerator(clock),
            new EventDefaults(config.scheduler().timezone(), config.scheduler().historyExpirySeconds()),
            clock,
            activityService,
            messageBus
        );
        JobLaunchMultiplexer multiplexer = new JobLaunchMultiplexer(registry, runner, activityService);
        JobHistoryService historyService = new JobHistoryService(listStore);

        CliContext context = new CliContext(
            registry,
            configService,
            configPath,
            (host, port) -> runServer(
                config,
                host,
                port,
                listStore,
                registry,
                multiplexer,
                historyService,
                activityService,
                messageBus,
                clock
            )
        );

        CommandLine commandLine = new CommandLine(new SchedulaCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("events", new EventsCommand(context));
        commandLine.addSubcommand("serve", new ServeCommand(context));

        int exitCode = commandLine.execute(args);
        httpClient.dispatcher().executorService().shutdown();
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String raw = System.getenv("SCHEDULA_CONFIG");
        if (raw == null || raw.isBlank()) {
            return ConfigPaths.defaultConfigPath();
        }
        if (raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(raw.substring(2));
        }
        return Path.of(raw);
    }

    private static SchedulaConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Failed to load config {}, using defaults: {}", configPath, e.getMessage());
            return SchedulaConfig.defaults();
        }
    }

    private static ListStore buildListStore(SchedulaConfig config, Path dataDir) {
        String backend = config.storage().backend() == null ? "file" : config.storage().backend().trim().toLowerCase();
        if ("sqlite".equals(backend)) {
            Path sqlitePath = dataDir.resolve("schedula.db");
            try {
                return new SqliteListStore(sqlitePath);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to initialize SQLite list store at " + sqlitePath, e);
            }
        }
        return new FileListStore(dataDir.resolve("lists"));
    }

    private static SchedulerState restoreSchedulerState(FileSchedulerStateStore stateStore) {
        try {
            return SchedulerState.restore(stateStore.load());
        } catch (Exception e) {
            LOG.warn("Failed to restore scheduler state, starting empty: {}", e.getMessage());
            return SchedulerState.restore(null);
        }
    }

    private static int runServer(
        SchedulaConfig config,
        String hostOverride,
        Integer portOverride,
        ListStore listStore,
        EventRegistry registry,
        JobLaunchMultiplexer multiplexer,
        JobHistoryService historyService,
        ActivityService activityService,
        InMemoryMessageBus messageBus,
        Clock clock
    ) throws Exception {
        String host = hostOverride == null ? config.server().host() : hostOverride;
        int port = portOverride == null ? config.server().port() : portOverride;
        long sweepMinutes = Math.max(1, config.scheduler().maintenanceIntervalMinutes());

        CountDownLatch shutdown = new CountDownLatch(1);
        var maintenance = Executors.newSingleThreadScheduledExecutor();
        try (GatewayServer server = new GatewayServer(
            port,
            host,
            registry,
            multiplexer,
            historyService,
            new StaticPrincipalResolver(config.apiKeys()),
            activityService,
            messageBus,
            clock,
            Duration.ofSeconds(Math.max(0, config.scheduler().requestTimeoutSeconds()))
        )) {
            Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
            server.start();
            maintenance.scheduleAtFixedRate(
                () -> purgeExpired(listStore, clock),
                1,
                sweepMinutes,
                TimeUnit.MINUTES
            );
            System.out.println("Schedula started on http://" + host + ":" + server.port());
            System.out.println("Endpoints: /api/app/*, WS /ws, GET /healthz");
            shutdown.await();
        } finally {
            maintenance.shutdownNow();
        }
        return 0;
    }

    private static void purgeExpired(ListStore listStore, Clock clock) {
        try {
            int purged = listStore.purgeExpired(clock.instant().getEpochSecond());
            if (purged > 0) {
                LOG.info("Maintenance sweep purged {} expired list(s)", purged);
            }
        } catch (Exception e) {
            LOG.warn("Maintenance sweep failed: {}", e.getMessage());
        }
    }
}
