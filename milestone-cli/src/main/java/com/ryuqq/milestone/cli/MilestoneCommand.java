package com.ryuqq.milestone.cli;

import com.ryuqq.milestone.adapter.file.FileProgressStore;
import com.ryuqq.milestone.adapter.file.ProgressStoreException;
import com.ryuqq.milestone.adapter.inmemory.store.InMemoryProgressStore;
import com.ryuqq.milestone.adapter.runner.ConcurrentMilestoneEngine;
import com.ryuqq.milestone.adapter.runner.LoggingWorkflowListener;
import com.ryuqq.milestone.application.engine.EngineReport;
import com.ryuqq.milestone.application.engine.EngineRequest;
import com.ryuqq.milestone.application.workflow.WorkflowKind;
import com.ryuqq.milestone.application.workflow.WorkflowPlan;
import com.ryuqq.milestone.cli.config.ConfigurationException;
import com.ryuqq.milestone.cli.config.MilestoneConfig;
import com.ryuqq.milestone.cli.config.YamlConfigLoader;
import com.ryuqq.milestone.cli.spi.RemoteClientProvider;
import com.ryuqq.milestone.cli.spi.RemoteClientProviders;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.WorkflowName;
import com.ryuqq.milestone.core.spi.ProgressStore;
import com.ryuqq.milestone.core.spi.RemoteClients;
import com.ryuqq.milestone.core.spi.noop.DryRunRemoteClient;
import com.ryuqq.milestone.core.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@code run}, {@code status} 하위 명령을 가진 {@code milestones} 명령.
 *
 * <p><strong>종료 코드:</strong></p>
 * <ul>
 *   <li>0: 선택한 모든 워크플로우가 완료, 차단, 비활성 중 하나로 끝남</li>
 *   <li>1: 설정 또는 진행 파일 문제로 아무것도 실행하지 않음</li>
 *   <li>2: 하나 이상의 워크플로우가 중단됨 (재실행하면 이어서 진행). 잘못된 옵션도 picocli가 2로 보고</li>
 * </ul>
 *
 * <p>실행 중 JVM이 종료되면 shutdown hook이 엔진을 취소하고, 요약 출력이 끝날 때까지
 * 최대 {@link #SHUTDOWN_WAIT}만큼 기다립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = "milestones",
    mixinStandardHelpOptions = true,
    version = "milestones 1.0.0",
    description = "Runs resumable, rate-limited milestone workflows against a remote repository",
    subcommands = {
        MilestoneCommand.RunCommand.class,
        MilestoneCommand.StatusCommand.class
    }
)
public final class MilestoneCommand implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MilestoneCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 1;
    static final int EXIT_STOPPED = 2;
    static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(15);

    @Spec
    CommandSpec spec;

    private final Function<String, String> environment;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Supplier<RemoteClientProvider> providers;

    public MilestoneCommand() {
        this(System::getenv, Clock.systemUTC(), Sleeper.system(), RemoteClientProviders::load);
    }

    MilestoneCommand(Function<String, String> environment, Clock clock, Sleeper sleeper,
                     Supplier<RemoteClientProvider> providers) {
        this.environment = environment;
        this.clock = clock;
        this.sleeper = sleeper;
        this.providers = providers;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    MilestoneConfig loadConfig(Path file) {
        return new YamlConfigLoader(environment).load(file);
    }

    /**
     * 취소를 요청한 뒤 실행 스레드가 {@code finished}를 해제할 때까지 기다리는 hook 본문.
     *
     * @param cancel 엔진 취소 동작
     * @param finished 실행 종료 시 해제되는 latch
     * @param wait 최대 대기 시간
     * @return shutdown hook으로 등록할 Runnable
     */
    static Runnable shutdownHook(Runnable cancel, CountDownLatch finished, Duration wait) {
        return () -> {
            cancel.run();
            try {
                if (!finished.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Run did not finish within {} after cancel; exiting anyway", wait);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
    }

    @Command(name = "run", mixinStandardHelpOptions = true,
        description = "Runs the selected workflows, resuming from the progress file")
    static final class RunCommand implements Callable<Integer> {

        @ParentCommand
        MilestoneCommand parent;

        @Spec
        CommandSpec spec;

        @Mixin
        LogLevel.Options logging;

        @Option(names = {"-c", "--config"}, defaultValue = "milestones.yaml",
            description = "Configuration file (default: ${DEFAULT-VALUE})")
        Path config;

        @Option(names = "--progress-file", description = "Progress file (overrides settings.progress_file)")
        Path progressFile;

        @Option(names = {"-w", "--workflow"}, split = ",",
            description = "Workflows to run (default: all enabled), e.g. pull-shark,quickdraw")
        List<String> workflows;

        @Option(names = "--dry-run", description = "Simulate every remote call; the progress file is not changed")
        boolean dryRun;

        @Option(names = "--max-duration", description = "Cancel the run after this long, e.g. 2h or PT90M")
        String maxDuration;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            MilestoneConfig settings;
            EngineRequest request;
            try {
                settings = applyOptions(parent.loadConfig(config));
                request = new EngineRequest(selectedWorkflows(), settings.dryRun());
            } catch (ConfigurationException | IllegalArgumentException e) {
                err.println("Configuration error: " + e.getMessage());
                return EXIT_CONFIG;
            }

            try (ProgressStore store = openStore(settings)) {
                RemoteClients clients = settings.dryRun() ? dryRunClients(settings) : liveClients(settings);
                ConcurrentMilestoneEngine engine = new ConcurrentMilestoneEngine(
                    settings.toPlan(), clients, store, settings.toEngineConfig(),
                    parent.clock, parent.sleeper, new LoggingWorkflowListener(new ConsoleReporter(out)));

                EngineReport report = runWithShutdownHook(engine, request, out);
                return report.allSuccessful() ? EXIT_OK : EXIT_STOPPED;
            } catch (ConfigurationException | ProgressStoreException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_CONFIG;
            }
        }

        private MilestoneConfig applyOptions(MilestoneConfig loaded) {
            MilestoneConfig result = loaded;
            if (progressFile != null) {
                result = result.withProgressFile(progressFile);
            }
            if (dryRun) {
                result = result.withDryRun(true);
            }
            if (maxDuration != null) {
                try {
                    result = result.withMaxDuration(YamlConfigLoader.parseDuration(maxDuration));
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("--max-duration: " + e.getMessage(), e);
                }
            }
            return result;
        }

        private Set<WorkflowKind> selectedWorkflows() {
            EnumSet<WorkflowKind> selected = EnumSet.noneOf(WorkflowKind.class);
            if (workflows != null) {
                for (String name : workflows) {
                    selected.add(WorkflowKind.fromName(name));
                }
            }
            return selected;
        }

        private ProgressStore openStore(MilestoneConfig settings) {
            Path file = settings.progressFile();
            if (!settings.dryRun()) {
                return new FileProgressStore(file, parent.clock);
            }
            if (!Files.exists(file)) {
                return new InMemoryProgressStore(parent.clock);
            }
            // 임시 사본: dry-run 커밋은 파일에 반영되지 않음
            try (FileProgressStore durable = new FileProgressStore(file, parent.clock)) {
                return InMemoryProgressStore.seededFrom(durable, parent.clock);
            }
        }

        private RemoteClients dryRunClients(MilestoneConfig settings) {
            DryRunRemoteClient primary = new DryRunRemoteClient(settings.primary().login(), parent.clock);
            DryRunRemoteClient secondary = settings.secondary() == null ? null
                : new DryRunRemoteClient(settings.secondary().login(), parent.clock);
            return RemoteClients.of(primary, secondary);
        }

        private RemoteClients liveClients(MilestoneConfig settings) {
            List<CredentialRole> unresolved = settings.unresolvedCredentials();
            if (!unresolved.isEmpty()) {
                throw new ConfigurationException("Unresolved token for " + unresolved
                    + "; set the referenced environment variables or use --dry-run");
            }
            RemoteClientProvider provider = parent.providers.get();
            return RemoteClients.of(
                provider.create(settings.primary()),
                settings.secondary() == null ? null : provider.create(settings.secondary()));
        }

        private EngineReport runWithShutdownHook(ConcurrentMilestoneEngine engine, EngineRequest request,
                                                 PrintWriter out) {
            CountDownLatch finished = new CountDownLatch(1);
            Thread hook = new Thread(shutdownHook(engine::cancel, finished, SHUTDOWN_WAIT), "milestones-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                EngineReport report = engine.run(request);
                ConsoleReporter.printSummary(out, report);
                return report;
            } finally {
                finished.countDown();
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("JVM shutdown in progress; hook stays registered");
                }
            }
        }
    }

    @Command(name = "status", mixinStandardHelpOptions = true,
        description = "Prints the committed progress of every workflow")
    static final class StatusCommand implements Callable<Integer> {

        @ParentCommand
        MilestoneCommand parent;

        @Spec
        CommandSpec spec;

        @Mixin
        LogLevel.Options logging;

        @Option(names = "--progress-file", defaultValue = "progress.json",
            description = "Progress file (default: ${DEFAULT-VALUE})")
        Path progressFile;

        @Option(names = {"-c", "--config"},
            description = "Configuration file used to show targets (default: built-in thresholds)")
        Path config;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();

            Map<WorkflowName, Long> targets = new HashMap<>();
            try {
                WorkflowPlan plan = config == null ? null : parent.loadConfig(config).toPlan();
                for (WorkflowKind kind : WorkflowKind.values()) {
                    long target = plan == null ? kind.defaults().target() : plan.settingsFor(kind).target();
                    targets.put(kind.workflowName(), target);
                }
            } catch (ConfigurationException e) {
                err.println("Configuration error: " + e.getMessage());
                return EXIT_CONFIG;
            }

            if (!Files.exists(progressFile)) {
                out.println("No progress file at " + progressFile);
                out.flush();
                return EXIT_OK;
            }
            try (FileProgressStore store = new FileProgressStore(progressFile, parent.clock)) {
                ConsoleReporter.printStatus(out, store.loadAll(), targets);
                return EXIT_OK;
            } catch (ProgressStoreException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_CONFIG;
            }
        }
    }
}
