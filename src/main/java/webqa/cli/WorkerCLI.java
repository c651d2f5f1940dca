package webqa.cli;

import webqa.WorkerConfig;
import webqa.model.JobCodec;
import webqa.model.MalformedJobException;
import webqa.model.Run;
import webqa.model.RunStatus;
import webqa.model.TestCaseJob;
import webqa.player.ArtifactCapture;
import webqa.player.KnownElements;
import webqa.player.LocatorResolver;
import webqa.player.RunController;
import webqa.player.SeleniumBrowserFactory;
import webqa.player.StepExecutor;
import webqa.player.VisualRegression;
import webqa.queue.JobWorker;
import webqa.reporting.LiveProgressClient;
import webqa.reporting.RunRecordClient;
import webqa.reporting.RunReporter;
import webqa.storage.FileSystemObjectStore;
import webqa.storage.ObjectStore;

import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Entry point for a WebQA execution worker.
 *
 * <ul>
 *   <li>{@code webqa-worker [--mode standard|live-view]}: consume jobs until stopped</li>
 *   <li>{@code webqa-worker run <job.json>}: execute one job file and exit</li>
 * </ul>
 * Exit code is non-zero only when the worker cannot start (or, for {@code run},
 * when a run failed).
 */
@Command(
        name        = "webqa-worker",
        description = "Queue-driven Selenium test execution worker",
        version     = "1.0.0-SNAPSHOT",
        mixinStandardHelpOptions = true,
        subcommands = { WorkerCLI.RunCommand.class }
)
public class WorkerCLI implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WorkerCLI.class);

    @Option(
            names       = {"-m", "--mode"},
            description = "Worker mode: standard or live-view (default: from config.properties)"
    )
    String mode;

    @Option(
            names       = {"--bootstrap-servers"},
            description = "Kafka bootstrap servers (default: from config.properties)"
    )
    String bootstrapServers;

    @Option(
            names       = {"-b", "--browser"},
            description = "Browser to use: chrome, firefox, edge (default: from config.properties)"
    )
    String browser;

    // ── Entry-point ─────────────────────────────────────────────────────────

    public static void main(String[] args) {
        int exit = new CommandLine(new WorkerCLI()).execute(args);
        System.exit(exit);
    }

    @Override
    public Integer call() {
        WorkerConfig config = loadConfig();
        RunController controller = buildController(config);

        Properties consumerProps = JobWorker.consumerProperties(config);
        JobWorker worker = new JobWorker(
                () -> new KafkaConsumer<>(consumerProps),
                config.getTopic(),
                controller::execute,
                config.getReconnectBackoffMs(),
                config.getPollTimeout());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, finishing in-flight job");
            worker.stop();
            try {
                stopped.await(config.getStepTimeout().toSeconds() + 30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "webqa-shutdown"));

        log.info("WebQA worker starting: mode={}, topic={}, brokers={}, browser={}",
                config.getMode(), config.getTopic(), config.getBootstrapServers(), config.getBrowser());
        try {
            worker.run();
        } finally {
            stopped.countDown();
        }
        return 0;
    }

    WorkerConfig loadConfig() {
        WorkerConfig config = new WorkerConfig();
        config.override(WorkerConfig.KEY_MODE, mode);
        config.override(WorkerConfig.KEY_BOOTSTRAP_SERVERS, bootstrapServers);
        config.override(WorkerConfig.KEY_BROWSER, browser);
        return config;
    }

    /** Wires the execution engine from configuration. */
    static RunController buildController(WorkerConfig config) {
        ObjectStore store = new FileSystemObjectStore(Path.of(config.getStorageRoot()));
        LocatorResolver resolver = new LocatorResolver(KnownElements.withOverrides(config.getKnownElements()));
        VisualRegression visual = new VisualRegression(store,
                config.getVisualThreshold(), config.getVisualChannelTolerance());
        RunReporter reporter = new RunReporter(
                RunRecordClient.fromConfig(config), LiveProgressClient.fromConfig(config));

        return new RunController(
                config,
                new SeleniumBrowserFactory(config.getBrowser(), config.getPageLoadTimeoutSec()),
                new StepExecutor(resolver, visual),
                new ArtifactCapture(store, config.isTracingEnabled()),
                reporter,
                Clock.systemUTC());
    }

    // ── Sub-commands ─────────────────────────────────────────────────────────

    /**
     * Executes a single job file without a broker, reporting as a worker would.
     */
    @Command(
            name        = "run",
            description = "Execute one job JSON file and exit",
            mixinStandardHelpOptions = true
    )
    static class RunCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        WorkerCLI parent;

        @Parameters(index = "0", description = "Path to a test case job JSON file")
        Path jobFile;

        @Override
        public Integer call() throws Exception {
            if (!Files.exists(jobFile)) {
                System.err.println("Job file not found: " + jobFile.toAbsolutePath());
                return 1;
            }
            TestCaseJob job;
            try {
                job = JobCodec.decode(Files.readString(jobFile, StandardCharsets.UTF_8));
            } catch (MalformedJobException e) {
                System.err.println("Invalid job: " + e.getMessage());
                return 1;
            }

            List<Run> runs = buildController(parent.loadConfig()).execute(job);
            boolean allPassed = true;
            for (Run run : runs) {
                System.out.printf("  %-20s %-5s visual=%-16s %s%n",
                        run.getDatasetName(), run.getStatus(), run.getVisualStatus(),
                        run.getFailureReason() == null ? "" : run.getFailureReason());
                allPassed &= run.getStatus() == RunStatus.PASS;
            }
            return allPassed ? 0 : 2;
        }
    }
}
