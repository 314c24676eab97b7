package io.pipeguard.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pipeguard.dead.ExportResult;
import io.pipeguard.dead.FailedMessage;
import io.pipeguard.dead.FailedQueueConsole;
import io.pipeguard.dead.PurgeNotConfirmedException;
import io.pipeguard.dead.PurgeResult;
import io.pipeguard.dead.RequeueResult;
import io.pipeguard.dead.UnknownFailedQueueException;
import io.pipeguard.scan.ScanReport;
import io.pipeguard.scan.StuckDocumentScanner;
import io.pipeguard.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(
        name = "pipeguard",
        mixinStandardHelpOptions = true,
        description = "Operator tools for the document pipeline's failed queues and stuck documents",
        subcommands = {
                PipeguardCommand.InitSchemaCommand.class,
                PipeguardCommand.ManageFailedQueuesCommand.class,
                PipeguardCommand.RetryStuckDocumentsCommand.class
        }
)
public final class PipeguardCommand implements Runnable {
    private static final Logger logger = Logger.getLogger(PipeguardCommand.class.getName());

    static final int EXIT_FAILURE = 1;
    static final int EXIT_UNKNOWN_QUEUE = 3;
    static final int EXIT_NOT_CONFIRMED = 4;

    @Spec
    CommandSpec spec;

    @Option(names = "--jdbc-url", description = "JDBC URL of the pipeline database (env PIPEGUARD_JDBC_URL)",
            defaultValue = "${env:PIPEGUARD_JDBC_URL}")
    String jdbcUrl;

    @Option(names = "--user", description = "Database user (env PIPEGUARD_JDBC_USER)",
            defaultValue = "${env:PIPEGUARD_JDBC_USER}")
    String user;

    @Option(names = "--password", description = "Database password (env PIPEGUARD_JDBC_PASSWORD)",
            defaultValue = "${env:PIPEGUARD_JDBC_PASSWORD}")
    String password;

    private final Map<String, String> environment;

    public PipeguardCommand() {
        this(System.getenv());
    }

    /**
     * @param environment source of the retry and scanner settings ({@code MAX_RETRIES_*},
     *                    {@code STUCK_THRESHOLD_HOURS}, ...)
     */
    PipeguardCommand(Map<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * Creates the command line with the exit-code mapping for operation errors.
     */
    public static CommandLine newCommandLine(PipeguardCommand command) {
        CommandLine commandLine = new CommandLine(command);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            cmd.getErr().println("Error: " + ex.getMessage());
            logger.log(Level.FINE, "Command failed", ex);
            return exitCodeFor(ex);
        });
        return commandLine;
    }

    static int exitCodeFor(Exception ex) {
        if (ex instanceof UnknownFailedQueueException) {
            return EXIT_UNKNOWN_QUEUE;
        }
        if (ex instanceof PurgeNotConfirmedException) {
            return EXIT_NOT_CONFIRMED;
        }
        return EXIT_FAILURE;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    CliContext open() {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Missing database: pass --jdbc-url or set PIPEGUARD_JDBC_URL");
        }
        return CliContext.open(jdbcUrl, user, password, environment);
    }

    static void print(CommandSpec spec, JsonNode node) throws JsonProcessingException {
        spec.commandLine().getOut().println(Jsons.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(node));
        spec.commandLine().getOut().flush();
    }

    @Command(name = "init-schema", description = "Create the entity and bus tables if they do not exist")
    static final class InitSchemaCommand implements Callable<Integer> {
        @ParentCommand
        PipeguardCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() throws Exception {
            try (CliContext context = parent.open()) {
                ObjectNode out = Jsons.object();
                out.put("dialect", context.applySchema());
                out.put("status", "ok");
                print(spec, out);
                return 0;
            }
        }
    }

    @Command(
            name = "manage-failed-queues",
            mixinStandardHelpOptions = true,
            description = "List, inspect, export, requeue or purge the pipeline's failed queues",
            subcommands = {
                    ListCommand.class,
                    InspectCommand.class,
                    ExportCommand.class,
                    RequeueCommand.class,
                    PurgeCommand.class
            }
    )
    static final class ManageFailedQueuesCommand implements Runnable {
        @ParentCommand
        PipeguardCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }
    }

    @Command(name = "list", description = "Show the message count of every failed queue")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        ManageFailedQueuesCommand parent;

        @Spec
        CommandSpec spec;

        @Override
        public Integer call() throws Exception {
            try (CliContext context = parent.parent.open()) {
                ObjectNode queues = Jsons.object();
                context.failedQueueConsole().list().forEach((queue, depth) -> queues.put(queue, depth.intValue()));
                print(spec, queues);
                return 0;
            }
        }
    }

    @Command(name = "inspect", description = "Print messages of a failed queue without removing them")
    static final class InspectCommand implements Callable<Integer> {
        @ParentCommand
        ManageFailedQueuesCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Failed queue name, e.g. parsing.failed")
        String queue;

        @Option(names = "--limit", description = "Maximum messages to show (default: ${DEFAULT-VALUE})",
                defaultValue = "10")
        int limit;

        @Override
        public Integer call() throws Exception {
            try (CliContext context = parent.parent.open()) {
                FailedQueueConsole console = context.failedQueueConsole();
                ArrayNode messages = Jsons.mapper().createArrayNode();
                for (FailedMessage message : console.inspect(queue, limit)) {
                    messages.add(console.toJson(message));
                }
                ObjectNode out = Jsons.object();
                out.put("queue", queue);
                out.put("total_messages_in_queue", context.bus().depth(queue));
                out.set("messages", messages);
                print(spec, out);
                return 0;
            }
        }
    }

    @Command(name = "export", description = "Write messages of a failed queue to a JSON file")
    static final class ExportCommand implements Callable<Integer> {
        @ParentCommand
        ManageFailedQueuesCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Failed queue name")
        String queue;

        @Option(names = {"-o", "--output"}, description = "Target file (default: <queue>-<epoch-seconds>.json)")
        Path output;

        @Option(names = "--limit", description = "Maximum messages to export; 0 exports the whole queue",
                defaultValue = "0")
        int limit;

        @Option(names = "--drain", description = "Remove exported messages once the file is written")
        boolean drain;

        @Override
        public Integer call() throws Exception {
            Path target = output != null ? output
                    : Path.of(queue + "-" + Instant.now().getEpochSecond() + ".json");
            try (CliContext context = parent.parent.open()) {
                ExportResult result = context.failedQueueConsole().export(queue, target, limit, drain);
                ObjectNode out = Jsons.object();
                out.put("queue", result.queue());
                out.put("file", result.file().toString());
                out.put("total_messages_in_queue", result.totalInQueue());
                out.put("messages_exported", result.exported());
                out.put("messages_drained", result.drained());
                print(spec, out);
                return 0;
            }
        }
    }

    @Command(name = "requeue", description = "Replay failure envelopes into the failing stage's input queue")
    static final class RequeueCommand implements Callable<Integer> {
        @ParentCommand
        ManageFailedQueuesCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Failed queue name")
        String queue;

        @Option(names = "--limit", description = "Maximum messages to requeue; 0 requeues the whole queue",
                defaultValue = "0")
        int limit;

        @Option(names = "--dry-run", description = "Report what would be requeued without changing anything")
        boolean dryRun;

        @Override
        public Integer call() throws Exception {
            try (CliContext context = parent.parent.open()) {
                RequeueResult result = context.failedQueueConsole().requeue(queue, limit, dryRun);
                ObjectNode out = Jsons.object();
                out.put("queue", result.queue());
                out.put("target_routing_key", result.targetRoutingKey());
                out.put("requeued", result.requeued());
                out.put("skipped", result.skipped());
                out.put("dry_run", result.dryRun());
                print(spec, out);
                return 0;
            }
        }
    }

    @Command(name = "purge", description = "Delete messages from a failed queue")
    static final class PurgeCommand implements Callable<Integer> {
        @ParentCommand
        ManageFailedQueuesCommand parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", description = "Failed queue name")
        String queue;

        @Option(names = "--limit", description = "Maximum messages to purge; 0 purges the whole queue",
                defaultValue = "0")
        int limit;

        @Option(names = "--confirm", description = "Required to actually delete messages")
        boolean confirm;

        @Option(names = "--dry-run", description = "Report what would be purged without changing anything")
        boolean dryRun;

        @Override
        public Integer call() throws Exception {
            try (CliContext context = parent.parent.open()) {
                PurgeResult result = context.failedQueueConsole().purge(queue, limit, confirm, dryRun);
                ObjectNode out = Jsons.object();
                out.put("queue", result.queue());
                out.put("purged", result.purged());
                out.put("dry_run", result.dryRun());
                print(spec, out);
                return 0;
            }
        }
    }

    @Command(
            name = "retry-stuck-documents",
            mixinStandardHelpOptions = true,
            description = "Republish trigger events for documents stuck in pending, or run the scanner as a daemon"
    )
    static final class RetryStuckDocumentsCommand implements Callable<Integer> {
        @ParentCommand
        PipeguardCommand parent;

        @Spec
        CommandSpec spec;

        @Option(names = "--once", description = "Run a single scan, print its report and exit")
        boolean once;

        @Option(names = "--interval", description = "Seconds between scans; overrides SCAN_INTERVAL_SECONDS")
        Long intervalSeconds;

        @Override
        public Integer call() throws Exception {
            Duration interval = intervalSeconds != null ? Duration.ofSeconds(intervalSeconds) : null;
            CliContext context = parent.open();
            StuckDocumentScanner scanner = scannerOrClose(context, interval);
            if (once) {
                try (context; scanner) {
                    ScanReport report = scanner.scanOnce();
                    print(spec, toJson(report));
                    return report.succeeded() ? 0 : EXIT_FAILURE;
                }
            }
            runUntilShutdown(context, scanner);
            return 0;
        }

        private static StuckDocumentScanner scannerOrClose(CliContext context, Duration interval) {
            try {
                return context.stuckDocumentScanner(interval);
            } catch (RuntimeException e) {
                context.close();
                throw e;
            }
        }

        private void runUntilShutdown(CliContext context, StuckDocumentScanner scanner) throws InterruptedException {
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                scanner.close();
                context.close();
                stopped.countDown();
            }, "pipeguard-cli-shutdown"));
            scanner.start();
            logger.log(Level.INFO, "Scanning for stuck documents; stop with Ctrl-C");
            stopped.await();
        }

        static ObjectNode toJson(ScanReport report) {
            ObjectNode out = Jsons.object();
            out.put("succeeded", report.succeeded());
            out.put("duration_ms", report.duration().toMillis());
            out.put("total_requeued", report.totalRequeued());
            out.put("total_marked_failed", report.totalMarkedFailed());
            ArrayNode collections = out.putArray("collections");
            for (ScanReport.CollectionReport c : report.collections()) {
                ObjectNode node = collections.addObject();
                node.put("collection", c.collection());
                node.put("stuck", c.stuck());
                node.put("requeued", c.requeued());
                node.put("skipped_backoff", c.skippedBackoff());
                node.put("lost_race", c.lostRace());
                node.put("marked_failed", c.markedFailed());
                node.put("publish_errors", c.publishErrors());
                node.put("failed_total", c.failedTotal());
                if (c.error() != null) {
                    node.put("error", c.error());
                }
            }
            return out;
        }
    }
}
