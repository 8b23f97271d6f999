package com.relaybot.app;

import com.relaybot.client.ChatClient;
import com.relaybot.client.ChatClientException;
import com.relaybot.client.TelegramBotApiClient;
import com.relaybot.config.Config;
import com.relaybot.config.ConfigException;
import com.relaybot.config.RelayConfig;
import com.relaybot.config.RelayConfigLoader;
import com.relaybot.http.HttpClientEx;
import com.relaybot.match.KeywordMatcher;
import com.relaybot.model.RunSummary;
import com.relaybot.report.LogRunReporter;
import com.relaybot.runner.BatchOrchestrator;
import com.relaybot.runner.DeliveryEngine;
import com.relaybot.runner.RelaySettings;
import com.relaybot.runner.RetryBackoff;
import com.relaybot.runner.RunControl;
import com.relaybot.runner.SourceRunner;
import com.relaybot.runner.WindowPlanner;
import com.relaybot.state.CursorStore;
import com.relaybot.state.CursorStoreException;
import com.relaybot.state.CursorWatermarks;
import com.relaybot.state.YamlCursorStore;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line entry point. {@code run} (default) relays matching messages once and exits;
 * {@code list-chats} prints the chats and topics the account can see.
 */
public final class RelayBotApplication {
    private static final Logger LOG = LogManager.getLogger(RelayBotApplication.class);

    static final String CMD_RUN = "run";
    static final String CMD_LIST_CHATS = "list-chats";
    private static final long SHUTDOWN_GRACE_SECONDS = 30L;

    @FunctionalInterface
    interface ChatClientFactory {
        /**
         * @param consumeUpdates false when the command must leave every message for a later run
         */
        ChatClient create(Config config, boolean consumeUpdates);
    }

    private final Path workingDir;
    private final ChatClientFactory clientFactory;
    private final Clock clock;
    private final PrintStream out;
    private final PrintStream err;
    private final boolean installShutdownHook;

    public RelayBotApplication() {
        this(
                Path.of(".").toAbsolutePath().normalize(),
                (config, consumeUpdates) -> TelegramBotApiClient.fromConfig(config, new HttpClientEx(), consumeUpdates),
                Clock.systemUTC(),
                System.out,
                System.err,
                true
        );
    }

    RelayBotApplication(
            Path workingDir,
            ChatClientFactory clientFactory,
            Clock clock,
            PrintStream out,
            PrintStream err,
            boolean installShutdownHook
    ) {
        this.workingDir = workingDir;
        this.clientFactory = clientFactory;
        this.clock = clock;
        this.out = out;
        this.err = err;
        this.installShutdownHook = installShutdownHook;
    }

    public static void main(String[] args) {
        int exit = new RelayBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            printHelp(options);
            err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            printHelp(options);
            return 0;
        }

        List<String> rest = cmd.getArgList();
        if (rest.size() > 1) {
            err.println("ERROR: expected at most one command, got " + rest);
            return 2;
        }
        String command = rest.isEmpty() ? CMD_RUN : rest.get(0).trim();
        if (!command.equals(CMD_RUN) && !command.equals(CMD_LIST_CHATS)) {
            printHelp(options);
            err.println("ERROR: unknown command: " + command);
            return 2;
        }

        Integer threads;
        Integer deadlineSeconds;
        try {
            threads = optionalInt(cmd, "threads", 1);
            deadlineSeconds = optionalInt(cmd, "deadline-seconds", 0);
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            return 2;
        }

        try {
            Config config = Config.load(workingDir);
            applyLogLevel(cmd.getOptionValue("log-level"));
            if (command.equals(CMD_LIST_CHATS)) {
                return listChats(config);
            }

            Path relayPath = cmd.hasOption("config")
                    ? Config.resolvePath(workingDir, cmd.getOptionValue("config"))
                    : config.getPath("config.path");
            RelayConfig relayConfig = new RelayConfigLoader().load(relayPath);

            RelaySettings.RelaySettingsBuilder settings = RelaySettings.fromConfig(config, relayConfig.destinationChatId())
                    .toBuilder()
                    .dryRun(cmd.hasOption("dry-run"));
            if (threads != null) {
                settings.threads(threads);
            }
            int deadline = deadlineSeconds != null ? deadlineSeconds : Math.max(0, config.getInt("run.deadline_seconds", 0));
            return runOnce(config, relayConfig, settings.build(), Duration.ofSeconds(deadline));
        } catch (ConfigException e) {
            err.println("CONFIG ERROR: " + e.getMessage());
            LOG.error("event=config_error error={}", e.getMessage());
            return 1;
        } catch (ChatClientException e) {
            err.println("FATAL: " + e.getMessage());
            LOG.error("event=fatal error={}", e.getMessage(), e);
            return 1;
        } catch (RuntimeException e) {
            err.println("FATAL: " + e.getMessage());
            LOG.error("event=fatal error={}", e.getMessage(), e);
            return 1;
        }
    }

    private int runOnce(Config config, RelayConfig relayConfig, RelaySettings settings, Duration deadline) {
        LOG.info("event=run_config config={} sources={} destination_chat_id={} threads={} dry_run={} on_failure={} deadline_seconds={}",
                relayConfig.path(),
                relayConfig.sources().size(),
                settings.getDestinationChatId(),
                settings.getThreads(),
                settings.isDryRun(),
                settings.getFailurePolicy(),
                deadline.getSeconds());

        RunControl control = RunControl.withDeadline(clock, deadline);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            control.cancel("shutdown signal");
            try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "relaybot-shutdown");
        if (installShutdownHook) {
            Runtime.getRuntime().addShutdownHook(hook);
        }

        try (ChatClient client = clientFactory.create(config, !settings.isDryRun())) {
            CursorStore cursorStore = new YamlCursorStore(relayConfig.path());
            DeliveryEngine deliveryEngine = new DeliveryEngine(
                    client,
                    RetryBackoff.fromConfig(config),
                    config.getInt("delivery.max_attempts", 5),
                    settings.isDryRun()
            );
            SourceRunner sourceRunner = new SourceRunner(
                    client,
                    cursorStore,
                    WindowPlanner.fromConfig(config),
                    new KeywordMatcher(),
                    deliveryEngine,
                    settings,
                    clock
            );
            BatchOrchestrator orchestrator = new BatchOrchestrator(
                    sourceRunner,
                    new LogRunReporter(),
                    settings.getThreads(),
                    settings.isDryRun(),
                    clock
            );
            RunSummary summary = orchestrator.runAll(relayConfig.sources(), control);
            if (!settings.isDryRun()) {
                releaseHandled(client, cursorStore, relayConfig);
            }
            out.println(LogRunReporter.formatSummary(summary));
            if (summary.allSourcesFailed()) {
                err.println("ERROR: every configured source failed");
                return 1;
            }
            return 0;
        } finally {
            finished.countDown();
            if (installShutdownHook) {
                removeHook(hook);
            }
        }
    }

    /**
     * Lets the client forget messages that every stored cursor has moved past. On failure the client
     * keeps them and the next run rescans them against the cursors.
     */
    private static void releaseHandled(ChatClient client, CursorStore cursorStore, RelayConfig relayConfig) {
        try {
            client.release(CursorWatermarks.handledThrough(relayConfig.sources(), cursorStore));
        } catch (CursorStoreException | ChatClientException e) {
            LOG.warn("event=release_failed error={}", e.getMessage(), e);
        }
    }

    private int listChats(Config config) throws ChatClientException {
        try (ChatClient client = clientFactory.create(config, false)) {
            for (String line : ChatListing.render(client)) {
                out.println(line);
            }
        }
        return 0;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("event=shutdown_in_progress hook_kept=true");
        }
    }

    private static Integer optionalInt(CommandLine cmd, String option, int min) {
        if (!cmd.hasOption(option)) {
            return null;
        }
        String raw = cmd.getOptionValue(option, "").trim();
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " must be an integer, got '" + raw + "'");
        }
        if (value < min) {
            throw new IllegalArgumentException("--" + option + " must be >= " + min);
        }
        return value;
    }

    private static void applyLogLevel(String raw) {
        if (raw == null || raw.isBlank()) {
            return;
        }
        Configurator.setRootLevel(Level.toLevel(raw.trim(), Level.INFO));
    }

    private void printHelp(Options options) {
        PrintWriter writer = new PrintWriter(out);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH,
                "relaybot [run|list-chats]", null, options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("config").hasArg().argName("path").desc("relay YAML file (default ~/.relaybot.yaml)").build());
        options.addOption(Option.builder().longOpt("dry-run").desc("scan and match only; no deliveries, no cursor writes").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n").desc("sources processed in parallel (default 1)").build());
        options.addOption(Option.builder().longOpt("deadline-seconds").hasArg().argName("n").desc("stop starting new work after n seconds (0 = no deadline)").build());
        options.addOption(Option.builder().longOpt("log-level").hasArg().argName("level").desc("root log level, e.g. DEBUG").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
