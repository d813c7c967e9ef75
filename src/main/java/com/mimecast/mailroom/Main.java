package com.mimecast.mailroom;

import com.mimecast.mailroom.config.EngineConfig;
import com.mimecast.mailroom.list.ListRegistry;
import com.mimecast.mailroom.list.MailingList;
import com.mimecast.mailroom.main.Engine;
import com.mimecast.mailroom.main.EngineContext;
import com.mimecast.mailroom.mime.MailMessage;
import com.mimecast.mailroom.moderation.HoldDisposition;
import com.mimecast.mailroom.moderation.HoldId;
import com.mimecast.mailroom.moderation.HoldRecord;
import com.mimecast.mailroom.moderation.ModerationService;
import com.mimecast.mailroom.queue.EntryId;
import com.mimecast.mailroom.queue.ShardAssignment;
import com.mimecast.mailroom.runner.Runner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.help.HelpFormatter;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Runs the engine or a single runner and exposes the moderator and ingestion operations.
 */
@SuppressWarnings("squid:S106")
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "mailroom.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Mailing list message transport engine";

    /**
     * Configuration file name within the configuration directory.
     */
    public static final String CONFIG_FILE = "mailroom.json5";

    private final String[] args;
    private int exitCode = 0;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        Main main = new Main(args);
        if (main.getExitCode() != 0) {
            System.exit(main.getExitCode());
        }
    }

    /**
     * Constructs a new Main instance and runs the requested command.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        Options options = options();
        Optional<CommandLine> opt = parseArgs(options);
        if (opt.isEmpty()) {
            exitCode = 2;
            return;
        }

        CommandLine cmd = opt.get();
        if (cmd.hasOption("help") || !hasCommand(cmd)) {
            optionsUsage(options);
            return;
        }

        try {
            EngineConfig config = new EngineConfig(Paths.get(cmd.getOptionValue("config", "cfg"), CONFIG_FILE).toString());
            EngineContext context = EngineContext.builder(config).build();
            run(cmd, context);
        } catch (IOException e) {
            log("Error: " + e.getMessage());
            exitCode = 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            log("Invalid request: " + e.getMessage());
            exitCode = 2;
        }
    }

    private void run(CommandLine cmd, EngineContext context) throws IOException {
        Engine engine = new Engine(context);

        // Run every configured runner.
        if (cmd.hasOption("start")) {
            engine.start(engine.createRunners());
        }

        // Run a single runner.
        else if (cmd.hasOption("runner")) {
            ShardAssignment shard = new ShardAssignment(context.getConfig().getShardStrategy(),
                    Integer.parseInt(cmd.getOptionValue("shard", "0")),
                    Integer.parseInt(cmd.getOptionValue("shards", "1")));
            Runner runner = Engine.createRunner(context, cmd.getOptionValue("runner"), shard,
                    context.getConfig().getPollIntervalMillis(), context.getConfig().getBatchSize());

            if (cmd.hasOption("once")) {
                int processed = runner.runOnce();
                log("Processed " + processed + " entries from " + runner.getQueue() + " on shard " + shard);
            } else {
                engine.start(List.of(runner));
            }
        }

        // List pending holds.
        else if (cmd.hasOption("held")) {
            MailingList list = requireList(context, cmd.getOptionValue("held"));
            List<HoldRecord> pending = moderation(context).pending(list);
            log(pending.size() + " pending holds for " + list.getName());
            for (HoldRecord record : pending) {
                log(String.join("\t", record.getId().toString(), String.valueOf(record.getHeldAt()),
                        String.valueOf(record.getSender()), String.valueOf(record.getSubject()), record.getReason()));
            }
        }

        // Moderator action.
        else if (cmd.hasOption("resolve")) {
            if (!cmd.hasOption("disposition")) {
                throw new IllegalArgumentException("--resolve requires --disposition");
            }
            HoldId id = HoldId.parse(cmd.getOptionValue("resolve"));
            MailingList list = requireList(context, id.getListName());
            HoldRecord record = moderation(context).resolve(id,
                    HoldDisposition.fromString(cmd.getOptionValue("disposition")), list, cmd.getOptionValue("comment"));
            log("Hold " + id + " " + record.getDisposition());
        }

        // Ingestion.
        else if (cmd.hasOption("inject")) {
            if (!cmd.hasOption("list")) {
                throw new IllegalArgumentException("--inject requires --list");
            }
            MailingList list = requireList(context, cmd.getOptionValue("list"));
            MailMessage message = MailMessage.parse(Files.readAllBytes(Path.of(cmd.getOptionValue("inject"))));
            EntryId id = engine.inject(message, list.getName(), cmd.hasOption("owner"));
            log("Queued " + id);
        }

        // Release shunted entries.
        else if (cmd.hasOption("unshunt")) {
            log("Unshunted " + engine.unshunt() + " entries");
        }
    }

    private static boolean hasCommand(CommandLine cmd) {
        return cmd.hasOption("start") || cmd.hasOption("runner") || cmd.hasOption("held")
                || cmd.hasOption("resolve") || cmd.hasOption("inject") || cmd.hasOption("unshunt");
    }

    private static ModerationService moderation(EngineContext context) {
        return new ModerationService(context.getLedger(), context.getStore(), context.getNotifier(), context.getClock());
    }

    private static MailingList requireList(EngineContext context, String name) throws IOException {
        ListRegistry lists = context.loadLists();
        return lists.get(name).orElseThrow(() -> new IllegalArgumentException("Unknown list: " + name));
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption(null, "start", false, "Run all configured runners until shutdown");
        options.addOption(null, "runner", true, "Run a single runner for the given queue");
        options.addOption(null, "shard", true, "Shard number for --runner, defaults to 0");
        options.addOption(null, "shards", true, "Shard count for --runner, defaults to 1");
        options.addOption(null, "once", false, "Run a single polling pass and exit");
        options.addOption(null, "config", true, "Configuration directory, defaults to cfg");
        options.addOption(null, "held", true, "Print pending holds of the given list");
        options.addOption(null, "resolve", true, "Resolve the given hold id (list/request)");
        options.addOption(null, "disposition", true, "Disposition for --resolve: approve, reject or discard");
        options.addOption(null, "comment", true, "Rejection reason for --resolve");
        options.addOption(null, "inject", true, "Enqueue the given RFC 822 file into the incoming queue");
        options.addOption(null, "list", true, "Target list for --inject");
        options.addOption(null, "owner", false, "Address --inject to the list owner");
        options.addOption(null, "unshunt", false, "Move shunted entries back to their queues");
        options.addOption(null, "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        // Capture System.out to get help output.
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        PrintStream ps = new PrintStream(baos);
        PrintStream oldOut = System.out;
        System.setOut(ps);

        try {
            HelpFormatter formatter = HelpFormatter.builder()
                    .setShowSince(false)
                    .get();
            formatter.printHelp(" ", "", options, "", true);
            System.out.flush();
        } catch (IOException e) {
            // Should not happen with ByteArrayOutputStream.
            throw new IllegalStateException(e);
        } finally {
            System.setOut(oldOut);
        }

        log(baos.toString());
        log("");
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Gets the exit code of the last command.
     *
     * @return Integer, 0 on success.
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
