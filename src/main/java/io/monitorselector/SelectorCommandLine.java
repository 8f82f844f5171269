package io.monitorselector;

import lombok.Getter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static io.monitorselector.config.Constants.*;

/**
 * Parsed command line: {@code monitor-selector <server|once|simulate> [--metrics-port N] [--server-id ID]}.
 * Options that are not ours (for example {@code --spring.datasource.url=...}) are handed to Spring untouched.
 */
@Getter
public class SelectorCommandLine {

    static final String OPT_METRICS_PORT = "metrics-port";
    static final String OPT_SERVER_ID = "server-id";
    static final String OPT_HELP = "help";

    private static final Set<String> COMMANDS = Set.of(COMMAND_SERVER, COMMAND_ONCE, COMMAND_SIMULATE);

    private final String command;
    private final int metricsPort;
    private final Long serverId;
    private final String[] springArgs;

    SelectorCommandLine(String command, int metricsPort, Long serverId, String[] springArgs) {
        this.command = command;
        this.metricsPort = metricsPort;
        this.serverId = serverId;
        this.springArgs = springArgs;
    }

    public boolean isServerMode() {
        return COMMAND_SERVER.equals(command);
    }

    public static SelectorCommandLine parse(String[] args) throws ParseException {
        if (args.length == 0) {
            throw new ParseException("Command argument expected, one of " + COMMANDS);
        }
        String command = args[0];
        if (!COMMANDS.contains(command)) {
            throw new ParseException("Unknown command '" + command + "', expected one of " + COMMANDS);
        }

        List<String> ours = new ArrayList<>();
        List<String> spring = new ArrayList<>();
        Options options = options();
        for (String arg : Arrays.copyOfRange(args, 1, args.length)) {
            if (isForeignLongOption(arg, options)) {
                spring.add(arg);
                continue;
            }
            ours.add(arg);
        }

        CommandLine cmd = new DefaultParser().parse(options, ours.toArray(new String[0]));
        if (!cmd.getArgList().isEmpty()) {
            throw new ParseException("Unexpected arguments: " + cmd.getArgList());
        }

        int metricsPort = DEFAULT_METRICS_PORT;
        if (cmd.hasOption(OPT_METRICS_PORT)) {
            metricsPort = parsePort(cmd.getOptionValue(OPT_METRICS_PORT));
        }
        Long serverId = null;
        if (cmd.hasOption(OPT_SERVER_ID)) {
            serverId = parseServerId(cmd.getOptionValue(OPT_SERVER_ID));
        }
        if (COMMAND_SIMULATE.equals(command) && serverId == null) {
            throw new ParseException("simulate requires --" + OPT_SERVER_ID);
        }
        return new SelectorCommandLine(command, metricsPort, serverId, spring.toArray(new String[0]));
    }

    static boolean isHelpRequested(String[] args) {
        return Arrays.stream(args).anyMatch(a -> a.equals("-h") || a.equals("--" + OPT_HELP));
    }

    static void printHelp(PrintWriter writer) {
        writer.println("Usage: monitor-selector <" + String.join("|", COMMANDS.stream().sorted().toList()) + "> [options]");
        writer.println();
        writer.println("  server    run the review loop and serve /metrics");
        writer.println("  once      run one pass over the due servers, or only --server-id, and exit");
        writer.println("  simulate  plan the changes for --server-id and roll them back");
        writer.println();
        new HelpFormatter().printOptions(writer, 100, options(), 2, 4);
        writer.flush();
    }

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder()
                .longOpt(OPT_METRICS_PORT)
                .hasArg()
                .argName("port")
                .desc("HTTP port for /metrics and /health (default " + DEFAULT_METRICS_PORT + ")")
                .build());
        options.addOption(Option.builder()
                .longOpt(OPT_SERVER_ID)
                .hasArg()
                .argName("id")
                .desc("Review only this server")
                .build());
        options.addOption(Option.builder("h")
                .longOpt(OPT_HELP)
                .desc("Print this help")
                .build());
        return options;
    }

    private static boolean isForeignLongOption(String arg, Options options) {
        if (!arg.startsWith("--") || arg.length() == 2) {
            return false;
        }
        String name = arg.substring(2);
        int eq = name.indexOf('=');
        if (eq >= 0) {
            name = name.substring(0, eq);
        }
        return !options.hasLongOption(name);
    }

    private static int parsePort(String value) throws ParseException {
        try {
            int port = Integer.parseInt(value);
            if (port < 0 || port > 65535) {
                throw new ParseException("Invalid --" + OPT_METRICS_PORT + ": " + value);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid --" + OPT_METRICS_PORT + ": " + value);
        }
    }

    private static long parseServerId(String value) throws ParseException {
        try {
            long id = Long.parseLong(value);
            if (id <= 0) {
                throw new ParseException("Invalid --" + OPT_SERVER_ID + ": " + value);
            }
            return id;
        } catch (NumberFormatException e) {
            throw new ParseException("Invalid --" + OPT_SERVER_ID + ": " + value);
        }
    }
}
