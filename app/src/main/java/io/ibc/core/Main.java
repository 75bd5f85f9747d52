package io.ibc.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.ibc.core.client.ClientId;
import io.ibc.core.client.ClientRegistry;
import io.ibc.core.client.RegistryConfig;
import io.ibc.core.metrics.RegistryMetrics;
import io.ibc.core.script.CommandScript;
import io.ibc.core.script.RegistryCommand;
import io.ibc.core.script.ScriptRunner;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        configureLogging();
        CliOptions options = CliOptions.parse(args);
        if (options.showHelp()) {
            options.printHelp();
            if (options.errorMessage() != null) {
                System.exit(1);
            }
            return;
        }

        RegistryConfig config = RegistryConfig.defaults()
                .withOrigin(options.originClientId())
                .withClientIdPrefix(options.clientPrefix());
        ClientRegistry registry = ClientRegistry.inMemory(config);

        List<RegistryCommand> commands;
        if (options.script() != null) {
            commands = CommandScript.load(options.script(), config.clientIdPrefix);
            LOG.info("Loaded " + commands.size() + " commands from " + options.script());
        } else {
            commands = demoCommands(config.originClientId);
            LOG.info("No --script given, running demo flow");
        }

        ObjectNode report = new ScriptRunner(registry, JSON).run(commands);
        System.out.println(render(report, options.pretty()));

        if (options.metrics()) {
            LOG.info("=== Metrics ===\n" + RegistryMetrics.scrapeMetrics());
        }
    }

    /**
     * Create two clients, advance the first, then send a duplicate, a stale and an
     * unknown-client update.
     */
    static List<RegistryCommand> demoCommands(long origin) {
        ClientId first = ClientId.of(origin);
        // any id below the origin or past the demo's three creates is never allocated
        ClientId unknown = ClientId.of(origin > Long.MAX_VALUE - 7 ? origin - 1 : origin + 7);
        return List.of(
                RegistryCommand.create(100),
                RegistryCommand.update(first, 150),
                RegistryCommand.update(first, 150),
                RegistryCommand.update(first, 90),
                RegistryCommand.update(unknown, 200),
                RegistryCommand.create(10),
                RegistryCommand.create(20),
                RegistryCommand.query(first)
        );
    }

    private static String render(ObjectNode report, boolean pretty) {
        try {
            return pretty
                    ? JSON.writerWithDefaultPrettyPrinter().writeValueAsString(report)
                    : JSON.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render report", e);
        }
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not load bundled logging.properties", e);
        }
    }

    static record CliOptions(
            boolean showHelp,
            String errorMessage,
            Path script,
            long originClientId,
            String clientPrefix,
            boolean metrics,
            boolean pretty
    ) {
        static CliOptions parse(String[] args) {
            Path script = envPath("ICS02_SCRIPT", null);
            String clientPrefix = envOrDefault("ICS02_CLIENT_PREFIX", RegistryConfig.DEFAULT_CLIENT_PREFIX);
            boolean metrics = "true".equalsIgnoreCase(System.getenv("ICS02_METRICS"));
            boolean pretty = true;
            boolean showHelp = false;
            String error = null;

            long originClientId = RegistryConfig.defaults().originClientId;
            String originEnv = System.getenv("ICS02_ORIGIN_ID");
            if (originEnv != null && !originEnv.isBlank()) {
                try {
                    originClientId = parseNonNegativeLong(originEnv, "ICS02_ORIGIN_ID");
                } catch (IllegalArgumentException ex) {
                    showHelp = true;
                    error = ex.getMessage();
                }
            }

            if (args != null) {
                for (String arg : args) {
                    if (arg == null || arg.isBlank()) {
                        continue;
                    }
                    if ("--help".equals(arg) || "-h".equals(arg)) {
                        showHelp = true;
                    } else if (arg.startsWith("--script=")) {
                        script = Path.of(arg.substring("--script=".length()));
                    } else if (arg.startsWith("--origin-id=")) {
                        try {
                            originClientId = parseNonNegativeLong(arg.substring("--origin-id=".length()), "--origin-id");
                        } catch (IllegalArgumentException ex) {
                            showHelp = true;
                            error = ex.getMessage();
                        }
                    } else if (arg.startsWith("--client-prefix=")) {
                        clientPrefix = arg.substring("--client-prefix=".length()).trim();
                    } else if (arg.equals("--metrics")) {
                        metrics = true;
                    } else if (arg.equals("--no-pretty")) {
                        pretty = false;
                    } else if (error == null) {
                        showHelp = true;
                        error = "Unknown option: " + arg;
                    }
                }
            }

            if (clientPrefix != null && clientPrefix.isBlank()) {
                clientPrefix = null;
            }

            return new CliOptions(
                    showHelp,
                    error,
                    script,
                    originClientId,
                    clientPrefix,
                    metrics,
                    pretty
            );
        }

        void printHelp() {
            if (errorMessage != null) {
                System.err.println("Error: " + errorMessage);
            }
            System.out.println("""
Usage: ics02-client-registry [options]

Options:
  --help, -h                 Show this help message and exit
  --script=<path>            JSON command script to run (default: built-in demo flow)
  --origin-id=<n>            First client id to allocate (default 0)
  --client-prefix=<prefix>   Display prefix for client ids (default 07-tendermint)
  --metrics                  Log a metrics scrape after the run
  --no-pretty                Print the report as compact JSON

Environment overrides:
  ICS02_SCRIPT               Override --script
  ICS02_ORIGIN_ID            Override --origin-id
  ICS02_CLIENT_PREFIX        Override --client-prefix
  ICS02_METRICS              Set to "true" to enable --metrics
""");
        }

        private static Path envPath(String key, Path fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : Path.of(value);
        }

        private static String envOrDefault(String key, String fallback) {
            String value = System.getenv(key);
            return (value == null || value.isBlank()) ? fallback : value;
        }

        private static long parseNonNegativeLong(String value, String flag) {
            try {
                long parsed = Long.parseLong(value);
                if (parsed < 0) {
                    throw new NumberFormatException();
                }
                return parsed;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + value);
            }
        }
    }
}
