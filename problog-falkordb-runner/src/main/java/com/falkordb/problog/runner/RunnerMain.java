package com.falkordb.problog.runner;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line shell that applies a converted Cypher file to FalkorDB.
 *
 * <pre>
 * RunnerMain &lt;file.cypher&gt; [--host h] [--port p] [--graph g]
 * </pre>
 *
 * <p>Connection settings not given on the command line are read from
 * environment variables:</p>
 * <ul>
 *   <li>FALKORDB_HOST - FalkorDB host (default: localhost)</li>
 *   <li>FALKORDB_PORT - FalkorDB port (default: 6379)</li>
 *   <li>FALKORDB_GRAPH - graph name (default: facts)</li>
 * </ul>
 */
public final class RunnerMain {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(
        RunnerMain.class);

    /** Environment variable name for FalkorDB host. */
    static final String ENV_HOST = "FALKORDB_HOST";

    /** Environment variable name for FalkorDB port. */
    static final String ENV_PORT = "FALKORDB_PORT";

    /** Environment variable name for the graph name. */
    static final String ENV_GRAPH = "FALKORDB_GRAPH";

    /** Exit status on success. */
    static final int EXIT_OK = 0;

    /** Exit status when a statement fails. */
    static final int EXIT_EXECUTION_ERROR = 1;

    /** Exit status on bad command-line arguments. */
    static final int EXIT_USAGE = 2;

    /** Exit status when the script cannot be read. */
    static final int EXIT_IO_ERROR = 3;

    /** Usage text. */
    static final String USAGE =
        "Usage: RunnerMain <file.cypher> [--host <host>] [--port <port>]"
        + " [--graph <name>]\n"
        + "Run a converted Cypher file against FalkorDB.";

    /** Prevent instantiation of this command-line class. */
    private RunnerMain() {
        throw new AssertionError("No instances");
    }

    /**
     * Entry point.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    /**
     * Run the script. Package-private to allow testing.
     *
     * @param args command line arguments
     * @param env environment variables to take defaults from
     * @param out where usage help goes
     * @param err where argument errors go
     * @return the exit status
     */
    static int run(final String[] args, final Map<String, String> env,
            final PrintStream out, final PrintStream err) {
        Settings settings;
        try {
            settings = Settings.parse(args, env);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (settings == null) {
            out.println(USAGE);
            return EXIT_OK;
        }

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Running {} against {}:{} graph {}", settings.script(),
                settings.host(), settings.port(), settings.graphName());
        }

        String script;
        try {
            script = Files.readString(settings.script(),
                StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("Could not read {}: {}", settings.script(),
                e.getMessage());
            return EXIT_IO_ERROR;
        }

        try (CypherScriptRunner runner = CypherScriptRunner.builder()
                .host(settings.host())
                .port(settings.port())
                .graphName(settings.graphName())
                .build()) {
            runner.run(script);
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOGGER.error("Execution failed: {}", e.getMessage());
            LOGGER.debug("Stack trace:", e);
            return EXIT_EXECUTION_ERROR;
        }
    }

    /**
     * Resolved command-line settings.
     *
     * @param script the Cypher file
     * @param host FalkorDB host
     * @param port FalkorDB port
     * @param graphName graph name
     */
    record Settings(Path script, String host, int port, String graphName) {

        /**
         * Parse arguments, falling back to the environment and then to the
         * runner defaults.
         *
         * @param args command line arguments
         * @param env environment variables
         * @return the settings, or null when help was requested
         * @throws IllegalArgumentException on bad arguments
         */
        static Settings parse(final String[] args,
                final Map<String, String> env) {
            String script = null;
            String host = envOrDefault(env, ENV_HOST,
                CypherScriptRunner.DEFAULT_HOST);
            String port = envOrDefault(env, ENV_PORT,
                String.valueOf(CypherScriptRunner.DEFAULT_PORT));
            String graph = envOrDefault(env, ENV_GRAPH,
                CypherScriptRunner.DEFAULT_GRAPH_NAME);

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-h":
                    case "--help":
                        return null;
                    case "--host":
                        host = value(args, ++i, arg);
                        break;
                    case "--port":
                        port = value(args, ++i, arg);
                        break;
                    case "--graph":
                        graph = value(args, ++i, arg);
                        break;
                    default:
                        if (arg.startsWith("-") || script != null) {
                            throw new IllegalArgumentException(
                                "Unexpected argument: " + arg);
                        }
                        script = arg;
                        break;
                }
            }

            if (script == null) {
                throw new IllegalArgumentException("Missing Cypher file");
            }
            int portNumber;
            try {
                portNumber = Integer.parseInt(port);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid port: " + port, e);
            }
            return new Settings(Paths.get(script), host, portNumber, graph);
        }

        private static String value(final String[] args, final int index,
                final String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            return args[index];
        }

        private static String envOrDefault(final Map<String, String> env,
                final String name, final String defaultValue) {
            String value = env.get(name);
            return (value != null && !value.isEmpty()) ? value : defaultValue;
        }
    }
}
