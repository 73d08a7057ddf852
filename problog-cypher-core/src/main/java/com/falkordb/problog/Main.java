package com.falkordb.problog;

import com.falkordb.problog.parse.FactSyntaxException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line shell for {@link ProblogToCypherConverter}.
 *
 * <pre>
 * Main &lt;input.pl&gt; [-o|--output &lt;file.cypher&gt;]
 * </pre>
 *
 * <p>The input is read as UTF-8. Without {@code --output} the statements are
 * written to standard output. Nothing is written when conversion fails.</p>
 */
public final class Main {
    /** Logger instance for this class. */
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    /** Exit status on success. */
    static final int EXIT_OK = 0;

    /** Exit status when the input contains a malformed fact. */
    static final int EXIT_CONVERSION_ERROR = 1;

    /** Exit status on bad command-line arguments. */
    static final int EXIT_USAGE = 2;

    /** Exit status when reading or writing a file fails. */
    static final int EXIT_IO_ERROR = 3;

    /** Usage text. */
    static final String USAGE =
        "Usage: Main <input.pl> [-o|--output <file.cypher>]\n"
        + "Convert ProbLog-style facts into Cypher.";

    /** Prevent instantiation of this command-line class. */
    private Main() {
        throw new AssertionError("No instances");
    }

    /**
     * Entry point.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run the converter. Package-private to allow testing.
     *
     * @param args command line arguments
     * @param out where statements go when no output file is given
     * @param err where usage text goes
     * @return the exit status
     */
    static int run(final String[] args, final PrintStream out,
            final PrintStream err) {
        String input = null;
        String output = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h":
                case "--help":
                    out.println(USAGE);
                    return EXIT_OK;
                case "-o":
                case "--output":
                    if (i + 1 >= args.length) {
                        err.println("Missing value for " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    output = args[++i];
                    break;
                default:
                    if (arg.startsWith("-") || input != null) {
                        err.println("Unexpected argument: " + arg);
                        err.println(USAGE);
                        return EXIT_USAGE;
                    }
                    input = arg;
                    break;
            }
        }

        if (input == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        String cypher;
        try {
            String text = Files.readString(Paths.get(input),
                StandardCharsets.UTF_8);
            cypher = ProblogToCypherConverter.convert(text);
        } catch (FactSyntaxException e) {
            LOGGER.error("Conversion of {} failed: {}", input, e.getMessage());
            return EXIT_CONVERSION_ERROR;
        } catch (IOException e) {
            LOGGER.error("Could not read {}: {}", input, e.getMessage());
            return EXIT_IO_ERROR;
        }

        if (output == null) {
            out.print(cypher);
            out.flush();
            return EXIT_OK;
        }

        Path target = Paths.get(output);
        try {
            Files.writeString(target, cypher, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("Could not write {}: {}", output, e.getMessage());
            return EXIT_IO_ERROR;
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Wrote {} statements to {}",
                cypher.lines().count(), target);
        }
        return EXIT_OK;
    }
}
