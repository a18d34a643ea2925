package com.pineparser.cli;

import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Pinecone.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code parse} - Parse a script and print its AST dump or JSON</li>
 *   <li>{@code unparse} - Parse a script and print the regenerated source</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * pinecone parse indicator.pine --indent 4
 * pinecone -v parse indicator.pine --format json --output-file ast.json
 * pinecone unparse indicator.pine
 * }</pre>
 */
@Command(
    name = "pinecone",
    mixinStandardHelpOptions = true,
    version = "Pinecone 1.0.0-SNAPSHOT",
    description = "Pine Script parser front end",
    subcommands = {
        ParseCommand.class,
        UnparseCommand.class
    }
)
public class PineconeCli implements Runnable {

    static final int EXIT_OK = 0;
    static final int EXIT_SYNTAX_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO_ERROR = 3;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();
        System.out.println("Use 'pinecone --help' to see available commands");
    }

    /**
     * Sets the root log level from the global options. Subcommands call this before doing any work.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new PineconeCli()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
