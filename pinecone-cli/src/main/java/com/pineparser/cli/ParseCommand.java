package com.pineparser.cli;

import com.pineparser.ParseException;
import com.pineparser.ParseOptions;
import com.pineparser.PineParser;
import com.pineparser.ast.Script;
import com.pineparser.dump.AstDump;
import com.pineparser.jackson.AstJsonException;
import com.pineparser.jackson.AstJsonSerializer;
import com.pineparser.jackson.ParseOptionsReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Parses a script file and writes its AST, as the indented dump or as JSON.
 */
@Command(
    name = "parse",
    description = "Parse a Pine Script file and print its AST",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    enum Format { DUMP, JSON }

    @ParentCommand
    private PineconeCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Script file to parse")
    private Path path;

    @Option(names = "--encoding", defaultValue = "utf-8", description = "Encoding of the script and the output (default: ${DEFAULT-VALUE})")
    private Charset encoding;

    @Option(names = "--indent", defaultValue = "2", description = "Dump indentation per level; 0 for a single line (default: ${DEFAULT-VALUE})")
    private int indent;

    @Option(names = "--output-file", defaultValue = "-", description = "Output file, '-' for standard output (default: ${DEFAULT-VALUE})")
    private String outputFile;

    @Option(names = "--format", defaultValue = "dump", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private Format format;

    @Option(names = "--options", description = "JSON file with parse options")
    private Path optionsFile;

    @Option(names = "--debug", description = "Print a caret diagnostic on syntax errors")
    private boolean debug;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        if (!Files.isRegularFile(path)) {
            throw new ParameterException(spec.commandLine(), "File '" + path + "' does not exist");
        }
        if (indent < 0) {
            throw new ParameterException(spec.commandLine(), "--indent must not be negative");
        }

        PrintWriter err = spec.commandLine().getErr();
        ParseOptions options;
        try {
            options = optionsFile != null ? ParseOptionsReader.read(optionsFile) : ParseOptions.defaults();
        } catch (AstJsonException | IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), "Invalid options file " + optionsFile + ": " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return PineconeCli.EXIT_IO_ERROR;
        }
        if (debug) {
            options = options.withDebug(true).withDiagnosticsOut(System.err);
        }

        log.debug("Parsing {} ({})", path, encoding);
        try {
            Script script = PineParser.parseFile(path, encoding, options);
            String rendered = format == Format.JSON
                ? new AstJsonSerializer().serializePretty(script)
                : AstDump.dump(script, indent);
            CommandOutput.write(spec.commandLine(), outputFile, rendered, encoding);
            log.info("Parsed {}: {} top-level statements", path, script.body().size());
            return PineconeCli.EXIT_OK;
        } catch (ParseException e) {
            err.println("Syntax error in " + path + ": " + e.getMessage());
            return PineconeCli.EXIT_SYNTAX_ERROR;
        } catch (UncheckedIOException e) {
            err.println("Error: " + e.getMessage());
            return PineconeCli.EXIT_IO_ERROR;
        } catch (IOException e) {
            err.println("Error: failed to write " + outputFile + ": " + e.getMessage());
            return PineconeCli.EXIT_IO_ERROR;
        }
    }
}
