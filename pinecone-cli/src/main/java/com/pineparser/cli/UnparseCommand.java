package com.pineparser.cli;

import com.pineparser.ParseException;
import com.pineparser.PineParser;
import com.pineparser.ParseOptions;
import com.pineparser.unparse.PineAst;
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
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Parses a script and prints it back as normalized Pine Script source.
 */
@Command(
    name = "unparse",
    description = "Parse a Pine Script file and print the regenerated source",
    mixinStandardHelpOptions = true
)
public class UnparseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(UnparseCommand.class);

    @ParentCommand
    private PineconeCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Script file to regenerate")
    private Path path;

    @Option(names = "--encoding", defaultValue = "utf-8", description = "Encoding of the script and the output (default: ${DEFAULT-VALUE})")
    private Charset encoding;

    @Option(names = "--output-file", defaultValue = "-", description = "Output file, '-' for standard output (default: ${DEFAULT-VALUE})")
    private String outputFile;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }
        if (!Files.isRegularFile(path)) {
            throw new ParameterException(spec.commandLine(), "File '" + path + "' does not exist");
        }

        log.debug("Regenerating {}", path);
        try {
            String source = PineAst.unparse(PineParser.parseFile(path, encoding, ParseOptions.defaults()));
            CommandOutput.write(spec.commandLine(), outputFile, source, encoding);
            return PineconeCli.EXIT_OK;
        } catch (ParseException e) {
            spec.commandLine().getErr().println("Syntax error in " + path + ": " + e.getMessage());
            return PineconeCli.EXIT_SYNTAX_ERROR;
        } catch (UncheckedIOException | IOException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return PineconeCli.EXIT_IO_ERROR;
        }
    }
}
