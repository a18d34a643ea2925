package com.pineparser;

import com.pineparser.ast.Script;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Parse entry points: input normalization, preprocessing, the grammar run under its
 * recursion limit, and the optional debug diagnostic on failure. The grammar runs on a
 * {@link DeepStack} sized for the limit, so input nested up to a large limit still parses
 * and deeper input fails with {@link RecursionLimitExceededException}.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * Script script = PineParser.parseString("//@version=5\nplot(close)\n");
 * Script fromFile = PineParser.parseFile(Path.of("indicator.pine"));
 * }</pre>
 */
public final class PineParser {

    private static final Logger log = LoggerFactory.getLogger(PineParser.class);

    private PineParser() {
        // Utility class
    }

    public static Script parseString(String source) {
        return parseString(source, ParseOptions.defaults());
    }

    public static Script parseString(String source, ParseOptions options) {
        PreprocessedSource prepared = new DirectivePreprocessor(options).process(source);
        RecursionLimit recursionLimit = new RecursionLimit(options.recursionLimit());

        Script script;
        try {
            Parser parser = new Parser(prepared.commentFree(), options.tabWidth(), recursionLimit);
            script = DeepStack.call(options.recursionLimit(), () -> parser.parse(options.parseAll()));
        } catch (ParseException e) {
            log.debug("Parse failed: {}", e.getMessage());
            if (options.debug()) {
                new DebugDiagnostics(options.tabWidth(), options.diagnosticsOut()).report(prepared.source(), e);
            }
            throw e;
        }

        if (prepared.version() != null) {
            script = script.withVersion(prepared.version());
        }
        log.debug("Parsed {} top-level statements (version {})", script.body().size(), script.version());
        return script;
    }

    public static Script parseFile(Object file) {
        return parseFile(file, null, ParseOptions.defaults());
    }

    /**
     * Parses a file or stream.
     *
     * @param file     a {@code String} or {@code Path} or {@code File} naming a file, a {@code byte[]},
     *                 an {@code InputStream} or a {@code Reader}
     * @param encoding the character encoding; UTF-8 when null
     * @throws UnsupportedInputTypeException if {@code file} is none of the accepted kinds
     */
    public static Script parseFile(Object file, Charset encoding, ParseOptions options) {
        String source = SourceInput.read(file, encoding);
        return parseString(source, options);
    }

    public static Script parse(Object source) {
        return parse(source, null, ParseOptions.defaults());
    }

    /**
     * Parses {@code source} as script text when it is a string that does not name an
     * existing file, and as a file or stream otherwise.
     */
    public static Script parse(Object source, Charset encoding, ParseOptions options) {
        if (source instanceof String text && !isExistingPath(text)) {
            return parseString(text, options);
        }
        return parseFile(source, encoding, options);
    }

    /**
     * Like {@link #parse(Object, Charset, ParseOptions)} but reports syntax errors as a
     * {@link ParseOutcome.SyntaxFailure} instead of throwing.
     */
    public static ParseOutcome<Script> tryParse(Object source, Charset encoding, ParseOptions options) {
        try {
            return new ParseOutcome.Success<>(parse(source, encoding, options));
        } catch (ParseException e) {
            return new ParseOutcome.SyntaxFailure<>(e);
        }
    }

    public static ParseOutcome<Script> tryParse(Object source) {
        return tryParse(source, null, ParseOptions.defaults());
    }

    private static boolean isExistingPath(String text) {
        try {
            return Files.exists(Path.of(text));
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
