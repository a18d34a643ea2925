package com.pineparser.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectReader;
import com.pineparser.ParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads {@link ParseOptions} from a JSON object such as
 * <pre>{"tabWidth": 8, "parseAll": false}</pre>
 * Keys mirror the option names. Missing keys keep their default, unknown keys are rejected.
 */
public final class ParseOptionsReader {

    private static final Logger log = LoggerFactory.getLogger(ParseOptionsReader.class);

    private static final ObjectReader READER = PineJackson.createObjectMapper()
        .readerFor(OptionsDocument.class)
        .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    record OptionsDocument(
        Boolean parseAll,
        Boolean expandTabs,
        Boolean debug,
        Integer tabWidth,
        Integer recursionLimit,
        String versionPattern
    ) {}

    private ParseOptionsReader() {
        // Utility class
    }

    /**
     * @throws AstJsonException     if the file is not a JSON object of known options
     * @throws UncheckedIOException if the file cannot be read
     */
    public static ParseOptions read(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read options file " + file, e);
        }
        log.debug("Loading parse options from {}", file);
        return read(json);
    }

    public static ParseOptions read(String json) {
        OptionsDocument document;
        try {
            document = READER.readValue(json);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Invalid parse options: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new AstJsonException("Invalid parse options: expected a JSON object");
        }

        ParseOptions options = ParseOptions.defaults();
        if (document.parseAll() != null) {
            options = options.withParseAll(document.parseAll());
        }
        if (document.expandTabs() != null) {
            options = options.withExpandTabs(document.expandTabs());
        }
        if (document.debug() != null) {
            options = options.withDebug(document.debug());
        }
        if (document.tabWidth() != null) {
            options = options.withTabWidth(document.tabWidth());
        }
        if (document.recursionLimit() != null) {
            options = options.withRecursionLimit(document.recursionLimit());
        }
        if (document.versionPattern() != null) {
            options = options.withVersionPattern(document.versionPattern());
        }
        return options;
    }
}
