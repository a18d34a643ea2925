package com.pineparser;

import java.io.PrintStream;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Options shared by all parse entry points.
 *
 * @param parseAll        reject input that is not matched completely
 * @param expandTabs      expand tabs before version extraction and parsing
 * @param debug           print a caret diagnostic to {@code diagnosticsOut} on a syntax error
 * @param tabWidth        tab stop width, at least 1
 * @param recursionLimit  maximum nesting depth of grammar rules, at least 1
 * @param versionPattern  regular expression with a named group {@code version} that
 *                        recognizes the version directive
 * @param diagnosticsOut  where debug diagnostics go
 */
public record ParseOptions(
    boolean parseAll,
    boolean expandTabs,
    boolean debug,
    int tabWidth,
    int recursionLimit,
    String versionPattern,
    PrintStream diagnosticsOut
) {
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final String DEFAULT_VERSION_PATTERN = "//\\s*@version\\s*=\\s*(?<version>\\w+)";

    public ParseOptions {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be at least 1, got " + tabWidth);
        }
        if (recursionLimit < 1) {
            throw new IllegalArgumentException("recursionLimit must be at least 1, got " + recursionLimit);
        }
        if (versionPattern == null) {
            versionPattern = DEFAULT_VERSION_PATTERN;
        }
        if (!versionPattern.contains("(?<version>")) {
            throw new IllegalArgumentException("versionPattern must declare a named group 'version': " + versionPattern);
        }
        try {
            Pattern.compile(versionPattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid versionPattern: " + e.getDescription(), e);
        }
        if (diagnosticsOut == null) {
            diagnosticsOut = System.out;
        }
    }

    public static ParseOptions defaults() {
        return new ParseOptions(true, true, false, DEFAULT_TAB_WIDTH, RecursionLimit.DEFAULT_LIMIT,
            DEFAULT_VERSION_PATTERN, System.out);
    }

    public Pattern compiledVersionPattern() {
        return Pattern.compile(versionPattern);
    }

    public ParseOptions withParseAll(boolean parseAll) {
        return new ParseOptions(parseAll, expandTabs, debug, tabWidth, recursionLimit, versionPattern, diagnosticsOut);
    }

    public ParseOptions withExpandTabs(boolean expandTabs) {
        return new ParseOptions(parseAll, expandTabs, debug, tabWidth, recursionLimit, versionPattern, diagnosticsOut);
    }

    public ParseOptions withDebug(boolean debug) {
        return new ParseOptions(parseAll, expandTabs, debug, tabWidth, recursionLimit, versionPattern, diagnosticsOut);
    }

    public ParseOptions withTabWidth(int tabWidth) {
        return new ParseOptions(parseAll, expandTabs, debug, tabWidth, recursionLimit, versionPattern, diagnosticsOut);
    }

    public ParseOptions withRecursionLimit(int recursionLimit) {
        return new ParseOptions(parseAll, expandTabs, debug, tabWidth, recursionLimit, versionPattern, diagnosticsOut);
    }

    public ParseOptions withVersionPattern(String versionPattern) {
        return new ParseOptions(parseAll, expandTabs, debug, tabWidth, recursionLimit, versionPattern, diagnosticsOut);
    }

    public ParseOptions withDiagnosticsOut(PrintStream diagnosticsOut) {
        return new ParseOptions(parseAll, expandTabs, debug, tabWidth, recursionLimit, versionPattern, diagnosticsOut);
    }
}
