package com.pineparser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prepares raw script text for the grammar: tab expansion, version directive extraction
 * and comment suppression, in that order.
 */
public final class DirectivePreprocessor {

    private static final Logger log = LoggerFactory.getLogger(DirectivePreprocessor.class);

    private final boolean expandTabs;
    private final int tabWidth;
    private final Pattern versionPattern;

    public DirectivePreprocessor(ParseOptions options) {
        this.expandTabs = options.expandTabs();
        this.tabWidth = options.tabWidth();
        this.versionPattern = options.compiledVersionPattern();
    }

    public PreprocessedSource process(String text) {
        String source = expandTabs ? TabExpander.expand(text, tabWidth) : text;
        String version = findVersion(source);
        if (version != null) {
            log.debug("Found version directive: {}", version);
        }
        return new PreprocessedSource(source, stripComments(source), version);
    }

    /**
     * Returns the value of the first version directive anywhere in the text, or null.
     */
    public String findVersion(String text) {
        Matcher matcher = versionPattern.matcher(text);
        return matcher.find() ? matcher.group("version") : null;
    }

    /**
     * Removes {@code //} comments that are not inside a string literal. Line terminators
     * are kept, so line numbers and the columns in front of a comment are unchanged.
     */
    public static String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (c == '"' || c == '\'') {
                int end = skipString(text, i, c);
                out.append(text, i, end);
                i = end;
            } else if (c == '/' && i + 1 < length && text.charAt(i + 1) == '/') {
                while (i < length && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
                    i++;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    // Index just past the closing quote, or the line end of an unterminated literal.
    private static int skipString(String text, int start, char quote) {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n') {
                return i;
            }
            if (c == '\\' && i + 1 < text.length() && text.charAt(i + 1) != '\n') {
                i += 2;
                continue;
            }
            i++;
        }
        return i;
    }
}
