package com.pineparser;

import java.io.PrintStream;
import java.util.List;

/**
 * Prints a syntax error against the numbered source with a caret under the failing
 * column. Only observes the error; the caller rethrows it.
 */
public final class DebugDiagnostics {

    private final int tabWidth;
    private final PrintStream out;

    public DebugDiagnostics(int tabWidth, PrintStream out) {
        this.tabWidth = tabWidth;
        this.out = out;
    }

    /**
     * @param source the text the error refers to, before comment suppression
     * @param error  the grammar's error, positioned in the comment-free buffer
     */
    public void report(String source, ParseException error) {
        String[] formattedLines = LineNumbers.format(source, tabWidth).split("\n", -1);
        List<String> sourceLines = LineNumbers.splitLines(source);

        // The ruler rows shift the numbered lines down; the first numbered line tells by how much.
        int lineOffset = 0;
        int columnOffset = 0;
        for (int i = 0; i < formattedLines.length; i++) {
            String line = formattedLines[i];
            if (line.stripLeading().startsWith("1:")) {
                lineOffset = i;
                columnOffset = line.indexOf(':') + 1;
                break;
            }
        }

        out.println();
        out.println("Error while parsing source:");
        for (int i = 0; i < formattedLines.length; i++) {
            out.println(formattedLines[i]);

            int lineno = i - lineOffset + 1;
            if (lineno != error.getLine() || error.getLine() > sourceLines.size()) {
                continue;
            }

            String sourceLine = sourceLines.get(error.getLine() - 1);
            int until = Math.max(0, Math.min(sourceLine.length(), error.getColumn() - 1));
            int width = TabExpander.width(sourceLine.substring(0, until), tabWidth);

            String arrowIndent = " ".repeat(columnOffset + width);
            out.println(arrowIndent + "^");
            out.println(arrowIndent + error.getMessage());
        }
        out.flush();
    }
}
