package com.pineparser;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders text with a column ruler and a line number in front of every line, for
 * human-readable error reports:
 *
 * <pre>
 *            1
 *   1234567890123
 * 1:x = ta.sma(|
 * 2:plot(x)|
 * </pre>
 *
 * The tens row is only present when the widest line reaches ten columns.
 */
public final class LineNumbers {

    private LineNumbers() {
        // Utility class
    }

    public static String format(String text, int tabWidth) {
        List<String> lines = splitLines(TabExpander.expand(text, tabWidth));
        int numberWidth = String.valueOf(lines.size()).length();
        int maxWidth = 0;
        for (String line : lines) {
            maxWidth = Math.max(maxWidth, line.length());
        }

        String margin = " ".repeat(numberWidth + 1);
        StringBuilder out = new StringBuilder();
        if (maxWidth >= 10) {
            out.append(margin);
            for (int column = 1; column <= maxWidth; column++) {
                out.append(column % 10 == 0 ? Character.forDigit((column / 10) % 10, 10) : ' ');
            }
            out.append('\n');
        }
        out.append(margin);
        for (int column = 1; column <= maxWidth; column++) {
            out.append(Character.forDigit(column % 10, 10));
        }

        for (int i = 0; i < lines.size(); i++) {
            out.append('\n').append(String.format("%" + numberWidth + "d:%s|", i + 1, lines.get(i)));
        }
        return out.toString();
    }

    // A trailing line terminator does not start another line.
    static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }
}
