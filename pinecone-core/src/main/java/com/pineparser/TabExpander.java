package com.pineparser;

/**
 * Tab handling with tab stops every {@code tabWidth} columns.
 */
public final class TabExpander {

    private TabExpander() {
        // Utility class
    }

    /**
     * Replaces every tab with spaces up to the next tab stop. The column count restarts
     * after each line terminator.
     */
    public static String expand(String text, int tabWidth) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        int column = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t') {
                int spaces = tabWidth - (column % tabWidth);
                out.append(" ".repeat(spaces));
                column += spaces;
            } else {
                out.append(c);
                column = (c == '\n' || c == '\r') ? 0 : column + 1;
            }
        }
        return out.toString();
    }

    /**
     * Rendered width of a single-line fragment, tabs advancing to the next tab stop.
     */
    public static int width(String fragment, int tabWidth) {
        int width = 0;
        for (int i = 0; i < fragment.length(); i++) {
            if (fragment.charAt(i) == '\t') {
                width = (width / tabWidth + 1) * tabWidth;
            } else {
                width++;
            }
        }
        return width;
    }
}
