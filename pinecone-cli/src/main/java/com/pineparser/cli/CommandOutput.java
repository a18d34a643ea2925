package com.pineparser.cli;

import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

final class CommandOutput {

    static final String STDOUT = "-";

    private CommandOutput() {
        // Utility class
    }

    /**
     * Writes {@code text} to the file named by {@code target}, or to the command's standard
     * output when the target is {@code -}. Files receive the text exactly; the console gets a
     * final line break if the text lacks one.
     */
    static void write(CommandLine commandLine, String target, String text, Charset encoding) throws IOException {
        if (STDOUT.equals(target)) {
            PrintWriter out = commandLine.getOut();
            out.print(text);
            if (!text.endsWith("\n")) {
                out.println();
            }
            out.flush();
            return;
        }
        Files.writeString(Path.of(target), text, encoding);
    }
}
