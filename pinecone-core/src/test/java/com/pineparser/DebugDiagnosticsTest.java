package com.pineparser;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DebugDiagnosticsTest {

    private static List<String> runWithDebug(String source, ParseOptions options) {
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        ParseOptions debugOptions = options.withDebug(true)
            .withDiagnosticsOut(new PrintStream(captured, true, StandardCharsets.UTF_8));

        assertThrows(ParseException.class, () -> PineParser.parseString(source, debugOptions));
        String output = captured.toString(StandardCharsets.UTF_8);
        System.out.println(output);
        return List.of(output.split("\\R", -1));
    }

    @Test
    void testCaretUnderTabbedColumn() {
        List<String> lines = runWithDebug("a = 1\nb = (1 +\t$)\n", ParseOptions.defaults().withExpandTabs(false));

        String indent = " ".repeat(14);
        assertEquals(List.of(
            "",
            "Error while parsing source:",
            "           1    ",
            "  12345678901234",
            "1:a = 1|",
            "2:b = (1 +    $)|",
            indent + "^",
            indent + "Unexpected character '$' (line 2, column 10)",
            ""
        ), lines);
    }

    @Test
    void testCaretSameWithExpandedTabs() {
        List<String> expanded = runWithDebug("a = 1\nb = (1 +\t$)\n", ParseOptions.defaults());
        assertEquals(" ".repeat(14) + "^", expanded.get(6));
        assertEquals(" ".repeat(14) + "Unexpected character '$' (line 2, column 13)", expanded.get(7));
    }

    @Test
    void testShortSourceHasNoTensRow() {
        List<String> lines = runWithDebug("x = $\n", ParseOptions.defaults());
        assertEquals("  12345", lines.get(2));
        assertEquals("1:x = $|", lines.get(3));
        assertEquals("      ^", lines.get(4));
    }

    @Test
    void testErrorIsRethrownUnchanged() {
        ParseException thrown = assertThrows(ParseException.class,
            () -> PineParser.parseString("a = (\n", ParseOptions.defaults()
                .withDebug(true)
                .withDiagnosticsOut(new PrintStream(new ByteArrayOutputStream()))));
        assertEquals("Unexpected end of line in expression", thrown.getReason());
        assertEquals(2, thrown.getLine());
    }

    @Test
    void testNoCaretWhenLineIsOutOfRange() {
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        new DebugDiagnostics(4, new PrintStream(captured, true, StandardCharsets.UTF_8))
            .report("a\nb\n", new ParseException("late", 7, 1));
        assertFalse(captured.toString(StandardCharsets.UTF_8).contains("^"));
    }

    @Test
    void testLineNumbersFormat() {
        assertEquals("  1\n1:a|\n2:b|", LineNumbers.format("a\nb\n", 4));
        assertEquals("  123456\n1:    ab|", LineNumbers.format("\tab", 4));

        String tenLines = "x\n".repeat(10);
        String formatted = LineNumbers.format(tenLines, 4);
        assertTrue(formatted.startsWith("   1\n 1:x|\n"), formatted);
        assertTrue(formatted.endsWith("\n10:x|"), formatted);
    }
}
