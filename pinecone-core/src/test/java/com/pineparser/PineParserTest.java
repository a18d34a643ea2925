package com.pineparser;

import com.pineparser.ast.*;
import com.pineparser.dump.AstDump;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PineParserTest {

    @Test
    void testCustomVersionPattern() {
        ParseOptions options = ParseOptions.defaults().withVersionPattern("//\\s*(?<version>v\\d+)");
        Script script = PineParser.parseString("// v1\nfoo()\n", options);

        assertEquals("v1", script.version());
        assertEquals(1, script.body().size());
        String dump = AstDump.dump(script, 2);
        System.out.println(dump);
        assertTrue(dump.startsWith("Script(\n  body=[\n    Expr("), dump);
        assertTrue(dump.endsWith("  version='v1',\n)"), dump);
    }

    @Test
    void testDefaultVersionDirective() {
        Script script = PineParser.parseString("//@version=5\nindicator(\"Demo\")\nplot(close)\n");
        assertEquals("5", script.version());
        assertEquals(2, script.body().size());
    }

    @Test
    void testFirstDirectiveAnywhereWins() {
        Script script = PineParser.parseString("a = 1\n// @version = 4\n//@version=5\n");
        assertEquals("4", script.version());
    }

    @Test
    void testNoDirective() {
        assertNull(PineParser.parseString("a = 1\n").version());
    }

    @Test
    void testEmptyInput() {
        Script script = PineParser.parseString("");
        assertTrue(script.body().isEmpty());
        assertEquals("Script(body=[], version=None)", AstDump.dump(script));
    }

    @Test
    void testCommentsAreIgnoredButNotInsideStrings() {
        Script script = PineParser.parseString("// header\nurl = \"http://example.com\" // trailing\n");
        assertEquals(1, script.body().size());
        Assign assign = (Assign) script.body().get(0);
        assertEquals("http://example.com", ((Constant) assign.value()).value());
    }

    @Test
    void testTabsAreExpandedBeforeParsing() {
        Script script = PineParser.parseString("if a\n\tb = 1\n");
        If statement = (If) ((Expr) script.body().get(0)).value();
        assertEquals(1, statement.body().size());
    }

    @Test
    void testParseAllRejectsTrailingGarbage() {
        assertThrows(ParseException.class, () -> PineParser.parseString("a = 1\n)\n"));

        Script partial = PineParser.parseString("a = 1\n)\n", ParseOptions.defaults().withParseAll(false));
        assertEquals(1, partial.body().size());
    }

    @Test
    void testCompleteStatementBeforeTrailingGarbageIsKept() {
        ParseOptions lenient = ParseOptions.defaults().withParseAll(false);

        Script script = PineParser.parseString("foo() )\n", lenient);
        assertEquals("Script(body=[Expr(value=Call(func=Name(id='foo'), args=[]))], version=None)", AstDump.dump(script));

        Script stopped = PineParser.parseString("a = 1\nb = 2 3\nc = 4\n", lenient);
        assertEquals(2, stopped.body().size());
        assertEquals("b", ((Name) ((Assign) stopped.body().get(1)).target()).id());

        assertThrows(ParseException.class, () -> PineParser.parseString("foo() )\n"));
    }

    @Test
    void testGarbageInsideBlockDropsTheWholeStatement() {
        ParseOptions lenient = ParseOptions.defaults().withParseAll(false);
        Script script = PineParser.parseString("a = 1\nif c\n    x := 1 2\nb = 2\n", lenient);
        assertEquals(1, script.body().size());
        assertInstanceOf(Assign.class, script.body().get(0));
    }

    @Test
    void testParseTreatsExistingPathAsFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("script.pine");
        Files.writeString(file, "//@version=5\nx = 1\ny = 2\n");

        Script fromFile = PineParser.parse(file.toString());
        assertEquals(2, fromFile.body().size());
        assertEquals("5", fromFile.version());

        Script fromText = PineParser.parse("x = 1\n");
        assertEquals(1, fromText.body().size());
    }

    @Test
    void testParseFileWithEncoding(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("latin.pine");
        Files.write(file, "s = \"café\"\n".getBytes(StandardCharsets.ISO_8859_1));

        Script script = PineParser.parseFile(file, StandardCharsets.ISO_8859_1, ParseOptions.defaults());
        assertEquals("café", ((Constant) ((Assign) script.body().get(0)).value()).value());
    }

    @Test
    void testTryParseOutcomes() {
        ParseOutcome<Script> ok = PineParser.tryParse("a = 1\n");
        assertTrue(ok.isSuccess());
        assertEquals(1, ok.orElseThrow().body().size());

        ParseOutcome<Script> bad = PineParser.tryParse("a = (\n");
        assertFalse(bad.isSuccess());
        assertInstanceOf(ParseOutcome.SyntaxFailure.class, bad);
        assertThrows(ParseException.class, bad::orElseThrow);
    }

    @Test
    void testNoDiagnosticsWithoutDebug() {
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        ParseOptions options = ParseOptions.defaults().withDiagnosticsOut(new PrintStream(captured, true));

        assertThrows(ParseException.class, () -> PineParser.parseString("a = $\n", options));
        assertEquals(0, captured.size());
    }

    @Test
    void testUnsupportedInput() {
        UnsupportedInputTypeException e = assertThrows(UnsupportedInputTypeException.class,
            () -> PineParser.parse(42));
        assertEquals("Unsupported argument type: java.lang.Integer", e.getMessage());
    }

    @Test
    void testOptionValidation() {
        assertThrows(IllegalArgumentException.class, () -> ParseOptions.defaults().withTabWidth(0));
        assertThrows(IllegalArgumentException.class, () -> ParseOptions.defaults().withRecursionLimit(0));
        assertThrows(IllegalArgumentException.class, () -> ParseOptions.defaults().withVersionPattern("//@version=(\\d+)"));
        assertEquals(ParseOptions.DEFAULT_VERSION_PATTERN, ParseOptions.defaults().withVersionPattern(null).versionPattern());
    }

    @Test
    void testMalformedVersionPatternIsRejectedUpFront() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ParseOptions.defaults().withVersionPattern("(?<version>["));
        assertTrue(e.getMessage().startsWith("Invalid versionPattern"), e.getMessage());
        assertInstanceOf(java.util.regex.PatternSyntaxException.class, e.getCause());
    }
}
