package com.pineparser;

import com.pineparser.ast.Script;
import com.pineparser.dump.AstDump;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RecursionLimitTest {

    private static String nestedParens(int depth) {
        return "x = " + "(".repeat(depth) + "1" + ")".repeat(depth) + "\n";
    }

    private static String nestedTypeArguments(int depth) {
        return "x = array.new<" + "a<".repeat(depth) + "b" + ">".repeat(depth) + ">(0)\n";
    }

    @Test
    void testDeepNestingWithinDefaultLimit() {
        Script script = PineParser.parseString(nestedParens(400));
        assertEquals(1, script.body().size());
    }

    @Test
    void testDefaultLimitFailsCleanly() {
        RecursionLimitExceededException e = assertThrows(RecursionLimitExceededException.class,
            () -> PineParser.parseString(nestedParens(1200)));
        assertEquals(RecursionLimit.DEFAULT_LIMIT, e.getLimit());
        assertEquals("Maximum nesting depth of 1000 exceeded", e.getReason());
        assertInstanceOf(ParseException.class, e);
    }

    @Test
    void testConfiguredLimit() {
        ParseOptions options = ParseOptions.defaults().withRecursionLimit(5);
        assertThrows(RecursionLimitExceededException.class, () -> PineParser.parseString(nestedParens(10), options));
        assertEquals(1, PineParser.parseString(nestedParens(2), options).body().size());
    }

    @Test
    void testLimitIsReportedEvenWhenNotParsingAll() {
        ParseOptions options = ParseOptions.defaults().withRecursionLimit(5).withParseAll(false);
        assertThrows(RecursionLimitExceededException.class, () -> PineParser.parseString(nestedParens(10), options));
    }

    @Test
    void testDepthReturnsToZero() {
        RecursionLimit limit = new RecursionLimit(8);
        assertThrows(RecursionLimitExceededException.class, () -> new Parser(nestedParens(20), 4, limit).parse(true));
        assertEquals(0, limit.depth());

        RecursionLimit roomy = new RecursionLimit(100);
        new Parser(nestedParens(20), 4, roomy).parse(true);
        assertEquals(0, roomy.depth());
        assertEquals(100, roomy.limit());
    }

    @Test
    void testNestedBlocksCountTowardsLimit() {
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < 10; i++) {
            source.append("    ".repeat(i)).append("if c\n");
        }
        source.append("    ".repeat(10)).append("x := 1\n");

        assertEquals(1, PineParser.parseString(source.toString()).body().size());
        assertThrows(RecursionLimitExceededException.class,
            () -> PineParser.parseString(source.toString(), ParseOptions.defaults().withRecursionLimit(10)));
    }

    @Test
    void testNestedTypeArgumentsCountTowardsLimit() {
        Script script = PineParser.parseString(nestedTypeArguments(50));
        assertEquals(1, script.body().size());
        System.out.println("50 nested type arguments: " + AstDump.dump(script).length() + " chars of dump");

        RecursionLimitExceededException e = assertThrows(RecursionLimitExceededException.class,
            () -> PineParser.parseString(nestedTypeArguments(2000)));
        assertEquals(RecursionLimit.DEFAULT_LIMIT, e.getLimit());
    }

    @Test
    void testNestedTypeArgumentsInDeclarations() {
        String declaration = "array<" + "array<".repeat(30) + "int" + ">".repeat(30) + "> x = na\n";
        assertEquals(1, PineParser.parseString(declaration).body().size());

        assertThrows(RecursionLimitExceededException.class,
            () -> PineParser.parseString(declaration, ParseOptions.defaults().withRecursionLimit(10)));
        assertThrows(RecursionLimitExceededException.class,
            () -> PineParser.parseString(declaration, ParseOptions.defaults().withRecursionLimit(10).withParseAll(false)));
    }

    @Test
    void testLargeLimitAllowsDeepNesting() {
        ParseOptions options = ParseOptions.defaults().withRecursionLimit(20000);
        Script script = PineParser.parseString(nestedParens(6000), options);
        assertEquals(1, script.body().size());

        RecursionLimitExceededException e = assertThrows(RecursionLimitExceededException.class,
            () -> PineParser.parseString(nestedParens(25000), options));
        assertEquals(20000, e.getLimit());
    }

    @Test
    void testStackExhaustionIsReportedAsLimit() {
        // Runs the grammar on the test thread, whose stack is far smaller than the limit allows.
        RecursionLimit limit = new RecursionLimit(1_000_000);
        Parser parser = new Parser(nestedParens(200_000), 4, limit);
        RecursionLimitExceededException e = assertThrows(RecursionLimitExceededException.class,
            () -> parser.parse(true));
        assertEquals(1_000_000, e.getLimit());
    }

    @Test
    void testInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new RecursionLimit(0));
    }
}
