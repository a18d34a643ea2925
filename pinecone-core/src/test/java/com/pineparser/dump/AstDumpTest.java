package com.pineparser.dump;

import com.pineparser.PineParser;
import com.pineparser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstDumpTest {

    private static final Script SAMPLE = new Script(List.of(
        new Expr(new Call(new Name("plot"), List.of(new Arg(new Name("close")))))
    ), "5");

    @Test
    void testCompact() {
        assertEquals(
            "Script(body=[Expr(value=Call(func=Name(id='plot'), args=[Arg(value=Name(id='close'), name=None)]))], version='5')",
            AstDump.dump(SAMPLE));
        assertEquals(AstDump.dump(SAMPLE), AstDump.dump(SAMPLE, 0));
        assertEquals(AstDump.dump(SAMPLE), AstDump.dump(SAMPLE, (String) null));
    }

    @Test
    void testIndented() {
        String expected = String.join("\n",
            "Script(",
            "  body=[",
            "    Expr(",
            "      value=Call(",
            "        func=Name(",
            "          id='plot',",
            "        ),",
            "        args=[",
            "          Arg(",
            "            value=Name(",
            "              id='close',",
            "            ),",
            "            name=None,",
            "          ),",
            "        ],",
            "      ),",
            "    ),",
            "  ],",
            "  version='5',",
            ")");
        assertEquals(expected, AstDump.dump(SAMPLE, 2));
        assertEquals(expected.replace("  ", "\t"), AstDump.dump(SAMPLE, "\t"));
    }

    @Test
    void testZeroFieldNodesAndEmptyLists() {
        Script script = new Script(List.of(
            new Expr(new While(new Constant(true), List.of(new Break())))
        ));
        String dump = AstDump.dump(script, 1);
        assertTrue(dump.contains(" Break(),"), dump);
        assertEquals("Call(\n func=Name(\n  id='f',\n ),\n args=[],\n)",
            AstDump.dump(new Call(new Name("f"), List.of()), 1));
    }

    @Test
    void testDeterministicAndLocationFree() {
        Script parsed = PineParser.parseString("//@version=5\nplot(close)\n");
        assertEquals(AstDump.dump(SAMPLE, 4), AstDump.dump(parsed, 4));
        assertEquals(AstDump.dump(parsed, 4), AstDump.dump(parsed, 4));
    }

    @Test
    void testNegativeIndentRejected() {
        assertThrows(IllegalArgumentException.class, () -> AstDump.dump(SAMPLE, -1));
    }

    @Test
    void testFieldOrderFollowsDeclaration() {
        Assign assign = new Assign(new Name("x"), new Constant(1L), new Name("int"), "var");
        assertEquals("Assign(target=Name(id='x'), value=Constant(value=1, kind=None), type=Name(id='int'), mode='var')",
            AstDump.dump(assign));
    }

    @Test
    void testLongLeftDeepSum() {
        Script script = PineParser.parseString("x = " + "1 + ".repeat(5000) + "1\n");

        String compact = AstDump.dump(script);
        assertTrue(compact.startsWith("Script(body=[Assign(target=Name(id='x'), value=BinOp(left=BinOp("), compact.substring(0, 80));
        assertEquals(5000, compact.split("BinOp\\(", -1).length - 1);
        assertEquals(compact, AstDump.repr(script));
        System.out.println("Compact dump of 5000 terms: " + compact.length() + " chars");

        Script shorter = PineParser.parseString("x = " + "1 + ".repeat(1000) + "1\n");
        String indented = AstDump.dump(shorter, " ");
        assertEquals(1000, indented.split("BinOp\\(", -1).length - 1);
        assertTrue(indented.endsWith("\n)"));
    }
}
