package io.github.eutro.ilcore.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PlainTextOutputTest {
    @Test
    void testIndentation() {
        PlainTextOutput out = new PlainTextOutput("  ");
        out.writeLine("a {");
        out.indent();
        out.writeLine("b");
        out.indent();
        out.write("c");
        out.writeLine();
        out.unindent();
        out.unindent();
        out.write('}');
        assertEquals("a {\n  b\n    c\n}", out.toString());
    }

    @Test
    void testFolds() {
        PlainTextOutput out = new PlainTextOutput();
        out.write("x ");
        out.markFoldStart("{...}");
        out.write("{ y }");
        out.markFoldEnd();
        assertEquals(1, out.getFolds().size());
        PlainTextOutput.Fold fold = out.getFolds().get(0);
        assertEquals(2, fold.start);
        assertEquals(7, fold.end);
        assertEquals("{...}", fold.collapsedText);
        assertEquals("{ y }", out.toString().substring(fold.start, fold.end));
    }

    @Test
    void testUnbalanced() {
        PlainTextOutput out = new PlainTextOutput();
        assertThrows(IllegalStateException.class, out::unindent);
        assertThrows(IllegalStateException.class, out::markFoldEnd);
    }
}
