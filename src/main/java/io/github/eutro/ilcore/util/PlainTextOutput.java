package io.github.eutro.ilcore.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A {@link TextOutput} that writes to a {@link StringBuilder}, and records fold regions
 * as character offsets into the written text.
 */
public class PlainTextOutput implements TextOutput {
    private final StringBuilder sb = new StringBuilder();
    private final String indentation;
    private int indent = 0;
    private boolean needsIndent = false;
    private final Deque<Integer> openFolds = new ArrayDeque<>();
    private final Deque<String> openFoldTexts = new ArrayDeque<>();
    private final List<Fold> folds = new ArrayList<>();

    /**
     * Construct an output indenting with tabs.
     */
    public PlainTextOutput() {
        this("\t");
    }

    /**
     * Construct an output indenting with the given string.
     *
     * @param indentation The string to write once per indentation level.
     */
    public PlainTextOutput(String indentation) {
        this.indentation = indentation;
    }

    private void writeIndent() {
        if (needsIndent) {
            needsIndent = false;
            for (int i = 0; i < indent; i++) {
                sb.append(indentation);
            }
        }
    }

    @Override
    public void write(String text) {
        writeIndent();
        sb.append(text);
    }

    @Override
    public void write(char c) {
        writeIndent();
        sb.append(c);
    }

    @Override
    public void writeLine() {
        sb.append('\n');
        needsIndent = true;
    }

    @Override
    public void indent() {
        indent++;
    }

    @Override
    public void unindent() {
        if (indent == 0) throw new IllegalStateException("unindent without matching indent");
        indent--;
    }

    @Override
    public void markFoldStart(String collapsedText) {
        writeIndent();
        openFolds.push(sb.length());
        openFoldTexts.push(collapsedText);
    }

    @Override
    public void markFoldEnd() {
        if (openFolds.isEmpty()) throw new IllegalStateException("markFoldEnd without matching markFoldStart");
        folds.add(new Fold(openFolds.pop(), sb.length(), openFoldTexts.pop()));
    }

    /**
     * Get the closed fold regions, in the order they were closed.
     *
     * @return The unmodifiable list of folds.
     */
    public List<Fold> getFolds() {
        return Collections.unmodifiableList(folds);
    }

    @Override
    public String toString() {
        return sb.toString();
    }

    /**
     * A collapsible region of the output.
     */
    public static final class Fold {
        /**
         * The offset of the first character in the region.
         */
        public final int start;
        /**
         * The offset after the last character in the region.
         */
        public final int end;
        /**
         * The text to show when the region is collapsed.
         */
        public final String collapsedText;

        Fold(int start, int end, String collapsedText) {
            this.start = start;
            this.end = end;
            this.collapsedText = collapsedText;
        }

        @Override
        public String toString() {
            return String.format("[%d, %d) %s", start, end, collapsedText);
        }
    }
}
