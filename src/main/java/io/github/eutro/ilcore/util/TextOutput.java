package io.github.eutro.ilcore.util;

import io.github.eutro.ilcore.il.ILInstruction;

/**
 * A sink for the textual form of the instruction tree, as produced by
 * {@link ILInstruction#writeTo(TextOutput)}.
 * <p>
 * Implementations track indentation, so writers only need to say where
 * a nested region starts and ends. Fold markers delimit regions that a
 * debug view may collapse.
 */
public interface TextOutput {
    /**
     * Write some text.
     *
     * @param text The text. Should not contain line breaks.
     */
    void write(String text);

    /**
     * Write a single character.
     *
     * @param c The character.
     */
    void write(char c);

    /**
     * End the current line.
     */
    void writeLine();

    /**
     * Write some text, then end the line.
     *
     * @param text The text.
     */
    default void writeLine(String text) {
        write(text);
        writeLine();
    }

    /**
     * Increase the indentation of lines started after this call.
     */
    void indent();

    /**
     * Decrease the indentation of lines started after this call.
     */
    void unindent();

    /**
     * Mark the start of a collapsible region.
     *
     * @param collapsedText The text to show in place of the region when it is collapsed.
     */
    void markFoldStart(String collapsedText);

    /**
     * Mark the end of the innermost open collapsible region.
     */
    void markFoldEnd();
}
