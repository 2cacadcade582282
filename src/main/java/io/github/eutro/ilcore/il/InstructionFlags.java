package io.github.eutro.ilcore.il;

import java.util.StringJoiner;

/**
 * Bit flags summarising the control flow and side effects of an instruction and its children.
 *
 * @see ILInstruction#getFlags()
 * @see ILInstruction#getDirectFlags()
 */
public final class InstructionFlags {
    private InstructionFlags() {
    }

    /**
     * No effects at all.
     */
    public static final int NONE = 0;
    /**
     * The instruction may read from local variables.
     */
    public static final int MAY_READ_LOCALS = 1;
    /**
     * The instruction may write to local variables.
     */
    public static final int MAY_WRITE_LOCALS = 1 << 1;
    /**
     * The instruction may have side effects other than reading or writing locals,
     * such as calling methods or writing to fields.
     */
    public static final int SIDE_EFFECT = 1 << 2;
    /**
     * The instruction may throw an exception.
     */
    public static final int MAY_THROW = 1 << 3;
    /**
     * Control never reaches the end of the instruction, for example because it always throws.
     */
    public static final int END_POINT_UNREACHABLE = 1 << 4;
    /**
     * The instruction performs control flow, such as a conditional or a switch.
     */
    public static final int CONTROL_FLOW = 1 << 5;

    /**
     * The flags which only hold for a set of alternative branches if they hold on every branch.
     * All other flags hold if they hold on any branch.
     */
    public static final int ON_ALL_BRANCHES = END_POINT_UNREACHABLE;

    /**
     * Combine the flags of two mutually exclusive control flow paths.
     * <p>
     * Flags in {@link #ON_ALL_BRANCHES} are intersected, every other flag is united.
     * So two branches that both throw give {@code MAY_THROW | END_POINT_UNREACHABLE},
     * but if only one throws, the result is just {@code MAY_THROW}.
     *
     * @param a The flags of one path.
     * @param b The flags of the other path.
     * @return The combined flags.
     */
    public static int combineBranches(int a, int b) {
        return (a & b & ON_ALL_BRANCHES) | ((a | b) & ~ON_ALL_BRANCHES);
    }

    /**
     * Format a set of flags for debugging.
     *
     * @param flags The flags.
     * @return The names of the set flags, separated by {@code |}, or {@code NONE}.
     */
    public static String toString(int flags) {
        if (flags == NONE) return "NONE";
        StringJoiner sj = new StringJoiner(" | ");
        if ((flags & MAY_READ_LOCALS) != 0) sj.add("MAY_READ_LOCALS");
        if ((flags & MAY_WRITE_LOCALS) != 0) sj.add("MAY_WRITE_LOCALS");
        if ((flags & SIDE_EFFECT) != 0) sj.add("SIDE_EFFECT");
        if ((flags & MAY_THROW) != 0) sj.add("MAY_THROW");
        if ((flags & END_POINT_UNREACHABLE) != 0) sj.add("END_POINT_UNREACHABLE");
        if ((flags & CONTROL_FLOW) != 0) sj.add("CONTROL_FLOW");
        return sj.toString();
    }
}
