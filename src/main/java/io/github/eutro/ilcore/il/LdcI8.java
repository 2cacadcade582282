package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

/**
 * Loads a constant 64-bit integer.
 */
public final class LdcI8 extends SimpleInstruction {
    private final long value;

    public LdcI8(long value) {
        super(OpCode.LDC_I8);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public StackType getResultType() {
        return StackType.I8;
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.NONE;
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(' ');
        output.write(Long.toString(value));
    }

    @Override
    public LdcI8 clone() {
        return copyILRangeTo(new LdcI8(value));
    }
}
