package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

/**
 * Loads a constant 32-bit integer.
 */
public final class LdcI4 extends SimpleInstruction {
    private final int value;

    public LdcI4(int value) {
        super(OpCode.LDC_I4);
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public StackType getResultType() {
        return StackType.I4;
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.NONE;
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(' ');
        output.write(Integer.toString(value));
    }

    @Override
    public LdcI4 clone() {
        return copyILRangeTo(new LdcI4(value));
    }
}
