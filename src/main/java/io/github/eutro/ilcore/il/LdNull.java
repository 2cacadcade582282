package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

/**
 * Loads the null reference.
 */
public final class LdNull extends SimpleInstruction {
    public LdNull() {
        super(OpCode.LD_NULL);
    }

    @Override
    public StackType getResultType() {
        return StackType.O;
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.NONE;
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
    }

    @Override
    public LdNull clone() {
        return copyILRangeTo(new LdNull());
    }
}
