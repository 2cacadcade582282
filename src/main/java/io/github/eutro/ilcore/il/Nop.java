package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

/**
 * Does nothing. Stands in for an absent instruction, such as a missing else branch.
 */
public final class Nop extends SimpleInstruction {
    public Nop() {
        super(OpCode.NOP);
    }

    @Override
    public StackType getResultType() {
        return StackType.VOID;
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
    public Nop clone() {
        return copyILRangeTo(new Nop());
    }
}
