package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

import java.util.Objects;

/**
 * Loads the value of a variable.
 */
public final class LdLoc extends SimpleInstruction {
    private ILVariable variable;

    public LdLoc(ILVariable variable) {
        super(OpCode.LD_LOC);
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public ILVariable getVariable() {
        return variable;
    }

    public void setVariable(ILVariable variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    @Override
    public StackType getResultType() {
        return variable.getStackType();
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.MAY_READ_LOCALS;
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(' ');
        output.write(variable.getName());
    }

    @Override
    public LdLoc clone() {
        return copyILRangeTo(new LdLoc(variable));
    }
}
