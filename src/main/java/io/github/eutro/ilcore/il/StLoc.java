package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

import java.util.Objects;

/**
 * Stores the result of its value into a variable.
 */
public final class StLoc extends ILInstruction {
    public static final SlotInfo VALUE_SLOT = new SlotInfo("value", true);

    private ILVariable variable;
    private ILInstruction value;

    public StLoc(ILVariable variable, ILInstruction value) {
        super(OpCode.ST_LOC);
        this.variable = Objects.requireNonNull(variable, "variable");
        setValue(value);
    }

    public ILVariable getVariable() {
        return variable;
    }

    public void setVariable(ILVariable variable) {
        this.variable = Objects.requireNonNull(variable, "variable");
    }

    public ILInstruction getValue() {
        return value;
    }

    public void setValue(ILInstruction value) {
        this.value = setChildInstruction(this.value, value, 0);
    }

    @Override
    public StackType getResultType() {
        return StackType.VOID;
    }

    @Override
    public int getChildCount() {
        return 1;
    }

    @Override
    public ILInstruction getChild(int index) {
        if (index == 0) return value;
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        if (index == 0) {
            setValue(value);
            return;
        }
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        if (index == 0) return VALUE_SLOT;
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.MAY_WRITE_LOCALS;
    }

    @Override
    protected int computeFlags() {
        return getDirectFlags() | value.getFlags();
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(' ');
        output.write(variable.getName());
        output.write('(');
        value.writeTo(output);
        output.write(')');
    }

    @Override
    public StLoc clone() {
        return copyILRangeTo(new StLoc(variable, value.clone()));
    }
}
