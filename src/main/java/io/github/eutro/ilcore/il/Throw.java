package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

/**
 * Throws the result of its argument. Never completes normally.
 */
public final class Throw extends ILInstruction {
    public static final SlotInfo ARGUMENT_SLOT = new SlotInfo("argument", true);

    private ILInstruction argument;

    public Throw(ILInstruction argument) {
        super(OpCode.THROW);
        setArgument(argument);
    }

    public ILInstruction getArgument() {
        return argument;
    }

    public void setArgument(ILInstruction argument) {
        this.argument = setChildInstruction(this.argument, argument, 0);
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
        if (index == 0) return argument;
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        if (index == 0) {
            setArgument(value);
            return;
        }
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        if (index == 0) return ARGUMENT_SLOT;
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.MAY_THROW | InstructionFlags.END_POINT_UNREACHABLE;
    }

    @Override
    protected int computeFlags() {
        return getDirectFlags() | argument.getFlags();
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write('(');
        argument.writeTo(output);
        output.write(')');
    }

    @Override
    public Throw clone() {
        return copyILRangeTo(new Throw(argument.clone()));
    }
}
