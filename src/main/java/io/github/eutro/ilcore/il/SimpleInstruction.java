package io.github.eutro.ilcore.il;

/**
 * An instruction without children.
 */
public abstract class SimpleInstruction extends ILInstruction {
    /**
     * Construct a leaf instruction with the given op code.
     *
     * @param opCode The op code.
     */
    protected SimpleInstruction(OpCode opCode) {
        super(opCode);
    }

    @Override
    public final int getChildCount() {
        return 0;
    }

    @Override
    public final ILInstruction getChild(int index) {
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public final void setChild(int index, ILInstruction value) {
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public final SlotInfo getChildSlot(int index) {
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    protected int computeFlags() {
        return getDirectFlags();
    }
}
