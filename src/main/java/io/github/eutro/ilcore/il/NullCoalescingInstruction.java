package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

/**
 * Evaluates the value, and produces it if it is not null.
 * Otherwise, evaluates and produces the fallback.
 * <p>
 * In source terms, {@code value ?? fallback}.
 */
public final class NullCoalescingInstruction extends ILInstruction {
    public static final SlotInfo VALUE_SLOT = new SlotInfo("value", true);
    public static final SlotInfo FALLBACK_SLOT = new SlotInfo("fallback");

    private ILInstruction value;
    private ILInstruction fallback;

    public NullCoalescingInstruction(ILInstruction value, ILInstruction fallback) {
        super(OpCode.NULL_COALESCING_INSTRUCTION);
        setValue(value);
        setFallback(fallback);
    }

    public ILInstruction getValue() {
        return value;
    }

    public void setValue(ILInstruction value) {
        this.value = setChildInstruction(this.value, value, 0);
    }

    public ILInstruction getFallback() {
        return fallback;
    }

    public void setFallback(ILInstruction fallback) {
        this.fallback = setChildInstruction(this.fallback, fallback, 1);
    }

    @Override
    public StackType getResultType() {
        return StackType.O;
    }

    @Override
    public int getChildCount() {
        return 2;
    }

    @Override
    public ILInstruction getChild(int index) {
        switch (index) {
            case 0:
                return value;
            case 1:
                return fallback;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(index));
        }
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        switch (index) {
            case 0:
                setValue(value);
                break;
            case 1:
                setFallback(value);
                break;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(index));
        }
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        switch (index) {
            case 0:
                return VALUE_SLOT;
            case 1:
                return FALLBACK_SLOT;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(index));
        }
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.CONTROL_FLOW;
    }

    @Override
    protected int computeFlags() {
        // the fallback is only evaluated on one of the two paths
        return getDirectFlags()
                | value.getFlags()
                | InstructionFlags.combineBranches(InstructionFlags.NONE, fallback.getFlags());
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write('(');
        value.writeTo(output);
        output.write(", ");
        fallback.writeTo(output);
        output.write(')');
    }

    @Override
    public NullCoalescingInstruction clone() {
        return copyILRangeTo(new NullCoalescingInstruction(value.clone(), fallback.clone()));
    }
}
