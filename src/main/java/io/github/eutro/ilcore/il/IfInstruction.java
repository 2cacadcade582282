package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

/**
 * A conditional. Evaluates the condition, then exactly one of the two branches.
 * <p>
 * The false branch is a {@link Nop} when there is no else.
 */
public final class IfInstruction extends ILInstruction {
    public static final SlotInfo CONDITION_SLOT = new SlotInfo("condition", true);
    public static final SlotInfo TRUE_INST_SLOT = new SlotInfo("trueInst");
    public static final SlotInfo FALSE_INST_SLOT = new SlotInfo("falseInst");

    private ILInstruction condition;
    private ILInstruction trueInst;
    private ILInstruction falseInst;

    public IfInstruction(ILInstruction condition, ILInstruction trueInst) {
        this(condition, trueInst, new Nop());
    }

    public IfInstruction(ILInstruction condition, ILInstruction trueInst, ILInstruction falseInst) {
        super(OpCode.IF_INSTRUCTION);
        setCondition(condition);
        setTrueInst(trueInst);
        setFalseInst(falseInst);
    }

    public ILInstruction getCondition() {
        return condition;
    }

    public void setCondition(ILInstruction condition) {
        this.condition = setChildInstruction(this.condition, condition, 0);
    }

    public ILInstruction getTrueInst() {
        return trueInst;
    }

    public void setTrueInst(ILInstruction trueInst) {
        this.trueInst = setChildInstruction(this.trueInst, trueInst, 1);
    }

    public ILInstruction getFalseInst() {
        return falseInst;
    }

    public void setFalseInst(ILInstruction falseInst) {
        this.falseInst = setChildInstruction(this.falseInst, falseInst, 2);
    }

    @Override
    public StackType getResultType() {
        return trueInst.getResultType();
    }

    @Override
    public int getChildCount() {
        return 3;
    }

    @Override
    public ILInstruction getChild(int index) {
        switch (index) {
            case 0:
                return condition;
            case 1:
                return trueInst;
            case 2:
                return falseInst;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(index));
        }
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        switch (index) {
            case 0:
                setCondition(value);
                break;
            case 1:
                setTrueInst(value);
                break;
            case 2:
                setFalseInst(value);
                break;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(index));
        }
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        switch (index) {
            case 0:
                return CONDITION_SLOT;
            case 1:
                return TRUE_INST_SLOT;
            case 2:
                return FALSE_INST_SLOT;
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
        return getDirectFlags()
                | condition.getFlags()
                | InstructionFlags.combineBranches(trueInst.getFlags(), falseInst.getFlags());
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(" (");
        condition.writeTo(output);
        output.write(") ");
        trueInst.writeTo(output);
        if (!falseInst.matchNop()) {
            output.write(" else ");
            falseInst.writeTo(output);
        }
    }

    @Override
    public IfInstruction clone() {
        return copyILRangeTo(new IfInstruction(condition.clone(), trueInst.clone(), falseInst.clone()));
    }
}
