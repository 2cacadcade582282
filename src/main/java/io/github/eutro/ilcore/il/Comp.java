package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

import java.util.Objects;

/**
 * Compares two values, producing 1 if the comparison holds and 0 otherwise.
 */
public final class Comp extends ILInstruction {
    public static final SlotInfo LEFT_SLOT = new SlotInfo("left", true);
    public static final SlotInfo RIGHT_SLOT = new SlotInfo("right", true);

    private final ComparisonKind kind;
    private ILInstruction left;
    private ILInstruction right;

    public Comp(ComparisonKind kind, ILInstruction left, ILInstruction right) {
        super(OpCode.COMP);
        this.kind = Objects.requireNonNull(kind, "kind");
        setLeft(left);
        setRight(right);
    }

    public ComparisonKind getKind() {
        return kind;
    }

    public ILInstruction getLeft() {
        return left;
    }

    public void setLeft(ILInstruction left) {
        this.left = setChildInstruction(this.left, left, 0);
    }

    public ILInstruction getRight() {
        return right;
    }

    public void setRight(ILInstruction right) {
        this.right = setChildInstruction(this.right, right, 1);
    }

    @Override
    public StackType getResultType() {
        return StackType.I4;
    }

    @Override
    public int getChildCount() {
        return 2;
    }

    @Override
    public ILInstruction getChild(int index) {
        switch (index) {
            case 0:
                return left;
            case 1:
                return right;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(index));
        }
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        switch (index) {
            case 0:
                setLeft(value);
                break;
            case 1:
                setRight(value);
                break;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(index));
        }
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        switch (index) {
            case 0:
                return LEFT_SLOT;
            case 1:
                return RIGHT_SLOT;
            default:
                throw new IndexOutOfBoundsException(String.valueOf(index));
        }
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.NONE;
    }

    @Override
    protected int computeFlags() {
        return left.getFlags() | right.getFlags();
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write('(');
        left.writeTo(output);
        output.write(' ');
        output.write(kind.getOperator());
        output.write(' ');
        right.writeTo(output);
        output.write(')');
    }

    @Override
    public Comp clone() {
        return copyILRangeTo(new Comp(kind, left.clone(), right.clone()));
    }
}
