package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.LongSet;
import io.github.eutro.ilcore.util.TextOutput;

import java.util.Objects;

/**
 * A case of a {@link SwitchInstruction}: the set of labels that select it, and the body to run.
 * <p>
 * A section is only valid in {@link SwitchInstruction#SECTION_SLOT}.
 */
public final class SwitchSection extends ILInstruction {
    public static final SlotInfo BODY_SLOT = new SlotInfo("body");

    private LongSet labels;
    private ILInstruction body;

    public SwitchSection(LongSet labels, ILInstruction body) {
        super(OpCode.SWITCH_SECTION);
        this.labels = Objects.requireNonNull(labels, "labels");
        setBody(body);
    }

    /**
     * Get the label values that select this section.
     *
     * @return The labels.
     */
    public LongSet getLabels() {
        return labels;
    }

    public void setLabels(LongSet labels) {
        this.labels = Objects.requireNonNull(labels, "labels");
    }

    public ILInstruction getBody() {
        return body;
    }

    public void setBody(ILInstruction body) {
        this.body = setChildInstruction(this.body, body, 0);
    }

    @Override
    protected boolean isValidInSlot(SlotInfo slot) {
        return slot == SwitchInstruction.SECTION_SLOT;
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
        if (index == 0) return body;
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        if (index == 0) {
            setBody(value);
            return;
        }
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        if (index == 0) return BODY_SLOT;
        throw new IndexOutOfBoundsException(String.valueOf(index));
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.NONE;
    }

    @Override
    protected int computeFlags() {
        return body.getFlags();
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(' ');
        output.write(labels.toString());
        output.write(": ");
        body.writeTo(output);
    }

    @Override
    public SwitchSection clone() {
        return copyILRangeTo(new SwitchSection(labels, body.clone()));
    }
}
