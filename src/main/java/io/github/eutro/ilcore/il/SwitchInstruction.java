package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.LongSet;
import io.github.eutro.ilcore.util.TextOutput;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A multi-way branch. Evaluates the value, then runs the body of the section whose
 * labels contain it, or the default body if there is none.
 * <p>
 * The labels of the sections must be pairwise disjoint and non-empty, and the value must
 * be a 32 or 64-bit integer; this is checked by {@link #checkInvariant()}, not on mutation.
 * 32-bit values are compared against labels after {@link #extendLabel(StackType, long) sign extension}.
 */
public final class SwitchInstruction extends ILInstruction {
    public static final SlotInfo VALUE_SLOT = new SlotInfo("value", true);
    public static final SlotInfo DEFAULT_BODY_SLOT = new SlotInfo("defaultBody");
    public static final SlotInfo SECTION_SLOT = new SlotInfo("sections", true, false, SwitchSection.class);

    private static final int SECTIONS_OFFSET = 2;

    private ILInstruction value;
    private ILInstruction defaultBody;
    private final InstructionCollection<SwitchSection> sections;

    /**
     * Construct a switch on the given value, with no sections and a {@link Nop} default body.
     *
     * @param value The value to switch on.
     */
    public SwitchInstruction(ILInstruction value) {
        super(OpCode.SWITCH_INSTRUCTION);
        setValue(value);
        setDefaultBody(new Nop());
        sections = new InstructionCollection<>(this, SECTIONS_OFFSET, SECTION_SLOT, 2);
    }

    public ILInstruction getValue() {
        return value;
    }

    public void setValue(ILInstruction value) {
        this.value = setChildInstruction(this.value, value, 0);
    }

    public ILInstruction getDefaultBody() {
        return defaultBody;
    }

    public void setDefaultBody(ILInstruction defaultBody) {
        this.defaultBody = setChildInstruction(this.defaultBody, defaultBody, 1);
    }

    /**
     * Get the mutable list of sections.
     *
     * @return The sections.
     */
    public List<SwitchSection> getSections() {
        return sections;
    }

    /**
     * Sign extend a label value of the given type to 64 bits.
     *
     * @param type  The type of the switch value.
     * @param label The label.
     * @return The extended label.
     */
    public static long extendLabel(StackType type, long label) {
        return type == StackType.I4 ? (long) (int) label : label;
    }

    /**
     * Find the section that would be run if the value evaluated to the given value.
     *
     * @param value The value.
     * @return The section, or null if the default body would be run.
     */
    public @Nullable SwitchSection findSection(long value) {
        long label = extendLabel(this.value.getResultType(), value);
        for (SwitchSection section : sections) {
            if (section.getLabels().contains(label)) {
                return section;
            }
        }
        return null;
    }

    @Override
    public StackType getResultType() {
        return StackType.VOID;
    }

    @Override
    public int getChildCount() {
        return SECTIONS_OFFSET + sections.size();
    }

    @Override
    public ILInstruction getChild(int index) {
        switch (index) {
            case 0:
                return value;
            case 1:
                return defaultBody;
            default:
                return sections.get(index - SECTIONS_OFFSET);
        }
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        switch (index) {
            case 0:
                setValue(value);
                break;
            case 1:
                setDefaultBody(value);
                break;
            default:
                if (index < SECTIONS_OFFSET) throw new IndexOutOfBoundsException(String.valueOf(index));
                // check before the cast, so the caller gets the same error as anywhere else
                validateChild(SECTION_SLOT, value);
                sections.set(index - SECTIONS_OFFSET, (SwitchSection) value);
        }
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        switch (index) {
            case 0:
                return VALUE_SLOT;
            case 1:
                return DEFAULT_BODY_SLOT;
            default:
                if (index < SECTIONS_OFFSET || index >= getChildCount()) {
                    throw new IndexOutOfBoundsException(String.valueOf(index));
                }
                return SECTION_SLOT;
        }
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.CONTROL_FLOW;
    }

    @Override
    protected int computeFlags() {
        int branches = defaultBody.getFlags();
        for (SwitchSection section : sections) {
            branches = InstructionFlags.combineBranches(branches, section.getFlags());
        }
        return getDirectFlags() | value.getFlags() | branches;
    }

    @Override
    public void checkInvariant() {
        super.checkInvariant();
        StackType type = value.getResultType();
        if (!type.isIntegerType()) {
            throw violation("switch value must be I4 or I8, got %s", type);
        }
        LongSet seen = LongSet.EMPTY;
        for (int i = 0; i < sections.size(); i++) {
            LongSet labels = sections.get(i).getLabels();
            if (labels.isEmpty()) {
                throw violation("section %d has no labels", i);
            }
            if (labels.overlaps(seen)) {
                throw violation("labels of section %d overlap an earlier section: %s", i, labels.intersect(seen));
            }
            seen = seen.union(labels);
        }
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(" (");
        value.writeTo(output);
        output.write(") ");
        output.markFoldStart("{...}");
        output.write('{');
        output.writeLine();
        output.indent();
        output.write("default: ");
        defaultBody.writeTo(output);
        output.writeLine();
        for (SwitchSection section : sections) {
            section.writeTo(output);
            output.writeLine();
        }
        output.unindent();
        output.write('}');
        output.markFoldEnd();
    }

    @Override
    public SwitchInstruction clone() {
        SwitchInstruction clone = new SwitchInstruction(value.clone());
        clone.setDefaultBody(defaultBody.clone());
        for (SwitchSection section : sections) {
            clone.sections.add(section.clone());
        }
        return copyILRangeTo(clone);
    }
}
