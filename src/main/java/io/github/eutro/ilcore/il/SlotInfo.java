package io.github.eutro.ilcore.il;

/**
 * Describes the role of a child position of an {@link ILInstruction}, without
 * exposing the concrete class of the parent.
 */
public final class SlotInfo {
    private final String name;
    private final boolean isCollection;
    private final boolean canInlineInto;
    private final Class<? extends ILInstruction> childType;

    /**
     * Construct a slot holding a single instruction, that instructions cannot be inlined into.
     *
     * @param name The name of the slot.
     */
    public SlotInfo(String name) {
        this(name, false, false, ILInstruction.class);
    }

    /**
     * Construct a slot holding a single instruction.
     *
     * @param name          The name of the slot.
     * @param canInlineInto Whether an expression may be inlined into this slot.
     */
    public SlotInfo(String name, boolean canInlineInto) {
        this(name, false, canInlineInto, ILInstruction.class);
    }

    /**
     * Construct a slot.
     *
     * @param name          The name of the slot.
     * @param isCollection  Whether the slot is part of an ordered collection of siblings.
     * @param canInlineInto Whether an expression may be inlined into this slot.
     * @param childType     The class every child in this slot must be an instance of.
     */
    public SlotInfo(String name, boolean isCollection, boolean canInlineInto, Class<? extends ILInstruction> childType) {
        this.name = name;
        this.isCollection = isCollection;
        this.canInlineInto = canInlineInto;
        this.childType = childType;
    }

    /**
     * Get the name of the slot, for display.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Get whether this slot belongs to an ordered collection of sibling children.
     *
     * @return Whether this is a collection slot.
     */
    public boolean isCollection() {
        return isCollection;
    }

    /**
     * Get whether an expression may be inlined into this slot, that is,
     * whether the slot is evaluated as an expression rather than as a statement.
     *
     * @return Whether this slot can be inlined into.
     */
    public boolean canInlineInto() {
        return canInlineInto;
    }

    /**
     * Get the class every child in this slot must be an instance of.
     *
     * @return The child type.
     */
    public Class<? extends ILInstruction> getChildType() {
        return childType;
    }

    /**
     * Check whether the given instruction may be placed in this slot.
     *
     * @param inst The instruction.
     * @return Whether the instruction is acceptable.
     */
    public boolean accepts(ILInstruction inst) {
        return childType.isInstance(inst) && inst.isValidInSlot(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
