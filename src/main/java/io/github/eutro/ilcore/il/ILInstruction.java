package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.ext.ExtHolder;
import io.github.eutro.ilcore.util.GraphWalker;
import io.github.eutro.ilcore.util.PlainTextOutput;
import io.github.eutro.ilcore.util.TextOutput;
import org.jetbrains.annotations.Nullable;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * A node of the instruction tree.
 * <p>
 * Every instruction owns its children exclusively, and each child knows its parent
 * and its index in the parent. Children are addressed generically by index through
 * {@link #getChild(int)}, {@link #setChild(int, ILInstruction)} and {@link #getChildSlot(int)},
 * so a transform can inspect or rewrite any instruction without knowing its concrete class.
 * <p>
 * The {@link #getFlags() flags} of an instruction are cached. Any change to the children
 * of an instruction invalidates the cache of that instruction and all its ancestors, and the
 * flags are recomputed the next time they are read.
 * <p>
 * Once an instruction is moved into a different slot, the slot it was in before must not be
 * read again until it is assigned a new instruction; {@link #checkInvariant()} reports trees
 * where an instruction appears in a slot of something other than its parent.
 */
public abstract class ILInstruction extends ExtHolder {
    private static final int FLAGS_INVALID = -1;

    private final OpCode opCode;
    private ILRange ilRange = ILRange.EMPTY;
    @Nullable
    private ILInstruction parent;
    private int childIndex;
    private int flags = FLAGS_INVALID;

    /**
     * Construct an instruction with the given op code.
     *
     * @param opCode The op code.
     */
    protected ILInstruction(OpCode opCode) {
        this.opCode = opCode;
    }

    /**
     * Get the op code of this instruction.
     *
     * @return The op code.
     */
    public final OpCode getOpCode() {
        return opCode;
    }

    /**
     * Get the range of bytecode this instruction was decoded from.
     *
     * @return The range, {@link ILRange#EMPTY} if not known.
     */
    public ILRange getILRange() {
        return ilRange;
    }

    /**
     * Set the range of bytecode this instruction was decoded from.
     *
     * @param ilRange The range.
     */
    public void setILRange(ILRange ilRange) {
        this.ilRange = Objects.requireNonNull(ilRange, "ilRange");
    }

    /**
     * Get the parent of this instruction.
     *
     * @return The parent, or null if this is the root of a tree.
     */
    public @Nullable ILInstruction getParent() {
        return parent;
    }

    /**
     * Get the index of this instruction in its {@link #getParent() parent}.
     * Only meaningful if the parent is not null.
     *
     * @return The child index.
     */
    public int getChildIndex() {
        return childIndex;
    }

    /**
     * Get the type of the value this instruction produces.
     *
     * @return The result type, {@link StackType#VOID} if it produces nothing.
     */
    public abstract StackType getResultType();

    // children

    /**
     * Get the number of children of this instruction.
     *
     * @return The number of children.
     */
    public abstract int getChildCount();

    /**
     * Get the child at the given index.
     *
     * @param index The index, {@code 0 <= index < getChildCount()}.
     * @return The child.
     * @throws IndexOutOfBoundsException If the index is out of bounds.
     */
    public abstract ILInstruction getChild(int index);

    /**
     * Replace the child at the given index.
     *
     * @param index The index, {@code 0 <= index < getChildCount()}.
     * @param value The new child.
     * @throws IllegalArgumentException  If the instruction cannot be placed in the slot at that index.
     *                                   The tree is left unchanged.
     * @throws IndexOutOfBoundsException If the index is out of bounds.
     */
    public abstract void setChild(int index, ILInstruction value);

    /**
     * Get the slot of the child at the given index.
     *
     * @param index The index, {@code 0 <= index < getChildCount()}.
     * @return The slot.
     * @throws IndexOutOfBoundsException If the index is out of bounds.
     */
    public abstract SlotInfo getChildSlot(int index);

    /**
     * Get a list view of the children of this instruction.
     * The list cannot change size, but {@link List#set(int, Object)} replaces children
     * through {@link #setChild(int, ILInstruction)}.
     *
     * @return The children.
     */
    public final List<ILInstruction> getChildren() {
        return new ChildrenView();
    }

    /**
     * Get this instruction and all its descendants, in pre-order.
     *
     * @return The descendants, starting with this.
     */
    public final GraphWalker.Order<ILInstruction> getDescendants() {
        return GraphWalker.treeWalker(this).preOrder();
    }

    /**
     * Check whether this instruction is the given instruction or one of its descendants.
     *
     * @param ancestor The possible ancestor.
     * @return Whether {@code ancestor} is this or an ancestor of this.
     */
    public final boolean isDescendantOf(ILInstruction ancestor) {
        for (ILInstruction inst = this; inst != null; inst = inst.parent) {
            if (inst == ancestor) return true;
        }
        return false;
    }

    /**
     * Replace this instruction in its parent's slot with another instruction.
     *
     * @param replacement The replacement.
     * @throws IllegalStateException If this instruction has no parent.
     */
    public final void replaceWith(ILInstruction replacement) {
        if (parent == null) throw new IllegalStateException("cannot replace the root of a tree");
        parent.setChild(childIndex, replacement);
    }

    /**
     * Check whether this instruction may be placed in the given slot,
     * in addition to the slot's {@link SlotInfo#getChildType() child type} check.
     *
     * @param slot The slot.
     * @return Whether this can be a child in the slot.
     */
    protected boolean isValidInSlot(SlotInfo slot) {
        return true;
    }

    /**
     * Check that an instruction can become a child of this in the given slot.
     *
     * @param slot  The slot.
     * @param child The prospective child.
     * @throws IllegalArgumentException If it can't.
     */
    protected void validateChild(SlotInfo slot, ILInstruction child) {
        if (child == null) {
            throw new IllegalArgumentException(String.format("null in slot %s of %s", slot, opCode));
        }
        if (!slot.accepts(child)) {
            throw new IllegalArgumentException(String.format(
                    "%s is not valid in slot %s of %s",
                    child.opCode, slot, opCode));
        }
        if (isDescendantOf(child)) {
            throw new IllegalArgumentException(String.format(
                    "placing %s in slot %s of %s would create a cycle",
                    child.opCode, slot, opCode));
        }
    }

    /**
     * Validate a new child for a single-instruction slot, and attach it to this.
     * Subclasses store the result in the field backing the slot.
     *
     * @param oldValue The previous child in the slot, or null if there is none yet.
     * @param newValue The new child.
     * @param index    The child index of the slot.
     * @param <T>      The type of the child.
     * @return {@code newValue}.
     * @throws IllegalArgumentException If the child is not valid in the slot.
     */
    protected final <T extends ILInstruction> T setChildInstruction(@Nullable ILInstruction oldValue, T newValue, int index) {
        validateChild(getChildSlot(index), newValue);
        if (oldValue != null && oldValue != newValue && oldValue.childIndex == index) {
            releaseChild(oldValue);
        }
        adoptChild(newValue, index);
        invalidateFlags();
        return newValue;
    }

    final void adoptChild(ILInstruction child, int index) {
        child.parent = this;
        child.childIndex = index;
    }

    final void releaseChild(ILInstruction child) {
        // it may already have been moved somewhere else
        if (child.parent == this) {
            child.parent = null;
        }
    }

    // flags

    /**
     * Get the flags of this instruction: its {@link #getDirectFlags() direct flags}
     * combined with the flags of its children.
     *
     * @return The flags.
     * @see InstructionFlags
     */
    public final int getFlags() {
        if (flags == FLAGS_INVALID) {
            flags = computeFlags();
        }
        return flags;
    }

    /**
     * Check whether any of the given flags are set in {@link #getFlags()}.
     *
     * @param flag The flags.
     * @return Whether any are set.
     */
    public final boolean hasFlag(int flag) {
        return (getFlags() & flag) != 0;
    }

    /**
     * Check whether any of the given flags are set in {@link #getDirectFlags()}.
     *
     * @param flag The flags.
     * @return Whether any are set.
     */
    public final boolean hasDirectFlag(int flag) {
        return (getDirectFlags() & flag) != 0;
    }

    /**
     * Get the flags of this instruction alone, ignoring its children.
     *
     * @return The direct flags.
     */
    public abstract int getDirectFlags();

    /**
     * Compute the flags of this instruction from its direct flags and its children's flags.
     * Must not depend on anything except the current children.
     *
     * @return The flags.
     */
    protected abstract int computeFlags();

    /**
     * Mark the cached flags of this instruction and its ancestors as stale.
     * Subclasses must call this whenever a change could affect {@link #computeFlags()}.
     */
    protected final void invalidateFlags() {
        // a valid parent implies valid children, so we can stop at the first invalid one
        for (ILInstruction inst = this; inst != null && inst.flags != FLAGS_INVALID; inst = inst.parent) {
            inst.flags = FLAGS_INVALID;
        }
    }

    // matching

    /**
     * Check whether this is a {@link Nop}.
     *
     * @return Whether this is a nop.
     */
    public final boolean matchNop() {
        return opCode == OpCode.NOP;
    }

    /**
     * Check whether this is an {@link LdNull}.
     *
     * @return Whether this loads null.
     */
    public final boolean matchLdNull() {
        return opCode == OpCode.LD_NULL;
    }

    /**
     * Check whether this is an {@link LdLoc} of the given variable.
     *
     * @param variable The variable.
     * @return Whether this loads the variable.
     */
    public final boolean matchLdLoc(ILVariable variable) {
        return opCode == OpCode.LD_LOC && ((LdLoc) this).getVariable() == variable;
    }

    // invariants

    /**
     * Check the structural invariants of this instruction and all of its descendants.
     * This never changes the tree.
     *
     * @throws IllegalStateException If an invariant is violated.
     */
    public void checkInvariant() {
        int count = getChildCount();
        for (int i = 0; i < count; i++) {
            ILInstruction child = getChild(i);
            if (child == null) {
                throw violation("child %d is null", i);
            }
            if (child.parent != this) {
                throw violation("child %d (%s) is not owned by this, its parent is %s",
                        i, child.opCode, child.parent == null ? "null" : child.parent.opCode);
            }
            if (child.childIndex != i) {
                throw violation("child %d (%s) thinks it is child %d", i, child.opCode, child.childIndex);
            }
            SlotInfo slot = getChildSlot(i);
            if (!slot.accepts(child)) {
                throw violation("child %d (%s) is not valid in slot %s", i, child.opCode, slot);
            }
            child.checkInvariant();
        }
        if (flags != FLAGS_INVALID && flags != computeFlags()) {
            throw violation("stale flags: cached %s, actual %s",
                    InstructionFlags.toString(flags),
                    InstructionFlags.toString(computeFlags()));
        }
    }

    /**
     * Create an exception for a violated invariant of this instruction.
     *
     * @param fmt  The format string.
     * @param args The format arguments.
     * @return The exception, to throw.
     */
    protected final IllegalStateException violation(String fmt, Object... args) {
        return new IllegalStateException(String.format(fmt, args) + "\n  in: " + this);
    }

    // output

    /**
     * Write the textual form of this instruction.
     *
     * @param output The output.
     */
    public abstract void writeTo(TextOutput output);

    @Override
    public String toString() {
        PlainTextOutput output = new PlainTextOutput();
        writeTo(output);
        return output.toString();
    }

    // cloning

    /**
     * Deep-copy this instruction, including the {@link #getILRange() IL range} of it and its descendants.
     * The copy has no parent, and shares no instructions with this tree. Exts are not copied.
     *
     * @return The copy.
     */
    @Override
    public abstract ILInstruction clone();

    /**
     * Copy the IL range of this instruction to a clone of it.
     *
     * @param clone The clone.
     * @param <T>   The type of the clone.
     * @return {@code clone}.
     */
    protected final <T extends ILInstruction> T copyILRangeTo(T clone) {
        clone.setILRange(ilRange);
        return clone;
    }

    private class ChildrenView extends AbstractList<ILInstruction> implements RandomAccess {
        @Override
        public ILInstruction get(int index) {
            return getChild(index);
        }

        @Override
        public ILInstruction set(int index, ILInstruction element) {
            ILInstruction old = getChild(index);
            setChild(index, element);
            return old;
        }

        @Override
        public int size() {
            return getChildCount();
        }
    }
}
