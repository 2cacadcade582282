package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.ext.TrackedList;

import java.util.ArrayList;

/**
 * An ordered, variable-length run of children of an {@link ILInstruction}, all in the same slot.
 * <p>
 * The child index of the element at position {@code i} is {@code firstChildIndex + i}.
 * Every mutation through this list keeps parent links and child indices up to date,
 * and invalidates the flags of the parent.
 *
 * @param <T> The type of the elements.
 */
public final class InstructionCollection<T extends ILInstruction> extends TrackedList<T> {
    private final ILInstruction parent;
    private final int firstChildIndex;
    private final SlotInfo slot;

    /**
     * Construct an empty instruction collection.
     *
     * @param parent          The instruction that owns the elements.
     * @param firstChildIndex The child index of the first element.
     * @param slot            The slot of every element.
     * @param capacity        The initial capacity.
     */
    public InstructionCollection(ILInstruction parent, int firstChildIndex, SlotInfo slot, int capacity) {
        super(new ArrayList<>(capacity));
        this.parent = parent;
        this.firstChildIndex = firstChildIndex;
        this.slot = slot;
    }

    /**
     * Get the slot of the elements of this collection.
     *
     * @return The slot.
     */
    public SlotInfo getSlot() {
        return slot;
    }

    @Override
    protected void onAdded(T elt) {
        parent.validateChild(slot, elt);
    }

    @Override
    protected void onRemoved(T elt) {
        if (elt.getParent() != parent) return;
        for (int i = 0; i < size(); i++) {
            if (get(i) == elt) {
                // still here, at another index
                parent.adoptChild(elt, firstChildIndex + i);
                return;
            }
        }
        parent.releaseChild(elt);
    }

    @Override
    protected void onChanged(int fromIndex) {
        int size = size();
        for (int i = fromIndex; i < size; i++) {
            parent.adoptChild(get(i), firstChildIndex + i);
        }
        parent.invalidateFlags();
    }
}
