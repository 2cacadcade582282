package io.github.eutro.ilcore.passes.meta;

import io.github.eutro.ilcore.il.ILInstruction;
import io.github.eutro.ilcore.passes.InPlaceIRPass;

/**
 * A pass which checks the structural invariants of an instruction tree,
 * throwing {@link IllegalStateException} if any are violated.
 * <p>
 * The tree is never modified.
 *
 * @see ILInstruction#checkInvariant()
 */
public class CheckInvariants implements InPlaceIRPass<ILInstruction> {
    /**
     * A singleton instance of this pass.
     */
    public static final CheckInvariants INSTANCE = new CheckInvariants();

    @Override
    public void runInPlace(ILInstruction root) {
        root.checkInvariant();
    }
}
