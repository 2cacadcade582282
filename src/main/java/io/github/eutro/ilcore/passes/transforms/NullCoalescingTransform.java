package io.github.eutro.ilcore.passes.transforms;

import io.github.eutro.ilcore.il.*;

import java.util.List;

/**
 * Recognizes the null-coalescing operator.
 * <p>
 * Rewrites
 * <pre>
 * stloc s(value)
 * if (comp(ldloc s == ldnull)) stloc s(fallback)
 * </pre>
 * into
 * <pre>
 * stloc s(if.notnull(value, fallback))
 * </pre>
 * where {@code s} is a {@link VariableKind#STACK_SLOT stack slot}. The true branch may also be
 * a block containing only the store.
 */
public class NullCoalescingTransform implements BlockTransform {
    /**
     * A singleton instance of this transform.
     */
    public static final NullCoalescingTransform INSTANCE = new NullCoalescingTransform();

    @Override
    public void run(Block block, BlockTransformContext context) {
        if (!context.getSettings().isNullCoalescing()) return;
        // backwards, so removing instruction i never shifts anything left to visit
        for (int i = block.getInstructions().size() - 1; i >= 1; i--) {
            transformNullCoalescing(block, i, context);
        }
    }

    /**
     * Try to rewrite the instruction at {@code i} and the one before it into a null-coalescing store.
     *
     * @param block   The block.
     * @param i       The index of the conditional.
     * @param context The context.
     * @return Whether the rewrite was made, in which case the instruction at {@code i} was removed.
     */
    public boolean transformNullCoalescing(Block block, int i, BlockTransformContext context) {
        List<ILInstruction> instructions = block.getInstructions();
        if (i < 1 || i >= instructions.size()) return false;

        ILInstruction prev = instructions.get(i - 1);
        if (prev.getOpCode() != OpCode.ST_LOC) return false;
        StLoc stloc = (StLoc) prev;
        ILVariable slot = stloc.getVariable();
        if (slot.getKind() != VariableKind.STACK_SLOT) return false;

        ILInstruction inst = instructions.get(i);
        if (inst.getOpCode() != OpCode.IF_INSTRUCTION) return false;
        IfInstruction ifInst = (IfInstruction) inst;
        if (!ifInst.getFalseInst().matchNop()) return false;

        if (ifInst.getCondition().getOpCode() != OpCode.COMP) return false;
        Comp comp = (Comp) ifInst.getCondition();
        if (comp.getKind() != ComparisonKind.EQUALITY
                || !comp.getLeft().matchLdLoc(slot)
                || !comp.getRight().matchLdNull()) {
            return false;
        }

        ILInstruction trueInst = Block.unwrap(ifInst.getTrueInst());
        if (trueInst.getOpCode() != OpCode.ST_LOC) return false;
        StLoc fallbackStore = (StLoc) trueInst;
        if (fallbackStore.getVariable() != slot) return false;

        context.step("TransformNullCoalescing", stloc);
        ILInstruction value = stloc.getValue();
        NullCoalescingInstruction nullCoalescing = new NullCoalescingInstruction(value, fallbackStore.getValue());
        nullCoalescing.setILRange(value.getILRange().union(ifInst.getILRange()));
        stloc.setValue(nullCoalescing);
        instructions.remove(i);
        return true;
    }
}
