package io.github.eutro.ilcore.passes.transforms;

import io.github.eutro.ilcore.ext.CommonExts;
import io.github.eutro.ilcore.il.*;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Type;

import static org.junit.jupiter.api.Assertions.*;

public class NullCoalescingTransformTest {
    private static final Type STRING = Type.getType(String.class);
    private final ILVariable s = new ILVariable(VariableKind.STACK_SLOT, STRING, 0, "s");
    private final ILVariable t = new ILVariable(VariableKind.STACK_SLOT, STRING, 1, "t");
    private final ILVariable a = new ILVariable(VariableKind.LOCAL, STRING, 0, "a");

    private static BlockTransformContext context() {
        return new BlockTransformContext(TransformSettings.builder().setCheckInvariants(true).build());
    }

    private static Comp isNull(ILVariable v) {
        return new Comp(ComparisonKind.EQUALITY, new LdLoc(v), new LdNull());
    }

    private Block pattern() {
        LdLoc value = new LdLoc(a);
        value.setILRange(new ILRange(0, 1));
        IfInstruction ifInst = new IfInstruction(isNull(s), new StLoc(s, new LdStr("default")));
        ifInst.setILRange(new ILRange(2, 8));
        return new Block(new StLoc(s, value), ifInst, new Throw(new LdLoc(s)));
    }

    private static void assertUnchanged(Block block) {
        String before = block.toString();
        int size = block.getInstructions().size();
        BlockTransformContext ctx = context();
        NullCoalescingTransform.INSTANCE.run(block, ctx);
        assertEquals(0, ctx.getStepper().getStepCount());
        assertEquals(size, block.getInstructions().size());
        assertEquals(before, block.toString());
        block.checkInvariant();
    }

    @Test
    void testMatch() {
        Block block = pattern();
        StLoc store = (StLoc) block.getInstructions().get(0);
        BlockTransformContext ctx = context();
        NullCoalescingTransform.INSTANCE.run(block, ctx);

        assertEquals(2, block.getInstructions().size());
        assertSame(store, block.getInstructions().get(0));
        assertEquals("stloc s(if.notnull(ldloc a, ldstr \"default\"))", store.toString());
        assertEquals("throw(ldloc s)", block.getInstructions().get(1).toString());
        assertEquals(1, block.getInstructions().get(1).getChildIndex());

        NullCoalescingInstruction nc = (NullCoalescingInstruction) store.getValue();
        assertEquals(new ILRange(0, 8), nc.getILRange());
        assertSame(store, nc.getParent());
        assertTrue(nc.getValue().matchLdLoc(a));

        assertEquals(1, ctx.getStepper().getStepCount());
        assertEquals(0, (int) store.getExtOrThrow(CommonExts.LAST_STEP));
        assertEquals("TransformNullCoalescing", store.getExtOrThrow(CommonExts.LAST_STEP_DESCRIPTION));
        block.checkInvariant();
    }

    @Test
    void testMatchWithBlockTrueBranch() {
        Block block = new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(isNull(s), new Block(new StLoc(s, new LdStr("x")))));
        NullCoalescingTransform.INSTANCE.run(block, context());
        assertEquals(1, block.getInstructions().size());
        assertEquals("stloc s(if.notnull(ldloc a, ldstr \"x\"))", block.getInstructions().get(0).toString());
        block.checkInvariant();
    }

    @Test
    void testIdempotent() {
        Block block = pattern();
        NullCoalescingTransform.INSTANCE.run(block, context());
        assertUnchanged(block);
    }

    @Test
    void testMultipleMatches() {
        Block block = new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(isNull(s), new StLoc(s, new LdStr("x"))),
                new StLoc(t, new LdLoc(a)),
                new IfInstruction(isNull(t), new StLoc(t, new LdStr("y"))));
        BlockTransformContext ctx = context();
        NullCoalescingTransform.INSTANCE.run(block, ctx);
        assertEquals(2, block.getInstructions().size());
        assertEquals(2, ctx.getStepper().getStepCount());
        block.checkInvariant();
    }

    @Test
    void testDisabled() {
        Block block = pattern();
        String before = block.toString();
        BlockTransformContext ctx = new BlockTransformContext(TransformSettings.builder()
                .setNullCoalescing(false)
                .build());
        NullCoalescingTransform.INSTANCE.run(block, ctx);
        assertEquals(before, block.toString());
        assertEquals(3, block.getInstructions().size());
    }

    @Test
    void testStepLimitLeavesBlockUnchanged() {
        Block block = pattern();
        String before = block.toString();
        BlockTransformContext ctx = new BlockTransformContext(TransformSettings.builder()
                .setStepLimit(0)
                .build());
        assertThrows(StepLimitReachedException.class, () -> NullCoalescingTransform.INSTANCE.run(block, ctx));
        assertEquals(before, block.toString());
        block.checkInvariant();
    }

    @Test
    void testOutOfRangeIndex() {
        Block block = pattern();
        assertFalse(NullCoalescingTransform.INSTANCE.transformNullCoalescing(block, 0, context()));
        assertFalse(NullCoalescingTransform.INSTANCE.transformNullCoalescing(block, 3, context()));
        assertTrue(NullCoalescingTransform.INSTANCE.transformNullCoalescing(block, 1, context()));
    }

    @Test
    void testNotStackSlot() {
        assertUnchanged(new Block(
                new StLoc(a, new LdLoc(s)),
                new IfInstruction(isNull(a), new StLoc(a, new LdStr("x")))));
    }

    @Test
    void testPreviousNotStore() {
        assertUnchanged(new Block(
                new Nop(),
                new IfInstruction(isNull(s), new StLoc(s, new LdStr("x")))));
    }

    @Test
    void testNotIf() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new StLoc(s, new LdStr("x"))));
    }

    @Test
    void testHasElse() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(isNull(s), new StLoc(s, new LdStr("x")), new StLoc(s, new LdStr("y")))));
    }

    @Test
    void testConditionNotComp() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(new LdLoc(s), new StLoc(s, new LdStr("x")))));
    }

    @Test
    void testInequality() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(new Comp(ComparisonKind.INEQUALITY, new LdLoc(s), new LdNull()),
                        new StLoc(s, new LdStr("x")))));
    }

    @Test
    void testComparesOtherVariable() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(isNull(t), new StLoc(s, new LdStr("x")))));
    }

    @Test
    void testComparesWithNonNull() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(new Comp(ComparisonKind.EQUALITY, new LdLoc(s), new LdStr("")),
                        new StLoc(s, new LdStr("x")))));
    }

    @Test
    void testOperandsSwapped() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(new Comp(ComparisonKind.EQUALITY, new LdNull(), new LdLoc(s)),
                        new StLoc(s, new LdStr("x")))));
    }

    @Test
    void testTrueBranchStoresOtherVariable() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(isNull(s), new StLoc(t, new LdStr("x")))));
    }

    @Test
    void testTrueBranchNotStore() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(isNull(s), new Throw(new LdNull()))));
    }

    @Test
    void testTrueBranchBlockOfTwo() {
        assertUnchanged(new Block(
                new StLoc(s, new LdLoc(a)),
                new IfInstruction(isNull(s), new Block(new Nop(), new StLoc(s, new LdStr("x"))))));
    }

    @Test
    void testTooShort() {
        assertUnchanged(new Block(new IfInstruction(isNull(s), new StLoc(s, new LdStr("x")))));
        assertUnchanged(new Block());
    }
}
