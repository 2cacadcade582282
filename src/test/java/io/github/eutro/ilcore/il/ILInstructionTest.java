package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.GraphWalker;
import io.github.eutro.ilcore.util.LongSet;
import org.junit.jupiter.api.Test;
import org.objectweb.asm.Type;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ILInstructionTest {
    private static final ILVariable S = new ILVariable(VariableKind.STACK_SLOT, Type.getType(String.class), 0, "s");
    private static final ILVariable A = new ILVariable(VariableKind.LOCAL, Type.getType(String.class), 1, "a");

    private static List<OpCode> opCodes(Iterable<ILInstruction> insts) {
        List<OpCode> ops = new ArrayList<>();
        for (ILInstruction inst : insts) {
            ops.add(inst.getOpCode());
        }
        return ops;
    }

    @Test
    void testParentLinks() {
        LdLoc load = new LdLoc(A);
        StLoc store = new StLoc(S, load);
        Block block = new Block(new Nop(), store);
        assertNull(block.getParent());
        assertSame(block, store.getParent());
        assertEquals(1, store.getChildIndex());
        assertSame(store, load.getParent());
        assertEquals(0, load.getChildIndex());
        assertSame(StLoc.VALUE_SLOT, store.getChildSlot(0));
        assertSame(Block.INSTRUCTION_SLOT, block.getChildSlot(1));
        block.checkInvariant();
    }

    @Test
    void testBlockIndicesFollowMutations() {
        Nop first = new Nop();
        Nop second = new Nop();
        Block block = new Block(first, second);
        LdNull inserted = new LdNull();
        block.getInstructions().add(0, inserted);
        assertEquals(0, inserted.getChildIndex());
        assertEquals(1, first.getChildIndex());
        assertEquals(2, second.getChildIndex());

        block.getInstructions().remove(1);
        assertNull(first.getParent());
        assertEquals(1, second.getChildIndex());
        block.checkInvariant();

        block.getInstructions().clear();
        assertNull(inserted.getParent());
        assertNull(second.getParent());
        assertEquals(0, block.getChildCount());
    }

    @Test
    void testMoveWithinBlock() {
        Nop a = new Nop();
        LdNull b = new LdNull();
        Block block = new Block(a, b);
        block.getInstructions().set(0, b);
        block.getInstructions().remove(1);
        assertSame(block, b.getParent());
        assertEquals(0, b.getChildIndex());
        assertNull(a.getParent());
        block.checkInvariant();
    }

    @Test
    void testRejectedAssignmentLeavesTreeUnchanged() {
        LdLoc load = new LdLoc(A);
        StLoc store = new StLoc(S, load);
        assertThrows(IllegalArgumentException.class, () -> store.setValue(null));
        assertThrows(IllegalArgumentException.class, () -> store.setChild(0, new SwitchSection(LongSet.of(1), new Nop())));
        assertSame(load, store.getValue());
        assertSame(store, load.getParent());

        Block block = new Block(store);
        assertThrows(IllegalArgumentException.class,
                () -> block.getInstructions().add(new SwitchSection(LongSet.of(1), new Nop())));
        assertEquals(1, block.getChildCount());
        block.checkInvariant();
    }

    @Test
    void testCyclesRejected() {
        Block inner = new Block(new Nop());
        Block outer = new Block(new IfInstruction(new LdcI4(1), inner));
        assertThrows(IllegalArgumentException.class, () -> outer.getInstructions().add(outer));
        assertThrows(IllegalArgumentException.class, () -> inner.getInstructions().add(outer));
        assertEquals(1, inner.getChildCount());
        assertEquals(1, outer.getChildCount());
        outer.checkInvariant();
    }

    @Test
    void testOutOfBounds() {
        StLoc store = new StLoc(S, new LdNull());
        assertThrows(IndexOutOfBoundsException.class, () -> store.getChild(1));
        assertThrows(IndexOutOfBoundsException.class, () -> store.getChildSlot(-1));
        assertThrows(IndexOutOfBoundsException.class, () -> new Nop().getChild(0));
        assertThrows(IndexOutOfBoundsException.class, () -> new Block().getChildSlot(0));
    }

    @Test
    void testChildrenView() {
        Comp comp = new Comp(ComparisonKind.EQUALITY, new LdLoc(S), new LdNull());
        List<ILInstruction> children = comp.getChildren();
        assertEquals(2, children.size());
        LdStr replacement = new LdStr("x");
        children.set(1, replacement);
        assertSame(replacement, comp.getRight());
        assertSame(comp, replacement.getParent());
        assertThrows(UnsupportedOperationException.class, () -> children.add(new Nop()));
    }

    @Test
    void testDescendants() {
        IfInstruction inst = new IfInstruction(
                new Comp(ComparisonKind.EQUALITY, new LdLoc(S), new LdNull()),
                new StLoc(S, new LdStr("x")));
        assertEquals(Arrays.asList(
                OpCode.IF_INSTRUCTION,
                OpCode.COMP, OpCode.LD_LOC, OpCode.LD_NULL,
                OpCode.ST_LOC, OpCode.LD_STR,
                OpCode.NOP
        ), opCodes(inst.getDescendants()));
        assertEquals(Arrays.asList(
                OpCode.LD_LOC, OpCode.LD_NULL, OpCode.COMP,
                OpCode.LD_STR, OpCode.ST_LOC,
                OpCode.NOP,
                OpCode.IF_INSTRUCTION
        ), opCodes(GraphWalker.treeWalker(inst).postOrder()));
    }

    @Test
    void testIsDescendantOfAndReplaceWith() {
        LdNull value = new LdNull();
        StLoc store = new StLoc(S, value);
        Block block = new Block(store);
        assertTrue(value.isDescendantOf(block));
        assertTrue(block.isDescendantOf(block));
        assertFalse(block.isDescendantOf(value));

        LdStr replacement = new LdStr("y");
        value.replaceWith(replacement);
        assertSame(replacement, store.getValue());
        assertNull(value.getParent());
        assertFalse(value.isDescendantOf(block));
        assertThrows(IllegalStateException.class, () -> block.replaceWith(new Nop()));
    }

    @Test
    void testStaleSlotDetected() {
        LdLoc load = new LdLoc(A);
        StLoc first = new StLoc(S, load);
        Block block = new Block(first);
        block.getInstructions().add(new StLoc(S, first.getValue()));
        IllegalStateException e = assertThrows(IllegalStateException.class, block::checkInvariant);
        assertTrue(e.getMessage().contains("not owned by this"), e.getMessage());
    }

    @Test
    void testCallArgumentCount() {
        Type desc = Type.getMethodType(Type.VOID_TYPE, Type.getType(String.class));
        Call call = new Call("java/io/PrintStream", "println", desc, false, new LdNull());
        assertEquals(StackType.VOID, call.getResultType());
        assertThrows(IllegalStateException.class, call::checkInvariant);
        call.getArguments().add(new LdStr("hi"));
        call.checkInvariant();
        assertEquals("call java/io/PrintStream.println(ldnull, ldstr \"hi\")", call.toString());
        assertThrows(IllegalArgumentException.class, () -> new Call("a/B", "c", Type.INT_TYPE, true));
    }

    @Test
    void testResultTypes() {
        assertEquals(StackType.O, new LdLoc(S).getResultType());
        assertEquals(StackType.I4, new Comp(ComparisonKind.LESS_THAN, new LdcI4(1), new LdcI4(2)).getResultType());
        assertEquals(StackType.I8, new LdcI8(1).getResultType());
        assertEquals(StackType.O, new NullCoalescingInstruction(new LdLoc(S), new LdStr("")).getResultType());
        assertEquals(StackType.VOID, new Block().getResultType());
        assertEquals(StackType.I4, new Call("java/lang/String", "length",
                Type.getMethodType(Type.INT_TYPE), false, new LdStr("")).getResultType());
    }

    @Test
    void testMatchHelpers() {
        assertTrue(new Nop().matchNop());
        assertFalse(new LdNull().matchNop());
        assertTrue(new LdNull().matchLdNull());
        assertTrue(new LdLoc(S).matchLdLoc(S));
        assertFalse(new LdLoc(A).matchLdLoc(S));
        assertFalse(new LdNull().matchLdLoc(S));
    }

    @Test
    void testUnwrap() {
        StLoc store = new StLoc(S, new LdNull());
        assertSame(store, Block.unwrap(new Block(store)));
        Block two = new Block(new Nop(), new Nop());
        assertSame(two, Block.unwrap(two));
        Block empty = new Block();
        assertSame(empty, Block.unwrap(empty));
        Nop nop = new Nop();
        assertSame(nop, Block.unwrap(nop));
    }
}
