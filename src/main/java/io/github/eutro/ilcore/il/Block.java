package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of instructions, executed one after the other.
 * <p>
 * Transforms mostly work on blocks: see {@link io.github.eutro.ilcore.passes.transforms.BlockTransform}.
 */
public final class Block extends ILInstruction {
    public static final SlotInfo INSTRUCTION_SLOT = new SlotInfo("instructions", true, false, ILInstruction.class);

    private final InstructionCollection<ILInstruction> instructions;

    /**
     * Construct an empty block.
     */
    public Block() {
        super(OpCode.BLOCK);
        instructions = new InstructionCollection<>(this, 0, INSTRUCTION_SLOT, 4);
    }

    /**
     * Construct a block with the given instructions.
     *
     * @param instructions The instructions.
     */
    public Block(ILInstruction... instructions) {
        this();
        for (ILInstruction instruction : instructions) {
            this.instructions.add(instruction);
        }
    }

    /**
     * Get the mutable list of instructions in this block.
     * <p>
     * Adding, removing and replacing instructions through this list keeps
     * the child indices of every instruction in the block up to date.
     *
     * @return The instructions.
     */
    public List<ILInstruction> getInstructions() {
        return instructions;
    }

    /**
     * If the given instruction is a block containing exactly one instruction, get that instruction.
     *
     * @param inst The instruction.
     * @return The only instruction in the block, or {@code inst} itself.
     */
    public static ILInstruction unwrap(ILInstruction inst) {
        if (inst.getOpCode() == OpCode.BLOCK) {
            Block block = (Block) inst;
            if (block.instructions.size() == 1) {
                return block.instructions.get(0);
            }
        }
        return inst;
    }

    @Override
    public StackType getResultType() {
        return StackType.VOID;
    }

    @Override
    public int getChildCount() {
        return instructions.size();
    }

    @Override
    public ILInstruction getChild(int index) {
        return instructions.get(index);
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        instructions.set(index, value);
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        Objects.checkIndex(index, instructions.size());
        return INSTRUCTION_SLOT;
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.NONE;
    }

    @Override
    protected int computeFlags() {
        int flags = getDirectFlags();
        for (ILInstruction instruction : instructions) {
            flags |= instruction.getFlags();
        }
        return flags;
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(' ');
        if (!getILRange().isEmpty()) {
            output.write(getILRange().toString());
            output.write(' ');
        }
        output.markFoldStart("{...}");
        output.write('{');
        output.writeLine();
        output.indent();
        for (ILInstruction instruction : instructions) {
            instruction.writeTo(output);
            output.writeLine();
        }
        output.unindent();
        output.write('}');
        output.markFoldEnd();
    }

    @Override
    public Block clone() {
        Block clone = new Block();
        for (ILInstruction instruction : instructions) {
            clone.instructions.add(instruction.clone());
        }
        return copyILRangeTo(clone);
    }
}
