package io.github.eutro.ilcore.passes.transforms;

import io.github.eutro.ilcore.il.Block;

/**
 * A rewrite of the instructions in a single {@link Block}.
 * <p>
 * A transform must leave the block structurally valid, and must announce every
 * rewrite it makes with {@link BlockTransformContext#step(String, io.github.eutro.ilcore.il.ILInstruction)}
 * before making it. A transform that announces no step is assumed to have changed nothing.
 *
 * @see BlockTransformPipeline
 */
@FunctionalInterface
public interface BlockTransform {
    /**
     * Run the transform on a block.
     *
     * @param block   The block.
     * @param context The context.
     */
    void run(Block block, BlockTransformContext context);
}
