package io.github.eutro.ilcore.passes.transforms;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.ilcore.il.Block;
import io.github.eutro.ilcore.il.ILInstruction;
import io.github.eutro.ilcore.il.OpCode;
import io.github.eutro.ilcore.passes.InPlaceIRPass;
import io.github.eutro.ilcore.util.GraphWalker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A pass which runs a list of {@link BlockTransform}s over every {@link Block} in a tree.
 * <p>
 * Blocks are visited in post-order, so nested blocks are transformed before the blocks
 * containing them. On each block, the transforms are run in order, over and over, until a whole
 * iteration takes no {@link BlockTransformContext#step(String, ILInstruction) step}, or until
 * {@link TransformSettings#getMaxIterations()} is reached.
 */
public class BlockTransformPipeline implements InPlaceIRPass<ILInstruction> {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final TransformSettings settings;
    private final List<BlockTransform> transforms;

    /**
     * Construct a pipeline.
     *
     * @param settings   The settings to create a context from, when run as a pass.
     * @param transforms The transforms to run, in order.
     */
    public BlockTransformPipeline(TransformSettings settings, List<BlockTransform> transforms) {
        this.settings = settings;
        this.transforms = Collections.unmodifiableList(new ArrayList<>(transforms));
    }

    /**
     * Construct a pipeline.
     *
     * @param settings   The settings to create a context from, when run as a pass.
     * @param transforms The transforms to run, in order.
     */
    public BlockTransformPipeline(TransformSettings settings, BlockTransform... transforms) {
        this(settings, Arrays.asList(transforms));
    }

    /**
     * Get the transforms that are run by default.
     *
     * @return The default transforms.
     */
    public static List<BlockTransform> defaultTransforms() {
        return Collections.singletonList(NullCoalescingTransform.INSTANCE);
    }

    /**
     * Construct a pipeline running the {@link #defaultTransforms() default transforms}.
     *
     * @param settings The settings.
     * @return The pipeline.
     */
    public static BlockTransformPipeline withDefaultTransforms(TransformSettings settings) {
        return new BlockTransformPipeline(settings, defaultTransforms());
    }

    public TransformSettings getSettings() {
        return settings;
    }

    public List<BlockTransform> getTransforms() {
        return transforms;
    }

    @Override
    public void runInPlace(ILInstruction root) {
        transform(root, new BlockTransformContext(settings));
    }

    /**
     * Run the transforms over every block in a tree, in an existing context.
     *
     * @param root    The root of the tree.
     * @param context The context, whose settings are used instead of this pipeline's.
     * @throws StepLimitReachedException If the step limit is reached.
     */
    public void transform(ILInstruction root, BlockTransformContext context) {
        List<Block> blocks = new ArrayList<>();
        for (ILInstruction inst : GraphWalker.treeWalker(root).postOrder()) {
            if (inst.getOpCode() == OpCode.BLOCK) {
                blocks.add((Block) inst);
            }
        }
        logger.atFine().log("running %d transforms over %d blocks", transforms.size(), blocks.size());
        try {
            for (Block block : blocks) {
                // an earlier rewrite may have dropped it from the tree
                if (!block.isDescendantOf(root)) continue;
                context.setBlock(block);
                transformBlock(block, context);
            }
        } finally {
            context.setBlock(null);
        }
    }

    private void transformBlock(Block block, BlockTransformContext context) {
        Stepper stepper = context.getStepper();
        int maxIterations = context.getSettings().getMaxIterations();
        for (int iteration = 0; ; iteration++) {
            if (iteration >= maxIterations) {
                logger.atWarning().log("block did not reach a fixed point after %d iterations", maxIterations);
                return;
            }
            int stepsBefore = stepper.getStepCount();
            for (BlockTransform transform : transforms) {
                runTransform(transform, block, context);
            }
            if (stepper.getStepCount() == stepsBefore) {
                logger.atFine().log("block reached a fixed point after %d iterations", iteration + 1);
                return;
            }
        }
    }

    private void runTransform(BlockTransform transform, Block block, BlockTransformContext context) {
        String name = transform.getClass().getSimpleName();
        Stepper stepper = context.getStepper();
        stepper.beginGroup(name);
        try {
            transform.run(block, context);
            if (context.getSettings().isCheckInvariants()) {
                block.checkInvariant();
            }
        } catch (StepLimitReachedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RuntimeException(String.format("error running transform %s\n  in block: %s", name, block), e);
        } finally {
            stepper.endGroup();
        }
    }
}
