package io.github.eutro.ilcore.passes.transforms;

import io.github.eutro.ilcore.il.Block;
import io.github.eutro.ilcore.il.ILInstruction;
import org.jetbrains.annotations.Nullable;

/**
 * The context in which {@link BlockTransform}s are run: the settings, the {@link Stepper},
 * and the block currently being transformed.
 * <p>
 * One context is shared by every transform in a single pipeline run.
 */
public class BlockTransformContext {
    private final TransformSettings settings;
    private final Stepper stepper;
    @Nullable
    private Block block;

    /**
     * Construct a context with a stepper created from the settings.
     *
     * @param settings The settings.
     */
    public BlockTransformContext(TransformSettings settings) {
        this(settings, Stepper.of(settings));
    }

    /**
     * Construct a context.
     *
     * @param settings The settings.
     * @param stepper  The stepper.
     */
    public BlockTransformContext(TransformSettings settings, Stepper stepper) {
        this.settings = settings;
        this.stepper = stepper;
    }

    public TransformSettings getSettings() {
        return settings;
    }

    public Stepper getStepper() {
        return stepper;
    }

    /**
     * Get the block currently being transformed.
     *
     * @return The block, or null outside of a transform.
     */
    public @Nullable Block getBlock() {
        return block;
    }

    /**
     * Set the block currently being transformed.
     *
     * @param block The block.
     */
    public void setBlock(@Nullable Block block) {
        this.block = block;
    }

    /**
     * Announce a rewrite, which will be made right after this returns.
     * Every rewrite a transform makes must be announced, exactly once.
     *
     * @param description What the rewrite does.
     * @param near        The instruction the rewrite is centred on.
     * @throws StepLimitReachedException If the step limit has been reached.
     * @see Stepper#step(String, ILInstruction)
     */
    public void step(String description, @Nullable ILInstruction near) {
        stepper.step(description, near);
    }
}
