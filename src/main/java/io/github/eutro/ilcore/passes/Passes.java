package io.github.eutro.ilcore.passes;

import io.github.eutro.ilcore.il.ILInstruction;
import io.github.eutro.ilcore.passes.meta.CheckInvariants;
import io.github.eutro.ilcore.passes.transforms.BlockTransformPipeline;
import io.github.eutro.ilcore.passes.transforms.TransformSettings;

/**
 * Some pre-composed passes. This should not be considered stable.
 */
public class Passes {
    /**
     * The default block transforms, with the invariants of the tree checked before and after.
     *
     * @param settings The transform settings.
     * @return The pass.
     */
    public static IRPass<ILInstruction, ILInstruction> blockTransforms(TransformSettings settings) {
        return CheckInvariants.INSTANCE
                .then(BlockTransformPipeline.withDefaultTransforms(settings))
                .then(CheckInvariants.INSTANCE);
    }

    /**
     * {@link #blockTransforms(TransformSettings)} with the {@link TransformSettings#DEFAULT default settings}.
     */
    public static final IRPass<ILInstruction, ILInstruction> BLOCK_TRANSFORMS = blockTransforms(TransformSettings.DEFAULT);
}
