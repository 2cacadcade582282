package io.github.eutro.ilcore.ext;

import io.github.eutro.ilcore.il.ILInstruction;
import io.github.eutro.ilcore.passes.transforms.Stepper;

/**
 * A collection of {@link Ext}s that may be attached to parts of the instruction tree.
 */
public class CommonExts {
    /**
     * Attached to an {@link ILInstruction} by {@link Stepper#step(String, ILInstruction)}.
     * The index of the last step that was taken at this instruction.
     */
    public static final Ext<Integer> LAST_STEP = Ext.create(Integer.class, "LAST_STEP");

    /**
     * Attached to an {@link ILInstruction} by {@link Stepper#step(String, ILInstruction)}.
     * The description of the last step that was taken at this instruction, usually
     * naming the transform that took it.
     */
    public static final Ext<String> LAST_STEP_DESCRIPTION = Ext.create(String.class, "LAST_STEP_DESCRIPTION");
}
