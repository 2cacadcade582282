package io.github.eutro.ilcore.passes.transforms;

/**
 * Thrown by {@link Stepper#step(String, io.github.eutro.ilcore.il.ILInstruction)} when the
 * configured step limit has been reached. The step that would have exceeded the limit is not
 * taken, so the tree is left as it was after the last allowed step.
 */
public class StepLimitReachedException extends RuntimeException {
    private final int stepLimit;

    /**
     * Construct the exception.
     *
     * @param stepLimit The limit that was reached.
     */
    public StepLimitReachedException(int stepLimit) {
        super("step limit reached: " + stepLimit);
        this.stepLimit = stepLimit;
    }

    /**
     * Get the limit that was reached.
     *
     * @return The step limit.
     */
    public int getStepLimit() {
        return stepLimit;
    }
}
