package io.github.eutro.ilcore.passes.transforms;

import com.google.common.flogger.GoogleLogger;
import io.github.eutro.ilcore.ext.CommonExts;
import io.github.eutro.ilcore.il.ILInstruction;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Counts, limits, and optionally records the rewrites made by block transforms.
 * <p>
 * Every rewrite is announced with {@link #step(String, ILInstruction)} before it is made.
 * Limiting the number of steps allows bisecting which rewrite broke a tree; recorded
 * steps can be inspected as a tree of {@link Step}s, grouped by {@link #beginGroup(String)}.
 */
public class Stepper {
    private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

    private final int stepLimit;
    private final boolean recordSteps;
    private final Step root = new Step(-1, "root", null, null);
    private final Deque<Step> openGroups = new ArrayDeque<>();
    private int groupDepth = 0;
    private int stepCount = 0;

    /**
     * Construct a stepper that never stops and records nothing.
     */
    public Stepper() {
        this(Integer.MAX_VALUE, false);
    }

    /**
     * Construct a stepper.
     *
     * @param stepLimit   The number of steps after which {@link #step(String, ILInstruction)} throws.
     * @param recordSteps Whether to record steps.
     */
    public Stepper(int stepLimit, boolean recordSteps) {
        this.stepLimit = stepLimit;
        this.recordSteps = recordSteps;
        openGroups.push(root);
    }

    /**
     * Construct a stepper from transform settings.
     *
     * @param settings The settings.
     * @return The stepper.
     */
    public static Stepper of(TransformSettings settings) {
        return new Stepper(settings.getStepLimit(), settings.isRecordSteps());
    }

    /**
     * Announce a rewrite, which will be made right after this returns.
     *
     * @param description What the rewrite does.
     * @param near        The instruction the rewrite is centred on, which is tagged with
     *                    {@link CommonExts#LAST_STEP} and {@link CommonExts#LAST_STEP_DESCRIPTION}.
     * @throws StepLimitReachedException If the step limit has been reached, in which case
     *                                   the rewrite must not be made.
     */
    public void step(String description, @Nullable ILInstruction near) {
        if (stepCount >= stepLimit) {
            logger.atFine().log("step limit %d reached before: %s", stepLimit, description);
            throw new StepLimitReachedException(stepLimit);
        }
        int index = stepCount++;
        logger.atFine().log("step %d: %s @ %s", index, description, near == null ? "-" : near.getOpCode());
        if (recordSteps) {
            openGroups.peek().children.add(new Step(index, description, near, near == null ? null : near.toString()));
        }
        if (near != null) {
            near.attachExt(CommonExts.LAST_STEP, index);
            near.attachExt(CommonExts.LAST_STEP_DESCRIPTION, description);
        }
    }

    /**
     * Start a group of steps. Groups nest, and must be closed with {@link #endGroup()}.
     *
     * @param description A description of the group.
     */
    public void beginGroup(String description) {
        groupDepth++;
        logger.atFinest().log("begin group %s at step %d", description, stepCount);
        if (recordSteps) {
            Step group = new Step(stepCount, description, null, null);
            openGroups.peek().children.add(group);
            openGroups.push(group);
        }
    }

    /**
     * End the most recently started group.
     *
     * @throws IllegalStateException If there is no open group.
     */
    public void endGroup() {
        if (groupDepth == 0) throw new IllegalStateException("endGroup without matching beginGroup");
        groupDepth--;
        logger.atFinest().log("end group at step %d", stepCount);
        if (recordSteps) {
            openGroups.pop();
        }
    }

    /**
     * Get the number of steps taken so far.
     *
     * @return The step count.
     */
    public int getStepCount() {
        return stepCount;
    }

    /**
     * Get the recorded top-level steps and groups. Empty if steps are not being recorded.
     *
     * @return The recorded steps.
     */
    public List<Step> getSteps() {
        return Collections.unmodifiableList(root.children);
    }

    /**
     * A recorded step, or a group of steps.
     */
    public static final class Step {
        private final int index;
        private final String description;
        @Nullable
        private final ILInstruction near;
        @Nullable
        private final String nearText;
        private final List<Step> children = new ArrayList<>();

        Step(int index, String description, @Nullable ILInstruction near, @Nullable String nearText) {
            this.index = index;
            this.description = description;
            this.near = near;
            this.nearText = nearText;
        }

        /**
         * Get the index of the step. For a group, the index of the first step that could be in it.
         *
         * @return The index.
         */
        public int getIndex() {
            return index;
        }

        public String getDescription() {
            return description;
        }

        /**
         * Get the instruction the step was centred on.
         *
         * @return The instruction, or null for groups and steps without one.
         */
        public @Nullable ILInstruction getNear() {
            return near;
        }

        /**
         * Get the rendering of the instruction the step was centred on, from before the rewrite.
         *
         * @return The rendering, or null for groups and steps without an instruction.
         */
        public @Nullable String getNearText() {
            return nearText;
        }

        /**
         * Get the steps in this group.
         *
         * @return The steps, empty if this is not a group.
         */
        public List<Step> getChildren() {
            return Collections.unmodifiableList(children);
        }

        @Override
        public String toString() {
            return index + ": " + description;
        }
    }
}
