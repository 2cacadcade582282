/**
 * Rewrites of the instructions in a single block, and the machinery to run them
 * over a whole tree until nothing changes.
 *
 * @see io.github.eutro.ilcore.passes.transforms.BlockTransform
 * @see io.github.eutro.ilcore.passes.transforms.BlockTransformPipeline
 */
package io.github.eutro.ilcore.passes.transforms;
