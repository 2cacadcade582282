/**
 * The instruction tree.
 * <p>
 * A method body is a tree of {@link io.github.eutro.ilcore.il.ILInstruction}s, usually rooted at a
 * {@link io.github.eutro.ilcore.il.Block}. Each instruction owns its children, which are reached
 * by index through {@link io.github.eutro.ilcore.il.ILInstruction#getChild(int)}, and each child
 * knows its parent and its index in the parent. Reading a child never fails on a well-formed tree,
 * and setting a child either succeeds or throws {@link java.lang.IllegalArgumentException}
 * without changing anything.
 * <p>
 * Variables ({@link io.github.eutro.ilcore.il.ILVariable}) are not part of the tree, and are
 * compared by identity.
 */
package io.github.eutro.ilcore.il;
