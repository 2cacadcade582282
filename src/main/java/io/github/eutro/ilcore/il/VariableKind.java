package io.github.eutro.ilcore.il;

/**
 * Where an {@link ILVariable} comes from.
 */
public enum VariableKind {
    /**
     * A local variable slot of the method.
     */
    LOCAL,
    /**
     * A parameter of the method.
     */
    PARAMETER,
    /**
     * A temporary introduced for a value on the evaluation stack.
     */
    STACK_SLOT,
    /**
     * The temporary holding the caught exception at the start of a handler.
     */
    EXCEPTION_STACK_SLOT,
}
