package io.github.eutro.ilcore.il;

import org.objectweb.asm.Type;

/**
 * The type of a value on the evaluation stack, as far as the instruction tree cares.
 * <p>
 * Values narrower than 32 bits are widened to {@link #I4} on the stack, as in the JVM.
 */
public enum StackType {
    /**
     * A 32-bit integer.
     */
    I4,
    /**
     * A 64-bit integer.
     */
    I8,
    /**
     * A 32-bit float.
     */
    F4,
    /**
     * A 64-bit float.
     */
    F8,
    /**
     * An object reference.
     */
    O,
    /**
     * No value.
     */
    VOID,
    /**
     * A type that could not be determined.
     */
    UNKNOWN;

    /**
     * Get the stack type of values of the given Java type.
     *
     * @param type The Java type.
     * @return The stack type.
     */
    public static StackType of(Type type) {
        switch (type.getSort()) {
            case Type.BOOLEAN:
            case Type.CHAR:
            case Type.BYTE:
            case Type.SHORT:
            case Type.INT:
                return I4;
            case Type.LONG:
                return I8;
            case Type.FLOAT:
                return F4;
            case Type.DOUBLE:
                return F8;
            case Type.ARRAY:
            case Type.OBJECT:
                return O;
            case Type.VOID:
                return VOID;
            default:
                return UNKNOWN;
        }
    }

    /**
     * Get whether this is an integer stack type.
     *
     * @return Whether this is {@link #I4} or {@link #I8}.
     */
    public boolean isIntegerType() {
        return this == I4 || this == I8;
    }
}
