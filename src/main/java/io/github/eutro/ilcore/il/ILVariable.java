package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.ext.ExtHolder;
import org.objectweb.asm.Type;

/**
 * A variable, read by {@link LdLoc} and written by {@link StLoc}.
 * <p>
 * Variables are compared by identity. They are not part of the instruction tree,
 * so any number of instructions may refer to the same variable.
 */
public final class ILVariable extends ExtHolder {
    private final VariableKind kind;
    private final Type type;
    private final int index;
    private String name;

    /**
     * Construct a variable.
     *
     * @param kind  The kind of variable.
     * @param type  The Java type of the variable.
     * @param index The index of the variable among variables of the same kind.
     * @param name  The name of the variable, for display.
     */
    public ILVariable(VariableKind kind, Type type, int index, String name) {
        this.kind = kind;
        this.type = type;
        this.index = index;
        this.name = name;
    }

    public VariableKind getKind() {
        return kind;
    }

    public Type getType() {
        return type;
    }

    public StackType getStackType() {
        return StackType.of(type);
    }

    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return name;
    }
}
