package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;
import org.objectweb.asm.Type;

import java.util.List;
import java.util.Objects;

/**
 * Invokes a method. The receiver, if the method is not static, is the first argument.
 */
public final class Call extends ILInstruction {
    public static final SlotInfo ARGUMENTS_SLOT = new SlotInfo("arguments", true, true, ILInstruction.class);

    private final String owner;
    private final String name;
    private final Type methodType;
    private final boolean isStatic;
    private final InstructionCollection<ILInstruction> arguments;

    /**
     * Construct a call with no arguments yet.
     *
     * @param owner      The internal name of the class declaring the method.
     * @param name       The name of the method.
     * @param methodType The method type, as in {@link Type#getMethodType(String)}.
     * @param isStatic   Whether the method is static.
     */
    public Call(String owner, String name, Type methodType, boolean isStatic) {
        super(OpCode.CALL);
        if (methodType.getSort() != Type.METHOD) {
            throw new IllegalArgumentException("not a method type: " + methodType);
        }
        this.owner = Objects.requireNonNull(owner, "owner");
        this.name = Objects.requireNonNull(name, "name");
        this.methodType = methodType;
        this.isStatic = isStatic;
        arguments = new InstructionCollection<>(this, 0, ARGUMENTS_SLOT, getExpectedArgumentCount());
    }

    /**
     * Construct a call with the given arguments.
     *
     * @param owner      The internal name of the class declaring the method.
     * @param name       The name of the method.
     * @param methodType The method type.
     * @param isStatic   Whether the method is static.
     * @param arguments  The arguments, receiver first.
     */
    public Call(String owner, String name, Type methodType, boolean isStatic, ILInstruction... arguments) {
        this(owner, name, methodType, isStatic);
        for (ILInstruction argument : arguments) {
            this.arguments.add(argument);
        }
    }

    public String getOwner() {
        return owner;
    }

    public String getName() {
        return name;
    }

    public Type getMethodType() {
        return methodType;
    }

    public boolean isStatic() {
        return isStatic;
    }

    /**
     * Get the mutable list of arguments, receiver first.
     *
     * @return The arguments.
     */
    public List<ILInstruction> getArguments() {
        return arguments;
    }

    /**
     * Get the number of arguments the method expects, including the receiver.
     *
     * @return The expected argument count.
     */
    public int getExpectedArgumentCount() {
        return methodType.getArgumentTypes().length + (isStatic ? 0 : 1);
    }

    @Override
    public StackType getResultType() {
        return StackType.of(methodType.getReturnType());
    }

    @Override
    public int getChildCount() {
        return arguments.size();
    }

    @Override
    public ILInstruction getChild(int index) {
        return arguments.get(index);
    }

    @Override
    public void setChild(int index, ILInstruction value) {
        arguments.set(index, value);
    }

    @Override
    public SlotInfo getChildSlot(int index) {
        Objects.checkIndex(index, arguments.size());
        return ARGUMENTS_SLOT;
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.SIDE_EFFECT | InstructionFlags.MAY_THROW;
    }

    @Override
    protected int computeFlags() {
        int flags = getDirectFlags();
        for (ILInstruction argument : arguments) {
            flags |= argument.getFlags();
        }
        return flags;
    }

    @Override
    public void checkInvariant() {
        super.checkInvariant();
        if (arguments.size() != getExpectedArgumentCount()) {
            throw violation("expected %d arguments, got %d", getExpectedArgumentCount(), arguments.size());
        }
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(' ');
        output.write(owner);
        output.write('.');
        output.write(name);
        output.write('(');
        boolean first = true;
        for (ILInstruction argument : arguments) {
            if (!first) output.write(", ");
            first = false;
            argument.writeTo(output);
        }
        output.write(')');
    }

    @Override
    public Call clone() {
        Call clone = new Call(owner, name, methodType, isStatic);
        for (ILInstruction argument : arguments) {
            clone.arguments.add(argument.clone());
        }
        return copyILRangeTo(clone);
    }
}
