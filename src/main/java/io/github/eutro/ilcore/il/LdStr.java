package io.github.eutro.ilcore.il;

import io.github.eutro.ilcore.util.TextOutput;

import java.util.Objects;

/**
 * Loads a constant string.
 */
public final class LdStr extends SimpleInstruction {
    private final String value;

    public LdStr(String value) {
        super(OpCode.LD_STR);
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getValue() {
        return value;
    }

    @Override
    public StackType getResultType() {
        return StackType.O;
    }

    @Override
    public int getDirectFlags() {
        return InstructionFlags.NONE;
    }

    @Override
    public void writeTo(TextOutput output) {
        output.write(getOpCode().getMnemonic());
        output.write(" \"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"':
                    output.write("\\\"");
                    break;
                case '\\':
                    output.write("\\\\");
                    break;
                case '\n':
                    output.write("\\n");
                    break;
                case '\t':
                    output.write("\\t");
                    break;
                default:
                    output.write(c);
            }
        }
        output.write('"');
    }

    @Override
    public LdStr clone() {
        return copyILRangeTo(new LdStr(value));
    }
}
