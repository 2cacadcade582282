package io.github.eutro.ilcore.il;

/**
 * The closed set of instruction kinds. Each concrete {@link ILInstruction} class has exactly one op code.
 */
public enum OpCode {
    NOP("nop"),
    BLOCK("Block"),
    LD_LOC("ldloc"),
    ST_LOC("stloc"),
    LD_NULL("ldnull"),
    LDC_I4("ldc.i4"),
    LDC_I8("ldc.i8"),
    LD_STR("ldstr"),
    COMP("comp"),
    IF_INSTRUCTION("if"),
    NULL_COALESCING_INSTRUCTION("if.notnull"),
    SWITCH_INSTRUCTION("switch"),
    SWITCH_SECTION("case"),
    THROW("throw"),
    CALL("call");

    private final String mnemonic;

    OpCode(String mnemonic) {
        this.mnemonic = mnemonic;
    }

    /**
     * Get the name this op code is rendered with.
     *
     * @return The mnemonic.
     */
    public String getMnemonic() {
        return mnemonic;
    }

    @Override
    public String toString() {
        return mnemonic;
    }
}
