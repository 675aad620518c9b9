package com.galois.cryptol.codegen.ast;

/**
 * Built-in constants and primitive operators.
 */
public enum ECon {
    TRUE("True"),
    FALSE("False"),
    DEMOTE("demote"),

    PLUS("+"),
    MINUS("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EXP("^^"),
    LG2("lg2"),
    NEG("negate"),

    LT("<"),
    GT(">"),
    LT_EQ("<="),
    GT_EQ(">="),
    EQ("=="),
    NOT_EQ("!="),
    FUN_EQ("==="),
    FUN_NOT_EQ("!=="),
    MIN("min"),
    MAX("max"),

    AND("&&"),
    OR("||"),
    XOR("^"),
    COMPL("~"),
    ZERO("zero"),

    SHIFT_L("<<"),
    SHIFT_R(">>"),
    ROT_L("<<<"),
    ROT_R(">>>"),

    CAT("#"),
    SPLIT_AT("splitAt"),
    JOIN("join"),
    SPLIT("split"),
    REVERSE("reverse"),
    TRANSPOSE("transpose"),

    AT("@"),
    AT_RANGE("@@"),
    AT_BACK("!"),
    AT_RANGE_BACK("!!"),

    FROM_THEN("fromThen"),
    FROM_TO("fromTo"),
    FROM_THEN_TO("fromThenTo"),
    INF_FROM("infFrom"),
    INF_FROM_THEN("infFromThen"),

    ERROR("error"),
    PMUL("pmult"),
    PDIV("pdiv"),
    PMOD("pmod"),
    RANDOM("random");

    private final String symbol;

    ECon(String symbol) {
        this.symbol = symbol;
    }

    /** Return the source syntax of the constant. */
    public String getSymbol() {
        return symbol;
    }

    public String toString() {
        return symbol;
    }
}
