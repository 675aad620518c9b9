package com.galois.cryptol.codegen.frontend;

/**
 * Parses expression text.
 */
public interface ExprParser {
    ParsedExpr parseExpr(String text) throws ParseException;
}
