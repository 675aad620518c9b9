package com.galois.cryptol.codegen.frontend;

/**
 * Thrown when source text is not a well-formed expression.
 */
public class ParseException extends Exception {
    private final Position position;

    public ParseException(Position position, String message) {
        super(message);
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }
}
