package com.galois.cryptol.codegen;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * CodeGenException is thrown when the code generation pipeline stops
 * before any port is declared: the root did not parse, did not elaborate,
 * could not be defaulted, or is not a monomorphic reference to a single
 * declaration.
 */
public class CodeGenException extends Exception {
    /** The pipeline stage that failed. */
    public enum Stage {
        PARSE,
        ELABORATE,
        DEFAULT,
        MONOMORPHIC,
        ROOT_SHAPE
    }

    private final Stage stage;
    private final List<String> messages;

    public CodeGenException(Stage stage, String message) {
        this(stage, message, Collections.<String>emptyList(), null);
    }

    public CodeGenException(Stage stage, String message, Throwable cause) {
        this(stage, message, Collections.<String>emptyList(), cause);
    }

    public CodeGenException(Stage stage, String message, List<String> messages) {
        this(stage, message, messages, null);
    }

    private CodeGenException(Stage stage, String message, List<String> messages, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.messages = Collections.unmodifiableList(new LinkedList<String>(messages));
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * Return the diagnostics reported by the failing stage, if any.
     */
    public List<String> getMessages() {
        return messages;
    }
}
