package com.galois.cryptol.codegen.frontend;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;

/**
 * Thrown when an expression cannot be renamed or type checked.
 */
public class ElaborationException extends Exception {
    private final List<String> messages;

    public ElaborationException(List<String> messages) {
        super(messages.isEmpty() ? "Elaboration failed" : messages.get(0));
        this.messages = Collections.unmodifiableList(new LinkedList<String>(messages));
    }

    public ElaborationException(String message) {
        this(Collections.singletonList(message));
    }

    public List<String> getMessages() {
        return messages;
    }
}
