package com.galois.cryptol.codegen.emit;

import java.io.File;
import java.io.IOException;

import com.galois.cryptol.codegen.sbvc.CWord;

/**
 * Receives the ports of a generated function.  Calls arrive in the order
 * {@link #begin}, then every input in argument order, then the output,
 * then {@link #finish}.
 */
public interface CodeGenBackend {
    /**
     * Start a function.
     *
     * @param functionName Name of the generated function.
     * @param outputDir Directory for the artifact, or null for the
     *   backend's default destination.
     */
    void begin(String functionName, File outputDir);

    /** Declare an input port carrying a fresh symbolic word. */
    void declareInput(String name, CWord word);

    /** Declare the output port and the word it computes. */
    void declareOutput(String name, CWord word);

    /** Write the artifact. */
    void finish() throws IOException;
}
