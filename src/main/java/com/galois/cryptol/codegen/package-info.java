/**
 * Code generation from typed expressions over fixed-width words.
 *
 * {@link com.galois.cryptol.codegen.CodeGen} resolves a top-level
 * declaration, evaluates it symbolically over
 * {@link com.galois.cryptol.codegen.sbvc.CWord}s, and declares one input
 * port per argument and one output port for the result to a
 * {@link com.galois.cryptol.codegen.emit.CodeGenBackend}.
 */
package com.galois.cryptol.codegen;
