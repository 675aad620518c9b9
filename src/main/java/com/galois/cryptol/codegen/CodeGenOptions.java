package com.galois.cryptol.codegen;

import java.io.PrintStream;

import com.galois.cryptol.codegen.eval.PPOpts;
import com.galois.cryptol.codegen.frontend.DeclarationElaborator;
import com.galois.cryptol.codegen.frontend.Defaulter;
import com.galois.cryptol.codegen.frontend.Elaborator;
import com.galois.cryptol.codegen.frontend.ExprParser;
import com.galois.cryptol.codegen.frontend.IdentityDefaulter;
import com.galois.cryptol.codegen.frontend.QualifiedNameParser;

public class CodeGenOptions {
    private PrintStream statusStream = null;
    private PPOpts ppOpts = PPOpts.DEFAULT;
    private String inputPrefix = "in";
    private String outputName = "out";
    private ExprParser parser = new QualifiedNameParser();
    private Elaborator elaborator = new DeclarationElaborator();
    private Defaulter defaulter = new IdentityDefaulter();

    /**
     * Set the stream that status messages are written to.  A null stream,
     * the default, disables them.
     */
    public void setStatusStream( PrintStream s ) {
        statusStream = s;
    }

    public PrintStream getStatusStream() {
        return statusStream;
    }

    /**
     * Set the options used to render values in diagnostics.
     */
    public void setPPOpts( PPOpts opts ) {
        if (opts == null) throw new NullPointerException("opts");
        ppOpts = opts;
    }

    public PPOpts getPPOpts() {
        return ppOpts;
    }

    /**
     * Set the prefix of input port names.  Inputs are numbered from zero
     * in argument order: <code>in0</code>, <code>in1</code>, ...
     */
    public void setInputPrefix( String prefix ) {
        if (prefix == null) throw new NullPointerException("prefix");
        inputPrefix = prefix;
    }

    public String getInputPrefix() {
        return inputPrefix;
    }

    /**
     * Set the name of the output port.
     */
    public void setOutputName( String name ) {
        if (name == null) throw new NullPointerException("name");
        outputName = name;
    }

    public String getOutputName() {
        return outputName;
    }

    public void setParser( ExprParser p ) {
        parser = p;
    }

    public ExprParser getParser() {
        return parser;
    }

    public void setElaborator( Elaborator e ) {
        elaborator = e;
    }

    public Elaborator getElaborator() {
        return elaborator;
    }

    /**
     * Set the defaulter.  The default one chooses nothing, so only roots
     * that are already monomorphic are accepted.
     */
    public void setDefaulter( Defaulter d ) {
        defaulter = d;
    }

    public Defaulter getDefaulter() {
        return defaulter;
    }
}
