package com.galois.cryptol.codegen.emit;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.IdentityHashMap;
import java.util.Map;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.proto.Protos;
import com.galois.cryptol.codegen.sbvc.CWord;
import com.galois.cryptol.codegen.sym.Term;

/**
 * Records declared ports and the terms they carry in a
 * <code>CodeGenHarness</code> message, and writes the message length
 * delimited for a synthesizer to read.
 *
 * With an output directory the message goes to
 * <code>&lt;dir&gt;/&lt;function&gt;.harness</code>; without one it goes to
 * the default stream given at construction.
 */
public class HarnessWriter implements CodeGenBackend {
    public static final String EXTENSION = ".harness";

    private final OutputStream defaultStream;

    private Protos.CodeGenHarness.Builder harness;
    private Map<Term, Integer> termIndex;
    private File outputDir;
    private Protos.CodeGenHarness written;

    /**
     * @param defaultStream Where to write when no directory is given.
     */
    public HarnessWriter(OutputStream defaultStream) {
        if (defaultStream == null) throw new NullPointerException("defaultStream");
        this.defaultStream = defaultStream;
    }

    public void begin(String functionName, File outputDir) {
        this.harness = Protos.CodeGenHarness.newBuilder().setFunctionName(functionName);
        this.termIndex = new IdentityHashMap<Term, Integer>();
        this.outputDir = outputDir;
        this.written = null;
    }

    public void declareInput(String name, CWord word) {
        addPort(name, Protos.PortDirection.InputPort, word);
    }

    public void declareOutput(String name, CWord word) {
        addPort(name, Protos.PortDirection.OutputPort, word);
    }

    private void addPort(String name, Protos.PortDirection dir, CWord word) {
        if (harness == null) {
            throw new IllegalStateException("declare called before begin");
        }
        if (!word.isSupported()) {
            throw Panic.panic("HarnessWriter.addPort",
                              "Port " + name + " has unsupported width " + word.width());
        }
        harness.addPort(Protos.Port.newBuilder()
                        .setName(name)
                        .setDirection(dir)
                        .setWidth((int) word.width())
                        .setTerm(addTerm(word.getTerm()))
                        .build());
    }

    /**
     * Add a term and everything it refers to, returning its index.  Shared
     * subterms are added once.
     */
    private int addTerm(Term t) {
        Integer known = termIndex.get(t);
        if (known != null) return known;

        Protos.Term.Builder b = Protos.Term.newBuilder()
            .setCode(termCode(t))
            .setWidth(t.getWidth());
        for (Term a : t.getArgs()) {
            b.addArg(addTerm(a));
        }
        switch (t.getOp()) {
        case LITERAL:
        case TEST_BIT:
            b.setValue(t.getValue());
            break;
        case INPUT:
            b.setName(t.getName());
            break;
        default:
            break;
        }
        int idx = harness.getTermCount();
        harness.addTerm(b.build());
        termIndex.put(t, idx);
        return idx;
    }

    private static Protos.TermCode termCode(Term t) {
        switch (t.getOp()) {
        case INPUT:      return Protos.TermCode.InputTerm;
        case LITERAL:    return Protos.TermCode.LiteralTerm;
        case ADD:        return Protos.TermCode.AddTerm;
        case SUB:        return Protos.TermCode.SubTerm;
        case MUL:        return Protos.TermCode.MulTerm;
        case QUOT:       return Protos.TermCode.QuotTerm;
        case REM:        return Protos.TermCode.RemTerm;
        case NEG:        return Protos.TermCode.NegTerm;
        case AND:        return Protos.TermCode.AndTerm;
        case OR:         return Protos.TermCode.OrTerm;
        case XOR:        return Protos.TermCode.XorTerm;
        case COMPLEMENT: return Protos.TermCode.ComplementTerm;
        case ITE:        return Protos.TermCode.IteTerm;
        case EQ:         return Protos.TermCode.EqTerm;
        case ULT:        return Protos.TermCode.UltTerm;
        case NOT:        return Protos.TermCode.NotTerm;
        case BOOL_AND:   return Protos.TermCode.BoolAndTerm;
        case BOOL_OR:    return Protos.TermCode.BoolOrTerm;
        case BOOL_XOR:   return Protos.TermCode.BoolXorTerm;
        case TEST_BIT:   return Protos.TermCode.TestBitTerm;
        case FROM_BITS:  return Protos.TermCode.FromBitsTerm;
        default:
            throw Panic.panic("HarnessWriter.termCode", "Unknown term operation " + t.getOp());
        }
    }

    public void finish() throws IOException {
        if (harness == null) {
            throw new IllegalStateException("finish called before begin");
        }
        Protos.CodeGenHarness msg = harness.build();
        if (outputDir == null) {
            msg.writeDelimitedTo(defaultStream);
            defaultStream.flush();
        } else {
            if (!outputDir.isDirectory() && !outputDir.mkdirs()) {
                throw new IOException("Could not create directory " + outputDir);
            }
            File f = new File(outputDir, msg.getFunctionName() + EXTENSION);
            OutputStream out = new FileOutputStream(f);
            try {
                msg.writeDelimitedTo(out);
            } finally {
                out.close();
            }
        }
        written = msg;
        harness = null;
    }

    /**
     * Return the message written by the last {@link #finish}, or null.
     */
    public Protos.CodeGenHarness getWritten() {
        return written;
    }
}
