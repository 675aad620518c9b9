package com.galois.cryptol.codegen.emit;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.proto.Protos;
import com.galois.cryptol.codegen.sbvc.CWord;
import com.galois.cryptol.codegen.sym.SWord;
import com.galois.cryptol.codegen.sym.Width;
import com.galois.cryptol.codegen.sym.WordBinOp;

public class TestHarnessWriter {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    static final WordBinOp ADD = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.add(y); }
    };

    static void writeDouble(HarnessWriter w, File dir) throws Exception {
        CWord x = CWord.input(16, "in0");
        w.begin("double16", dir);
        w.declareInput("in0", x);
        w.declareOutput("out", CWord.liftBinary(ADD, x, x));
        w.finish();
    }

    @Test
    public void writesToDefaultStream() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        HarnessWriter w = new HarnessWriter(bytes);
        writeDouble(w, null);

        Protos.CodeGenHarness h =
            Protos.CodeGenHarness.parseDelimitedFrom(new ByteArrayInputStream(bytes.toByteArray()));
        Assert.assertEquals(w.getWritten(), h);
        Assert.assertEquals("double16", h.getFunctionName());
        Assert.assertEquals(2, h.getPortCount());

        Protos.Port in = h.getPort(0);
        Assert.assertEquals("in0", in.getName());
        Assert.assertEquals(Protos.PortDirection.InputPort, in.getDirection());
        Assert.assertEquals(16, in.getWidth());
        Protos.Term inTerm = h.getTerm(in.getTerm());
        Assert.assertEquals(Protos.TermCode.InputTerm, inTerm.getCode());
        Assert.assertEquals("in0", inTerm.getName());

        Protos.Port out = h.getPort(1);
        Assert.assertEquals(Protos.PortDirection.OutputPort, out.getDirection());
        Protos.Term sum = h.getTerm(out.getTerm());
        Assert.assertEquals(Protos.TermCode.AddTerm, sum.getCode());
        // Both operands refer to the input's term.
        Assert.assertEquals(2, sum.getArgCount());
        Assert.assertEquals(in.getTerm(), sum.getArg(0));
        Assert.assertEquals(in.getTerm(), sum.getArg(1));
        Assert.assertEquals(2, h.getTermCount());
    }

    @Test
    public void writesIntoDirectory() throws Exception {
        ByteArrayOutputStream unused = new ByteArrayOutputStream();
        File dir = new File(tmp.getRoot(), "gen");
        writeDouble(new HarnessWriter(unused), dir);

        Assert.assertEquals(0, unused.size());
        File f = new File(dir, "double16" + HarnessWriter.EXTENSION);
        Assert.assertTrue(f.isFile());
        InputStream in = new FileInputStream(f);
        try {
            Assert.assertEquals("double16", Protos.CodeGenHarness.parseDelimitedFrom(in).getFunctionName());
        } finally {
            in.close();
        }
    }

    @Test
    public void literalsCarryTheirValue() throws Exception {
        HarnessWriter w = new HarnessWriter(new ByteArrayOutputStream());
        w.begin("answer", null);
        w.declareOutput("out", CWord.makeWord(32, 42));
        w.finish();
        Protos.CodeGenHarness h = w.getWritten();
        Protos.Term t = h.getTerm(h.getPort(0).getTerm());
        Assert.assertEquals(Protos.TermCode.LiteralTerm, t.getCode());
        Assert.assertEquals(42, t.getValue());
        Assert.assertEquals(32, t.getWidth());
    }

    @Test(expected = Panic.class)
    public void unsupportedWidthIsRejected() {
        HarnessWriter w = new HarnessWriter(new ByteArrayOutputStream());
        w.begin("odd", null);
        w.declareOutput("out", CWord.makeWord(5, 3));
    }

    @Test(expected = IllegalStateException.class)
    public void declareBeforeBegin() {
        new HarnessWriter(new ByteArrayOutputStream()).declareInput("in0", CWord.input(8, "in0"));
    }
}
