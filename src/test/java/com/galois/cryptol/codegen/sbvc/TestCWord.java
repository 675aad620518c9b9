package com.galois.cryptol.codegen.sbvc;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.sym.Assignment;
import com.galois.cryptol.codegen.sym.SBool;
import com.galois.cryptol.codegen.sym.SWord;
import com.galois.cryptol.codegen.sym.Width;
import com.galois.cryptol.codegen.sym.WordBinOp;
import com.galois.cryptol.codegen.sym.WordUnOp;

public class TestCWord {
    private static final int[] WIDTHS = { 8, 16, 32, 64 };

    private static final WordBinOp ADD = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.add(y); }
    };

    private static final WordBinOp AND = new WordBinOp() {
        public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) { return x.and(y); }
    };

    private static List<SBool> randomBits(Random r, int n) {
        List<SBool> bits = new ArrayList<SBool>(n);
        for (int i = 0; i != n; ++i) {
            bits.add(SBool.literal(r.nextBoolean()));
        }
        return bits;
    }

    @Test
    public void unpackPackRoundTrip() {
        Random r = new Random(7);
        for (int w : WIDTHS) {
            for (int k = 0; k != 20; ++k) {
                List<SBool> bits = randomBits(r, w);
                Assert.assertEquals(bits, CWord.pack(bits).unpack());
            }
        }
    }

    @Test
    public void unpackPackRoundTripSymbolic() {
        List<SBool> bits = new ArrayList<SBool>();
        for (int i = 0; i != 8; ++i) {
            bits.add(SBool.input("b" + i));
        }
        List<SBool> back = CWord.pack(bits).unpack();

        Assignment a = new Assignment();
        for (int i = 0; i != 8; ++i) {
            a.set("b" + i, i % 3 == 0);
        }
        for (int i = 0; i != 8; ++i) {
            Assert.assertEquals(SBool.literal(i % 3 == 0), a.evaluate(back.get(i)));
        }
    }

    @Test
    public void packPreservesWidth() {
        for (int w : WIDTHS) {
            CWord x = CWord.input(w, "x");
            Assert.assertEquals(w, CWord.pack(x.unpack()).width());
            Assert.assertTrue(CWord.pack(x.unpack()).isSupported());
        }
    }

    @Test
    public void packOfOddLengthIsUnsupported() {
        CWord w = CWord.pack(randomBits(new Random(1), 12));
        Assert.assertTrue(w instanceof CWord.UnsupportedSize);
        Assert.assertEquals(12, w.width());
        Assert.assertNull(w.asLiteral());
    }

    @Test
    public void makeWordTruncates() {
        Assert.assertEquals(Long.valueOf(44), CWord.makeWord(8, 300).asLiteral());
        Assert.assertEquals(Long.valueOf(0xFF),
                            CWord.makeWord(BigInteger.valueOf(8), BigInteger.valueOf(-1)).asLiteral());
        Assert.assertEquals(Long.valueOf(0),
                            CWord.makeWord(BigInteger.valueOf(64), BigInteger.ONE.shiftLeft(64)).asLiteral());
        Assert.assertTrue(CWord.makeWord(24, 5) instanceof CWord.UnsupportedSize);
        Assert.assertEquals(24, CWord.makeWord(24, 5).width());
    }

    @Test
    public void hugeWidthsAreUnsupported() {
        CWord w = CWord.makeWord(BigInteger.ONE.shiftLeft(40), BigInteger.ONE);
        Assert.assertTrue(w instanceof CWord.UnsupportedSize);
        Assert.assertEquals(1L << 40, w.width());

        CWord huge = CWord.makeWord(BigInteger.ONE.shiftLeft(80), BigInteger.ZERO);
        Assert.assertFalse(huge.isSupported());
        Assert.assertEquals(Long.MAX_VALUE, huge.width());
    }

    @Test
    public void liftedOperationsKeepWidth() {
        Random r = new Random(3);
        for (int w : WIDTHS) {
            CWord x = CWord.makeWord(w, r.nextLong());
            CWord y = CWord.makeWord(w, r.nextLong());
            Assert.assertEquals(w, CWord.liftBinary(ADD, x, y).width());
            Assert.assertEquals(w, CWord.liftBinary(AND, x, CWord.input(w, "z")).width());
        }
    }

    @Test
    public void liftedAddMatchesModularArithmetic() {
        CWord r = CWord.liftBinary(ADD, CWord.makeWord(16, 0xFFFF), CWord.makeWord(16, 2));
        Assert.assertTrue(r instanceof CWord.CWord16);
        Assert.assertEquals(Long.valueOf(1), r.asLiteral());
    }

    @Test
    public void mismatchedWidthsAreFatal() {
        for (int a : WIDTHS) {
            for (int b : WIDTHS) {
                if (a == b) continue;
                try {
                    CWord.liftBinary(ADD, CWord.makeWord(a, 1), CWord.makeWord(b, 1));
                    Assert.fail("expected a size mismatch for " + a + " and " + b);
                } catch (Panic p) {
                    Assert.assertEquals("size mismatch", p.getDetails().get(0));
                    Assert.assertEquals(String.valueOf(a), p.getDetails().get(1));
                    Assert.assertEquals(String.valueOf(b), p.getDetails().get(2));
                }
            }
        }
    }

    @Test(expected = Panic.class)
    public void supportedAndUnsupportedAreFatal() {
        CWord.liftBinary(ADD, CWord.makeWord(8, 1), new CWord.UnsupportedSize(8));
    }

    @Test(expected = Panic.class)
    public void differentUnsupportedWidthsAreFatal() {
        CWord.liftBinary(ADD, new CWord.UnsupportedSize(12), new CWord.UnsupportedSize(13));
    }

    @Test
    public void equalUnsupportedWidthsPropagate() {
        CWord r = CWord.liftBinary(ADD, new CWord.UnsupportedSize(12), new CWord.UnsupportedSize(12));
        Assert.assertTrue(r instanceof CWord.UnsupportedSize);
        Assert.assertEquals(12, r.width());
    }

    @Test
    public void unaryLiftLeavesUnsupportedUnchanged() {
        CWord u = new CWord.UnsupportedSize(5);
        Assert.assertSame(u, CWord.liftUnary(new WordUnOp() {
                public <W extends Width> SWord<W> apply(SWord<W> x) { return x.negate(); }
            }, u));
    }

    @Test(expected = Panic.class)
    public void unpackUnsupportedIsFatal() {
        new CWord.UnsupportedSize(3).unpack();
    }

    @Test
    public void compareUnsupported() {
        try {
            CWord.cmp(new CWord.UnsupportedSize(3), new CWord.UnsupportedSize(3));
            Assert.fail();
        } catch (Panic p) {
            Assert.assertTrue(p.getDetails().get(0).contains("unsupported size 3"));
        }
        try {
            CWord.cmp(CWord.makeWord(8, 0), CWord.makeWord(16, 0));
            Assert.fail();
        } catch (Panic p) {
            Assert.assertTrue(p.getDetails().get(0).contains("differing sizes"));
        }
    }

    @Test
    public void compareIsUnsigned() {
        Assert.assertSame(SBool.TRUE,
                          CWord.cmp(CWord.makeWord(64, 1), CWord.makeWord(64, -1)).lt());
    }

    @Test
    public void mergeSymbolic() {
        SBool c = SBool.input("c");
        CWord.CWord8 x = (CWord.CWord8) CWord.input(8, "x");
        CWord.CWord8 y = (CWord.CWord8) CWord.input(8, "y");
        CWord.CWord8 m = (CWord.CWord8) CWord.merge(c, x, y);

        Assignment a = new Assignment().set("x", 1).set("y", 2);
        Assert.assertEquals(Long.valueOf(1), a.set("c", true).evaluate(m.getWord()).asLiteral());
        Assert.assertEquals(Long.valueOf(2), a.set("c", false).evaluate(m.getWord()).asLiteral());
    }

    @Test
    public void testBitFromMostSignificant() {
        CWord w = CWord.makeWord(16, 0x8001);
        Assert.assertSame(SBool.TRUE, w.testBit(0));
        Assert.assertSame(SBool.FALSE, w.testBit(1));
        Assert.assertSame(SBool.TRUE, w.testBit(15));
    }

    @Test(expected = Panic.class)
    public void inputOfUnsupportedWidthIsFatal() {
        CWord.input(7, "x");
    }
}
