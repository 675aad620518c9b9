package com.galois.cryptol.codegen.sbvc;

import java.math.BigInteger;
import java.util.List;

import com.galois.cryptol.codegen.Panic;
import com.galois.cryptol.codegen.sym.BinOp;
import com.galois.cryptol.codegen.sym.SBool;
import com.galois.cryptol.codegen.sym.SOrdering;
import com.galois.cryptol.codegen.sym.SWord;
import com.galois.cryptol.codegen.sym.Term;
import com.galois.cryptol.codegen.sym.UnOp;
import com.galois.cryptol.codegen.sym.Width;
import com.galois.cryptol.codegen.sym.Width16;
import com.galois.cryptol.codegen.sym.Width32;
import com.galois.cryptol.codegen.sym.Width64;
import com.galois.cryptol.codegen.sym.Width8;
import com.galois.cryptol.codegen.sym.WordBinOp;
import com.galois.cryptol.codegen.sym.WordUnOp;

/**
 * A symbolic word whose width is one of 8, 16, 32 or 64 bits, or a marker
 * recording the width of a word that cannot be represented.
 *
 * The subclasses are closed: every operation dispatches on exactly these
 * five cases.  Binary operations require both operands to have the same
 * case.
 */
public abstract class CWord {
    private CWord() {}

    /** Width of the word in bits. */
    public abstract long width();

    /**
     * Return the unsigned value of the word if it is statically known.
     *
     * @return the value, or null if the word is symbolic or unsupported.
     */
    public abstract Long asLiteral();

    /** Whether the width is one of the supported widths. */
    public boolean isSupported() {
        return true;
    }

    /** An 8-bit word. */
    public static final class CWord8 extends CWord {
        private final SWord<Width8> word;

        public CWord8(SWord<Width8> word) {
            if (word == null) throw new NullPointerException("word");
            this.word = word;
        }

        public SWord<Width8> getWord() {
            return word;
        }

        public long width() {
            return 8;
        }

        public Long asLiteral() {
            return word.asLiteral();
        }
    }

    /** A 16-bit word. */
    public static final class CWord16 extends CWord {
        private final SWord<Width16> word;

        public CWord16(SWord<Width16> word) {
            if (word == null) throw new NullPointerException("word");
            this.word = word;
        }

        public SWord<Width16> getWord() {
            return word;
        }

        public long width() {
            return 16;
        }

        public Long asLiteral() {
            return word.asLiteral();
        }
    }

    /** A 32-bit word. */
    public static final class CWord32 extends CWord {
        private final SWord<Width32> word;

        public CWord32(SWord<Width32> word) {
            if (word == null) throw new NullPointerException("word");
            this.word = word;
        }

        public SWord<Width32> getWord() {
            return word;
        }

        public long width() {
            return 32;
        }

        public Long asLiteral() {
            return word.asLiteral();
        }
    }

    /** A 64-bit word. */
    public static final class CWord64 extends CWord {
        private final SWord<Width64> word;

        public CWord64(SWord<Width64> word) {
            if (word == null) throw new NullPointerException("word");
            this.word = word;
        }

        public SWord<Width64> getWord() {
            return word;
        }

        public long width() {
            return 64;
        }

        public Long asLiteral() {
            return word.asLiteral();
        }
    }

    /**
     * A word of a width that has no representation.  Only the width is
     * kept.
     */
    public static final class UnsupportedSize extends CWord {
        private final long width;

        public UnsupportedSize(long width) {
            this.width = width;
        }

        public long width() {
            return width;
        }

        public Long asLiteral() {
            return null;
        }

        public boolean isSupported() {
            return false;
        }
    }

    /** True if <code>n</code> is 8, 16, 32 or 64. */
    public static boolean isSupportedWidth(long n) {
        return n == 8 || n == 16 || n == 32 || n == 64;
    }

    /**
     * Build a word from bits, most significant first.  Any number of bits
     * other than a supported width gives {@link UnsupportedSize}.
     */
    public static CWord pack(List<SBool> bits) {
        switch (bits.size()) {
        case 8:  return new CWord8(SWord.fromBitsBE(Width8.INSTANCE, bits));
        case 16: return new CWord16(SWord.fromBitsBE(Width16.INSTANCE, bits));
        case 32: return new CWord32(SWord.fromBitsBE(Width32.INSTANCE, bits));
        case 64: return new CWord64(SWord.fromBitsBE(Width64.INSTANCE, bits));
        default: return new UnsupportedSize(bits.size());
        }
    }

    /**
     * Split the word into bits, most significant first.
     *
     * @throws Panic for a word of unsupported width.
     */
    public List<SBool> unpack() {
        if (this instanceof CWord8)  return ((CWord8) this).word.blastBE();
        if (this instanceof CWord16) return ((CWord16) this).word.blastBE();
        if (this instanceof CWord32) return ((CWord32) this).word.blastBE();
        if (this instanceof CWord64) return ((CWord64) this).word.blastBE();
        throw Panic.panic("CWord.unpack",
                          "Words of width " + width() + " are not supported.");
    }

    /**
     * A constant word.  The value is reduced modulo 2^width.  Widths that
     * do not fit in a long are recorded as {@link Long#MAX_VALUE}.
     */
    public static CWord makeWord(BigInteger width, BigInteger value) {
        if (width.bitLength() > 63) {
            return new UnsupportedSize(Long.MAX_VALUE);
        }
        return makeWord(width.longValue(), value.longValue());
    }

    public static CWord makeWord(long width, long value) {
        if (width == 8)  return new CWord8(SWord.literal(Width8.INSTANCE, value));
        if (width == 16) return new CWord16(SWord.literal(Width16.INSTANCE, value));
        if (width == 32) return new CWord32(SWord.literal(Width32.INSTANCE, value));
        if (width == 64) return new CWord64(SWord.literal(Width64.INSTANCE, value));
        return new UnsupportedSize(width);
    }

    /**
     * A fresh symbolic word of a supported width.
     *
     * @throws Panic if the width is not supported.
     */
    public static CWord input(int width, String name) {
        switch (width) {
        case 8:  return new CWord8(SWord.input(Width8.INSTANCE, name));
        case 16: return new CWord16(SWord.input(Width16.INSTANCE, name));
        case 32: return new CWord32(SWord.input(Width32.INSTANCE, name));
        case 64: return new CWord64(SWord.input(Width64.INSTANCE, name));
        default:
            throw Panic.panic("CWord.input", "Words of width " + width + " are not supported.");
        }
    }

    /**
     * Apply the operation for the word's width.  A word of unsupported
     * width is returned unchanged.
     */
    public static CWord liftUnary(UnOp<SWord<Width8>> op8,
                                  UnOp<SWord<Width16>> op16,
                                  UnOp<SWord<Width32>> op32,
                                  UnOp<SWord<Width64>> op64,
                                  CWord w) {
        if (w instanceof CWord8)  return new CWord8(op8.apply(((CWord8) w).word));
        if (w instanceof CWord16) return new CWord16(op16.apply(((CWord16) w).word));
        if (w instanceof CWord32) return new CWord32(op32.apply(((CWord32) w).word));
        if (w instanceof CWord64) return new CWord64(op64.apply(((CWord64) w).word));
        return w;
    }

    /** Lift an operation defined at every width. */
    public static CWord liftUnary(final WordUnOp op, CWord w) {
        return liftUnary(new UnOp<SWord<Width8>>() {
                public SWord<Width8> apply(SWord<Width8> x) { return op.apply(x); }
            }, new UnOp<SWord<Width16>>() {
                public SWord<Width16> apply(SWord<Width16> x) { return op.apply(x); }
            }, new UnOp<SWord<Width32>>() {
                public SWord<Width32> apply(SWord<Width32> x) { return op.apply(x); }
            }, new UnOp<SWord<Width64>>() {
                public SWord<Width64> apply(SWord<Width64> x) { return op.apply(x); }
            }, w);
    }

    /**
     * Apply the operation for the operands' common width.  Two words of the
     * same unsupported width give that unsupported width back.
     *
     * @throws Panic if the widths differ.
     */
    public static CWord liftBinary(BinOp<SWord<Width8>> op8,
                                   BinOp<SWord<Width16>> op16,
                                   BinOp<SWord<Width32>> op32,
                                   BinOp<SWord<Width64>> op64,
                                   CWord l, CWord r) {
        if (l instanceof CWord8 && r instanceof CWord8) {
            return new CWord8(op8.apply(((CWord8) l).word, ((CWord8) r).word));
        }
        if (l instanceof CWord16 && r instanceof CWord16) {
            return new CWord16(op16.apply(((CWord16) l).word, ((CWord16) r).word));
        }
        if (l instanceof CWord32 && r instanceof CWord32) {
            return new CWord32(op32.apply(((CWord32) l).word, ((CWord32) r).word));
        }
        if (l instanceof CWord64 && r instanceof CWord64) {
            return new CWord64(op64.apply(((CWord64) l).word, ((CWord64) r).word));
        }
        if (l instanceof UnsupportedSize && r instanceof UnsupportedSize
            && l.width() == r.width()) {
            return l;
        }
        throw Panic.panic("CWord.liftBinary",
                          "size mismatch",
                          String.valueOf(l.width()),
                          String.valueOf(r.width()));
    }

    /** Lift an operation defined at every width. */
    public static CWord liftBinary(final WordBinOp op, CWord l, CWord r) {
        return liftBinary(new BinOp<SWord<Width8>>() {
                public SWord<Width8> apply(SWord<Width8> x, SWord<Width8> y) {
                    return op.apply(x, y);
                }
            }, new BinOp<SWord<Width16>>() {
                public SWord<Width16> apply(SWord<Width16> x, SWord<Width16> y) {
                    return op.apply(x, y);
                }
            }, new BinOp<SWord<Width32>>() {
                public SWord<Width32> apply(SWord<Width32> x, SWord<Width32> y) {
                    return op.apply(x, y);
                }
            }, new BinOp<SWord<Width64>>() {
                public SWord<Width64> apply(SWord<Width64> x, SWord<Width64> y) {
                    return op.apply(x, y);
                }
            }, l, r);
    }

    /**
     * Unsigned three-way comparison of words of the same supported width.
     *
     * @throws Panic on unsupported or differing widths.
     */
    public static SOrdering cmp(CWord l, CWord r) {
        if (l instanceof CWord8 && r instanceof CWord8) {
            return ((CWord8) l).word.compareTo(((CWord8) r).word);
        }
        if (l instanceof CWord16 && r instanceof CWord16) {
            return ((CWord16) l).word.compareTo(((CWord16) r).word);
        }
        if (l instanceof CWord32 && r instanceof CWord32) {
            return ((CWord32) l).word.compareTo(((CWord32) r).word);
        }
        if (l instanceof CWord64 && r instanceof CWord64) {
            return ((CWord64) l).word.compareTo(((CWord64) r).word);
        }
        if (l.width() == r.width()) {
            throw Panic.panic("CWord.cmp",
                              "Can't compare words of unsupported size " + l.width());
        }
        throw Panic.panic("CWord.cmp",
                          "Can't compare words of differing sizes:",
                          String.valueOf(l.width()),
                          String.valueOf(r.width()));
    }

    /**
     * Bit <code>i</code> of the word, counted from the most significant end.
     *
     * @throws Panic for a word of unsupported width.
     */
    public SBool testBit(int i) {
        if (this instanceof CWord8)  return ((CWord8) this).word.testBit(i);
        if (this instanceof CWord16) return ((CWord16) this).word.testBit(i);
        if (this instanceof CWord32) return ((CWord32) this).word.testBit(i);
        if (this instanceof CWord64) return ((CWord64) this).word.testBit(i);
        throw Panic.panic("CWord.testBit",
                          "Trying to index into a word of unsupported size " + width());
    }

    /** Symbolic if-then-else on words of the same width. */
    public static CWord merge(final SBool cond, CWord l, CWord r) {
        return liftBinary(new WordBinOp() {
                public <W extends Width> SWord<W> apply(SWord<W> x, SWord<W> y) {
                    return SWord.ite(cond, x, y);
                }
            }, l, r);
    }

    /**
     * The symbolic term of a supported word, for handing to an emitter.
     *
     * @throws Panic for a word of unsupported width.
     */
    public Term getTerm() {
        if (this instanceof CWord8)  return ((CWord8) this).word.getTerm();
        if (this instanceof CWord16) return ((CWord16) this).word.getTerm();
        if (this instanceof CWord32) return ((CWord32) this).word.getTerm();
        if (this instanceof CWord64) return ((CWord64) this).word.getTerm();
        throw Panic.panic("CWord.getTerm",
                          "Words of width " + width() + " have no term.");
    }

    public String toString() {
        Long v = asLiteral();
        if (v != null) {
            return Long.toUnsignedString(v.longValue());
        }
        return "<[" + width() + "]>";
    }
}
