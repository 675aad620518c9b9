package com.galois.cryptol.codegen.sbvc;

import com.galois.cryptol.codegen.eval.Merge;
import com.galois.cryptol.codegen.sym.SBool;

/**
 * Symbolic merge of values over symbolic bits and {@link CWord}s.
 */
public final class SBVCMerge extends Merge<SBool, CWord> {
    public static final SBVCMerge INSTANCE = new SBVCMerge();

    private SBVCMerge() {}

    protected Boolean asLiteral(SBool cond) {
        return cond.asLiteral();
    }

    protected SBool iteBit(SBool cond, SBool then, SBool otherwise) {
        return SBool.ite(cond, then, otherwise);
    }

    protected CWord iteWord(SBool cond, CWord then, CWord otherwise) {
        return CWord.merge(cond, then, otherwise);
    }
}
