package com.galois.cryptol.codegen;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.cryptol.codegen.ast.Decl;
import com.galois.cryptol.codegen.ast.EAbs;
import com.galois.cryptol.codegen.ast.ECon;
import com.galois.cryptol.codegen.ast.ETAbs;
import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.ModName;
import com.galois.cryptol.codegen.ast.Name;
import com.galois.cryptol.codegen.ast.Pass;
import com.galois.cryptol.codegen.ast.QName;
import com.galois.cryptol.codegen.ast.Schema;
import com.galois.cryptol.codegen.ast.Subst;
import com.galois.cryptol.codegen.ast.TVar;
import com.galois.cryptol.codegen.ast.Type;
import com.galois.cryptol.codegen.frontend.Defaulted;
import com.galois.cryptol.codegen.frontend.Defaulter;
import com.galois.cryptol.codegen.frontend.Elaborated;
import com.galois.cryptol.codegen.frontend.ElaborationException;
import com.galois.cryptol.codegen.frontend.Elaborator;
import com.galois.cryptol.codegen.frontend.Module;
import com.galois.cryptol.codegen.frontend.ModuleEnv;
import com.galois.cryptol.codegen.frontend.ParsedExpr;
import com.galois.cryptol.codegen.frontend.Position;
import com.galois.cryptol.codegen.sbvc.CWord;
import com.galois.cryptol.codegen.sym.Assignment;

public class TestCodeGen {
    static final ModName MAIN = ModName.of("Main");
    static final TVar A = new TVar(1, "a");

    static QName q(String n) {
        return QName.qualified(MAIN, n);
    }

    static Expr prim(ECon c, Type t) {
        return Expr.tapp(Expr.con(c), t);
    }

    static Module module() {
        QName x = QName.local("x");
        QName y = QName.local("y");
        Type w8 = Type.word(8);
        Type w16 = Type.word(16);
        return new Module(MAIN, Arrays.asList(
            // bad = 1 << 1
            new Decl(q("bad"), Schema.mono(w8),
                     Expr.app(prim(ECon.SHIFT_L, w8), Expr.word(1, 8), Expr.word(1, 8))),
            // compl8 x = ~x
            new Decl(q("compl8"), Schema.mono(Type.fun(w8, w8)),
                     new EAbs(x, w8, Expr.app(prim(ECon.COMPL, w8), Expr.var(x)))),
            // add8 x y = x + y
            new Decl(q("add8"), Schema.mono(Type.fun(w8, w8, w8)),
                     new EAbs(x, w8, new EAbs(y, w8,
                         Expr.app(prim(ECon.PLUS, w8), Expr.var(x), Expr.var(y))))),
            // double8 x = add8 x x
            new Decl(q("double8"), Schema.mono(Type.fun(w8, w8)),
                     new EAbs(x, w8, Expr.app(Expr.var(q("add8")), Expr.var(x), Expr.var(x)))),
            // triple16 x = x * 3
            new Decl(q("triple16"), Schema.mono(Type.fun(w16, w16)),
                     new EAbs(x, w16, Expr.app(prim(ECon.MUL, w16), Expr.var(x), Expr.word(3, 16)))),
            // answer = 42
            new Decl(q("answer"), Schema.mono(Type.word(32)), Expr.word(42, 32)),
            // id : {a} a -> a
            new Decl(q("id"), new Schema(Collections.singletonList(A),
                                         Collections.<Type>emptyList(),
                                         Type.fun(A, A)),
                     new ETAbs(A, new EAbs(x, A, Expr.var(x)))),
            // open : a -> a, with a free
            new Decl(q("open"), Schema.mono(Type.fun(A, A)), new EAbs(x, A, Expr.var(x))),
            // flip x = ~x on bits
            new Decl(q("flip"), Schema.mono(Type.fun(Type.BIT, Type.BIT)),
                     new EAbs(x, Type.BIT, Expr.app(prim(ECon.COMPL, Type.BIT), Expr.var(x)))),
            // narrow x = x on 12-bit words
            new Decl(q("narrow"), Schema.mono(Type.fun(Type.word(12), Type.word(12))),
                     new EAbs(x, Type.word(12), Expr.var(x)))));
    }

    CodeGenOptions options;
    RecordingBackend backend;
    Module mod;

    @Before
    public void setUp() {
        options = new CodeGenOptions();
        backend = new RecordingBackend();
        mod = module();
    }

    void run(String root) throws Exception {
        new CodeGen(options, backend).codeGen(null, GenerationRoot.identifier(root), mod,
                                              ModuleEnv.focusedOn(mod));
    }

    CodeGenException.Stage failingStage(String root) throws Exception {
        try {
            run(root);
        } catch (CodeGenException e) {
            Assert.assertTrue("no ports on failure", backend.events.isEmpty());
            return e.getStage();
        }
        Assert.fail("expected " + root + " to fail");
        return null;
    }

    static long output(CWord w, Assignment a) {
        return a.evaluate(((CWord.CWord8) w).getWord()).asLiteral().longValue();
    }

    @Test
    public void complementDeclaresOneInputAndOneOutput() throws Exception {
        run("compl8");
        Assert.assertEquals(Arrays.asList("begin Main_compl8", "input in0 8", "output out 8", "finish"),
                            backend.events);
        Assignment a = new Assignment().set("in0", 0x0F);
        Assert.assertEquals(0xF0, output(backend.ports.get("out"), a));
    }

    @Test
    public void additionDeclaresInputsInOrder() throws Exception {
        run("add8");
        Assert.assertEquals(Arrays.asList("begin Main_add8", "input in0 8", "input in1 8",
                                          "output out 8", "finish"),
                            backend.events);
        Assignment a = new Assignment().set("in0", 200).set("in1", 100);
        Assert.assertEquals(44, output(backend.ports.get("out"), a));
    }

    @Test
    public void declarationsSeeEarlierDeclarations() throws Exception {
        run("Main::double8");
        Assignment a = new Assignment().set("in0", 21);
        Assert.assertEquals(42, output(backend.ports.get("out"), a));
    }

    @Test
    public void unusedDeclarationsAreNotEvaluated() throws Exception {
        run("compl8");
        Assert.assertEquals(4, backend.events.size());
        try {
            run("bad");
            Assert.fail("expected the shift to be rejected");
        } catch (Panic p) {
            Assert.assertEquals("operation not supported: <<", p.getDetails().get(0));
        }
    }

    @Test
    public void declarationsMayReferToLaterOnes() throws Exception {
        QName x = QName.local("x");
        Type w8 = Type.word(8);
        mod = new Module(MAIN, Arrays.asList(
            new Decl(q("twice"), Schema.mono(Type.fun(w8, w8)),
                     new EAbs(x, w8, Expr.app(Expr.var(q("inc")), Expr.app(Expr.var(q("inc")), Expr.var(x))))),
            new Decl(q("inc"), Schema.mono(Type.fun(w8, w8)),
                     new EAbs(x, w8, Expr.app(prim(ECon.PLUS, w8), Expr.var(x), Expr.word(1, 8))))));
        run("twice");
        Assert.assertEquals(12, output(backend.ports.get("out"), new Assignment().set("in0", 10)));
    }

    @Test
    public void rootsInOtherLoadedModules() throws Exception {
        ModName lib = ModName.of("Lib");
        QName x = QName.local("x");
        Type w8 = Type.word(8);
        Module libMod = new Module(lib, Arrays.asList(
            new Decl(QName.qualified(lib, "compl8"), Schema.mono(Type.fun(w8, w8)),
                     new EAbs(x, w8, Expr.app(prim(ECon.COMPL, w8), Expr.var(x))))));
        new CodeGen(options, backend).codeGen(null, GenerationRoot.identifier("Lib::compl8"), mod,
                                              new ModuleEnv(Arrays.asList(libMod), mod));
        Assert.assertEquals(Arrays.asList("begin Lib_compl8", "input in0 8", "output out 8", "finish"),
                            backend.events);
        Assert.assertEquals(0x0F, output(backend.ports.get("out"), new Assignment().set("in0", 0xF0)));
    }

    @Test
    public void sixteenBitWords() throws Exception {
        run("triple16");
        Assert.assertEquals(Arrays.asList("begin Main_triple16", "input in0 16", "output out 16", "finish"),
                            backend.events);
        CWord.CWord16 out = (CWord.CWord16) backend.ports.get("out");
        Assert.assertEquals(Long.valueOf(30000),
                            new Assignment().set("in0", 10000).evaluate(out.getWord()).asLiteral());
    }

    @Test
    public void constantsHaveOnlyAnOutput() throws Exception {
        run("answer");
        Assert.assertEquals(Arrays.asList("begin Main_answer", "output out 32", "finish"),
                            backend.events);
        Assert.assertEquals(Long.valueOf(42), backend.ports.get("out").asLiteral());
    }

    @Test
    public void portNamesAreConfigurable() throws Exception {
        options.setInputPrefix("arg");
        options.setOutputName("result");
        run("add8");
        Assert.assertEquals(Arrays.asList("begin Main_add8", "input arg0 8", "input arg1 8",
                                          "output result 8", "finish"),
                            backend.events);
    }

    @Test
    public void polymorphicRootIsRejected() throws Exception {
        Assert.assertEquals(CodeGenException.Stage.MONOMORPHIC, failingStage("id"));
        Assert.assertEquals(CodeGenException.Stage.MONOMORPHIC, failingStage("open"));
    }

    @Test
    public void defaultingSubstitutionIsApplied() throws Exception {
        options.setDefaulter(new Defaulter() {
            public Defaulted defaultExpr(Position loc, Expr e, Schema s) {
                return new Defaulted(Subst.single(A, Type.word(8)), e);
            }
        });
        run("open");
        Assert.assertEquals(Arrays.asList("begin Main_open", "input in0 8", "output out 8", "finish"),
                            backend.events);
    }

    @Test
    public void parseFailure() throws Exception {
        Assert.assertEquals(CodeGenException.Stage.PARSE, failingStage("1x"));
        Assert.assertEquals(CodeGenException.Stage.PARSE, failingStage("a b"));
    }

    @Test
    public void unknownName() throws Exception {
        try {
            run("missing");
            Assert.fail();
        } catch (CodeGenException e) {
            Assert.assertEquals(CodeGenException.Stage.ELABORATE, e.getStage());
            Assert.assertTrue(e.getMessages().get(0).startsWith("Value not in scope: missing"));
        }
    }

    @Test
    public void diagnosticsAbort() throws Exception {
        options.setElaborator(new Elaborator() {
            public Elaborated elaborate(ParsedExpr e, ModuleEnv env) throws ElaborationException {
                return new Elaborated(Expr.var(q("add8")), Schema.mono(Type.fun(Type.word(8), Type.word(8))),
                                      env, Collections.singletonList("warning: shadowed name"));
            }
        });
        Assert.assertEquals(CodeGenException.Stage.ELABORATE, failingStage("add8"));
    }

    @Test
    public void defaultingFailure() throws Exception {
        options.setDefaulter(new Defaulter() {
            public Defaulted defaultExpr(Position loc, Expr e, Schema s) {
                return null;
            }
        });
        Assert.assertEquals(CodeGenException.Stage.DEFAULT, failingStage("add8"));
    }

    @Test
    public void rootMustBeAVariable() throws Exception {
        options.setDefaulter(new Defaulter() {
            public Defaulted defaultExpr(Position loc, Expr e, Schema s) {
                return new Defaulted(Subst.EMPTY, Expr.tapp(e, Type.word(8)));
            }
        });
        Assert.assertEquals(CodeGenException.Stage.ROOT_SHAPE, failingStage("add8"));
    }

    @Test
    public void unhandledShapesDeclareNothing() throws Exception {
        for (String root : new String[] { "flip", "narrow" }) {
            try {
                run(root);
                Assert.fail("expected " + root + " to be unhandled");
            } catch (Panic p) {
                Assert.assertEquals("unhandled code generation type", p.getDetails().get(0));
                Assert.assertTrue(backend.events.isEmpty());
            }
        }
    }

    @Test
    public void statusMessages() throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        options.setStatusStream(new PrintStream(bytes, true, "UTF-8"));
        run("add8");
        String log = bytes.toString("UTF-8");
        Assert.assertTrue(log.startsWith("cryptol-codegen: Parsing add8\n"));
        Assert.assertTrue(log.contains("cryptol-codegen: Declared 2 inputs and 1 output for Main_add8\n"));
    }

    @Test
    public void cNames() {
        Assert.assertEquals("f", CName.cName(QName.local("f")));
        Assert.assertEquals("A_B_f", CName.cName(QName.qualified(ModName.of("A", "B"), "f")));
        Assert.assertEquals("NoPat_3", CName.cName(Name.generated(Pass.NO_PAT, 3)));
        Assert.assertEquals("M_MonoValues_12",
                            CName.cName(new QName(ModName.of("M"), Name.generated(Pass.MONO_VALUES, 12))));
    }
}
