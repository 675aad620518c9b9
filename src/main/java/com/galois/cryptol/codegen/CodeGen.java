package com.galois.cryptol.codegen;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.galois.cryptol.codegen.ast.Decl;
import com.galois.cryptol.codegen.ast.EVar;
import com.galois.cryptol.codegen.ast.Expr;
import com.galois.cryptol.codegen.ast.QName;
import com.galois.cryptol.codegen.ast.Schema;
import com.galois.cryptol.codegen.ast.Type;
import com.galois.cryptol.codegen.emit.CodeGenBackend;
import com.galois.cryptol.codegen.eval.Evaluator;
import com.galois.cryptol.codegen.eval.LazyValue;
import com.galois.cryptol.codegen.eval.TValue;
import com.galois.cryptol.codegen.eval.TypeEvaluator;
import com.galois.cryptol.codegen.eval.VWord;
import com.galois.cryptol.codegen.eval.Value;
import com.galois.cryptol.codegen.frontend.Defaulted;
import com.galois.cryptol.codegen.frontend.Elaborated;
import com.galois.cryptol.codegen.frontend.ElaborationException;
import com.galois.cryptol.codegen.frontend.Module;
import com.galois.cryptol.codegen.frontend.ModuleEnv;
import com.galois.cryptol.codegen.frontend.ParseException;
import com.galois.cryptol.codegen.frontend.ParsedExpr;
import com.galois.cryptol.codegen.sbvc.CWord;
import com.galois.cryptol.codegen.sbvc.Env;
import com.galois.cryptol.codegen.sbvc.SBVCOperations;
import com.galois.cryptol.codegen.sym.SBool;

/**
 * Generates code for a top-level declaration.
 *
 * The root is parsed, elaborated and defaulted; it must then be a
 * monomorphic reference to a declaration whose type is a curried function
 * from words to a word, or a word.  The declaration is evaluated
 * symbolically, one input port is declared per argument and one output
 * port for the result.
 */
public class CodeGen {
    private final CodeGenOptions options;
    private final CodeGenBackend backend;
    private final Evaluator<Env, SBool, CWord> evaluator;

    public CodeGen(CodeGenOptions options, CodeGenBackend backend) {
        if (options == null) throw new NullPointerException("options");
        if (backend == null) throw new NullPointerException("backend");
        this.options = options;
        this.backend = backend;
        this.evaluator =
            new Evaluator<Env, SBool, CWord>(new SBVCOperations(options.getPPOpts()));
    }

    private void logStatus(String msg) {
        PrintStream s = options.getStatusStream();
        if (s != null) {
            s.printf("cryptol-codegen: %s\n", msg);
            s.flush();
        }
    }

    /**
     * Generate code for <code>root</code>.
     *
     * @param outputDir Directory for the artifact, or null for the
     *   backend's default destination.
     * @param root What to generate.
     * @param module The module whose declarations are in scope.
     * @param modEnv The loaded modules.
     * @throws CodeGenException if the root cannot be resolved to a
     *   monomorphic declaration.  Nothing is declared in that case.
     * @throws IOException if the backend cannot write its artifact.
     */
    public void codeGen(File outputDir, GenerationRoot root, Module module, ModuleEnv modEnv)
        throws CodeGenException, IOException {

        String text = ((GenerationRoot.Identifier) root).getText();

        logStatus("Parsing " + text);
        ParsedExpr parsed;
        try {
            parsed = options.getParser().parseExpr(text);
        } catch (ParseException e) {
            throw new CodeGenException(CodeGenException.Stage.PARSE,
                                       "Could not parse " + text + ": " + e.getMessage(), e);
        }

        logStatus("Elaborating " + parsed);
        Elaborated elaborated;
        try {
            elaborated = options.getElaborator().elaborate(parsed, modEnv);
        } catch (ElaborationException e) {
            throw new CodeGenException(CodeGenException.Stage.ELABORATE,
                                       "Could not elaborate " + text, e.getMessages());
        }
        if (!elaborated.getDiagnostics().isEmpty()) {
            throw new CodeGenException(CodeGenException.Stage.ELABORATE,
                                       "Elaborating " + text + " produced diagnostics",
                                       elaborated.getDiagnostics());
        }

        Defaulted defaulted =
            options.getDefaulter().defaultExpr(ParsedExpr.location(parsed),
                                               elaborated.getExpr(),
                                               elaborated.getSchema());
        if (defaulted == null) {
            throw new CodeGenException(CodeGenException.Stage.DEFAULT,
                                       "Could not default the type of " + text);
        }

        Schema schema = defaulted.getSubst().apply(elaborated.getSchema());
        if (!schema.isMonomorphic()) {
            throw new CodeGenException(CodeGenException.Stage.MONOMORPHIC,
                                       text + " has polymorphic type " + schema);
        }

        Expr mono = defaulted.getExpr();
        if (!(mono instanceof EVar)) {
            throw new CodeGenException(CodeGenException.Stage.ROOT_SHAPE,
                                       text + " does not name a declaration: " + mono);
        }
        QName qn = ((EVar) mono).getName();
        String functionName = CName.cName(qn);

        Type type = schema.getBody();
        List<Integer> argWidths = new ArrayList<Integer>();
        int resultWidth = portShape(type, argWidths);
        logStatus("Generating " + functionName + " : " + type);

        Env env = moduleEnv(module, modEnv);
        Value<SBool, CWord> value = evaluator.evaluate(env, mono);

        backend.begin(functionName, outputDir);
        for (int i = 0; i != argWidths.size(); ++i) {
            String port = options.getInputPrefix() + i;
            CWord in = CWord.input(argWidths.get(i), port);
            backend.declareInput(port, in);
            value = value.apply(new VWord<SBool, CWord>(in));
        }
        CWord out = value.fromVWord();
        if (out.width() != resultWidth) {
            throw Panic.panic("CodeGen.codeGen",
                              "Result of " + functionName + " has width " + out.width()
                              + ", expected " + resultWidth);
        }
        backend.declareOutput(options.getOutputName(), out);
        backend.finish();
        logStatus("Declared " + argWidths.size() + " inputs and 1 output for " + functionName);
    }

    /**
     * Bind the declarations of every loaded module, and of
     * <code>module</code>, as global terms.  A declaration is evaluated when
     * it is first looked up, in the environment that binds all of them.
     */
    Env moduleEnv(Module module, ModuleEnv modEnv) {
        List<Module> modules = new ArrayList<Module>(modEnv.getModules());
        if (!modules.contains(module)) {
            modules.add(module);
        }
        final Env[] scope = new Env[1];
        Env env = Env.EMPTY;
        for (Module m : modules) {
            for (final Decl d : m.getDecls()) {
                LazyValue<SBool, CWord> value = new LazyValue<SBool, CWord>() {
                    protected Value<SBool, CWord> compute() {
                        return evaluator.evaluate(scope[0], d.getDefinition());
                    }
                };
                env = env.bindGlobalTerm(d.getName(), value, d.getSchema());
            }
        }
        scope[0] = env;
        return env;
    }

    /**
     * Split a function type into the widths of its word arguments, and
     * return the width of its word result.
     *
     * @throws Panic for any argument or result that is not a word of a
     *   supported width.
     */
    static int portShape(Type type, List<Integer> argWidths) {
        TValue t = TypeEvaluator.evalType(Env.EMPTY, type);
        while (t.isFun()) {
            argWidths.add(wordWidth(t.funArg(), type));
            t = t.funResult();
        }
        return wordWidth(t, type);
    }

    private static int wordWidth(TValue t, Type whole) {
        if (t.isSeq() && t.seqElem().isBit() && t.seqLength().isFin()
            && t.seqLength().getNum().bitLength() < 8
            && CWord.isSupportedWidth(t.seqLength().getNum().longValue())) {
            return t.seqLength().getNum().intValue();
        }
        throw Panic.panic("CodeGen.supplyArgs",
                          "unhandled code generation type",
                          whole.toString());
    }
}
