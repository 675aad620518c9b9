package com.galois.cryptol.codegen.frontend;

import org.junit.Assert;
import org.junit.Test;

import com.galois.cryptol.codegen.ast.ModName;
import com.galois.cryptol.codegen.ast.QName;

public class TestQualifiedNameParser {
    static final QualifiedNameParser PARSER = new QualifiedNameParser();

    static QName parse(String text) throws ParseException {
        ParsedExpr e = ParsedExpr.dislocate(PARSER.parseExpr(text));
        Assert.assertTrue(e instanceof ParsedExpr.PVar);
        return ((ParsedExpr.PVar) e).getName();
    }

    static long errorColumn(String text) {
        try {
            PARSER.parseExpr(text);
        } catch (ParseException e) {
            return ((SourcePosition) e.getPosition()).getCol();
        }
        Assert.fail("expected " + text + " to be rejected");
        return -1;
    }

    @Test
    public void simpleNames() throws Exception {
        Assert.assertEquals(QName.local("f"), parse("f"));
        Assert.assertEquals(QName.local("x'"), parse("x'"));
        Assert.assertEquals(QName.local("_tmp1"), parse("  _tmp1 \t"));
    }

    @Test
    public void qualifiedNames() throws Exception {
        Assert.assertEquals(QName.qualified(ModName.of("Crypto", "AES"), "encrypt"),
                            parse("Crypto::AES::encrypt"));
    }

    @Test
    public void locationPointsAtTheName() throws Exception {
        Position p = ParsedExpr.location(PARSER.parseExpr("  f"));
        Assert.assertTrue(p instanceof SourcePosition);
        Assert.assertEquals(3, ((SourcePosition) p).getCol());
        Assert.assertEquals(1, ((SourcePosition) p).getLine());
        Assert.assertEquals("  f", ((SourcePosition) p).getText());
        Assert.assertEquals("<interactive>:1:3", p.toString());
    }

    @Test
    public void unlocatedExpressionsHaveTheEmptyPosition() {
        ParsedExpr e = new ParsedExpr.PVar(QName.local("f"));
        Assert.assertSame(Position.empty(), ParsedExpr.location(e));
    }

    @Test
    public void malformedInput() {
        Assert.assertEquals(1, errorColumn(""));
        Assert.assertEquals(1, errorColumn("1x"));
        Assert.assertEquals(2, errorColumn("A::"));
        Assert.assertEquals(2, errorColumn("a b"));
        Assert.assertEquals(4, errorColumn("A::9"));
    }
}
