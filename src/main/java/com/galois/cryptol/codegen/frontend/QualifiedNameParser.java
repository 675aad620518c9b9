package com.galois.cryptol.codegen.frontend;

import java.util.ArrayList;
import java.util.List;

import com.galois.cryptol.codegen.ast.ModName;
import com.galois.cryptol.codegen.ast.QName;

/**
 * Parses a possibly qualified identifier such as <code>f</code> or
 * <code>Crypto::AES::encrypt</code>.  Surrounding whitespace is ignored.
 */
public class QualifiedNameParser implements ExprParser {
    static final String SOURCE = "<interactive>";

    public ParsedExpr parseExpr(String text) throws ParseException {
        int start = 0;
        int end = text.length();
        while (start < end && Character.isWhitespace(text.charAt(start))) ++start;
        while (end > start && Character.isWhitespace(text.charAt(end - 1))) --end;
        if (start == end) {
            throw new ParseException(pos(text, start), "Expected an identifier");
        }

        List<String> segments = new ArrayList<String>();
        int i = start;
        while (true) {
            int s = i;
            if (!isIdentStart(text.charAt(i))) {
                throw new ParseException(pos(text, i),
                                         "Unexpected character '" + text.charAt(i) + "'");
            }
            ++i;
            while (i < end && isIdentPart(text.charAt(i))) ++i;
            segments.add(text.substring(s, i));
            if (i == end) break;
            if (!text.startsWith("::", i) || i + 2 >= end) {
                throw new ParseException(pos(text, i),
                                         "Unexpected input after identifier: " + text.substring(i, end));
            }
            i += 2;
        }

        String local = segments.remove(segments.size() - 1);
        QName name = segments.isEmpty()
            ? QName.local(local)
            : QName.qualified(new ModName(segments), local);
        return new ParsedExpr.PLocated(new ParsedExpr.PVar(name), pos(text, start));
    }

    private static SourcePosition pos(String text, int offset) {
        return new SourcePosition(SOURCE, 1, offset + 1, text);
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '\'';
    }
}
