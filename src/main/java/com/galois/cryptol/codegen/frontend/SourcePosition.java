package com.galois.cryptol.codegen.frontend;

/**
 * A column of a line of input text.
 */
public class SourcePosition extends Position {
    final String path;
    final long line;
    final long col;
    final String text;

    /**
     * @param path Name of the input, such as <code>&lt;interactive&gt;</code>.
     * @param line One-based line number.
     * @param col One-based column number.
     * @param text The line of input the position points into.
     */
    public SourcePosition( String path, long line, long col, String text )
    {
        this.path = path;
        this.line = line;
        this.col  = col;
        this.text = text;
    }

    public String getPath() { return path; }
    public long getLine() { return line; }
    public long getCol() { return col; }
    public String getText() { return text; }

    public boolean equals(Object o) {
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition r = (SourcePosition) o;
        return path.equals(r.path) && line == r.line && col == r.col
            && text.equals(r.text);
    }

    public int hashCode() {
        return (path.hashCode() * 31 + (int) line) * 31 + (int) col;
    }

    public String toString()
    {
        return path + ":" + line + ":" + col;
    }
}
