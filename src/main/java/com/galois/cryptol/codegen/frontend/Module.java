package com.galois.cryptol.codegen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.cryptol.codegen.ast.Decl;
import com.galois.cryptol.codegen.ast.ModName;
import com.galois.cryptol.codegen.ast.QName;

/**
 * A type checked module: its name and its top-level declarations in
 * dependency order.
 */
public final class Module {
    private final ModName name;
    private final List<Decl> decls;

    public Module(ModName name, List<Decl> decls) {
        if (name == null) throw new NullPointerException("name");
        this.name = name;
        this.decls = Collections.unmodifiableList(new ArrayList<Decl>(decls));
    }

    public ModName getName() {
        return name;
    }

    public List<Decl> getDecls() {
        return decls;
    }

    /**
     * Find the declaration of <code>name</code>, or null.
     */
    public Decl lookup(QName name) {
        for (Decl d : decls) {
            if (d.getName().equals(name)) {
                return d;
            }
        }
        return null;
    }

    /**
     * Find a declaration by its unqualified name, or null.
     */
    public Decl lookupLocal(QName name) {
        for (Decl d : decls) {
            if (d.getName().getName().equals(name.getName())) {
                return d;
            }
        }
        return null;
    }

    public String toString() {
        return "module " + name;
    }
}
