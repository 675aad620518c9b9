package com.galois.cryptol.codegen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.cryptol.codegen.ast.ModName;

/**
 * The loaded modules, one of which has focus.  Unqualified names are
 * resolved in the focused module.
 */
public final class ModuleEnv {
    private final List<Module> modules;
    private final Module focused;

    public ModuleEnv(List<Module> modules, Module focused) {
        if (focused == null) throw new NullPointerException("focused");
        List<Module> ms = new ArrayList<Module>(modules);
        if (!ms.contains(focused)) {
            ms.add(focused);
        }
        this.modules = Collections.unmodifiableList(ms);
        this.focused = focused;
    }

    /** An environment with one module, which has focus. */
    public static ModuleEnv focusedOn(Module m) {
        return new ModuleEnv(Collections.<Module>emptyList(), m);
    }

    public List<Module> getModules() {
        return modules;
    }

    public Module getFocused() {
        return focused;
    }

    /** Find a loaded module by name, or null. */
    public Module findModule(ModName name) {
        for (Module m : modules) {
            if (m.getName().equals(name)) {
                return m;
            }
        }
        return null;
    }
}
