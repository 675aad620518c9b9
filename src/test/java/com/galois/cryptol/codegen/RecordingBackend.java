package com.galois.cryptol.codegen;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.galois.cryptol.codegen.emit.CodeGenBackend;
import com.galois.cryptol.codegen.sbvc.CWord;

/**
 * A backend that remembers every call.
 */
class RecordingBackend implements CodeGenBackend {
    final List<String> events = new ArrayList<String>();
    final Map<String, CWord> ports = new LinkedHashMap<String, CWord>();

    public void begin(String functionName, File outputDir) {
        events.add("begin " + functionName);
    }

    public void declareInput(String name, CWord word) {
        events.add("input " + name + " " + word.width());
        ports.put(name, word);
    }

    public void declareOutput(String name, CWord word) {
        events.add("output " + name + " " + word.width());
        ports.put(name, word);
    }

    public void finish() {
        events.add("finish");
    }
}
