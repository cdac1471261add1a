package com.keiyaku.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The live variable table. There is no parent chain: loops and conditionals
 * write straight into it, and a function call works on a {@link #copy()} that
 * is dropped when the call ends.
 */
public class Environment {

    private final Map<String, Value> values;

    public Environment() {
        this.values = new LinkedHashMap<>();
    }

    public Environment(Map<String, Value> initial) {
        this.values = new LinkedHashMap<>();
        if (initial != null) values.putAll(initial);
    }

    public void define(String name, Value value) {
        if (value == null) throw new IllegalArgumentException("value for '" + name + "' must not be null");
        values.put(name, value);
    }

    public boolean exists(String name) {
        return values.containsKey(name);
    }

    public Value get(String name) {
        Value v = values.get(name);
        if (v == null) {
            throw new KeiyakuScriptException(ErrorKind.UNRESOLVED_REFERENCE, "Undefined variable: " + name);
        }
        return v;
    }

    /** Working copy for a function call frame. */
    public Environment copy() {
        return new Environment(values);
    }

    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
