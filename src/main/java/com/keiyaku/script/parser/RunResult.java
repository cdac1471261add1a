package com.keiyaku.script.parser;

import java.util.List;
import java.util.Map;

/** Outcome of a successful run: printed values, final variables and the entry-function result. */
public class RunResult {
    private final List<Value> outputs;
    private final Map<String, Value> env;
    private final boolean entryInvoked;
    private final Value value;

    public RunResult(List<Value> outputs, Map<String, Value> env, boolean entryInvoked, Value value) {
        this.outputs = List.copyOf(outputs);
        this.env = env;
        this.entryInvoked = entryInvoked;
        this.value = (value == null) ? Value.voidValue() : value;
    }

    public List<Value> outputs() { return outputs; }
    public Map<String, Value> env() { return env; }

    /** True when an entry function ran after the top level, automatically or on request. */
    public boolean entryInvoked() { return entryInvoked; }

    /** Entry-function result; void when no entry function ran or it returned nothing. */
    public Value value() { return value; }
}
