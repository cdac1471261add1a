package com.keiyaku.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Script failure with its location trace.
 *
 * The trace holds the line the failure was raised on first, followed by the
 * call-site line of every function call it unwound through.
 */
public class KeiyakuScriptException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String detail;
    private final List<SourceLine> trace = new ArrayList<>();

    public KeiyakuScriptException(ErrorKind kind, String detail) {
        super(detail);
        this.kind = kind;
        this.detail = detail;
    }

    public KeiyakuScriptException(ErrorKind kind, String detail, SourceLine at) {
        this(kind, detail);
        if (at != null) trace.add(at);
    }

    public ErrorKind kind() { return kind; }

    public String detail() { return detail; }

    public List<SourceLine> trace() { return Collections.unmodifiableList(trace); }

    public boolean isLocated() { return !trace.isEmpty(); }

    /** The line the failure was raised on, or null before the engine located it. */
    public SourceLine location() {
        return trace.isEmpty() ? null : trace.get(0);
    }

    public int lineNumber() {
        SourceLine at = location();
        return (at == null) ? -1 : at.number;
    }

    KeiyakuScriptException at(SourceLine line) {
        if (trace.isEmpty()) trace.add(line);
        return this;
    }

    /** Appends a call site; recursion repeats the same line once per frame. */
    KeiyakuScriptException calledFrom(SourceLine line) {
        trace.add(line);
        return this;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append(": ").append(detail);
        if (!trace.isEmpty()) {
            SourceLine at = trace.get(0);
            sb.append(" (line ").append(at.number).append(": ").append(at.raw.strip()).append(')');
            for (int i = 1; i < trace.size(); i++) {
                SourceLine call = trace.get(i);
                sb.append("\n  called from line ").append(call.number).append(": ").append(call.raw.strip());
            }
        }
        return sb.toString();
    }
}
