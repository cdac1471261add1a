package com.keiyaku.script;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.keiyaku.debug.Debug;
import com.keiyaku.script.parser.BlockScanner;
import com.keiyaku.script.parser.BlockScanner.BlockKind;
import com.keiyaku.script.parser.BlockScanner.Header;
import com.keiyaku.script.parser.Environment;
import com.keiyaku.script.parser.Interpreter;
import com.keiyaku.script.parser.KeiyakuScriptException;
import com.keiyaku.script.parser.RunResult;
import com.keiyaku.script.parser.SourceLine;
import com.keiyaku.script.parser.Value;

/**
 * Core KeiyakuScript engine.
 *
 * - Sentence-per-line programs written like contract clauses
 *   ("A は 2 とする。", "A を出力する。", "3 回、以下を行う。" ... "以上。")
 * - Types: integer, float, string (plus void for a call that returned nothing)
 * - One variable table; function calls run on a copy that is discarded afterwards
 * - Entry point: when the top level printed or assigned nothing and 主文 is
 *   defined, 主文() is called with no arguments
 *
 * One interpreter is created per run, so an engine instance can be reused
 * sequentially but must not be shared between threads while running.
 */
public class KeiyakuScript {

    private static final String TAG = "KeiyakuScript";

    public static final String DEFAULT_ENTRY_FUNCTION = "主文";
    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    /** Receives every printed value, in order. */
    public interface OutputSink {
        void emit(Value value);
    }

    /** Host hook notified of a failure before it is rethrown. */
    public interface SystemErrorReporter {
        void report(KeiyakuScriptException e, Interpreter interpreter);
    }

    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private String entryFunctionName = DEFAULT_ENTRY_FUNCTION;
    private boolean autoInvokeEntry = true;
    private OutputSink outputSink = null;
    private SystemErrorReporter errorReporter = null;

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("max call depth must be at least 1");
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    public void setEntryFunctionName(String name) {
        this.entryFunctionName = (name == null || name.isBlank()) ? DEFAULT_ENTRY_FUNCTION : name.strip();
    }

    public String getEntryFunctionName() { return entryFunctionName; }

    public void setAutoInvokeEntry(boolean autoInvokeEntry) { this.autoInvokeEntry = autoInvokeEntry; }

    public void setOutputSink(OutputSink sink) { this.outputSink = sink; }

    public void setErrorReporter(SystemErrorReporter reporter) { this.errorReporter = reporter; }

    public RunResult run(String source) {
        return run(source, Collections.emptyMap());
    }

    /**
     * Runs the whole program, then applies the entry-point convention.
     *
     * @throws KeiyakuScriptException on the first failure; nothing is recovered
     */
    public RunResult run(String source, Map<String, Value> initialEnv) {
        if (source == null) throw new IllegalArgumentException("source must not be null");

        Environment env = new Environment(initialEnv);
        Interpreter interpreter = new Interpreter(env, maxCallDepth, outputSink);
        try {
            interpreter.execute(SourceLine.split(source));

            boolean invoked = false;
            if (autoInvokeEntry && interpreter.hasFunction(entryFunctionName) && !interpreter.hasTopLevelEffect()) {
                Debug.get().d(TAG, "no top-level effect, invoking " + entryFunctionName + "()");
                interpreter.invokeForHost(entryFunctionName, Collections.emptyList());
                invoked = true;
            }
            return new RunResult(interpreter.outputs(), interpreter.environment().snapshot(), invoked, null);
        } catch (KeiyakuScriptException e) {
            onInterpreterError(e, interpreter);
            throw e;
        }
    }

    /**
     * Runs the top level, then calls {@code entryFunctionName} with the given
     * arguments and returns its value with the final environment. The
     * automatic entry-point convention does not apply here.
     */
    public RunResult runWithEntryResult(
            String source,
            String entryFunctionName,
            List<Value> entryArgs,
            Map<String, Value> initialEnv
    ) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        if (entryFunctionName == null || entryFunctionName.isBlank()) {
            throw new IllegalArgumentException("entryFunctionName must not be empty");
        }

        Environment env = new Environment(initialEnv);
        Interpreter interpreter = new Interpreter(env, maxCallDepth, outputSink);
        try {
            // 1) top level
            interpreter.execute(SourceLine.split(source));

            // 2) entry call
            List<Value> args = (entryArgs == null) ? Collections.emptyList() : entryArgs;
            Value out = interpreter.invokeForHost(entryFunctionName.strip(), args);

            return new RunResult(interpreter.outputs(), interpreter.environment().snapshot(), true, out);
        } catch (KeiyakuScriptException e) {
            onInterpreterError(e, interpreter);
            throw e;
        }
    }

    /**
     * Side-effect-free check: does the source contain a definition sentence for
     * {@code fnName}? Nothing is executed, so definitions nested in blocks that
     * would never run are reported too.
     */
    public boolean hasUserFunction(String source, String fnName) {
        if (source == null) return false;
        if (fnName == null || fnName.isBlank()) return false;

        for (SourceLine line : SourceLine.split(source)) {
            Header h = BlockScanner.header(line);
            if (h != null && h.kind == BlockKind.FUNCTION && h.name.equals(fnName.strip())) return true;
        }
        return false;
    }

    private void onInterpreterError(KeiyakuScriptException e, Interpreter interpreter) {
        Debug.get().e(TAG, e.getMessage());
        if (errorReporter == null) return;
        try {
            errorReporter.report(e, interpreter);
        } catch (RuntimeException reporterFailure) {
            Debug.get().e(TAG, "error reporter failed", reporterFailure);
        }
    }
}
