package com.keiyaku.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.keiyaku.debug.Debug;
import com.keiyaku.script.KeiyakuScript.OutputSink;
import com.keiyaku.script.parser.BlockScanner.Block;
import com.keiyaku.script.parser.BlockScanner.Conditional;
import com.keiyaku.script.parser.BlockScanner.Header;
import com.keiyaku.script.parser.Statement.AliasStmt;
import com.keiyaku.script.parser.Statement.ArithmeticStmt;
import com.keiyaku.script.parser.Statement.AssignStmt;
import com.keiyaku.script.parser.Statement.Operator;
import com.keiyaku.script.parser.Statement.PrintStmt;
import com.keiyaku.script.parser.Statement.ReturnStmt;
import com.keiyaku.script.parser.Statement.Stmt;
import com.keiyaku.script.parser.Statement.StmtVisitor;

/**
 * Executes program lines top to bottom.
 *
 * Block openers are handed to {@link BlockScanner}; the extracted body is then
 * run by re-entering {@link #execute(List)} (once for a branch, N times for a
 * loop, once per call for a function). Any other line is parsed by
 * {@link StatementParser} and dispatched through the visitor methods.
 */
public class Interpreter implements StmtVisitor {

    private static final String TAG = "Interpreter";

    Environment env;
    private final Map<String, UserFunction> userFunctions = new LinkedHashMap<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<>();
    private final List<Value> outputs = new ArrayList<>();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(this);
    private final int maxDepth;
    private final OutputSink outputSink;

    private boolean topLevelEffect = false;

    public Interpreter(Environment env, int maxDepth, OutputSink outputSink) {
        if (maxDepth < 1) throw new IllegalArgumentException("max call depth must be at least 1");
        this.env = env;
        this.maxDepth = maxDepth;
        this.outputSink = outputSink;
    }

    // ===================== HOST API =====================

    public Environment environment() { return env; }

    public List<Value> outputs() { return Collections.unmodifiableList(outputs); }

    /** True once a statement has completed outside of any function call. */
    public boolean hasTopLevelEffect() { return topLevelEffect; }

    public boolean hasFunction(String name) { return userFunctions.containsKey(name); }

    /** Calls a program-defined function from host code. */
    public Value invokeForHost(String name, List<Value> args) {
        if (!hasFunction(name)) {
            throw new KeiyakuScriptException(ErrorKind.UNKNOWN_FUNCTION, "Unknown function: " + name);
        }
        return callFunction(name, args);
    }

    // ===================== EXECUTION =====================

    /**
     * Runs a line sequence against the current environment.
     *
     * @return normal completion, or the early return raised by a return sentence
     *         somewhere inside it; the remaining lines are skipped in that case
     */
    public Completion execute(List<SourceLine> lines) {
        int i = 0;
        while (i < lines.size()) {
            SourceLine line = lines.get(i);
            if (line.isBlank() || line.isComment()) {
                i++;
                continue;
            }

            Header header = BlockScanner.header(line);
            if (header != null) {
                switch (header.kind) {
                    case FUNCTION: {
                        Block block = BlockScanner.scan(lines, i);
                        defineFunction(block);
                        i = block.closeIndex + 1;
                        continue;
                    }
                    case LOOP: {
                        Block block = BlockScanner.scan(lines, i);
                        Completion done = runLoop(block);
                        if (done.isReturn()) return done;
                        i = block.closeIndex + 1;
                        continue;
                    }
                    case IF_ZERO:
                    case IF_NONZERO: {
                        Conditional cond = BlockScanner.scanConditional(lines, i);
                        Completion done = runConditional(cond);
                        if (done.isReturn()) return done;
                        i = cond.endIndex() + 1;
                        continue;
                    }
                    case ELSE:
                        throw new KeiyakuScriptException(ErrorKind.SYNTAX_ERROR,
                                "そうでなければ without a preceding conditional block", line);
                    default:
                        throw new IllegalStateException("Unhandled block kind: " + header.kind);
                }
            }

            if (BlockScanner.isClose(line)) {
                throw new KeiyakuScriptException(ErrorKind.SYNTAX_ERROR, "以上。 without an open block", line);
            }

            Completion done = executeStatement(line);
            if (done.isReturn()) return done;
            i++;
        }
        return Completion.normal();
    }

    private Completion executeStatement(SourceLine line) {
        try {
            Stmt stmt = StatementParser.parse(line);
            Completion done = stmt.accept(this);
            if (callStack.isEmpty()) topLevelEffect = true;
            return done;
        } catch (KeiyakuScriptException e) {
            throw locate(e, line);
        }
    }

    private void defineFunction(Block block) {
        Header h = block.header;
        UserFunction previous = userFunctions.put(h.name, new UserFunction(h.name, h.params, block.body, h.line));
        if (previous != null) {
            Debug.get().d(TAG, "line " + h.line.number + " redefines " + h.name + " (was line " + previous.definedAt.number + ")");
        }
        Debug.get().t(TAG, "defined " + h.name + h.params + " (" + block.body.size() + " body lines)");
    }

    private Completion runLoop(Block block) {
        SourceLine line = block.header.line;
        Value count = evaluateAt(line, block.header.expression);
        if (!count.isNumeric()) {
            throw new KeiyakuScriptException(ErrorKind.TYPE_MISMATCH,
                    "Repeat count must be a number, got " + count.getType(), line);
        }
        long times = (count.getType() == Value.Type.INTEGER) ? count.asInteger() : (long) count.asFloat();
        if (times < 0) {
            throw new KeiyakuScriptException(ErrorKind.NEGATIVE_REPEAT_COUNT,
                    "Repeat count must not be negative: " + count.display(), line);
        }

        Debug.get().t(TAG, "loop on line " + line.number + " x" + times);
        for (long n = 0; n < times; n++) {
            Completion done = execute(block.body);
            if (done.isReturn()) return done;
        }
        return Completion.normal();
    }

    private Completion runConditional(Conditional cond) {
        Header h = cond.then.header;
        Value tested = evaluateAt(h.line, h.expression);
        if (!tested.isNumeric()) {
            throw new KeiyakuScriptException(ErrorKind.TYPE_MISMATCH,
                    "Condition must be a number, got " + tested.getType(), h.line);
        }

        boolean isZero = (tested.getType() == Value.Type.INTEGER)
                ? tested.asInteger() == 0L
                : tested.asFloat() == 0.0;
        boolean takeThen = (h.kind == BlockScanner.BlockKind.IF_ZERO) == isZero;

        if (takeThen) return execute(cond.then.body);
        if (cond.otherwise != null) return execute(cond.otherwise.body);
        return Completion.normal();
    }

    Value callFunction(String name, List<Value> args) {
        UserFunction fn = userFunctions.get(name);
        if (fn == null) {
            throw new KeiyakuScriptException(ErrorKind.UNKNOWN_FUNCTION, "Unknown function: " + name);
        }
        if (callStack.size() >= maxDepth) {
            throw new KeiyakuScriptException(ErrorKind.CALL_DEPTH_EXCEEDED,
                    "Max call depth exceeded (" + maxDepth + ") calling " + name + " from " + callStack.peek().functionName);
        }

        CallFrame frame = new CallFrame(name, args);
        callStack.push(frame);
        try {
            Debug.get().t(TAG, "call " + frame.functionName + frame.arguments + " depth " + callStack.size());
            return fn.call(this, args);
        } finally {
            callStack.pop();
        }
    }

    // ===================== STATEMENTS =====================

    @Override
    public Completion visitAliasStmt(AliasStmt stmt) {
        assign(stmt.name, evaluator.evaluate(stmt.expression));
        return Completion.normal();
    }

    @Override
    public Completion visitArithmeticStmt(ArithmeticStmt stmt) {
        Value x = evaluator.evaluate(stmt.left);
        Value y = evaluator.evaluate(stmt.right);
        assign(stmt.target, arithmetic(stmt.operator, x, y));
        return Completion.normal();
    }

    @Override
    public Completion visitAssignStmt(AssignStmt stmt) {
        assign(stmt.target, evaluator.evaluate(stmt.expression));
        return Completion.normal();
    }

    @Override
    public Completion visitPrintStmt(PrintStmt stmt) {
        Value v = evaluator.evaluate(stmt.expression);
        outputs.add(v);
        if (outputSink != null) outputSink.emit(v);
        return Completion.normal();
    }

    @Override
    public Completion visitReturnStmt(ReturnStmt stmt) {
        if (callStack.isEmpty()) {
            throw new KeiyakuScriptException(ErrorKind.SYNTAX_ERROR, "を返す。 outside of a function body");
        }
        return Completion.returned(evaluator.evaluate(stmt.expression));
    }

    // ===================== HELPERS =====================

    private void assign(String name, Value value) {
        String target = (name == null) ? "" : name.strip();
        if (target.isEmpty()) {
            throw new KeiyakuScriptException(ErrorKind.INVALID_IDENTIFIER, "Cannot assign to an empty identifier");
        }
        env.define(target, value);
    }

    static Value arithmetic(Operator op, Value x, Value y) {
        if (!x.isNumeric() || !y.isNumeric()) {
            throw new KeiyakuScriptException(ErrorKind.TYPE_MISMATCH,
                    "Operator '" + op.symbol + "' expects numbers, got " + x.getType() + " and " + y.getType());
        }

        if (op == Operator.DIVIDE) {
            double divisor = y.asNumber();
            if (divisor == 0.0) {
                throw new KeiyakuScriptException(ErrorKind.DIVISION_BY_ZERO, "Division by zero");
            }
            return Value.floating(x.asNumber() / divisor);
        }

        if (x.getType() == Value.Type.INTEGER && y.getType() == Value.Type.INTEGER) {
            long a = x.asInteger();
            long b = y.asInteger();
            try {
                switch (op) {
                    case ADD:      return Value.integer(Math.addExact(a, b));
                    case SUBTRACT: return Value.integer(Math.subtractExact(a, b));
                    case MULTIPLY: return Value.integer(Math.multiplyExact(a, b));
                    default: throw new IllegalStateException("Unhandled operator: " + op);
                }
            } catch (ArithmeticException overflow) {
                // Out of long range: continue in floating point, as oversized literals do.
                Debug.get().t(TAG, "integer overflow on '" + op.symbol + "', using float");
            }
        }

        double a = x.asNumber();
        double b = y.asNumber();
        switch (op) {
            case ADD:      return Value.floating(a + b);
            case SUBTRACT: return Value.floating(a - b);
            case MULTIPLY: return Value.floating(a * b);
            default: throw new IllegalStateException("Unhandled operator: " + op);
        }
    }

    private Value evaluateAt(SourceLine line, String expression) {
        try {
            return evaluator.evaluate(expression);
        } catch (KeiyakuScriptException e) {
            throw locate(e, line);
        }
    }

    private static KeiyakuScriptException locate(KeiyakuScriptException e, SourceLine line) {
        return e.isLocated() ? e.calledFrom(line) : e.at(line);
    }
}
