package com.keiyaku.script.parser;

import java.util.List;

/** A function defined by the program. The body stays as source lines until it is called. */
public class UserFunction {
    final String name;
    final List<String> params;
    final List<SourceLine> body;
    final SourceLine definedAt;

    UserFunction(String name, List<String> params, List<SourceLine> body, SourceLine definedAt) {
        this.name = name;
        this.params = List.copyOf(params);
        this.body = List.copyOf(body);
        this.definedAt = definedAt;
    }

    Value call(Interpreter interpreter, List<Value> args) {
        if (args.size() != params.size()) {
            throw new KeiyakuScriptException(ErrorKind.ARITY_MISMATCH,
                    name + "() expects " + params.size() + " arguments, got " + args.size());
        }

        Environment previous = interpreter.env;

        // The callee sees a working copy of the caller's table; nothing it
        // writes survives the call.
        interpreter.env = previous.copy();

        try {
            for (int i = 0; i < params.size(); i++) {
                interpreter.env.define(params.get(i), args.get(i));
            }

            Completion done = interpreter.execute(body);
            return done.isReturn() ? done.value() : Value.voidValue();
        } finally {
            interpreter.env = previous;
        }
    }
}
