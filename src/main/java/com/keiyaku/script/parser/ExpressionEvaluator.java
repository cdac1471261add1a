package com.keiyaku.script.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Resolves a token of sentence text into a value.
 *
 * Resolution order: call of a defined function, quoted string, integer,
 * float, bound variable. Anything else is an unresolved reference.
 */
public class ExpressionEvaluator {

    private static final char DOUBLE_QUOTE = '"';
    private static final char OPEN_QUOTE = '「';
    private static final char CLOSE_QUOTE = '」';

    private final Interpreter interpreter;

    public ExpressionEvaluator(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    public Value evaluate(String token) {
        String t = (token == null) ? "" : token.strip();

        Matcher call = Templates.CALL.matcher(t);
        boolean callShaped = call.matches();
        if (callShaped && interpreter.hasFunction(call.group("name"))) {
            String name = call.group("name");
            List<Value> args = new ArrayList<>();
            for (String arg : splitArguments(call.group("args"))) {
                args.add(evaluate(arg));
            }
            return interpreter.callFunction(name, args);
        }

        if (isQuoted(t)) {
            return Value.string(t.substring(1, t.length() - 1));
        }

        if (Templates.INTEGER.matcher(t).matches()) {
            try {
                return Value.integer(Long.parseLong(t));
            } catch (NumberFormatException tooLarge) {
                return Value.floating(Double.parseDouble(t));
            }
        }

        if (Templates.FLOAT.matcher(t).matches()) {
            return Value.floating(Double.parseDouble(t));
        }

        if (interpreter.env.exists(t)) {
            return interpreter.env.get(t);
        }

        if (callShaped) {
            throw new KeiyakuScriptException(ErrorKind.UNKNOWN_FUNCTION, "Unknown function: " + call.group("name"));
        }
        throw new KeiyakuScriptException(ErrorKind.UNRESOLVED_REFERENCE,
                "Undefined identifier or unreadable value: " + t);
    }

    /**
     * Splits an argument list on top-level commas. Commas inside "…", 「…」 or
     * nested parentheses belong to the argument.
     */
    public static List<String> splitArguments(String raw) {
        List<String> args = new ArrayList<>();
        if (raw == null || raw.isBlank()) return args;

        StringBuilder buf = new StringBuilder();
        int parenDepth = 0;
        boolean inDouble = false;
        boolean inBracket = false;

        for (int i = 0; i < raw.length(); i++) {
            char ch = raw.charAt(i);
            if (ch == DOUBLE_QUOTE && !inBracket) {
                inDouble = !inDouble;
            } else if (ch == OPEN_QUOTE && !inDouble) {
                inBracket = true;
            } else if (ch == CLOSE_QUOTE && inBracket) {
                inBracket = false;
            } else if (!inDouble && !inBracket) {
                if (ch == '(') {
                    parenDepth++;
                } else if (ch == ')' && parenDepth > 0) {
                    parenDepth--;
                } else if (ch == ',' && parenDepth == 0) {
                    args.add(buf.toString().strip());
                    buf.setLength(0);
                    continue;
                }
            }
            buf.append(ch);
        }
        if (buf.length() > 0) args.add(buf.toString().strip());
        return args;
    }

    private static boolean isQuoted(String t) {
        if (t.length() < 2) return false;
        char first = t.charAt(0);
        char last = t.charAt(t.length() - 1);
        return (first == OPEN_QUOTE && last == CLOSE_QUOTE) || (first == DOUBLE_QUOTE && last == DOUBLE_QUOTE);
    }
}
