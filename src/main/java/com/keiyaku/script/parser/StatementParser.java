package com.keiyaku.script.parser;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.keiyaku.script.parser.Statement.AliasStmt;
import com.keiyaku.script.parser.Statement.ArithmeticStmt;
import com.keiyaku.script.parser.Statement.AssignStmt;
import com.keiyaku.script.parser.Statement.Operator;
import com.keiyaku.script.parser.Statement.PrintStmt;
import com.keiyaku.script.parser.Statement.ReturnStmt;
import com.keiyaku.script.parser.Statement.Stmt;

/**
 * Matches one normalized line against the statement templates. Order matters:
 * the alias form is tried first, then the arithmetic forms, then plain
 * assignment, print and return.
 */
public final class StatementParser {

    private static final class ArithmeticForm {
        final Pattern pattern;
        final Operator operator;
        ArithmeticForm(Pattern pattern, Operator operator) { this.pattern = pattern; this.operator = operator; }
    }

    private static final List<ArithmeticForm> ARITHMETIC = List.of(
            new ArithmeticForm(Templates.ADD, Operator.ADD),
            new ArithmeticForm(Templates.SUBTRACT, Operator.SUBTRACT),
            new ArithmeticForm(Templates.DEDUCT, Operator.SUBTRACT),
            new ArithmeticForm(Templates.MULTIPLY, Operator.MULTIPLY),
            new ArithmeticForm(Templates.DIVIDE, Operator.DIVIDE),
            new ArithmeticForm(Templates.SPLIT, Operator.DIVIDE)
    );

    private StatementParser() {}

    public static Stmt parse(SourceLine line) {
        String text = line.text;

        Matcher m = Templates.ALIAS.matcher(text);
        if (m.find()) {
            return new AliasStmt(m.group("lhs").strip(), m.group("alias").strip());
        }

        for (ArithmeticForm form : ARITHMETIC) {
            m = form.pattern.matcher(text);
            if (m.matches()) {
                return new ArithmeticStmt(form.operator, m.group("x").strip(), m.group("y").strip(), m.group("z").strip());
            }
        }

        m = Templates.ASSIGN.matcher(text);
        if (m.matches()) return new AssignStmt(m.group("var").strip(), m.group("expr").strip());

        m = Templates.PRINT.matcher(text);
        if (m.matches()) return new PrintStmt(m.group("expr").strip());

        m = Templates.RETURN.matcher(text);
        if (m.matches()) return new ReturnStmt(m.group("expr").strip());

        throw new KeiyakuScriptException(ErrorKind.SYNTAX_ERROR, "Unrecognized sentence: " + line.raw.strip(), line);
    }
}
