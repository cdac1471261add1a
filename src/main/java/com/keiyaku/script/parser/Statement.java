package com.keiyaku.script.parser;

/** Sentence forms handled by the statement dispatcher. */
public class Statement {

    public interface Stmt {
        Completion accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        Completion visitAliasStmt(AliasStmt stmt);
        Completion visitArithmeticStmt(ArithmeticStmt stmt);
        Completion visitAssignStmt(AssignStmt stmt);
        Completion visitPrintStmt(PrintStmt stmt);
        Completion visitReturnStmt(ReturnStmt stmt);
    }

    public enum Operator {
        ADD('+'),
        SUBTRACT('-'),
        MULTIPLY('*'),
        DIVIDE('/');

        public final char symbol;

        Operator(char symbol) { this.symbol = symbol; }
    }

    /** {@code <expr>（以下「<name>」という。）} */
    public static final class AliasStmt implements Stmt {
        final String expression;
        final String name;
        AliasStmt(String expression, String name) { this.expression = expression; this.name = name; }
        public Completion accept(StmtVisitor visitor) { return visitor.visitAliasStmt(this); }
    }

    public static final class ArithmeticStmt implements Stmt {
        final Operator operator;
        final String left;
        final String right;
        final String target;

        ArithmeticStmt(Operator operator, String left, String right, String target) {
            this.operator = operator;
            this.left = left;
            this.right = right;
            this.target = target;
        }

        public Completion accept(StmtVisitor visitor) { return visitor.visitArithmeticStmt(this); }
    }

    /** {@code <var>は <expr> とする。} */
    public static final class AssignStmt implements Stmt {
        final String target;
        final String expression;
        AssignStmt(String target, String expression) { this.target = target; this.expression = expression; }
        public Completion accept(StmtVisitor visitor) { return visitor.visitAssignStmt(this); }
    }

    public static final class PrintStmt implements Stmt {
        final String expression;
        PrintStmt(String expression) { this.expression = expression; }
        public Completion accept(StmtVisitor visitor) { return visitor.visitPrintStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        final String expression;
        ReturnStmt(String expression) { this.expression = expression; }
        public Completion accept(StmtVisitor visitor) { return visitor.visitReturnStmt(this); }
    }
}
