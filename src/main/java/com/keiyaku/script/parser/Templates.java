package com.keiyaku.script.parser;

import java.util.regex.Pattern;

/**
 * Sentence templates, written against normalized text (NFKC, single spaces).
 * The closing "。" is optional everywhere.
 */
final class Templates {

    private Templates() {}

    // ---- statements, in dispatch order ----

    /** Searched, not anchored at the start: the definition clause closes the sentence. */
    static final Pattern ALIAS = Pattern.compile(
            "(?<lhs>.+?)[（(]以下[「\"](?<alias>[^」\"]+)[」\"]という。?[)）][。.]?$");

    static final Pattern ADD = Pattern.compile("^(?<x>.+)に (?<y>.+) を加えた数を (?<z>.+) とする。?$");
    static final Pattern SUBTRACT = Pattern.compile("^(?<x>.+)から (?<y>.+) を減じた数を (?<z>.+) とする。?$");
    static final Pattern DEDUCT = Pattern.compile("^(?<x>.+)から (?<y>.+) を差し引いた数を (?<z>.+) とする。?$");
    static final Pattern MULTIPLY = Pattern.compile("^(?<x>.+)と (?<y>.+) の積を (?<z>.+) とする。?$");
    static final Pattern DIVIDE = Pattern.compile("^(?<x>.+)を (?<y>.+) で除した数を (?<z>.+) とする。?$");
    static final Pattern SPLIT = Pattern.compile("^(?<x>.+)を (?<y>.+) で割った数を (?<z>.+) とする。?$");

    static final Pattern ASSIGN = Pattern.compile("^(?<var>[^は]+)は (?<expr>.+) とする。?$");
    static final Pattern PRINT = Pattern.compile("^(?<expr>.+)を出力する。?$");
    static final Pattern RETURN = Pattern.compile("^(?<expr>.+)を返す。?$");

    // ---- block markers ----

    static final Pattern FUNCTION = Pattern.compile(
            "^(?:関数 )?(?<name>[^\\s()]+)\\((?<params>[^)]*)\\) を(?:関数として)?定義する。?$");
    static final Pattern LOOP = Pattern.compile("^(?<count>.+) 回、以下を行う。?$");
    static final Pattern IF_ZERO = Pattern.compile("^もし (?<expr>.+) が 0 なら(?:ば)?、以下を行う。?$");
    static final Pattern IF_NONZERO = Pattern.compile("^もし (?<expr>.+) が 0 でなければ、以下を行う。?$");
    static final Pattern ELSE = Pattern.compile("^そうでなければ(?:、以下を行う。?)?$");
    static final Pattern CLOSE = Pattern.compile("^以上。?$");

    // ---- expressions ----

    static final Pattern CALL = Pattern.compile("(?<name>[^\\s()]+)\\((?<args>.*)\\)");
    static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");
    static final Pattern FLOAT = Pattern.compile("[+-]?(?:[0-9]+\\.[0-9]*|[0-9]*\\.[0-9]+)");
}
