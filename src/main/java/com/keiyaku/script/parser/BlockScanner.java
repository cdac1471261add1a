package com.keiyaku.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Finds the extent of loop, conditional and function-definition blocks.
 *
 * Every construct closes with the same sentence ("以上。"), so a scan keeps a
 * single depth counter: any opener (function definition, loop, either if form
 * or else) increments it, the close marker decrements it, and the body ends
 * where it returns to zero. Blank and comment lines never change the depth.
 */
public final class BlockScanner {

    public enum BlockKind {
        FUNCTION("function definition"),
        LOOP("loop"),
        IF_ZERO("conditional"),
        IF_NONZERO("conditional"),
        ELSE("else branch");

        public final String label;

        BlockKind(String label) { this.label = label; }

        public boolean isConditional() {
            return this == IF_ZERO || this == IF_NONZERO;
        }
    }

    /** A recognized block-opening sentence and the parts captured from it. */
    public static final class Header {
        public final BlockKind kind;
        public final SourceLine line;
        /** Repeat count for LOOP, tested value for IF_ZERO / IF_NONZERO, otherwise null. */
        public final String expression;
        /** Function name for FUNCTION, otherwise null. */
        public final String name;
        public final List<String> params;

        private Header(BlockKind kind, SourceLine line, String expression, String name, List<String> params) {
            this.kind = kind;
            this.line = line;
            this.expression = expression;
            this.name = name;
            this.params = params;
        }
    }

    /** Body lines of one construct, plus the index of the close marker that ended it. */
    public static final class Block {
        public final Header header;
        public final List<SourceLine> body;
        public final int closeIndex;

        private Block(Header header, List<SourceLine> body, int closeIndex) {
            this.header = header;
            this.body = body;
            this.closeIndex = closeIndex;
        }
    }

    public static final class Conditional {
        public final Block then;
        /** Null when no else marker follows the THEN block. */
        public final Block otherwise;

        private Conditional(Block then, Block otherwise) {
            this.then = then;
            this.otherwise = otherwise;
        }

        /** Index of the last close marker belonging to this conditional. */
        public int endIndex() {
            return (otherwise != null) ? otherwise.closeIndex : then.closeIndex;
        }
    }

    private BlockScanner() {}

    /** Returns the opener recognized on this line, or null for any other sentence. */
    public static Header header(SourceLine line) {
        if (line.isBlank() || line.isComment()) return null;
        String text = line.text;

        Matcher m = Templates.FUNCTION.matcher(text);
        if (m.matches()) {
            return new Header(BlockKind.FUNCTION, line, null, m.group("name").strip(), parseParams(m.group("params")));
        }
        m = Templates.LOOP.matcher(text);
        if (m.matches()) {
            return new Header(BlockKind.LOOP, line, m.group("count").strip(), null, Collections.emptyList());
        }
        m = Templates.IF_ZERO.matcher(text);
        if (m.matches()) {
            return new Header(BlockKind.IF_ZERO, line, m.group("expr").strip(), null, Collections.emptyList());
        }
        m = Templates.IF_NONZERO.matcher(text);
        if (m.matches()) {
            return new Header(BlockKind.IF_NONZERO, line, m.group("expr").strip(), null, Collections.emptyList());
        }
        if (Templates.ELSE.matcher(text).matches()) {
            return new Header(BlockKind.ELSE, line, null, null, Collections.emptyList());
        }
        return null;
    }

    public static boolean isClose(SourceLine line) {
        return !line.isComment() && Templates.CLOSE.matcher(line.text).matches();
    }

    /**
     * Scans the block opened at {@code openIndex}.
     *
     * @throws KeiyakuScriptException UNTERMINATED_BLOCK, located at the opening line
     */
    public static Block scan(List<SourceLine> lines, int openIndex) {
        SourceLine opening = lines.get(openIndex);
        Header header = header(opening);
        if (header == null) {
            throw new IllegalArgumentException("line " + opening.number + " does not open a block");
        }

        int depth = 1;
        for (int j = openIndex + 1; j < lines.size(); j++) {
            SourceLine candidate = lines.get(j);
            if (header(candidate) != null) {
                depth++;
            } else if (isClose(candidate)) {
                depth--;
                if (depth == 0) {
                    List<SourceLine> body = List.copyOf(lines.subList(openIndex + 1, j));
                    return new Block(header, body, j);
                }
            }
        }

        String what = (header.kind == BlockKind.FUNCTION) ? header.kind.label + " '" + header.name + "'" : header.kind.label;
        throw new KeiyakuScriptException(ErrorKind.UNTERMINATED_BLOCK,
                "No closing 以上。 for " + what + " opened on line " + opening.number, opening);
    }

    /** Scans an if block and, when the next non-blank line is an else marker, its alternate branch. */
    public static Conditional scanConditional(List<SourceLine> lines, int openIndex) {
        Block then = scan(lines, openIndex);
        if (!then.header.kind.isConditional()) {
            throw new IllegalArgumentException("line " + then.header.line.number + " does not open a conditional");
        }

        int k = then.closeIndex + 1;
        while (k < lines.size() && lines.get(k).isBlank()) k++;

        if (k < lines.size()) {
            Header next = header(lines.get(k));
            if (next != null && next.kind == BlockKind.ELSE) {
                return new Conditional(then, scan(lines, k));
            }
        }
        return new Conditional(then, null);
    }

    private static List<String> parseParams(String raw) {
        if (raw == null || raw.isBlank()) return Collections.emptyList();
        List<String> out = new ArrayList<>();
        for (String p : raw.split(",")) {
            String name = p.strip();
            if (!name.isEmpty()) out.add(name);
        }
        return Collections.unmodifiableList(out);
    }
}
