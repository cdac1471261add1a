package com.keiyaku.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One program line: 1-based number, raw text (trailing whitespace removed) and its normalized form. */
public final class SourceLine {
    public final int number;
    public final String raw;
    public final String text;

    public SourceLine(int number, String raw) {
        this.number = number;
        this.raw = stripTrailing(raw);
        this.text = Normalizer.normalize(this.raw);
    }

    public boolean isBlank() {
        return text.isEmpty();
    }

    public boolean isComment() {
        return text.startsWith("※") || text.startsWith("(注)");
    }

    /** Splits program text into numbered lines. A leading byte-order mark is dropped. */
    public static List<SourceLine> split(String source) {
        if (source == null || source.isEmpty()) return Collections.emptyList();
        String[] parts = Normalizer.stripByteOrderMark(source).split("\r\n|\r|\n", -1);
        int count = parts.length;
        // a trailing newline does not start another line
        if (count > 0 && parts[count - 1].isEmpty()) count--;
        List<SourceLine> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) out.add(new SourceLine(i + 1, parts[i]));
        return Collections.unmodifiableList(out);
    }

    private static String stripTrailing(String s) {
        return (s == null) ? "" : s.stripTrailing();
    }

    @Override
    public String toString() {
        return number + ": " + raw;
    }
}
