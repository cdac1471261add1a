package com.keiyaku.script.parser;

import java.text.Normalizer.Form;
import java.util.regex.Pattern;

/**
 * Canonical text form every sentence template is matched against.
 *
 * NFKC folds full-width letters, digits, parentheses and commas to their ASCII
 * forms; the ideographic space is mapped to a plain space and space runs are
 * collapsed. Applying it twice gives the same text as applying it once.
 */
public final class Normalizer {

    private static final char IDEOGRAPHIC_SPACE = '\u3000';
    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final Pattern SPACE_RUN = Pattern.compile(" {2,}");

    private Normalizer() {}

    public static String normalize(String text) {
        if (text == null) return "";
        String s = java.text.Normalizer.normalize(text, Form.NFKC);
        s = s.replace(IDEOGRAPHIC_SPACE, ' ');
        s = s.strip();
        return SPACE_RUN.matcher(s).replaceAll(" ");
    }

    public static String stripByteOrderMark(String source) {
        if (source != null && !source.isEmpty() && source.charAt(0) == BYTE_ORDER_MARK) {
            return source.substring(1);
        }
        return source;
    }
}
