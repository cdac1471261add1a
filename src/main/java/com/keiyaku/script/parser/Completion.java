package com.keiyaku.script.parser;

/**
 * Outcome of running a statement or a block: either normal completion, or an
 * early return carrying the function's result up to its call boundary.
 */
public final class Completion {

    private static final Completion NORMAL = new Completion(null);

    private final Value returnValue;

    private Completion(Value returnValue) {
        this.returnValue = returnValue;
    }

    public static Completion normal() { return NORMAL; }

    public static Completion returned(Value value) {
        if (value == null) throw new IllegalArgumentException("return value must not be null");
        return new Completion(value);
    }

    public boolean isReturn() { return returnValue != null; }

    public Value value() {
        if (returnValue == null) throw new IllegalStateException("normal completion carries no value");
        return returnValue;
    }
}
