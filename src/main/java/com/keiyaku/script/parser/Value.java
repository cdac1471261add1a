package com.keiyaku.script.parser;

import java.util.Objects;

public class Value {
    public enum Type { INTEGER, FLOAT, STRING, VOID }

    public final Type type;
    public final Object value;

    private static final Value VOID = new Value(Type.VOID, null);

    public Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long n) { return new Value(Type.INTEGER, n); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value string(String s) { return new Value(Type.STRING, s); }

    /** Result of a function call that finished without returning a value. */
    public static Value voidValue() { return VOID; }

    public Type getType() { return type; }

    public boolean isNumeric() {
        return type == Type.INTEGER || type == Type.FLOAT;
    }

    public long asInteger() {
        if (type != Type.INTEGER) throw new IllegalStateException("Expected integer, got " + type);
        return (long) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw new IllegalStateException("Expected float, got " + type);
        return (double) value;
    }

    /** Numeric view of an INTEGER or FLOAT value. */
    public double asNumber() {
        switch (type) {
            case INTEGER: return (double) (long) value;
            case FLOAT:   return (double) value;
            default: throw new IllegalStateException("Expected number, got " + type);
        }
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** Text written to the output observer. */
    public String display() {
        switch (type) {
            case INTEGER: return Long.toString(asInteger());
            case FLOAT:   return Double.toString(asFloat());
            case STRING:  return asString();
            default:      return "null";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING: return '"' + asString() + '"';
            default:     return display();
        }
    }
}
