package com.minipar.script.parser;

/**
 * Immutable runtime value. Because values never change after construction, scope
 * snapshots can share them between threads without copying.
 */
public final class Value {
    public enum Type { INT, FLOAT, BOOL, STRING, NULL }

    public static final String TAG_INT = "int";
    public static final String TAG_FLOAT = "float";
    public static final String TAG_BOOL = "bool";
    public static final String TAG_STRING = "string";

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value integer(long l) { return new Value(Type.INT, l); }
    public static Value floating(double d) { return new Value(Type.FLOAT, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return s == null ? NIL : new Value(Type.STRING, s); }
    public static Value nil() { return NIL; }

    /** Zero value for a declared type tag; unknown or missing tags give int 0. */
    public static Value zeroOf(String typeTag) {
        if (typeTag == null) return integer(0);
        switch (typeTag) {
            case TAG_FLOAT: return floating(0.0);
            case TAG_BOOL: return FALSE;
            case TAG_STRING: return string("");
            default: return integer(0);
        }
    }

    public Type getType() { return type; }

    public long asInt() {
        if (type != Type.INT) throw new IllegalStateException("Expected int, got " + type);
        return (Long) value;
    }

    public double asFloat() {
        if (type != Type.FLOAT) throw new IllegalStateException("Expected float, got " + type);
        return (Double) value;
    }

    /** Numeric view of an INT or FLOAT value. */
    public double asDouble() {
        if (type == Type.INT) return (Long) value;
        if (type == Type.FLOAT) return (Double) value;
        throw new IllegalStateException("Expected number, got " + type);
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    /** Type tag as written in declarations; null for NULL. */
    public String typeTag() {
        switch (type) {
            case INT: return TAG_INT;
            case FLOAT: return TAG_FLOAT;
            case BOOL: return TAG_BOOL;
            case STRING: return TAG_STRING;
            default: return null;
        }
    }

    public boolean isTruthy() {
        switch (type) {
            case BOOL: return asBool();
            case INT: return asInt() != 0;
            case FLOAT: return asFloat() != 0.0;
            case STRING: return !asString().isEmpty();
            default: return false;
        }
    }

    /** Text form used by print, string concatenation and channel replies. */
    public String stringify() {
        switch (type) {
            case INT: return Long.toString(asInt());
            case FLOAT: return Double.toString(asFloat());
            case BOOL: return Boolean.toString(asBool());
            case STRING: return asString();
            default: return "null";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        return value == null ? other.value == null : value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return type.hashCode() * 31 + (value == null ? 0 : value.hashCode());
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING: return '"' + asString() + '"';
            default: return stringify();
        }
    }
}
