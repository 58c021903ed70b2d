package com.minipar.script.parser;

/**
 * Outcome of executing one statement. Bodies stop at the first result that is not
 * {@link Kind#NORMAL} and hand it to their enclosing construct.
 */
public final class ControlResult {

    public enum Kind { NORMAL, BREAK, CONTINUE, RETURN }

    public static final ControlResult NORMAL = new ControlResult(Kind.NORMAL, null, -1);

    public final Kind kind;
    public final Value value; // only set for RETURN
    public final int line;    // line of the break/continue/return that produced it

    private ControlResult(Kind kind, Value value, int line) {
        this.kind = kind;
        this.value = value;
        this.line = line;
    }

    public static ControlResult breaking(int line) {
        return new ControlResult(Kind.BREAK, null, line);
    }

    public static ControlResult continuing(int line) {
        return new ControlResult(Kind.CONTINUE, null, line);
    }

    public static ControlResult returning(Value value, int line) {
        return new ControlResult(Kind.RETURN, value == null ? Value.nil() : value, line);
    }

    public boolean isNormal() { return kind == Kind.NORMAL; }

    /** Keyword that produced this result, for error messages. */
    String keyword() {
        switch (kind) {
            case BREAK: return "break";
            case CONTINUE: return "continue";
            case RETURN: return "return";
            default: return "";
        }
    }

    @Override
    public String toString() {
        return kind == Kind.RETURN ? "Return(" + value + ")" : kind.name();
    }
}
