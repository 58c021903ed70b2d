package com.minipar.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Execution-time failure. The {@link Kind} classifies the failure so hosts and
 * tests can react without parsing messages.
 */
public class MiniParRuntimeException extends MiniParException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        UNDEFINED_VARIABLE,
        UNDEFINED_FUNCTION,
        BUILTIN_REDEFINITION,
        INVALID_ACCESS,
        DIVISION_BY_ZERO,
        INVALID_OPERAND,
        CHANNEL,
        MISPLACED_CONTROL,
        ARITY,
        CALL_DEPTH,
        BRANCH_FAILURE,
        IO
    }

    private final Kind kind;
    private final List<String> callTrace = new ArrayList<String>();

    public MiniParRuntimeException(Kind kind, int line, String message) {
        super(line, message);
        this.kind = kind;
    }

    public MiniParRuntimeException(Kind kind, int line, String message, Throwable cause) {
        super(line, message, cause);
        this.kind = kind;
    }

    public MiniParRuntimeException(Kind kind, String message) {
        this(kind, -1, message);
    }

    public Kind getKind() {
        return kind;
    }

    /** User function calls the error passed through, innermost first. Empty at top level. */
    public List<String> getCallTrace() {
        return Collections.unmodifiableList(callTrace);
    }

    void addCallFrame(CallFrame frame) {
        callTrace.add(frame.toString());
    }
}
