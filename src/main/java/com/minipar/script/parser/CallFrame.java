package com.minipar.script.parser;

import java.util.List;

/** One active user function call: name, argument values and call-site line. */
public class CallFrame {
    final String functionName;
    final List<Value> arguments;
    final int line;

    CallFrame(String functionName, List<Value> arguments, int line) {
        this.functionName = functionName;
        this.arguments = arguments;
        this.line = line;
    }

    @Override
    public String toString() {
        return functionName + arguments + " called at line " + line;
    }
}
