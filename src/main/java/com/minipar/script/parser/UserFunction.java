package com.minipar.script.parser;

import java.util.List;

import com.minipar.script.parser.MiniParRuntimeException.Kind;
import com.minipar.script.parser.Statement.FuncDef;
import com.minipar.script.parser.Statement.Param;

public class UserFunction {
    final String name;
    final FuncDef declaration;

    UserFunction(FuncDef declaration) {
        this.name = declaration.name.lexeme;
        this.declaration = declaration;
    }

    /**
     * Runs the body in a fresh frame parented to the root. Arguments were already
     * evaluated in the caller's scope; defaults are evaluated here, in the new frame.
     */
    Value call(Interpreter interpreter, List<Value> args, int line) {
        List<Param> params = declaration.params;
        if (args.size() > params.size()) {
            throw new MiniParRuntimeException(Kind.ARITY, line,
                    name + "() expects at most " + params.size() + " arguments, got " + args.size());
        }

        ScopeChain scopes = interpreter.scopes();
        scopes.pushFunction();
        try {
            for (Param p : params) {
                if (p.defaultValue != null) {
                    scopes.declare(p.name(), interpreter.evaluate(p.defaultValue));
                }
            }
            for (int i = 0; i < params.size(); i++) {
                Param p = params.get(i);
                if (i < args.size()) {
                    scopes.declare(p.name(), args.get(i));
                } else if (p.defaultValue == null) {
                    scopes.declare(p.name(), Value.zeroOf(p.type));
                }
            }

            ControlResult result = interpreter.executeBody(declaration.body);
            switch (result.kind) {
                case RETURN:
                    return result.value;
                case BREAK:
                case CONTINUE:
                    throw new MiniParRuntimeException(Kind.MISPLACED_CONTROL, result.line,
                            "'" + result.keyword() + "' outside of a loop in " + name + "()");
                default:
                    return Value.nil();
            }
        } finally {
            scopes.pop();
        }
    }

    int arity() { return declaration.params.size(); }

    @Override
    public String toString() {
        return "<fn " + name + "/" + arity() + ">";
    }
}
