package com.minipar.script.plugins;

import java.util.List;

import com.minipar.script.MiniPar;
import com.minipar.script.parser.Interpreter;
import com.minipar.script.parser.MiniParRuntimeException;
import com.minipar.script.parser.MiniParRuntimeException.Kind;
import com.minipar.script.parser.Value;

/**
 * MiniParMathPlugin
 *
 * Math functions for MiniPar scripts. Arguments go through the usual numeric
 * coercion, so numeric strings and booleans are accepted.
 *
 * Usage:
 *   MiniParMathPlugin.register(engine);
 *
 * Then in scripts:
 *   x = pow(2, 8);
 *   y = sqrt(16);
 *   z = round(2.5);   # 3, int
 *
 * The engine registers this plugin in its constructor.
 */
public final class MiniParMathPlugin {

    private MiniParMathPlugin() {}

    public static void register(MiniPar engine) {

        engine.registerFunction("pow", args -> {
            requireArgs("pow", args, 2);
            Value base = numeric("pow", args, 0);
            Value exp = numeric("pow", args, 1);
            if (base.getType() == Value.Type.INT && exp.getType() == Value.Type.INT && exp.asInt() >= 0) {
                double r = Math.pow(base.asInt(), exp.asInt());
                if (Math.abs(r) < 9.0e18) return Value.integer((long) r);
            }
            return Value.floating(Math.pow(base.asDouble(), exp.asDouble()));
        });

        engine.registerFunction("sqrt", args -> {
            requireArgs("sqrt", args, 1);
            return Value.floating(Math.sqrt(num("sqrt", args, 0)));
        });

        engine.registerFunction("exp", args -> {
            requireArgs("exp", args, 1);
            return Value.floating(Math.exp(num("exp", args, 0)));
        });

        engine.registerFunction("log", args -> {
            requireArgs("log", args, 1);
            return Value.floating(Math.log(num("log", args, 0)));
        });

        engine.registerFunction("abs", args -> {
            requireArgs("abs", args, 1);
            Value v = numeric("abs", args, 0);
            return (v.getType() == Value.Type.INT) ? Value.integer(Math.abs(v.asInt())) : Value.floating(Math.abs(v.asDouble()));
        });

        engine.registerFunction("round", args -> {
            requireArgs("round", args, 1);
            return Value.integer(Math.round(num("round", args, 0)));
        });

        engine.registerFunction("floor", args -> {
            requireArgs("floor", args, 1);
            return Value.integer((long) Math.floor(num("floor", args, 0)));
        });

        engine.registerFunction("ceil", args -> {
            requireArgs("ceil", args, 1);
            return Value.integer((long) Math.ceil(num("ceil", args, 0)));
        });

        engine.registerFunction("sin", args -> {
            requireArgs("sin", args, 1);
            return Value.floating(Math.sin(num("sin", args, 0)));
        });

        engine.registerFunction("cos", args -> {
            requireArgs("cos", args, 1);
            return Value.floating(Math.cos(num("cos", args, 0)));
        });

        engine.registerFunction("tan", args -> {
            requireArgs("tan", args, 1);
            return Value.floating(Math.tan(num("tan", args, 0)));
        });
    }

    // ===================== HELPERS =====================

    private static void requireArgs(String fn, List<Value> args, int n) {
        if (args.size() != n) {
            throw new MiniParRuntimeException(Kind.ARITY, fn + "() expects " + n + " arguments, got " + args.size());
        }
    }

    private static Value numeric(String fn, List<Value> args, int idx) {
        Value v = Interpreter.toNumeric(args.get(idx));
        if (v == null) {
            throw new MiniParRuntimeException(Kind.INVALID_OPERAND,
                    fn + "(): argument " + idx + " must be a number, got " + args.get(idx));
        }
        return v;
    }

    private static double num(String fn, List<Value> args, int idx) {
        return numeric(fn, args, idx).asDouble();
    }
}
