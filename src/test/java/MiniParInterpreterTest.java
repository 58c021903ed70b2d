import org.junit.jupiter.api.Test;

import com.minipar.script.MiniPar;
import com.minipar.script.parser.MiniParRuntimeException;
import com.minipar.script.parser.MiniParRuntimeException.Kind;
import com.minipar.script.parser.Value;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MiniParInterpreterTest {

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Expected variable in env: " + name);
        return val;
    }

    private static Map<String, Value> run(String src) {
        return new MiniPar().execute(src);
    }

    private static String output(String src) {
        return output(new MiniPar(), src);
    }

    private static String output(MiniPar mp, String src) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        mp.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));
        mp.execute(src);
        return buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static Kind failureKind(String src) {
        return assertThrows(MiniParRuntimeException.class, () -> run(src)).getKind();
    }

    @Test
    void arithmeticPrecedenceAndIntegerResults() {
        Map<String, Value> env = run("x = 1 + 2 * 3;\ny = (1 + 2) * 3;\nz = 7 - 10;");
        assertEquals(Value.integer(7), v(env, "x"));
        assertEquals(Value.integer(9), v(env, "y"));
        assertEquals(Value.integer(-3), v(env, "z"));
    }

    @Test
    void divisionDemotesWholeResultsAndModuloFloors() {
        Map<String, Value> env = run("a = 10 / 2;\nb = 7 / 2;\nc = -7 % 3;\nd = 7 % -3;\nf = 1.5 + 1;");
        assertEquals(Value.integer(5), v(env, "a"));
        assertEquals(Value.floating(3.5), v(env, "b"));
        assertEquals(Value.integer(2), v(env, "c"));
        assertEquals(Value.integer(-2), v(env, "d"));
        assertEquals(Value.floating(2.5), v(env, "f"));
    }

    @Test
    void divisionAndModuloByZero() {
        MiniParRuntimeException div = assertThrows(MiniParRuntimeException.class, () -> run("x = 5 / 0;"));
        assertEquals(Kind.DIVISION_BY_ZERO, div.getKind());
        assertTrue(div.getMessage().contains("division/modulo by zero"));
        assertEquals(Kind.DIVISION_BY_ZERO, failureKind("x = 5 % 0;"));
        assertEquals(Kind.DIVISION_BY_ZERO, failureKind("x = 5 / 0.0;"));
    }

    @Test
    void integerOverflowIsAnError() {
        MiniParRuntimeException add = assertThrows(MiniParRuntimeException.class,
                () -> run("a = 9223372036854775807 + 1;"));
        assertEquals(Kind.INVALID_OPERAND, add.getKind());
        assertTrue(add.getMessage().contains("integer overflow"));

        assertEquals(Kind.INVALID_OPERAND, failureKind("b = 3037000500 * 3037000500;"));
        assertEquals(Kind.INVALID_OPERAND, failureKind("c = 0 - 9223372036854775807 - 2;"));
        assertEquals(Kind.INVALID_OPERAND, failureKind("m = 0 - 9223372036854775807 - 1;\nq = m / -1;"));
        assertEquals(Kind.INVALID_OPERAND, failureKind("m = 0 - 9223372036854775807 - 1;\nn = -m;"));

        Map<String, Value> env = run("ok = 3037000499 * 3037000499;\nmax = 9223372036854775806 + 1;");
        assertEquals(Value.integer(9223372030926249001L), v(env, "ok"));
        assertEquals(Value.integer(Long.MAX_VALUE), v(env, "max"));
    }

    @Test
    void exactIntegerDivisionKeepsFullPrecision() {
        Map<String, Value> env = run(
                "c = 9007199254740993 / 1;\nd = 9223372036854775806 / 2;\ne = 9007199254740993 / 10;");
        assertEquals(Value.integer(9007199254740993L), v(env, "c"));
        assertEquals(Value.integer(4611686018427387903L), v(env, "d"));
        assertEquals(Value.Type.FLOAT, v(env, "e").getType());
    }

    @Test
    void logicalOperatorsShortCircuit() {
        Map<String, Value> env = run("a = true || false && false;\nb = true || nope();\nc = false && nope();\nd = 0 || \"x\";");
        assertTrue(v(env, "a").asBool());
        assertTrue(v(env, "b").asBool());
        assertFalse(v(env, "c").asBool());
        assertTrue(v(env, "d").asBool());
    }

    @Test
    void coercionOfStringsAndBools() {
        Map<String, Value> env = run(
                "a = \"3\" + 4;\n" +
                "b = \"2.5\" * 2;\n" +
                "c = \"ab\" + 1;\n" +
                "d = true + true;\n" +
                "e2 = \"10\" > 9;\n" +
                "f = \"abc\" < \"abd\";\n" +
                "g = 1 == \"x\";\n" +
                "h = 1 != \"x\";");
        assertEquals(Value.integer(7), v(env, "a"));
        assertEquals(Value.floating(5.0), v(env, "b"));
        assertEquals(Value.string("ab1"), v(env, "c"));
        assertEquals(Value.integer(2), v(env, "d"));
        assertTrue(v(env, "e2").asBool());
        assertTrue(v(env, "f").asBool());
        assertFalse(v(env, "g").asBool());
        assertTrue(v(env, "h").asBool());

        assertEquals(Kind.INVALID_OPERAND, failureKind("x = \"ab\" - 1;"));
        assertEquals(Kind.INVALID_OPERAND, failureKind("x = 1 < \"ab\";"));
        assertEquals(Kind.INVALID_OPERAND, failureKind("x = -\"ab\";"));
    }

    @Test
    void assignmentInsideIfBodyIsVisibleAfterwards() {
        Map<String, Value> env = run("x = 1; if (x == 1) { y = 2; }");
        assertEquals(Value.integer(2), v(env, "y"));
    }

    @Test
    void declarationsAreBlockLocal() {
        Map<String, Value> env = run("x = 1;\nif (x == 1) { int x = 5; z = x; }\nw = x;");
        assertEquals(Value.integer(5), v(env, "z"));
        assertEquals(Value.integer(1), v(env, "w"));
    }

    @Test
    void whileWithBreakAndContinue() {
        Map<String, Value> env = run(
                "i = 0;\n" +
                "sum = 0;\n" +
                "while (true) {\n" +
                "  i = i + 1;\n" +
                "  if (i > 10) break;\n" +
                "  if (i % 2 == 0) continue;\n" +
                "  sum = sum + i;\n" +
                "}\n");
        assertEquals(Value.integer(25), v(env, "sum"));
        assertEquals(Value.integer(11), v(env, "i"));
    }

    @Test
    void functionsWithDefaultsAndZeroFill() {
        Map<String, Value> env = run(
                "function add(int a, b: int = 10, int c) {\n" +
                "  return a + b + c;\n" +
                "}\n" +
                "function wrap(string s) { return \"[\" + s + \"]\"; }\n" +
                "x = add(1);\n" +
                "y = add(1, 2);\n" +
                "z = add(1, 2, 3);\n" +
                "w = wrap();\n");
        assertEquals(Value.integer(11), v(env, "x"));
        assertEquals(Value.integer(3), v(env, "y"));
        assertEquals(Value.integer(6), v(env, "z"));
        assertEquals(Value.string("[]"), v(env, "w"));
    }

    @Test
    void functionsSeeGlobalsButNotCallerLocals() {
        Map<String, Value> env = run(
                "g = 100;\n" +
                "function peek() { return g; }\n" +
                "function caller() { int local = 1; return hidden(); }\n" +
                "function hidden() { return local; }\n" +
                "p = peek();\n");
        assertEquals(Value.integer(100), v(env, "p"));

        MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class, () -> run(
                "function caller() { int local = 1; return hidden(); }\n" +
                "function hidden() { return local; }\n" +
                "x = caller();\n"));
        assertEquals(Kind.UNDEFINED_VARIABLE, ex.getKind());
    }

    @Test
    void functionLocalsDoNotLeakAndGlobalsCanBeUpdated() {
        Map<String, Value> env = run(
                "count = 0;\n" +
                "function bump() { count = count + 1; tmp = 5; }\n" +
                "bump();\n" +
                "bump();\n");
        assertEquals(Value.integer(2), v(env, "count"));
        assertNull(env.get("tmp"));
    }

    @Test
    void recursionAndCallDepthLimit() {
        Map<String, Value> env = run(
                "function fact(n) { if (n <= 1) return 1; return n * fact(n - 1); }\n" +
                "f = fact(10);\n");
        assertEquals(Value.integer(3628800), v(env, "f"));

        MiniPar mp = new MiniPar();
        mp.setMaxCallDepth(16);
        MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class,
                () -> mp.execute("function loop(n) { return loop(n + 1); }\nx = loop(0);"));
        assertEquals(Kind.CALL_DEPTH, ex.getKind());
    }

    @Test
    void misplacedControlFlow() {
        assertEquals(Kind.MISPLACED_CONTROL, failureKind("break;"));
        assertEquals(Kind.MISPLACED_CONTROL, failureKind("continue;"));
        assertEquals(Kind.MISPLACED_CONTROL, failureKind("return 1;"));
        assertEquals(Kind.MISPLACED_CONTROL, failureKind("function f() { break; }\nf();"));
        assertEquals(Kind.MISPLACED_CONTROL, failureKind("x = 1; if (x == 1) { return; }"));
    }

    @Test
    void callErrors() {
        assertEquals(Kind.UNDEFINED_FUNCTION, failureKind("x = nothing(1);"));
        assertEquals(Kind.ARITY, failureKind("function f(a) { return a; }\nx = f(1, 2);"));
        assertEquals(Kind.BUILTIN_REDEFINITION, failureKind("function print(x) { return x; }"));
        assertEquals(Kind.UNDEFINED_VARIABLE, failureKind("x = y + 1;"));
    }

    @Test
    void runtimeErrorsCarryTheUserCallChain() {
        MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class, () -> run(
                "function inner(n) { return n / 0; }\n" +
                "function outer(a) { return inner(a + 1); }\n" +
                "x = outer(4);\n"));
        assertEquals(Kind.DIVISION_BY_ZERO, ex.getKind());
        assertEquals(1, ex.getLine());
        assertEquals(2, ex.getCallTrace().size());
        assertEquals("inner[5] called at line 2", ex.getCallTrace().get(0));
        assertEquals("outer[4] called at line 3", ex.getCallTrace().get(1));

        MiniParRuntimeException top = assertThrows(MiniParRuntimeException.class, () -> run("x = 1 / 0;"));
        assertTrue(top.getCallTrace().isEmpty());
    }

    @Test
    void redefiningAFunctionReplacesIt() {
        Map<String, Value> env = run(
                "function f() { return 1; }\na = f();\nfunction f() { return 2; }\nb = f();");
        assertEquals(Value.integer(1), v(env, "a"));
        assertEquals(Value.integer(2), v(env, "b"));
    }

    @Test
    void stringAccess() {
        Map<String, Value> env = run("s = \"hello\";\nc = s[1];\nl = len(s);");
        assertEquals(Value.string("e"), v(env, "c"));
        assertEquals(Value.integer(5), v(env, "l"));
        assertEquals(Kind.INVALID_ACCESS, failureKind("s = \"hi\";\nc = s[2];"));
        assertEquals(Kind.INVALID_ACCESS, failureKind("n = 5;\nc = n[0];"));
    }

    @Test
    void printAndOutputJoinArgumentsWithSpaces() {
        String out = output("x = 2;\nprint(\"x is\", x, 1.5, true);\noutput(\"done\");");
        assertEquals("x is 2 1.5 true\ndone\n", out);
    }

    @Test
    void inputSniffsNumbers() {
        MiniPar mp = new MiniPar();
        mp.setInput(new StringReader("42\n2.5\nhello\n"));
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        mp.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));
        Map<String, Value> env = mp.execute("a = input(\"? \");\nb = input();\nc = input();\nd = input();");

        assertEquals(Value.integer(42), v(env, "a"));
        assertEquals(Value.floating(2.5), v(env, "b"));
        assertEquals(Value.string("hello"), v(env, "c"));
        assertEquals(Value.string(""), v(env, "d"));
        assertEquals("? ", buf.toString(StandardCharsets.UTF_8));
    }

    @Test
    void conversionAndCharacterBuiltins() {
        Map<String, Value> env = run(
                "a = to_number(\"12\");\n" +
                "b = to_string(3.5);\n" +
                "c = to_bool(\"false\");\n" +
                "d = to_bool(1);\n" +
                "e1 = isalpha(\"abc\");\n" +
                "e2 = isalpha(\"ab1\");\n" +
                "n1 = isnum(\"123\");\n" +
                "n2 = isnum(\"12a\");\n");
        assertEquals(Value.integer(12), v(env, "a"));
        assertEquals(Value.string("3.5"), v(env, "b"));
        assertFalse(v(env, "c").asBool());
        assertTrue(v(env, "d").asBool());
        assertTrue(v(env, "e1").asBool());
        assertFalse(v(env, "e2").asBool());
        assertTrue(v(env, "n1").asBool());
        assertFalse(v(env, "n2").asBool());
        assertEquals(Kind.INVALID_OPERAND, failureKind("x = to_number(\"abc\");"));
    }

    @Test
    void mathPluginAndConstants() {
        Map<String, Value> env = run(
                "a = sqrt(16);\n" +
                "b = pow(2, 10);\n" +
                "c = floor(2.7);\n" +
                "d = ceil(2.1);\n" +
                "r = round(2.5);\n" +
                "m = abs(-3);\n" +
                "t = pi > 3.14 && e > 2.71;\n");
        assertEquals(Value.floating(4.0), v(env, "a"));
        assertEquals(Value.integer(1024), v(env, "b"));
        assertEquals(Value.integer(2), v(env, "c"));
        assertEquals(Value.integer(3), v(env, "d"));
        assertEquals(Value.integer(3), v(env, "r"));
        assertEquals(Value.integer(3), v(env, "m"));
        assertTrue(v(env, "t").asBool());
    }

    @Test
    void hostFunctionsAreDispatched() {
        MiniPar mp = new MiniPar();
        mp.registerFunction("twice", args -> Value.integer(args.get(0).asInt() * 2));
        Map<String, Value> env = mp.execute("x = twice(21);");
        assertEquals(Value.integer(42), v(env, "x"));
    }

    @Test
    void seqBlockRunsInOrder() {
        String out = output("SEQ {\n print(1);\n print(2);\n}\nSEQ\n print(3);\n");
        assertEquals("1\n2\n3\n", out);
    }

    @Test
    void channelOperationsOnUnknownChannelFail() {
        assertEquals(Kind.CHANNEL, failureKind("x = send(nowhere, \"hi\");"));
        assertEquals(Kind.CHANNEL, failureKind("nowhere.close();"));
        assertEquals(Kind.UNDEFINED_FUNCTION, failureKind("s_channel srv { missing, \"\", \"localhost\", 0 }"));
    }
}
