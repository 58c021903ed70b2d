import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.minipar.script.MiniPar;
import com.minipar.script.parser.MiniParRuntimeException;
import com.minipar.script.parser.MiniParRuntimeException.Kind;
import com.minipar.script.parser.Value;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(20)
public class MiniParParTest {

    private ByteArrayOutputStream buf;

    private MiniPar engine() {
        MiniPar mp = new MiniPar();
        buf = new ByteArrayOutputStream();
        mp.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));
        return mp;
    }

    private List<String> lines() {
        String out = buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
        return Arrays.asList(out.split("\n"));
    }

    @Test
    void branchesWorkOnIsolatedCopies() {
        MiniPar mp = engine();
        Map<String, Value> env = mp.execute(
                "counter = 0;\n" +
                "PAR {\n" +
                "  { counter = counter + 1; print(counter); }\n" +
                "  { counter = counter + 1; print(counter); }\n" +
                "}\n" +
                "print(counter);\n");

        assertEquals(List.of("1", "1", "0"), lines());
        assertEquals(Value.integer(0), env.get("counter"));
    }

    @Test
    void parentWaitsForEveryBranch() {
        MiniPar mp = engine();
        mp.execute(
                "PAR {\n" +
                "  { sleep(0.2); print(\"slow\"); }\n" +
                "  print(\"fast\");\n" +
                "}\n" +
                "print(\"after\");\n");

        List<String> out = lines();
        assertEquals(3, out.size());
        assertTrue(out.contains("slow"));
        assertTrue(out.contains("fast"));
        assertEquals("after", out.get(2));
    }

    @Test
    void branchesRunOnNamedThreads() {
        MiniPar mp = engine();
        mp.registerFunction("thread_name", args -> Value.string(Thread.currentThread().getName()));
        mp.execute("PAR {\n  print(thread_name());\n  print(thread_name());\n}\n");

        for (String line : lines()) {
            assertTrue(line.startsWith("minipar-par-"), line);
        }
    }

    @Test
    void failuresAreAggregatedAfterSiblingsFinish() {
        MiniPar mp = engine();
        MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class, () -> mp.execute(
                "PAR {\n" +
                "  x = 1 / 0;\n" +
                "  { sleep(0.1); print(\"sibling done\"); }\n" +
                "  y = nothing();\n" +
                "}\n" +
                "print(\"not reached\");\n"));

        assertEquals(Kind.BRANCH_FAILURE, ex.getKind());
        assertEquals(2, ex.getSuppressed().length);
        for (Throwable t : ex.getSuppressed()) {
            assertInstanceOf(MiniParRuntimeException.class, t);
        }
        assertEquals(List.of("sibling done"), lines());
    }

    @Test
    void returnInsideBranchIsMisplaced() {
        MiniPar mp = engine();
        MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class,
                () -> mp.execute("function f() {\n  PAR {\n    return 1;\n  }\n}\nf();\n"));

        assertEquals(Kind.BRANCH_FAILURE, ex.getKind());
        MiniParRuntimeException cause = assertInstanceOf(MiniParRuntimeException.class, ex.getSuppressed()[0]);
        assertEquals(Kind.MISPLACED_CONTROL, cause.getKind());
        assertEquals(3, cause.getLine());
    }

    @Test
    void functionsAreClonedIntoBranches() {
        MiniPar mp = engine();
        mp.execute(
                "function square(n) { return n * n; }\n" +
                "PAR {\n" +
                "  print(square(3));\n" +
                "  function later() { return 1; }\n" +
                "}\n");
        assertEquals(List.of("9"), lines());

        MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class, () -> engine().execute(
                "PAR {\n  function later() { return 1; }\n}\nx = later();\n"));
        assertEquals(Kind.UNDEFINED_FUNCTION, ex.getKind());
    }

    @Test
    void implicitParBodyForksEachStatement() {
        MiniPar mp = engine();
        mp.execute("a = 5;\nPAR\n  print(a + 1);\n  print(a + 2);\nSEQ\n  print(\"end\");\n");

        List<String> out = lines();
        assertEquals(3, out.size());
        assertTrue(out.subList(0, 2).containsAll(List.of("6", "7")));
        assertEquals("end", out.get(2));
    }
}
