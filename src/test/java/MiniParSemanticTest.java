import org.junit.jupiter.api.Test;

import com.minipar.script.MiniPar;
import com.minipar.script.parser.Lexer;
import com.minipar.script.parser.Parser;
import com.minipar.script.parser.SemanticAnalyzer;
import com.minipar.script.parser.SemanticException;

import static org.junit.jupiter.api.Assertions.*;

public class MiniParSemanticTest {

    private static void check(String src) {
        new SemanticAnalyzer().check(new Parser(new Lexer(src).tokenize()).parse());
    }

    @Test
    void conditionsMustBeBoolWhenKnown() {
        assertDoesNotThrow(() -> check("x = 1;\nif (x == 1) { y = 2; }\nwhile (!false) break;"));
        assertDoesNotThrow(() -> check("x = 1;\nif (x) { y = 2; }"));

        SemanticException ex = assertThrows(SemanticException.class, () -> check("if (1) { y = 2; }"));
        assertEquals(1, ex.getLine());
        assertThrows(SemanticException.class, () -> check("while (\"s\") { y = 2; }"));
        assertThrows(SemanticException.class, () -> check("while (-1) { y = 2; }"));
    }

    @Test
    void declaredTypeMustMatchKnownValueType() {
        assertDoesNotThrow(() -> check("int a = 1;\nstring s = \"x\";\nb: bool = 1 < 2;\nf: float = 2.5;"));
        assertDoesNotThrow(() -> check("int a = \"3\" + 1;"));

        assertThrows(SemanticException.class, () -> check("int a = \"x\";"));
        assertThrows(SemanticException.class, () -> check("bool b = 1;"));
        assertThrows(SemanticException.class, () -> check("s: string = true && false;"));
        assertThrows(SemanticException.class, () -> check("f: float = 1;"));
    }

    @Test
    void nestedBodiesAreChecked() {
        SemanticException ex = assertThrows(SemanticException.class, () -> check(
                "function f() {\n" +
                "  SEQ {\n" +
                "    PAR {\n" +
                "      int n = \"oops\";\n" +
                "    }\n" +
                "  }\n" +
                "}\n"));
        assertEquals(4, ex.getLine());
    }

    @Test
    void engineChecksBeforeRunning() {
        assertThrows(SemanticException.class, () -> new MiniPar().execute("print(\"ran\");\nif (5) print(1);"));
    }
}
