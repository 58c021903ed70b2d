import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.minipar.script.MiniPar;
import com.minipar.script.diag.MiniParJson;

import static org.junit.jupiter.api.Assertions.*;

public class MiniParJsonTest {

    @Test
    void tokensAsJsonArray() {
        MiniPar mp = new MiniPar();
        JsonNode arr = MiniParJson.tokens(mp.scan("x = 1;\nprint(x);"));

        assertTrue(arr.isArray());
        assertEquals("IDENTIFIER", arr.get(0).get("kind").asText());
        assertEquals("x", arr.get(0).get("lexeme").asText());
        assertEquals(1, arr.get(0).get("line").asInt());
        assertEquals(2, arr.get(4).get("line").asInt());
        assertEquals("EOF", arr.get(arr.size() - 1).get("kind").asText());
    }

    @Test
    void treeFollowsPrecedence() {
        MiniPar mp = new MiniPar();
        JsonNode module = MiniParJson.tree(mp.parse(mp.scan("x = 1 + 2 * 3;")));

        assertEquals("Module", module.get("node").asText());
        JsonNode assign = module.get("body").get(0);
        assertEquals("Assign", assign.get("node").asText());
        assertEquals("x", assign.get("target").get("name").asText());

        JsonNode plus = assign.get("value");
        assertEquals("Arithmetic", plus.get("node").asText());
        assertEquals("+", plus.get("op").asText());
        assertEquals(1, plus.get("left").get("value").asInt());
        assertEquals("*", plus.get("right").get("op").asText());
        assertEquals(3, plus.get("right").get("right").get("value").asInt());
    }

    @Test
    void writtenJsonReadsBack() {
        MiniPar mp = new MiniPar();
        String json = MiniParJson.write(MiniParJson.tree(mp.parse(mp.scan(
                "function f(int a = 1) { return a; }\n" +
                "PAR { c_channel cli \"localhost\" 9000; cli.send(\"x\"); }\n"))));

        JsonNode back = MiniParJson.read(json);
        JsonNode fn = back.get("body").get(0);
        assertEquals("FuncDef", fn.get("node").asText());
        assertEquals("int", fn.get("params").get(0).get("type").asText());

        JsonNode par = back.get("body").get(1);
        assertEquals("Par", par.get("node").asText());
        assertEquals("ClientChannelDecl", par.get("body").get(0).get("node").asText());
        JsonNode call = par.get("body").get(1);
        assertEquals("send", call.get("name").asText());
        assertEquals("cli", call.get("channel").asText());
    }
}
