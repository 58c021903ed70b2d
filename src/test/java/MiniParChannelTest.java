import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.minipar.script.MiniPar;
import com.minipar.script.channel.Framing;
import com.minipar.script.parser.MiniParRuntimeException;
import com.minipar.script.parser.MiniParRuntimeException.Kind;
import com.minipar.script.parser.Value;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.ConnectException;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(30)
public class MiniParChannelTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private ByteArrayOutputStream buf;

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private static int freePort() throws IOException {
        try (ServerSocket s = new ServerSocket(0)) {
            return s.getLocalPort();
        }
    }

    private MiniPar engine() {
        MiniPar mp = new MiniPar();
        buf = new ByteArrayOutputStream();
        mp.setOutput(new PrintStream(buf, true, StandardCharsets.UTF_8));
        mp.setConnectAttempts(100);
        mp.setConnectRetryDelayMillis(50);
        mp.registerFunction("upper", args -> Value.string(args.get(0).stringify().toUpperCase(Locale.ROOT)));
        return mp;
    }

    private String output() {
        return buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private static String readRaw(InputStream in) throws IOException {
        byte[] b = new byte[2048];
        int n = in.read(b);
        return (n < 0) ? null : new String(b, 0, n, StandardCharsets.UTF_8);
    }

    private static Socket connectWithRetry(int port) throws Exception {
        for (int i = 0; i < 200; i++) {
            try {
                return new Socket("localhost", port);
            } catch (ConnectException e) {
                Thread.sleep(25);
            }
        }
        throw new AssertionError("server channel never started listening on " + port);
    }

    @Test
    void clientChannelTalksToPlainSocketServer() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            int port = server.getLocalPort();
            Future<String> peer = pool.submit(() -> {
                try (Socket s = server.accept()) {
                    String req = readRaw(s.getInputStream());
                    OutputStream out = s.getOutputStream();
                    out.write(req.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
                    out.flush();
                    assertNull(readRaw(s.getInputStream()));
                    return req;
                }
            });

            Map<String, Value> env = engine().execute(
                    "c_channel cli \"localhost\" " + port + ";\n" +
                    "r = cli.send(\"abc\");\n" +
                    "cli.close();\n");

            assertEquals(Value.string("ABC"), env.get("r"));
            assertEquals("abc", peer.get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void redeclaringAChannelClosesThePreviousConnection() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            int port = server.getLocalPort();
            Future<String> peer = pool.submit(() -> {
                try (Socket first = server.accept(); Socket second = server.accept()) {
                    assertNull(readRaw(first.getInputStream()));
                    String req = readRaw(second.getInputStream());
                    second.getOutputStream().write("ok".getBytes(StandardCharsets.UTF_8));
                    second.getOutputStream().flush();
                    return req;
                }
            });

            Map<String, Value> env = engine().execute(
                    "c_channel cli \"localhost\" " + port + ";\n" +
                    "c_channel cli \"localhost\" " + port + ";\n" +
                    "r = cli.send(\"two\");\n");

            assertEquals(Value.string("ok"), env.get("r"));
            assertEquals("two", peer.get(10, TimeUnit.SECONDS));
        }
    }

    private Future<Boolean> peerSeesDisconnect(ServerSocket server) {
        return pool.submit(() -> {
            try (Socket s = server.accept()) {
                return readRaw(s.getInputStream()) == null;
            }
        });
    }

    @Test
    void channelsLeftOpenAreClosedWhenTheRunEnds() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            Future<Boolean> peer = peerSeesDisconnect(server);
            engine().execute("c_channel cli \"localhost\" " + server.getLocalPort() + ";\nx = 1;\n");
            assertTrue(peer.get(10, TimeUnit.SECONDS));
        }

        try (ServerSocket server = new ServerSocket(0)) {
            Future<Boolean> peer = peerSeesDisconnect(server);
            MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class, () -> engine().execute(
                    "c_channel cli \"localhost\" " + server.getLocalPort() + ";\nx = 1 / 0;\n"));
            assertEquals(Kind.DIVISION_BY_ZERO, ex.getKind());
            assertTrue(peer.get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void hostPortAndChannelNameMayComeFromVariables() throws Exception {
        try (ServerSocket server = new ServerSocket(0)) {
            int port = server.getLocalPort();
            Future<String> peer = pool.submit(() -> {
                try (Socket s = server.accept()) {
                    String req = readRaw(s.getInputStream());
                    s.getOutputStream().write(("got " + req).getBytes(StandardCharsets.UTF_8));
                    s.getOutputStream().flush();
                    return req;
                }
            });

            Map<String, Value> env = engine().execute(
                    "host = \"localhost\";\n" +
                    "port = " + port + ";\n" +
                    "c_channel cli host port;\n" +
                    "name = \"cli\";\n" +
                    "r = send(name, 42);\n");

            assertEquals(Value.string("got 42"), env.get("r"));
            assertEquals("42", peer.get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void serverChannelGreetsAndAnswersPlainSocketClient() throws Exception {
        int port = freePort();
        MiniPar mp = engine();
        mp.setMaxServerConnections(2);
        Future<?> script = pool.submit(() -> mp.execute(
                "function shout(msg) { return upper(msg) + \"!\"; }\n" +
                "s_channel srv { shout, \"hello\", \"localhost\", " + port + " }\n"));

        for (int round = 0; round < 2; round++) {
            try (Socket s = connectWithRetry(port)) {
                InputStream in = s.getInputStream();
                assertEquals("hello", readRaw(in));
                s.getOutputStream().write("abc".getBytes(StandardCharsets.UTF_8));
                s.getOutputStream().flush();
                assertEquals("ABC!", readRaw(in));
            }
        }
        script.get(10, TimeUnit.SECONDS);
    }

    @Test
    void miniParServerAndClientInParallelBranches() throws Exception {
        int port = freePort();
        MiniPar mp = engine();
        mp.execute(
                "PAR {\n" +
                "  s_channel srv { upper, \"\", \"localhost\", " + port + " }\n" +
                "  {\n" +
                "    c_channel cli \"localhost\" " + port + ";\n" +
                "    r = cli.send(\"abc\");\n" +
                "    print(r);\n" +
                "    cli.close();\n" +
                "  }\n" +
                "}\n");

        assertEquals("ABC\n", output());
    }

    @Test
    void lengthPrefixedFramingWithGreeting() throws Exception {
        int port = freePort();
        MiniPar mp = engine();
        mp.setChannelFraming(Framing.LENGTH_PREFIXED);
        mp.execute(
                "PAR {\n" +
                "  s_channel srv { upper, \"welcome\", \"localhost\", " + port + " }\n" +
                "  {\n" +
                "    c_channel cli \"localhost\" " + port + ";\n" +
                "    g = cli.receive();\n" +
                "    r = send(cli, \"xyz\");\n" +
                "    print(g, r);\n" +
                "  }\n" +
                "}\n");

        assertEquals("welcome XYZ\n", output());
    }

    @Test
    void lengthPrefixedFramingDeliversEmptyReplies() throws Exception {
        int port = freePort();
        MiniPar mp = engine();
        mp.setChannelFraming(Framing.LENGTH_PREFIXED);
        mp.registerFunction("blank", args -> Value.string(""));
        mp.execute(
                "PAR {\n" +
                "  s_channel srv { blank, \"\", \"localhost\", " + port + " }\n" +
                "  {\n" +
                "    c_channel cli \"localhost\" " + port + ";\n" +
                "    r = cli.send(\"anything\");\n" +
                "    print(\"[\" + r + \"]\");\n" +
                "  }\n" +
                "}\n");

        assertEquals("[]\n", output());
    }

    @Test
    void connectFailureIsAChannelError() throws Exception {
        int port = freePort();
        MiniPar mp = engine();
        mp.setConnectAttempts(1);
        MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class,
                () -> mp.execute("c_channel cli \"localhost\" " + port + ";"));

        assertEquals(Kind.CHANNEL, ex.getKind());
        assertInstanceOf(IOException.class, ex.getCause());
        assertEquals(1, ex.getLine());
    }

    @Test
    void invalidPortIsAChannelError() {
        MiniParRuntimeException ex = assertThrows(MiniParRuntimeException.class,
                () -> engine().execute("c_channel cli \"localhost\" \"nope\";"));
        assertEquals(Kind.CHANNEL, ex.getKind());
    }
}
