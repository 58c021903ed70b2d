package com.minipar.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.minipar.debug.Debug;
import com.minipar.debug.DebugLevel;
import com.minipar.script.channel.Framing;
import com.minipar.script.diag.MiniParJson;
import com.minipar.script.parser.MiniParException;
import com.minipar.script.parser.MiniParRuntimeException;
import com.minipar.script.parser.Statement.Module;
import com.minipar.script.parser.SyntaxException;
import com.minipar.script.parser.Token;

public final class MiniParCli {

    static final int EXIT_OK = 0;
    static final int EXIT_SCRIPT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNREADABLE = 3;

    private static final String USAGE =
            "Usage: MiniParCli [-tok | -ast | -check] [-v] [--framing=raw|length]"
                    + " [--max-connections=N] [--recv-buffer=N] <script-file>";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the CLI and returns the exit code instead of exiting. */
    static int run(String[] args) {
        String mode = "run";
        String file = null;
        MiniPar engine = new MiniPar();

        try {
            for (String a : args) {
                if (a.equals("-tok") || a.equals("-ast") || a.equals("-check")) {
                    mode = a.substring(1);
                } else if (a.equals("-v")) {
                    Debug.useSysErr();
                    Debug.get().setMinLevel(DebugLevel.DEBUG);
                } else if (a.startsWith("--framing=")) {
                    engine.setChannelFraming(Framing.parse(value(a)));
                } else if (a.startsWith("--max-connections=")) {
                    engine.setMaxServerConnections(Integer.parseInt(value(a)));
                } else if (a.startsWith("--recv-buffer=")) {
                    engine.setReceiveBufferSize(Integer.parseInt(value(a)));
                } else if (a.startsWith("-")) {
                    throw new IllegalArgumentException("Unknown option: " + a);
                } else if (file == null) {
                    file = a;
                } else {
                    throw new IllegalArgumentException("Only one script file may be given");
                }
            }
            if (file == null) throw new IllegalArgumentException("Missing script file");
            engine.options();
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        final Path scriptPath = Path.of(file);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(System.err);
            return EXIT_UNREADABLE;
        }

        engine.setInput(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));

        try {
            switch (mode) {
                case "tok": {
                    List<Token> tokens = engine.scan(script);
                    System.out.println(MiniParJson.write(MiniParJson.tokens(tokens)));
                    return EXIT_OK;
                }
                case "ast": {
                    Module module = engine.parse(engine.scan(script));
                    engine.check(module);
                    System.out.println(MiniParJson.write(MiniParJson.tree(module)));
                    return EXIT_OK;
                }
                case "check": {
                    List<SyntaxException> errors = engine.diagnose(script);
                    for (SyntaxException e : errors) System.out.println(e.getMessage());
                    return errors.isEmpty() ? EXIT_OK : EXIT_SCRIPT_ERROR;
                }
                default:
                    engine.execute(script);
                    return EXIT_OK;
            }
        } catch (MiniParException e) {
            System.err.println("Script error: " + e.getMessage());
            if (e instanceof MiniParRuntimeException) {
                for (String frame : ((MiniParRuntimeException) e).getCallTrace()) {
                    System.err.println("  in " + frame);
                }
            }
            for (Throwable s : e.getSuppressed()) {
                System.err.println("  " + s.getMessage());
            }
            return EXIT_SCRIPT_ERROR;
        }
    }

    private static String value(String option) {
        return option.substring(option.indexOf('=') + 1);
    }

    private MiniParCli() {}
}
