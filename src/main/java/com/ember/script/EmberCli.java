package com.ember.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.ember.script.runtime.OutputSink;

/**
 * Runs one script from disk against stdin.
 *
 * Every stdin line is delivered as a stream line followed by a prompt. Echoed text goes to stdout; outbound
 * commands go to stdout prefixed with {@code "> "}.
 */
public final class EmberCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_NOT_FOUND = 3;

    /** How long scripts may keep running after stdin is exhausted. */
    private static final long LINGER_MILLIS = 5000;

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Path root = Path.of(".");
        Path configFile = null;
        String script = null;
        List<String> scriptArgs = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (script != null) {
                scriptArgs.add(arg);
            } else if (arg.equals("--root") || arg.equals("--config")) {
                if (i + 1 >= args.length) return usage(err);
                Path value = Path.of(args[++i]);
                if (arg.equals("--root")) root = value;
                else configFile = value;
            } else if (arg.startsWith("--")) {
                return usage(err);
            } else {
                script = arg;
            }
        }
        if (script == null) return usage(err);

        EngineConfig config;
        try {
            config = configFile == null ? EngineConfig.fromClasspath() : EngineConfig.load(configFile);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Failed to read config: " + configFile);
            e.printStackTrace(err);
            return EXIT_FAILURE;
        }

        OutputSink sink = new OutputSink() {
            @Override
            public void echo(String text, String preset) {
                out.println(text);
            }

            @Override
            public void sendCommand(String command) {
                out.println("> " + command);
            }
        };

        try (EmberScript engine = new EmberScript(new FileTextSource(root, config.scriptExtension()), sink, config)) {
            engine.loadAndRun(script, scriptArgs);

            BufferedReader stdin = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            while (!engine.running().isEmpty() && (line = stdin.readLine()) != null) {
                engine.deliverStreamLine(line);
                engine.deliverPrompt();
            }

            long deadline = System.currentTimeMillis() + LINGER_MILLIS;
            while (!engine.running().isEmpty() && System.currentTimeMillis() < deadline) {
                Thread.sleep(50);
            }
            return EXIT_OK;
        } catch (ScriptNotFoundException e) {
            err.println(e.getMessage());
            return EXIT_NOT_FOUND;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted");
            return EXIT_FAILURE;
        } catch (Exception e) {
            err.println("Script error:");
            e.printStackTrace(err);
            return EXIT_FAILURE;
        }
    }

    private static int usage(PrintStream err) {
        err.println("Usage: ember [--root <dir>] [--config <file>] <script> [args...]");
        return EXIT_USAGE;
    }

    private EmberCli() {}
}
