import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ember.script.EmberCli;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class EmberCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return EmberCli.run(args, in,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() { return out.toString(StandardCharsets.UTF_8); }

    private String stderr() { return err.toString(StandardCharsets.UTF_8); }

    @Test
    void noScript_printsUsage() {
        assertEquals(EmberCli.EXIT_USAGE, run(""));
        assertTrue(stderr().contains("Usage: ember"));
    }

    @Test
    void unknownOption_printsUsage() {
        assertEquals(EmberCli.EXIT_USAGE, run("", "--verbose", "main"));
        assertEquals(EmberCli.EXIT_USAGE, run("", "--root"));
    }

    @Test
    void missingScript(@TempDir Path dir) {
        assertEquals(EmberCli.EXIT_NOT_FOUND, run("", "--root", dir.toString(), "ghost"));
        assertTrue(stderr().contains("Script 'ghost' does not exist"));
    }

    @Test
    void badConfig(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("bad.json");
        Files.writeString(config, "{oops", StandardCharsets.UTF_8);

        assertEquals(EmberCli.EXIT_FAILURE, run("", "--config", config.toString(), "main"));
        assertTrue(stderr().contains("Failed to read config"));
    }

    @Test
    void runsScriptAgainstStdin(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("main.cmd"),
                "echo hello %1\nwaitfor ready\nput go\n", StandardCharsets.UTF_8);

        int code = run("not yet\nready now\n", "--root", dir.toString(), "main", "world");

        assertEquals(EmberCli.EXIT_OK, code);
        String output = stdout();
        assertTrue(output.contains("[Starting 'main']"), output);
        assertTrue(output.contains("hello world"), output);
        assertTrue(output.contains("> go"), output);
        assertTrue(output.contains("[Script 'main' finished]"), output);
        assertTrue(output.indexOf("hello world") < output.indexOf("> go"), output);
    }
}
