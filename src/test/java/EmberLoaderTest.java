import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ember.script.FileTextSource;
import com.ember.script.InMemoryTextSource;
import com.ember.script.ScriptLoader;
import com.ember.script.ScriptNotFoundException;
import com.ember.script.parser.ScriptLine;
import com.ember.script.runtime.Label;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EmberLoaderTest {

    private final InMemoryTextSource source = new InMemoryTextSource();
    private final RecordingOutputSink sink = new RecordingOutputSink();
    private final ScriptLoader loader = new ScriptLoader(source, sink, ".cmd");

    private static List<String> texts(ScriptLoader.LoadedScript script) {
        List<String> out = new ArrayList<>();
        for (ScriptLine line : script.lines) out.add(line.originalText());
        return out;
    }

    @Test
    void include_mergesLinesAndLabels() throws IOException {
        source.put("forage", "start:", "include util", "", "echo foraging");
        source.put("util", "Helper:", "   echo helping");

        ScriptLoader.LoadedScript script = loader.load("forage");

        assertEquals(List.of("start:", "Helper:", "echo helping", "echo foraging"), texts(script));
        assertEquals(2, script.labels.size());

        Label helper = script.labels.get("helper");
        assertEquals(1, helper.line);
        assertEquals("util", helper.fileName);

        ScriptLine last = script.lines.get(3);
        assertEquals("forage", last.fileName());
        assertEquals(4, last.lineNumber());
        assertEquals(List.of("[forage(2)]: including 'util'"), sink.echoes());
        assertTrue(sink.errors().isEmpty());
    }

    @Test
    void selfInclude_isReportedAndSkipped() throws IOException {
        source.put("self", "top:", "include self", "echo x");

        ScriptLoader.LoadedScript script = loader.load("self");

        assertEquals(List.of("top:", "echo x"), texts(script));
        assertEquals(1, script.labels.size());
        assertTrue(sink.hasErrorContaining("script 'self' cannot include itself!"));
    }

    @Test
    void mutualInclude_stopsAtTheCycle() throws IOException {
        source.put("a", "include b", "echo a");
        source.put("b", "include a.cmd", "echo b");

        ScriptLoader.LoadedScript script = loader.load("a");

        assertEquals(List.of("echo b", "echo a"), texts(script));
        assertEquals(List.of("[b(1)]: script 'a' cannot include itself!"), sink.errors());
    }

    @Test
    void includingTheSameScriptTwice_isAllowed() throws IOException {
        source.put("main", "include util", "include util");
        source.put("util", "echo u");

        assertEquals(List.of("echo u", "echo u"), texts(loader.load("main")));
        assertTrue(sink.errors().isEmpty());
    }

    @Test
    void duplicateLabel_laterWins() throws IOException {
        source.put("dup", "go:", "echo 1", "GO:", "echo 2");

        ScriptLoader.LoadedScript script = loader.load("dup");

        assertEquals(2, script.labels.get("go").line);
        assertTrue(sink.hasErrorContaining("duplicate label 'go'"));
    }

    @Test
    void missingInclude_isReportedAndSkipped() throws IOException {
        source.put("main", "include nope", "echo still here");

        ScriptLoader.LoadedScript script = loader.load("main");

        assertEquals(List.of("echo still here"), texts(script));
        assertEquals(List.of("[main(1)]: included script 'nope' does not exist"), sink.errors());
    }

    @Test
    void missingScript_throws() {
        ScriptNotFoundException e = assertThrows(ScriptNotFoundException.class, () -> loader.load("ghost"));
        assertEquals("ghost", e.scriptName());
    }

    @Test
    void extensionIsStripped() throws IOException {
        source.put("forage", "echo hi");
        assertEquals("forage", loader.load("forage.cmd").name);
    }

    @Test
    void loaderWithoutSink_stillReportsThroughDebug() throws IOException {
        source.put("self", "include self", "echo x");
        ScriptLoader quiet = new ScriptLoader(source, null, ".cmd");
        assertEquals(List.of("echo x"), texts(quiet.load("self")));
    }

    @Test
    void fileTextSource_readsFromDisk(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("main.cmd"), "start:\ninclude lib\necho main\n", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve("lib.cmd"), "lib:\necho lib é\n", StandardCharsets.UTF_8);

        FileTextSource files = new FileTextSource(dir, ".cmd");
        assertTrue(files.exists("main"));
        assertTrue(files.exists("main.cmd"));
        assertFalse(files.exists("other"));

        ScriptLoader.LoadedScript script = new ScriptLoader(files, sink, ".cmd").load("main");
        assertEquals(List.of("start:", "lib:", "echo lib é", "echo main"), texts(script));
        assertEquals(1, script.labels.get("lib").line);
    }
}
