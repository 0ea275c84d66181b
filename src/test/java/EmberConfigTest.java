import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.ember.script.EngineConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class EmberConfigTest {

    @Test
    void defaults() {
        EngineConfig c = EngineConfig.defaults();
        assertEquals(".cmd", c.scriptExtension());
        assertEquals(100, c.maxGosubDepth());
        assertEquals(500, c.loopGuardLimit());
        assertEquals(100, c.loopGuardWindowMillis());
        assertEquals(1.0, c.defaultPauseSeconds(), 1e-9);
        assertTrue(c.echoStatus());
        assertEquals("roundtime", c.roundtimeVariable());
    }

    @Test
    void fromJson_overridesOnlyGivenKeys() {
        EngineConfig c = EngineConfig.fromJson("{\"maxGosubDepth\": 5, \"echoStatus\": false, \"bogus\": 1}");
        assertEquals(5, c.maxGosubDepth());
        assertFalse(c.echoStatus());
        assertEquals(500, c.loopGuardLimit());
        assertEquals(".cmd", c.scriptExtension());
    }

    @Test
    void fromJson_nonObjectGivesDefaults() {
        assertEquals(100, EngineConfig.fromJson("[1, 2]").maxGosubDepth());
    }

    @Test
    void fromJson_invalid() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromJson("{not json"));
    }

    @Test
    void fromClasspath_readsShippedDefaults() {
        EngineConfig c = EngineConfig.fromClasspath();
        assertEquals(".cmd", c.scriptExtension());
        assertEquals("hh:mm:ss a", c.timeFormat());
    }

    @Test
    void load_fromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("engine.json");
        Files.writeString(file, "{\"scriptExtension\": \".ems\", \"defaultPauseSeconds\": 0.5}", StandardCharsets.UTF_8);

        EngineConfig c = EngineConfig.load(file);
        assertEquals(".ems", c.scriptExtension());
        assertEquals(0.5, c.defaultPauseSeconds(), 1e-9);
    }
}
