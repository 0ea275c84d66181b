package com.ember.script;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Engine tunables. Read from JSON; missing keys keep their defaults and unknown keys are ignored.
 *
 * <pre>
 * {
 *   "scriptExtension": ".cmd",
 *   "maxGosubDepth": 100,
 *   "loopGuardLimit": 500,
 *   "loopGuardWindowMillis": 100,
 *   "defaultPauseSeconds": 1,
 *   "echoStatus": true,
 *   "dateFormat": "yyyy-MM-dd",
 *   "timeFormat": "hh:mm:ss a",
 *   "datetimeFormat": "yyyy-MM-dd hh:mm:ss a",
 *   "roundtimeVariable": "roundtime"
 * }
 * </pre>
 */
public final class EngineConfig {

    public static final String DEFAULTS_RESOURCE = "ember-defaults.json";

    private static final ObjectMapper om = new ObjectMapper();

    private String scriptExtension = ".cmd";
    private int maxGosubDepth = 100;
    private int loopGuardLimit = 500;
    private long loopGuardWindowMillis = 100;
    private double defaultPauseSeconds = 1;
    private boolean echoStatus = true;
    private String dateFormat = "yyyy-MM-dd";
    private String timeFormat = "hh:mm:ss a";
    private String datetimeFormat = "yyyy-MM-dd hh:mm:ss a";
    private String roundtimeVariable = "roundtime";

    private EngineConfig() {}

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromJson(String json) {
        try {
            return fromNode(om.readTree(json));
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid engine config: " + e.getMessage(), e);
        }
    }

    public static EngineConfig load(Path path) throws IOException {
        return fromNode(om.readTree(Files.readString(path, StandardCharsets.UTF_8)));
    }

    /** Defaults as shipped in {@value #DEFAULTS_RESOURCE}. */
    public static EngineConfig fromClasspath() {
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) return defaults();
            return fromNode(om.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static EngineConfig fromNode(JsonNode node) {
        EngineConfig c = new EngineConfig();
        if (node == null || !node.isObject()) return c;
        c.scriptExtension = node.path("scriptExtension").asText(c.scriptExtension);
        c.maxGosubDepth = node.path("maxGosubDepth").asInt(c.maxGosubDepth);
        c.loopGuardLimit = node.path("loopGuardLimit").asInt(c.loopGuardLimit);
        c.loopGuardWindowMillis = node.path("loopGuardWindowMillis").asLong(c.loopGuardWindowMillis);
        c.defaultPauseSeconds = node.path("defaultPauseSeconds").asDouble(c.defaultPauseSeconds);
        c.echoStatus = node.path("echoStatus").asBoolean(c.echoStatus);
        c.dateFormat = node.path("dateFormat").asText(c.dateFormat);
        c.timeFormat = node.path("timeFormat").asText(c.timeFormat);
        c.datetimeFormat = node.path("datetimeFormat").asText(c.datetimeFormat);
        c.roundtimeVariable = node.path("roundtimeVariable").asText(c.roundtimeVariable);
        return c;
    }

    public String scriptExtension() { return scriptExtension; }
    public int maxGosubDepth() { return maxGosubDepth; }
    public int loopGuardLimit() { return loopGuardLimit; }
    public long loopGuardWindowMillis() { return loopGuardWindowMillis; }
    public double defaultPauseSeconds() { return defaultPauseSeconds; }
    public boolean echoStatus() { return echoStatus; }
    public String dateFormat() { return dateFormat; }
    public String timeFormat() { return timeFormat; }
    public String datetimeFormat() { return datetimeFormat; }
    public String roundtimeVariable() { return roundtimeVariable; }
}
