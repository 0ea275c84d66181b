package com.ember.script;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.ember.debug.Debug;
import com.ember.script.parser.ScriptLine;
import com.ember.script.runtime.Label;
import com.ember.script.runtime.OutputSink;

/**
 * Reads a script and everything it includes into one line buffer plus a label table.
 *
 * {@code include <name>} lines are replaced, in place, by the lines of the named script. A script that is
 * already being expanded cannot be included again; the include is reported and skipped.
 */
public final class ScriptLoader {
    private static final String TAG = "ScriptLoader";

    private static final Pattern INCLUDE = Pattern.compile("^\\s*include (.+)$");
    private static final Pattern LABEL = Pattern.compile("^\\s*(\\w+((\\.|-|\\w)+)?):");

    /** The merged result of a load. */
    public static final class LoadedScript {
        public final String name;
        public final List<ScriptLine> lines;
        public final Map<String, Label> labels;

        LoadedScript(String name, List<ScriptLine> lines, Map<String, Label> labels) {
            this.name = name;
            this.lines = Collections.unmodifiableList(lines);
            this.labels = Collections.unmodifiableMap(labels);
        }
    }

    private final TextSource source;
    private final OutputSink sink;
    private final String extension;

    public ScriptLoader(TextSource source, OutputSink sink, String extension) {
        if (source == null) throw new IllegalArgumentException("source is null");
        this.source = source;
        this.sink = sink;
        this.extension = extension == null ? "" : extension;
    }

    /**
     * @throws ScriptNotFoundException when {@code name} does not exist
     * @throws IOException when the top-level script cannot be read
     */
    public LoadedScript load(String name) throws IOException {
        String scriptName = stripExtension(name.trim());
        if (!source.exists(scriptName)) throw new ScriptNotFoundException(scriptName);

        List<ScriptLine> lines = new ArrayList<>();
        Map<String, Label> labels = new LinkedHashMap<>();
        Set<String> expanding = new HashSet<>();
        expand(scriptName, source.load(scriptName), lines, labels, expanding);

        Debug.get().d(TAG, "loaded '" + scriptName + "': " + lines.size() + " lines, " + labels.size() + " labels");
        return new LoadedScript(scriptName, lines, labels);
    }

    private void expand(String fileName, List<String> source, List<ScriptLine> lines, Map<String, Label> labels,
                        Set<String> expanding) {
        expanding.add(fileName);
        int lineNumber = 0;
        for (String raw : source) {
            lineNumber++;
            if (raw.trim().isEmpty()) continue;

            Matcher include = INCLUDE.matcher(raw);
            if (include.find()) {
                includeScript(stripExtension(include.group(1).trim()), fileName, lineNumber, lines, labels, expanding);
                continue;
            }

            lines.add(new ScriptLine(raw.trim(), fileName, lineNumber));

            Matcher label = LABEL.matcher(raw);
            if (label.find()) {
                String labelName = label.group(1).toLowerCase();
                Label added = new Label(labelName, lines.size() - 1, fileName);
                Label existing = labels.put(labelName, added);
                if (existing != null) {
                    report(fileName, lineNumber, "duplicate label '" + labelName + "' from '" + existing.fileName
                            + "' replaced by the one in '" + fileName + "'");
                }
            }
        }
        expanding.remove(fileName);
    }

    private void includeScript(String includeName, String fileName, int lineNumber, List<ScriptLine> lines,
                               Map<String, Label> labels, Set<String> expanding) {
        if (expanding.contains(includeName)) {
            report(fileName, lineNumber, "script '" + includeName + "' cannot include itself!");
            return;
        }
        if (!source.exists(includeName)) {
            report(fileName, lineNumber, "included script '" + includeName + "' does not exist");
            return;
        }

        List<String> included;
        try {
            included = source.load(includeName);
        } catch (IOException e) {
            Debug.get().w(TAG, "failed to read include '" + includeName + "'", e);
            report(fileName, lineNumber, "unable to read included script '" + includeName + "'");
            return;
        }
        if (sink != null) sink.echo("[" + fileName + "(" + lineNumber + ")]: including '" + includeName + "'", OutputSink.ECHO);
        expand(includeName, included, lines, labels, expanding);
    }

    private void report(String fileName, int lineNumber, String message) {
        String text = "[" + fileName + "(" + lineNumber + ")]: " + message;
        Debug.get().w(TAG, text);
        if (sink != null) sink.echo(text, OutputSink.ERROR);
    }

    private String stripExtension(String name) {
        if (!extension.isEmpty() && name.endsWith(extension)) {
            return name.substring(0, name.length() - extension.length()).trim();
        }
        return name;
    }
}
