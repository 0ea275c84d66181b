package com.ember.script;

import java.io.FileNotFoundException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** {@link TextSource} backed by a map; handy for embedding scripts and for tests. */
public final class InMemoryTextSource implements TextSource {

    private final Map<String, List<String>> scripts = new ConcurrentHashMap<>();

    public InMemoryTextSource put(String name, List<String> lines) {
        if (name == null) throw new IllegalArgumentException("name is null");
        scripts.put(name, new ArrayList<>(lines));
        return this;
    }

    public InMemoryTextSource put(String name, String... lines) {
        return put(name, Arrays.asList(lines));
    }

    @Override
    public boolean exists(String name) {
        return name != null && scripts.containsKey(name);
    }

    @Override
    public List<String> load(String name) throws FileNotFoundException {
        List<String> lines = name == null ? null : scripts.get(name);
        if (lines == null) throw new FileNotFoundException("No script named '" + name + "'");
        return new ArrayList<>(lines);
    }
}
