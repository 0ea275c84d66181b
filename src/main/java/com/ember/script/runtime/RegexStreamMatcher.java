package com.ember.script.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.ember.debug.Debug;

/** {@link StreamMatcher} backed by {@link java.util.regex}; recently used compiled patterns are cached. */
public final class RegexStreamMatcher implements StreamMatcher {
    private static final String TAG = "StreamMatcher";

    public static final int DEFAULT_CACHE_SIZE = 256;

    private final Map<String, Pattern> cache;

    public RegexStreamMatcher() {
        this(DEFAULT_CACHE_SIZE);
    }

    public RegexStreamMatcher(int maxCachedPatterns) {
        if (maxCachedPatterns < 1) throw new IllegalArgumentException("maxCachedPatterns must be positive");
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Pattern> eldest) {
                return size() > maxCachedPatterns;
            }
        };
    }

    @Override
    public List<String> matchText(String line, String target) {
        if (line == null || target == null || target.isEmpty()) return null;
        return line.contains(target) ? Collections.singletonList(target) : null;
    }

    @Override
    public List<String> matchRegex(String line, String pattern) {
        if (line == null || pattern == null || pattern.isEmpty()) return null;
        Pattern compiled = compile(pattern);
        if (compiled == null) return null;

        Matcher m = compiled.matcher(line);
        if (!m.find()) return null;
        List<String> groups = new ArrayList<>(m.groupCount() + 1);
        for (int i = 0; i <= m.groupCount(); i++) {
            String group = m.group(i);
            groups.add(group == null ? "" : group);
        }
        return groups;
    }

    public synchronized int cachedPatterns() {
        return cache.size();
    }

    private synchronized Pattern compile(String pattern) {
        Pattern compiled = cache.get(pattern);
        if (compiled != null) return compiled;
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            Debug.get().w(TAG, "invalid pattern '" + pattern + "': " + e.getDescription());
            return null;
        }
        cache.put(pattern, compiled);
        return compiled;
    }
}
