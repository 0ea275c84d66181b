package com.ember.script.vars;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each sigil to the namespaces it searches, in priority order.
 */
public final class VariableContext {
    private final Map<Character, List<VariableLookup>> lookups = new LinkedHashMap<>();

    public VariableContext add(char sigil, VariableLookup lookup) {
        lookups.computeIfAbsent(sigil, k -> new ArrayList<>()).add(lookup);
        return this;
    }

    /** Sigils in registration order. */
    public Set<Character> sigils() {
        return lookups.keySet();
    }

    /** First value found for {@code key} among the namespaces of {@code sigil}, or null. */
    public String lookup(char sigil, String key) {
        List<VariableLookup> list = lookups.get(sigil);
        if (list == null) return null;
        for (VariableLookup lookup : list) {
            String value = lookup.lookup(key);
            if (value != null) return value;
        }
        return null;
    }

    public boolean containsSigil(String text) {
        for (char sigil : lookups.keySet()) {
            if (text.indexOf(sigil) >= 0) return true;
        }
        return false;
    }
}
