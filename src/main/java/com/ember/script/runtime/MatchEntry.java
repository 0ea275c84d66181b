package com.ember.script.runtime;

/** A pending {@code match} or {@code matchre} waiting for {@code matchwait}. */
final class MatchEntry {
    final String label;
    final String value;
    final boolean regex;

    MatchEntry(String label, String value, boolean regex) {
        this.label = label;
        this.value = value;
        this.regex = regex;
    }
}
