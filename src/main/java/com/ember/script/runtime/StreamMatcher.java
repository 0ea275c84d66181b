package com.ember.script.runtime;

import java.util.List;

/**
 * Matches one incoming text line against a script target. Both methods return the captured groups
 * (group 0 is the whole match) or null when the line does not match.
 */
public interface StreamMatcher {

    List<String> matchText(String line, String target);

    List<String> matchRegex(String line, String pattern);
}
