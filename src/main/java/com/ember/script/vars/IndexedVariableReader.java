package com.ember.script.vars;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text into plain runs and indexed variable references such as {@code $list[2]} or {@code %items(%i)}.
 */
final class IndexedVariableReader {

    private static final Pattern INDEXED =
            Pattern.compile("([%$&][a-zA-Z0-9_.\\-$%&]+)[\\[(]([a-zA-Z0-9._\\-$%&]+)[\\])]");

    static final class Segment {
        final String text;
        final String name;
        final String index;

        private Segment(String text, String name, String index) {
            this.text = text;
            this.name = name;
            this.index = index;
        }

        static Segment plain(String text) { return new Segment(text, null, null); }

        static Segment indexed(String original, String name, String index) { return new Segment(original, name, index); }

        boolean isIndexed() { return name != null; }
    }

    List<Segment> read(String input) {
        List<Segment> segments = new ArrayList<>();
        Matcher m = INDEXED.matcher(input);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) segments.add(Segment.plain(input.substring(last, m.start())));
            segments.add(Segment.indexed(m.group(0), m.group(1), m.group(2)));
            last = m.end();
        }
        if (last < input.length()) segments.add(Segment.plain(input.substring(last)));
        return segments;
    }
}
