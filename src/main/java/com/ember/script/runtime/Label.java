package com.ember.script.runtime;

/** Jump target: the index of the declaring line in the merged line buffer. */
public final class Label {
    public final String name;
    public final int line;
    public final String fileName;

    public Label(String name, int line, String fileName) {
        this.name = name;
        this.line = line;
        this.fileName = fileName;
    }

    @Override
    public String toString() {
        return name + " @" + fileName + ":" + line;
    }
}
