package com.ember.script;

import java.io.IOException;
import java.util.List;

/** Where script sources come from. Names are logical: no directory, no extension. */
public interface TextSource {

    boolean exists(String name);

    /** Lines of {@code name} in order. */
    List<String> load(String name) throws IOException;
}
