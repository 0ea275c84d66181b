package com.ember.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Loads {@code <root>/<name><extension>} as UTF-8. */
public final class FileTextSource implements TextSource {

    private final Path root;
    private final String extension;

    public FileTextSource(Path root, String extension) {
        if (root == null) throw new IllegalArgumentException("root is null");
        this.root = root;
        this.extension = extension == null ? "" : extension;
    }

    public Path resolve(String name) {
        String file = name.endsWith(extension) ? name : name + extension;
        return root.resolve(file).normalize();
    }

    @Override
    public boolean exists(String name) {
        return name != null && !name.isEmpty() && Files.isRegularFile(resolve(name));
    }

    @Override
    public List<String> load(String name) throws IOException {
        return Files.readAllLines(resolve(name), StandardCharsets.UTF_8);
    }
}
