package com.ecolityper.core.model;

import java.io.Serializable;
import java.util.HashSet;

/**
 * Glob summarizing an {@link InputSet} for tools that take a pattern instead of a file list.
 *
 * <p>{@code *.<ext>} when every file shares one extension, {@code *} otherwise. The extension is
 * written as authored. Extensions that agree only after lower-casing fall back to {@code *},
 * since the staged copies keep their authored names.
 */
public record FilePattern(String glob) implements Serializable {

    public static final String CATCH_ALL = "*";

    public static FilePattern of(InputSet inputs) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive a file pattern from an empty input set");
        }
        if (inputs.extensions().size() != 1) {
            return new FilePattern(CATCH_ALL);
        }
        var authored = new HashSet<String>();
        for (var file : inputs.files()) {
            authored.add(file.authoredExtension());
        }
        if (authored.size() != 1) {
            return new FilePattern(CATCH_ALL);
        }
        String ext = authored.iterator().next();
        return new FilePattern(ext.isEmpty() ? CATCH_ALL : "*." + ext);
    }

    @Override
    public String toString() {
        return glob;
    }
}
