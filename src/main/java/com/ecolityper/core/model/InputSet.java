package com.ecolityper.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Sorted, duplicate-free sequence of input files shared by every analysis in a run.
 */
public record InputSet(List<InputFile> files) implements Serializable {

    public InputSet {
        files = List.copyOf(new TreeSet<>(files == null ? List.of() : files));
    }

    public static InputSet of(InputFile... files) {
        return new InputSet(List.of(files));
    }

    public static InputSet empty() {
        return new InputSet(List.of());
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    public int size() {
        return files.size();
    }

    public List<String> fileNames() {
        var names = new ArrayList<String>(files.size());
        for (var file : files) {
            names.add(file.fileName());
        }
        return names;
    }

    /** Distinct lower-cased extensions, in first-seen order. */
    public Set<String> extensions() {
        var extensions = new LinkedHashSet<String>();
        for (var file : files) {
            extensions.add(file.extension());
        }
        return extensions;
    }

    public FilePattern filePattern() {
        return FilePattern.of(this);
    }
}
