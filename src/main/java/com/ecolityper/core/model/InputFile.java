package com.ecolityper.core.model;

import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * A genome assembly selected for analysis.
 *
 * @param path      absolute, normalized path to an existing regular file
 * @param extension lower-cased file extension without the leading dot (empty if none)
 */
public record InputFile(Path path, String extension) implements Serializable, Comparable<InputFile> {

    public InputFile {
        if (path == null) {
            throw new IllegalArgumentException("Input path must not be null");
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Not a regular file: " + path);
        }
        extension = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
    }

    /**
     * Creates an InputFile from any path, normalizing it and deriving the extension.
     */
    public static InputFile of(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        return new InputFile(absolute, extensionOf(absolute.getFileName().toString()));
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    /** Extension exactly as written in the file name, without the dot. */
    public String authoredExtension() {
        return extensionOf(fileName());
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 || dot == fileName.length() - 1 ? "" : fileName.substring(dot + 1);
    }

    @Override
    public int compareTo(InputFile other) {
        return path.compareTo(other.path);
    }
}
