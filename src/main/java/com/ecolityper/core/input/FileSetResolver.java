package com.ecolityper.core.input;

import com.ecolityper.core.model.InputFile;
import com.ecolityper.core.model.InputSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Expands an input specifier (file, directory, or wildcard pattern) into an {@link InputSet}.
 *
 * <p>Resolution only reads the file system, so resolving the same specifier twice against an
 * unchanged tree yields the same set.
 */
@Service
public class FileSetResolver {

    private static final Logger log = LoggerFactory.getLogger(FileSetResolver.class);

    /** Recognized FASTA extensions, as authored in directory globs. */
    public static final List<String> FASTA_EXTENSIONS = List.of("fna", "fasta", "fa", "fsa");

    /** Only these make a specifier a pattern; brackets and braces are legal in file names. */
    private static final String WILDCARD_CHARS = "*?";

    public InputSet resolve(String specifier) {
        if (specifier == null || specifier.isBlank()) {
            throw new InputNotFoundException("No input specified");
        }
        log.info("Resolving input files from '{}'", specifier);

        Path path = asPath(specifier);
        if (path != null && Files.isRegularFile(path) && hasFastaExtension(path)) {
            log.info("Using single FASTA file {}", path.getFileName());
            return InputSet.of(InputFile.of(path));
        }

        if (path != null && Files.isDirectory(path)) {
            var files = scanDirectory(path);
            if (files.isEmpty()) {
                log.warn("No FASTA files found in directory {}", path);
            } else {
                log.info("Found {} FASTA file(s) in directory {}", files.size(), path);
            }
            return new InputSet(files);
        }

        if (containsWildcard(specifier)) {
            var files = expandPattern(specifier);
            log.info("Pattern '{}' matched {} FASTA file(s)", specifier, files.size());
            return new InputSet(files);
        }

        throw new InputNotFoundException("Input path not found: " + specifier);
    }

    static boolean containsWildcard(String specifier) {
        for (char c : specifier.toCharArray()) {
            if (WILDCARD_CHARS.indexOf(c) >= 0) return true;
        }
        return false;
    }

    private static Path asPath(String specifier) {
        try {
            return Path.of(specifier);
        } catch (InvalidPathException e) {
            log.debug("'{}' is not a valid path: {}", specifier, e.getMessage());
            return null;
        }
    }

    static boolean hasFastaExtension(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : FASTA_EXTENSIONS) {
            if (name.endsWith("." + ext)) return true;
        }
        return false;
    }

    private static boolean isHidden(Path path) {
        return path.getFileName().toString().startsWith(".");
    }

    /**
     * Splits the specifier into the longest wildcard-free leading directory and a glob for the
     * remainder, then walks just deep enough to match it.
     */
    private List<InputFile> expandPattern(String specifier) {
        String normalized = specifier.replace('\\', '/');
        String[] segments = normalized.split("/", -1);

        var base = new StringBuilder();
        int firstWild = 0;
        while (firstWild < segments.length - 1 && !containsWildcard(segments[firstWild])) {
            base.append(segments[firstWild]).append('/');
            firstWild++;
        }
        Path baseDir = base.length() == 0 ? Path.of(".") : Path.of(base.toString());
        String relativeGlob = String.join("/", List.of(segments).subList(firstWild, segments.length));
        int depth = segments.length - firstWild;

        if (!Files.isDirectory(baseDir)) {
            log.warn("Pattern base directory {} does not exist", baseDir);
            return List.of();
        }

        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + relativeGlob);
        var matches = new TreeSet<InputFile>();
        try (Stream<Path> walk = Files.walk(baseDir, depth)) {
            walk.filter(p -> !p.equals(baseDir))
                .filter(p -> matcher.matches(baseDir.relativize(p)))
                .filter(Files::isRegularFile)
                .filter(FileSetResolver::hasFastaExtension)
                .filter(p -> !isHidden(p))
                .forEach(p -> matches.add(InputFile.of(p)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to expand pattern " + specifier, e);
        }
        return new ArrayList<>(matches);
    }

    private List<InputFile> scanDirectory(Path dir) {
        var matches = new TreeSet<InputFile>();
        for (String ext : FASTA_EXTENSIONS) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*." + ext)) {
                for (Path p : stream) {
                    if (Files.isRegularFile(p) && !isHidden(p)) {
                        matches.add(InputFile.of(p));
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list " + dir, e);
            }
        }
        return new ArrayList<>(matches);
    }
}
