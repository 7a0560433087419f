package com.ecolityper.core.input;

import com.ecolityper.core.model.InputSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSetResolverTest {

    @TempDir
    Path dir;

    private final FileSetResolver resolver = new FileSetResolver();

    @BeforeEach
    void setUp() throws IOException {
        for (String name : List.of("s2.fna", "s1.fasta", "s3.fa", "s4.fsa", "notes.txt", ".hidden.fna")) {
            Files.writeString(dir.resolve(name), ">x\nACGT\n");
        }
        Files.createDirectories(dir.resolve("nested"));
        Files.writeString(dir.resolve("nested/deep.fna"), ">x\nACGT\n");
        Files.createDirectories(dir.resolve("folder.fna"));
    }

    @Nested
    @DisplayName("Directory specifier")
    class DirectoryTests {

        @Test
        @DisplayName("Collects recognized FASTA files directly inside, sorted")
        void collectsFasta() {
            InputSet set = resolver.resolve(dir.toString());
            assertEquals(List.of("s1.fasta", "s2.fna", "s3.fa", "s4.fsa"), set.fileNames());
        }

        @Test
        @DisplayName("Empty directory yields an empty set")
        void emptyDirectory() throws IOException {
            Path empty = Files.createDirectory(dir.resolve("empty"));
            assertTrue(resolver.resolve(empty.toString()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Pattern specifier")
    class PatternTests {

        @Test
        @DisplayName("Expands a glob and keeps only FASTA regular files")
        void expandsGlob() {
            InputSet set = resolver.resolve(dir + "/s*");
            assertEquals(List.of("s1.fasta", "s2.fna", "s3.fa", "s4.fsa"), set.fileNames());
        }

        @Test
        @DisplayName("Extension glob excludes hidden files and directories")
        void extensionGlob() {
            InputSet set = resolver.resolve(dir + "/*.fna");
            assertEquals(List.of("s2.fna"), set.fileNames());
        }

        @Test
        @DisplayName("Glob over subdirectories matches nested files")
        void nestedGlob() {
            InputSet set = resolver.resolve(dir + "/*/*.fna");
            assertEquals(List.of("deep.fna"), set.fileNames());
        }

        @Test
        @DisplayName("Pattern with no matches yields an empty set")
        void noMatches() {
            assertTrue(resolver.resolve(dir + "/*.gbk").isEmpty());
        }
    }

    @Nested
    @DisplayName("Single file specifier")
    class SingleFileTests {

        @Test
        @DisplayName("Existing FASTA file yields a one-element set")
        void singleFile() {
            InputSet set = resolver.resolve(dir.resolve("s2.fna").toString());
            assertEquals(1, set.size());
            assertEquals(dir.resolve("s2.fna").toAbsolutePath().normalize(), set.files().get(0).path());
        }

        @Test
        @DisplayName("Extension match is case-insensitive")
        void upperCase() throws IOException {
            Path upper = Files.writeString(dir.resolve("UPPER.FASTA"), ">x\nA\n");
            assertEquals(1, resolver.resolve(upper.toString()).size());
        }

        @Test
        @DisplayName("Non-FASTA file is not found")
        void nonFasta() {
            assertThrows(InputNotFoundException.class, () -> resolver.resolve(dir.resolve("notes.txt").toString()));
        }

        @Test
        @DisplayName("Missing path is not found")
        void missing() {
            assertThrows(InputNotFoundException.class, () -> resolver.resolve(dir.resolve("nope.fna").toString()));
        }
    }

    @Test
    @DisplayName("Resolving twice gives the same set")
    void idempotent() {
        assertEquals(resolver.resolve(dir.toString()), resolver.resolve(dir.toString()));
    }

    @Test
    @DisplayName("Only * and ? make a specifier a pattern")
    void wildcardDetection() {
        assertTrue(FileSetResolver.containsWildcard("a/*.fna"));
        assertTrue(FileSetResolver.containsWildcard("a/s?.fna"));
        assertFalse(FileSetResolver.containsWildcard("a/isolate[1].fna"));
        assertFalse(FileSetResolver.containsWildcard("a/run{A}"));
        assertFalse(FileSetResolver.containsWildcard("a/b.fna"));
    }

    @Nested
    @DisplayName("Names containing glob syntax")
    class LiteralNameTests {

        @Test
        @DisplayName("File with brackets in its name resolves to itself")
        void bracketFile() throws IOException {
            Path bracketed = Files.writeString(dir.resolve("isolate[1].fna"), ">x\nA\n");
            Files.writeString(dir.resolve("isolate1.fna"), ">y\nC\n");

            InputSet set = resolver.resolve(bracketed.toString());

            assertEquals(List.of("isolate[1].fna"), set.fileNames());
        }

        @Test
        @DisplayName("Directory with braces in its name is scanned as a directory")
        void braceDirectory() throws IOException {
            Path braced = Files.createDirectories(dir.resolve("run{A}"));
            Files.writeString(braced.resolve("g.fna"), ">g\nA\n");

            assertEquals(List.of("g.fna"), resolver.resolve(braced.toString()).fileNames());
        }

        @Test
        @DisplayName("Pattern below a braced directory uses it as the base")
        void patternUnderBracedDirectory() throws IOException {
            Path braced = Files.createDirectories(dir.resolve("run{A}"));
            Files.writeString(braced.resolve("g.fna"), ">g\nA\n");

            assertEquals(List.of("g.fna"), resolver.resolve(braced + "/*.fna").fileNames());
        }
    }
}
