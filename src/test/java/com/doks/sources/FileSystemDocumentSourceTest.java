package com.doks.sources;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.doks.stream.StreamException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemDocumentSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReadMatchingFilesRecursively() throws Exception {
        Path top = write("notes.txt", "top level notes");
        Path nested = write("a/b/deep.txt", "deeply nested");
        write("a/image.png", "not text really");

        FileSystemDocumentSource source = new FileSystemDocumentSource("local", List.of(tempDir),
                PathFilter.compile(List.of("\\.txt$"), List.of()));

        List<Document> documents = source.fetch().toList();
        documents = documents.stream().sorted(Comparator.comparing(Document::id)).toList();

        assertEquals(2, documents.size());
        Document deep = documents.stream().filter(d -> d.id().equals(nested.toString())).findFirst().orElseThrow();
        assertEquals("local", deep.source());
        assertEquals("deep.txt", deep.title());
        assertEquals(nested.toString(), deep.link());
        assertEquals("deeply nested", deep.content());
        assertTrue(deep.metadata().isEmpty());
        assertTrue(documents.stream().anyMatch(d -> d.id().equals(top.toString())));
    }

    @Test
    void shouldApplyExcludesToFullPath() throws Exception {
        write("keep/readme.md", "keep me");
        write("vendor/readme.md", "skip me");

        FileSystemDocumentSource source = new FileSystemDocumentSource("local", List.of(tempDir),
                PathFilter.compile(List.of("\\.md$"), List.of("/vendor/")));

        List<Document> documents = source.fetch().toList();

        assertEquals(1, documents.size());
        assertEquals("keep me", documents.get(0).content());
    }

    @Test
    void shouldWalkEveryRoot() throws Exception {
        write("first/one.txt", "1");
        write("second/two.txt", "2");

        FileSystemDocumentSource source = new FileSystemDocumentSource("local",
                List.of(tempDir.resolve("first"), tempDir.resolve("second")), PathFilter.acceptAll());

        List<String> contents = source.fetch().toList().stream().map(Document::content).toList();

        assertEquals(List.of("1", "2"), contents);
    }

    @Test
    void shouldFailWhenRootDoesNotExist() {
        Path missing = tempDir.resolve("missing");
        FileSystemDocumentSource source = new FileSystemDocumentSource("local", List.of(missing), PathFilter.acceptAll());

        StreamException error = assertThrows(StreamException.class, () -> source.fetch().toList());

        assertTrue(error.getMessage().contains("missing"), error.getMessage());
    }

    @Test
    void shouldFailOnFilesThatAreNotUtf8() throws Exception {
        Path binary = tempDir.resolve("broken.txt");
        Files.write(binary, new byte[] { (byte) 0xC3, (byte) 0x28, (byte) 0xFF });
        FileSystemDocumentSource source = new FileSystemDocumentSource("local", List.of(tempDir), PathFilter.acceptAll());

        StreamException error = assertThrows(StreamException.class, () -> source.fetch().toList());

        assertInstanceOf(IOException.class, error.getCause());
        assertTrue(error.getMessage().contains("broken.txt"), error.getMessage());
    }

    @Test
    void shouldRejectBlankSourceId() {
        assertThrows(IllegalArgumentException.class,
                () -> new FileSystemDocumentSource(" ", List.of(tempDir), PathFilter.acceptAll()));
    }

    private Path write(String relative, String content) throws Exception {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
