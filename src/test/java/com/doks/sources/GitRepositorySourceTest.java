package com.doks.sources;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.doks.git.GitRepositoryManager;
import com.doks.git.RepositoryDescriptor;
import com.doks.git.StaticRepositoryLister;
import com.doks.stream.ChannelStream;
import com.doks.stream.StreamException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GitRepositorySourceTest {

    @TempDir
    Path workRoot;

    @Test
    void shouldEmitFilteredDocumentsOfEveryRepository() throws Exception {
        FakeRepositoryManager manager = new FakeRepositoryManager(workRoot);
        manager.files("org/alpha", Map.of("README.md", "alpha readme", "src/Main.java", "class Main {}"));
        manager.files("org/beta", Map.of("docs/guide.md", "beta guide"));
        GitRepositorySource source = new GitRepositorySource("github",
                new StaticRepositoryLister(List.of(repository("org/alpha"), repository("org/beta"))),
                PathFilter.compile(List.of("\\.md$"), List.of()),
                manager);

        List<Document> documents = source.fetch().toList();

        assertEquals(List.of("alpha readme", "beta guide"), documents.stream().map(Document::content).toList());
        assertEquals(List.of("README.md", "guide.md"), documents.stream().map(Document::title).toList());
        assertTrue(documents.stream().allMatch(document -> document.source().equals("github")));
        assertEquals(List.of("org/alpha", "org/beta"), manager.cloned);
        assertWorkspacesDeleted();
    }

    @Test
    void shouldOnlyWalkConfiguredFolder() throws Exception {
        FakeRepositoryManager manager = new FakeRepositoryManager(workRoot);
        manager.files("org/alpha", Map.of("README.md", "top", "docs/inside.md", "inside"));
        RepositoryDescriptor withFolder = new RepositoryDescriptor("org/alpha", "https://github.com/org/alpha.git", null, "docs");
        GitRepositorySource source = new GitRepositorySource("github",
                new StaticRepositoryLister(List.of(withFolder)), PathFilter.acceptAll(), manager);

        List<Document> documents = source.fetch().toList();

        assertEquals(1, documents.size());
        assertEquals("inside", documents.get(0).content());
    }

    @Test
    void shouldFailWithoutDocumentsWhenFirstCloneFails() throws Exception {
        FakeRepositoryManager manager = new FakeRepositoryManager(workRoot);
        manager.failing("org/missing");
        manager.files("org/beta", Map.of("README.md", "beta"));
        GitRepositorySource source = new GitRepositorySource("github",
                new StaticRepositoryLister(List.of(repository("org/missing"), repository("org/beta"))),
                PathFilter.acceptAll(), manager);

        ChannelStream<Document> documents = source.fetch();

        assertTrue(documents.hasNext());
        StreamException error = assertThrows(StreamException.class, documents::next);
        assertInstanceOf(IOException.class, error.getCause());
        assertTrue(error.getMessage().contains("org/missing"), error.getMessage());
        assertTrue(error.getMessage().contains("https://github.com/org/missing.git"), error.getMessage());
        assertEquals(List.of("org/missing"), manager.cloned);
        assertWorkspacesDeleted();
    }

    @Test
    void shouldEmitEarlierRepositoriesBeforeCloneFailure() throws Exception {
        FakeRepositoryManager manager = new FakeRepositoryManager(workRoot);
        manager.files("org/alpha", Map.of("README.md", "alpha"));
        manager.failing("org/broken");
        GitRepositorySource source = new GitRepositorySource("github",
                new StaticRepositoryLister(List.of(repository("org/alpha"), repository("org/broken"))),
                PathFilter.acceptAll(), manager);

        List<String> contents = new ArrayList<>();
        StreamException error = null;
        try (ChannelStream<Document> documents = source.fetch()) {
            while (documents.hasNext()) {
                try {
                    contents.add(documents.next().content());
                } catch (StreamException e) {
                    error = e;
                }
            }
        }

        assertEquals(List.of("alpha"), contents);
        assertNotNull(error);
        assertTrue(error.getMessage().contains("org/broken"), error.getMessage());
        assertWorkspacesDeleted();
    }

    @Test
    void shouldFailWhenConfiguredFolderIsMissing() throws Exception {
        FakeRepositoryManager manager = new FakeRepositoryManager(workRoot);
        manager.files("org/alpha", Map.of("README.md", "top"));
        RepositoryDescriptor withFolder = new RepositoryDescriptor("org/alpha", "https://github.com/org/alpha.git", null, "nope");
        GitRepositorySource source = new GitRepositorySource("github",
                new StaticRepositoryLister(List.of(withFolder)), PathFilter.acceptAll(), manager);

        StreamException error = assertThrows(StreamException.class, () -> source.fetch().toList());

        assertTrue(error.getMessage().contains("nope"), error.getMessage());
        assertWorkspacesDeleted();
    }

    private void assertWorkspacesDeleted() throws IOException {
        try (Stream<Path> remaining = Files.list(workRoot)) {
            assertEquals(List.of(), remaining.toList());
        }
    }

    private static RepositoryDescriptor repository(String name) {
        return new RepositoryDescriptor(name, "https://github.com/" + name + ".git");
    }

    private static final class FakeRepositoryManager extends GitRepositoryManager {
        private final Map<String, Map<String, String>> contents = new LinkedHashMap<>();
        private final List<String> failures = new ArrayList<>();
        private final List<String> cloned = new ArrayList<>();

        private FakeRepositoryManager(Path workRoot) {
            super(Duration.ofSeconds(1), workRoot);
        }

        private void files(String repository, Map<String, String> files) {
            contents.put(repository, files);
        }

        private void failing(String repository) {
            failures.add(repository);
        }

        @Override
        public void cloneInto(RepositoryDescriptor repository, Path destination) throws IOException {
            cloned.add(repository.name());
            if (failures.contains(repository.name())) {
                throw new IOException("fatal: repository '" + repository.cloneUrl() + "' not found");
            }
            for (Map.Entry<String, String> file : contents.getOrDefault(repository.name(), Map.of()).entrySet()) {
                Path target = destination.resolve(file.getKey());
                Files.createDirectories(target.getParent());
                Files.writeString(target, file.getValue());
            }
        }
    }
}
