package com.doks.sources;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doks.stream.ChannelStream;

public class FileSystemDocumentSource implements DocumentSource {
    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentSource.class);

    private final String sourceId;
    private final List<Path> roots;
    private final PathFilter filter;

    public FileSystemDocumentSource(String sourceId, List<Path> roots, PathFilter filter) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
        this.sourceId = sourceId;
        this.roots = List.copyOf(roots);
        this.filter = filter;
    }

    @Override
    public String id() {
        return sourceId;
    }

    @Override
    public ChannelStream<Document> fetch() {
        return ChannelStream.open(sender -> {
            for (Path root : roots) {
                log.info("Walking '{}' for source '{}'", root, sourceId);
                int accepted = 0;
                try (Stream<Path> paths = Files.walk(root)) {
                    Iterator<Path> iterator = paths.iterator();
                    while (hasNext(iterator, root)) {
                        Path file = iterator.next();
                        if (!Files.isRegularFile(file)) {
                            continue;
                        }
                        String path = file.toString();
                        if (!filter.accepts(path)) {
                            log.trace("Skipping '{}', rejected by {}", path, filter);
                            continue;
                        }
                        sender.send(read(file, path));
                        accepted++;
                    }
                }
                log.info("Finished walking '{}' for source '{}' documents={}", root, sourceId, accepted);
            }
        });
    }

    private Document read(Path file, String path) throws IOException {
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new IOException("Unable to read file '" + path + "': " + e.getMessage(), e);
        }
        Path fileName = file.getFileName();
        String title = fileName == null ? path : fileName.toString();
        return new Document(path, sourceId, title, path, content, Map.of());
    }

    private static boolean hasNext(Iterator<Path> iterator, Path root) throws IOException {
        try {
            return iterator.hasNext();
        } catch (UncheckedIOException e) {
            throw new IOException("Error while walking '" + root + "': " + e.getCause().getMessage(), e.getCause());
        }
    }

    @Override
    public String toString() {
        return "FileSystemDocumentSource{" +
                "sourceId='" + sourceId + '\'' +
                ", roots=" + roots +
                ", filter=" + filter +
                '}';
    }
}
