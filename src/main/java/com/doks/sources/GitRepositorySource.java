package com.doks.sources;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doks.git.GitRepositoryManager;
import com.doks.git.RepositoryDescriptor;
import com.doks.git.RepositoryLister;
import com.doks.stream.ChannelStream;

public class GitRepositorySource implements DocumentSource {
    private static final Logger log = LoggerFactory.getLogger(GitRepositorySource.class);

    private final String sourceId;
    private final RepositoryLister lister;
    private final PathFilter filter;
    private final GitRepositoryManager repositoryManager;

    public GitRepositorySource(String sourceId, RepositoryLister lister, PathFilter filter, GitRepositoryManager repositoryManager) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
        this.sourceId = sourceId;
        this.lister = lister;
        this.filter = filter;
        this.repositoryManager = repositoryManager;
    }

    @Override
    public String id() {
        return sourceId;
    }

    @Override
    public ChannelStream<Document> fetch() {
        return ChannelStream.open(sender -> {
            int repositories = 0;
            try (ChannelStream<RepositoryDescriptor> listed = lister.list()) {
                while (listed.hasNext()) {
                    RepositoryDescriptor repository = listed.next();
                    Path workspace = repositoryManager.createWorkspace(repository);
                    try {
                        cloneRepository(repository, workspace);
                        FileSystemDocumentSource files = new FileSystemDocumentSource(
                                sourceId, List.of(walkRoot(repository, workspace)), filter);
                        try (ChannelStream<Document> documents = files.fetch()) {
                            while (documents.hasNext()) {
                                sender.send(documents.next());
                            }
                        }
                        repositories++;
                    } finally {
                        repositoryManager.release(workspace);
                    }
                }
            }
            log.info("Source '{}' processed {} repositories", sourceId, repositories);
        });
    }

    private void cloneRepository(RepositoryDescriptor repository, Path workspace) throws IOException, InterruptedException {
        try {
            repositoryManager.cloneInto(repository, workspace);
        } catch (IOException e) {
            throw new IOException("Error while cloning repository '" + repository.name() + "' from "
                    + repository.cloneUrl() + ": " + e.getMessage(), e);
        }
    }

    private static Path walkRoot(RepositoryDescriptor repository, Path workspace) throws IOException {
        if (repository.folder() == null || repository.folder().isBlank()) {
            return workspace;
        }
        Path folder = workspace.resolve(repository.folder()).normalize();
        if (!folder.startsWith(workspace) || !Files.isDirectory(folder)) {
            throw new IOException("Folder '" + repository.folder() + "' not found in repository '" + repository.name() + "'");
        }
        return folder;
    }
}
