package com.doks.git;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GitRepositoryManager {
    private static final Logger log = LoggerFactory.getLogger(GitRepositoryManager.class);

    private final GitCommandRunner gitCommandRunner;
    private final Path workRoot;

    public GitRepositoryManager() {
        this(Duration.ofMinutes(5), null);
    }

    public GitRepositoryManager(Duration cloneTimeout, Path workRoot) {
        this(new GitCommandRunner(cloneTimeout), workRoot);
    }

    GitRepositoryManager(GitCommandRunner gitCommandRunner, Path workRoot) {
        this.gitCommandRunner = gitCommandRunner;
        this.workRoot = workRoot;
    }

    public Path createWorkspace(RepositoryDescriptor repository) throws IOException {
        String prefix = "doks-" + workspacePrefix(repository.name()) + "-";
        if (workRoot == null) {
            return Files.createTempDirectory(prefix);
        }
        Files.createDirectories(workRoot);
        return Files.createTempDirectory(workRoot, prefix);
    }

    public void cloneInto(RepositoryDescriptor repository, Path destination) throws IOException, InterruptedException {
        log.info("Cloning repository '{}' into {}", repository.cloneUrl(), destination);
        List<String> command = new ArrayList<>(List.of("git", "clone", "--depth", "1"));
        if (repository.branch() != null && !repository.branch().isBlank()) {
            command.add("--branch");
            command.add(repository.branch());
            command.add("--single-branch");
        }
        command.add(repository.cloneUrl());
        command.add(destination.toString());
        runCommand(command.toArray(String[]::new));
        deleteRecursively(destination.resolve(".git"));
    }

    public void release(Path workspace) {
        try {
            deleteRecursively(workspace);
            log.debug("Deleted clone workspace {}", workspace);
        } catch (IOException e) {
            log.warn("Unable to delete clone workspace {}", workspace, e);
        }
    }

    String workspacePrefix(String repositoryName) {
        String baseName = repositoryName == null ? "" : repositoryName.strip();
        int slashIdx = Math.max(baseName.lastIndexOf('/'), baseName.lastIndexOf(':'));
        if (slashIdx >= 0 && slashIdx < baseName.length() - 1) {
            baseName = baseName.substring(slashIdx + 1);
        }
        if (baseName.endsWith(".git")) {
            baseName = baseName.substring(0, baseName.length() - 4);
        }
        baseName = baseName.replaceAll("[^A-Za-z0-9._-]", "-");
        return baseName.isBlank() ? "repo" : baseName;
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (exc instanceof NoSuchFileException) {
                    return FileVisitResult.CONTINUE;
                }
                throw exc;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private String runCommand(String... command) throws IOException, InterruptedException {
        GitCommandResult result = gitCommandRunner.run(null, command);
        if (result.interrupted()) {
            throw new InterruptedException("Command interrupted: " + String.join(" ", command));
        }
        if (!result.isSuccess()) {
            log.error("git command failed command='{}' exitCode={} timedOut={} stderr={}",
                    String.join(" ", command), result.exitCode(), result.timedOut(), result.stderr());
            throw new IOException("Command failed (" + String.join(" ", command) + ") " + result.describeFailure());
        }
        return result.stdout();
    }
}
