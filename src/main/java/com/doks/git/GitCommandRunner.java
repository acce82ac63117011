package com.doks.git;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.doks.stream.NamedThreadFactory;

public class GitCommandRunner {
    private static final Logger log = LoggerFactory.getLogger(GitCommandRunner.class);

    private static final int TIMEOUT_EXIT_CODE = 124;
    private static final int INTERRUPTED_EXIT_CODE = 130;
    private static final int LAUNCH_FAILURE_EXIT_CODE = 127;
    static final Duration OUTPUT_GRACE = Duration.ofSeconds(2);
    private static final ExecutorService OUTPUT_READERS =
            Executors.newCachedThreadPool(new NamedThreadFactory("doks-git-output"));

    private final Duration timeout;
    private final ProcessStarter processStarter;

    public GitCommandRunner(Duration timeout) {
        this(timeout, new DefaultProcessStarter());
    }

    GitCommandRunner(Duration timeout, ProcessStarter processStarter) {
        this.timeout = timeout;
        this.processStarter = processStarter;
    }

    public GitCommandResult run(Path workingDirectory, String... command) {
        log.debug("Running '{}' in {}", String.join(" ", command), workingDirectory == null ? "." : workingDirectory);
        Process process;
        try {
            process = processStarter.start(workingDirectory, command);
        } catch (IOException e) {
            return new GitCommandResult(LAUNCH_FAILURE_EXIT_CODE, "", e.getMessage(), false, false, true);
        }

        CompletableFuture<String> stdoutFuture = drain(process.getInputStream());
        CompletableFuture<String> stderrFuture = drain(process.getErrorStream());

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                destroyTree(process);
                return new GitCommandResult(TIMEOUT_EXIT_CODE, collect(stdoutFuture), collect(stderrFuture), true, false, false);
            }
            return new GitCommandResult(process.exitValue(), collect(stdoutFuture), collect(stderrFuture), false, false, false);
        } catch (InterruptedException e) {
            destroyTree(process);
            Thread.currentThread().interrupt();
            return new GitCommandResult(INTERRUPTED_EXIT_CODE, collect(stdoutFuture), collect(stderrFuture), false, true, false);
        }
    }

    // helpers such as git-remote-https inherit the pipes, so they must die with git
    private static void destroyTree(Process process) {
        try {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
        } catch (UnsupportedOperationException e) {
            log.debug("Process does not expose its descendants, destroying it alone");
        }
        process.destroyForcibly();
    }

    // output still held open by a stray child must not block past the grace period
    private static String collect(CompletableFuture<String> output) {
        return output.completeOnTimeout("", OUTPUT_GRACE.toMillis(), TimeUnit.MILLISECONDS).join();
    }

    private CompletableFuture<String> drain(InputStream inputStream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = inputStream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.debug("Unable to read git process output", e);
                return "";
            }
        }, OUTPUT_READERS);
    }

    interface ProcessStarter {
        Process start(Path workingDirectory, String... command) throws IOException;
    }

    private static final class DefaultProcessStarter implements ProcessStarter {
        @Override
        public Process start(Path workingDirectory, String... command) throws IOException {
            ProcessBuilder builder = new ProcessBuilder(command)
                    .directory(workingDirectory == null ? null : workingDirectory.toFile());
            // never block on a credential prompt
            builder.environment().put("GIT_TERMINAL_PROMPT", "0");
            return builder.start();
        }
    }

    @Override
    public String toString() {
        return "GitCommandRunner{" +
                "timeout=" + timeout +
                ", processStarter=" + processStarter.getClass().getSimpleName() +
                '}';
    }
}
