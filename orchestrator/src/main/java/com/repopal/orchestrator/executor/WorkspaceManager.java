package com.repopal.orchestrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Allocates and removes per-execution workspace directories under a quota-bound root.
 */
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final Path root;
    private final long maxBytes;

    public WorkspaceManager(Path root, long maxBytes) {
        this.root     = root;
        this.maxBytes = maxBytes;
    }

    /**
     * Create a fresh, uniquely named, empty directory.
     *
     * @throws ExecutorException kind FATAL if the root is over quota, the name collides,
     *                           or the directory cannot be created
     */
    public Workspace allocate(UUID pipelineId) {
        String name = "ws-" + pipelineId + "-" + UUID.randomUUID().toString().substring(0, 8);
        try {
            Files.createDirectories(root);
            long used = sizeOf(root);
            if (used >= maxBytes) {
                throw new ExecutorException(ExecutorException.Kind.FATAL,
                        "Workspace quota exceeded: %d of %d bytes in use under %s".formatted(used, maxBytes, root));
            }
            Path dir = Files.createDirectory(root.resolve(name));
            log.info("Allocated workspace {}", dir);
            return new Workspace(name, dir);
        } catch (FileAlreadyExistsException e) {
            throw new ExecutorException(ExecutorException.Kind.FATAL, "Workspace name collision: " + name, e);
        } catch (IOException | UncheckedIOException e) {
            throw new ExecutorException(ExecutorException.Kind.FATAL, "Could not allocate workspace " + name, e);
        }
    }

    /** Total size in bytes of the regular files under {@code path}; 0 if it does not exist. */
    public long sizeOf(Path path) throws IOException {
        if (!Files.exists(path)) return 0;
        try (Stream<Path> files = Files.walk(path)) {
            return files.filter(Files::isRegularFile)
                    .mapToLong(WorkspaceManager::fileSize)
                    .sum();
        }
    }

    /**
     * Remove the workspace directory and everything in it.
     *
     * @throws IOException if anything is left behind
     */
    public void delete(Workspace workspace) throws IOException {
        Path dir = workspace.dir();
        if (!Files.exists(dir)) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        log.info("Deleted workspace {}", dir);
    }


    private static long fileSize(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            // Deleted between walk and stat.
            return 0;
        }
    }
}
