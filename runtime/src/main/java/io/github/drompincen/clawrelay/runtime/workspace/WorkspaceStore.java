package io.github.drompincen.clawrelay.runtime.workspace;

import io.github.drompincen.clawrelay.runtime.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Owns the on-disk side of sessions: isolated directory trees and the credential blob that is
 * shared between them. The shared blob is only ever replaced whole (temp file + rename), so a
 * session being created concurrently never copies a half-written file.
 */
@Service
public class WorkspaceStore {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceStore.class);

    static final String CREDENTIAL_DIR = "opencode";
    static final String CREDENTIAL_FILE = "auth.json";

    private final Path workspaceBase;
    private final Path sharedCredentialFile;

    public WorkspaceStore(RelayProperties properties) {
        this.workspaceBase = properties.getWorkspaceBase();
        this.sharedCredentialFile = properties.getXdgDataHome().resolve(CREDENTIAL_DIR).resolve(CREDENTIAL_FILE);
    }

    public SessionPaths allocate(String sessionId) {
        SessionPaths paths = SessionPaths.under(workspaceBase, sessionId);
        try {
            Files.createDirectories(paths.workspace());
            Files.createDirectories(paths.data());
            Files.createDirectories(paths.logs());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create workspace for session " + sessionId, e);
        }
        log.debug("Allocated workspace {}", paths.root());
        return paths;
    }

    /** Recursively deletes a session tree. A tree that is already gone is not an error. */
    public void destroy(SessionPaths paths) {
        Path root = paths.root();
        if (root == null || !Files.exists(root)) {
            return;
        }
        try {
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
                    if (exc != null && !(exc instanceof NoSuchFileException)) {
                        throw exc;
                    }
                    Files.deleteIfExists(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
            log.debug("Removed workspace {}", root);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove workspace " + root, e);
        }
    }

    /**
     * Copies the shared credential blob into a fresh session's data directory.
     *
     * @return true if a blob existed and was copied
     */
    public boolean seedCredentials(SessionPaths paths) {
        if (!Files.isRegularFile(sharedCredentialFile)) {
            return false;
        }
        Path target = sessionCredentialFile(paths);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(sharedCredentialFile, target, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            log.warn("Could not copy shared credentials into {}: {}", paths.data(), e.getMessage());
            return false;
        }
    }

    /**
     * Replaces the shared credential blob with the session's copy.
     *
     * @return true if the session had a blob to publish
     */
    public boolean publishCredentials(SessionPaths paths) throws IOException {
        Path source = sessionCredentialFile(paths);
        if (!Files.isRegularFile(source)) {
            return false;
        }
        Path targetDir = sharedCredentialFile.getParent();
        Files.createDirectories(targetDir);
        Path temp = Files.createTempFile(targetDir, CREDENTIAL_FILE, ".tmp");
        try {
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            try {
                Files.move(temp, sharedCredentialFile,
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, sharedCredentialFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        return true;
    }

    public Path sharedCredentialFile() {
        return sharedCredentialFile;
    }

    public Path sessionCredentialFile(SessionPaths paths) {
        return paths.data().resolve(CREDENTIAL_DIR).resolve(CREDENTIAL_FILE);
    }

    public Path workspaceBase() {
        return workspaceBase;
    }
}
