package com.agentrooms.auth;

import com.agentrooms.shared.model.ClaudeAuth;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * The {@code claudeAiOauth} credentials file shared with the Claude Code CLI.
 * Files are always created owner-only and replaced by an atomic move, so a
 * reader never sees a partially written file. Requests that bring their own
 * tokens get a private file next to the shared one.
 */
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);
    private static final Duration EXPIRY_MARGIN = Duration.ofMinutes(5);
    private static final FileAttribute<Set<PosixFilePermission>> OWNER_ONLY =
            PosixFilePermissions.asFileAttribute(PosixFilePermissions.fromString("rw-------"));

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    public CredentialStore(Path path) {
        this(path, Clock.systemUTC());
    }

    public CredentialStore(Path path, Clock clock) {
        this.path = path;
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    public Optional<ClaudeAuth> read() {
        if (!Files.isRegularFile(path)) return Optional.empty();
        try {
            var node = mapper.readTree(path.toFile()).path("claudeAiOauth");
            if (!node.isObject()) return Optional.empty();
            return Optional.of(mapper.treeToValue(node, ClaudeAuth.class));
        } catch (IOException e) {
            log.debug("Unreadable credentials file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    public boolean hasValidCredentials() {
        return read().filter(auth -> isValid(auth, clock.millis())).isPresent();
    }

    public static boolean isValid(ClaudeAuth auth, long nowMillis) {
        return auth.hasAccessToken()
                && auth.expiresAt() != null
                && auth.expiresAt() > nowMillis + EXPIRY_MARGIN.toMillis();
    }

    public boolean isCurrent(ClaudeAuth auth) {
        return auth != null && isValid(auth, clock.millis());
    }

    public synchronized void write(ClaudeAuth auth) throws IOException {
        var tmp = createOwnerOnly(".credentials-", ".tmp");
        try {
            Files.writeString(tmp, render(auth));
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Wrote credentials to {} (token {})", path, ClaudeAuth.mask(auth.accessToken()));
    }

    /**
     * Writes {@code auth} to a new owner-only file beside the shared one. The
     * caller owns the file and removes it with {@link #discard(Path)}.
     */
    public Path writeForRequest(String requestId, ClaudeAuth auth) throws IOException {
        var file = createOwnerOnly(stem() + "-" + requestId.replaceAll("[^A-Za-z0-9._-]", "_") + "-", ".json");
        try {
            Files.writeString(file, render(auth));
        } catch (IOException e) {
            Files.deleteIfExists(file);
            throw e;
        }
        log.debug("Wrote request credentials to {} (token {})", file, ClaudeAuth.mask(auth.accessToken()));
        return file;
    }

    public void discard(Path file) {
        if (file == null || file.equals(path)) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete request credentials {}: {}", file, e.getMessage());
        }
    }

    private String render(ClaudeAuth auth) throws IOException {
        var root = mapper.createObjectNode();
        root.set("claudeAiOauth", mapper.valueToTree(auth));
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    private Path createOwnerOnly(String prefix, String suffix) throws IOException {
        var dir = path.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        if (dir.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return Files.createTempFile(dir, prefix, suffix, OWNER_ONLY);
        }
        log.debug("POSIX permissions not supported for {}", dir);
        return Files.createTempFile(dir, prefix, suffix);
    }

    private String stem() {
        var name = path.getFileName().toString();
        var dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
