package net.convertcompress.support.sandbox;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.config.ProcessingProperties;
import net.convertcompress.exception.PermissionDeniedException;
import net.convertcompress.util.PathUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Registry of scoped file access.
 *
 * <p>Every source read and destination-directory write acquires a {@link ScopedAccessToken}.
 * Tokens are re-entrant: the same path may be held by any number of workers at once and
 * the registry keeps a reference count per path. When enforcement is enabled access is
 * granted only beneath directories registered at ingestion or configured as allowed
 * roots; otherwise every path is granted and only the bookkeeping runs.</p>
 */
@Slf4j
@Component
public class SandboxAccessManager {

    private final boolean enforce;
    private final Set<Path> grantedRoots = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<Path, Integer> activeTokens = new ConcurrentHashMap<>();

    @Autowired
    public SandboxAccessManager(ProcessingProperties properties) {
        this(properties.getSandbox().isEnforce(), properties.getSandbox().getAllowedRoots());
    }

    public SandboxAccessManager(boolean enforce, List<Path> allowedRoots) {
        this.enforce = enforce;
        if (allowedRoots != null) {
            allowedRoots.forEach(root -> grantedRoots.add(normalize(root)));
        }
    }

    /**
     * Acquires access to {@code path}.
     *
     * @throws PermissionDeniedException when enforcement is on and the path is outside every granted root
     */
    public ScopedAccessToken acquire(Path path) {
        Path normalized = normalize(path);
        if (!isPermitted(normalized)) {
            log.warn("Scoped access denied for {}", normalized);
            throw new PermissionDeniedException(normalized);
        }
        activeTokens.merge(normalized, 1, Integer::sum);
        return new ScopedAccessToken(normalized, this);
    }

    /**
     * Records the directory containing {@code path} (or the path itself for directories) as
     * granted, the way a user-selected file grants its folder.
     */
    public void register(Path path) {
        Path normalized = normalize(path);
        Path root = Files.isDirectory(normalized) ? normalized : PathUtils.parentDirectory(normalized);
        if (root != null && grantedRoots.add(root)) {
            log.debug("Registered scoped access root {}", root);
        }
    }

    /** Probes access to a directory, releasing the probe token immediately. */
    public boolean canAccess(Path directory) {
        if (!isPermitted(normalize(directory))) {
            return false;
        }
        try (ScopedAccessToken ignored = acquire(directory)) {
            return true;
        }
    }

    /** Number of unreleased tokens currently held for {@code path}. */
    public int activeTokenCount(Path path) {
        return activeTokens.getOrDefault(normalize(path), 0);
    }

    public int totalActiveTokens() {
        return activeTokens.values().stream().mapToInt(Integer::intValue).sum();
    }

    void release(Path normalized) {
        activeTokens.computeIfPresent(normalized, (key, count) -> count <= 1 ? null : count - 1);
    }

    private boolean isPermitted(Path normalized) {
        if (!enforce) {
            return true;
        }
        for (Path root : grantedRoots) {
            if (PathUtils.isUnder(normalized, root)) {
                return true;
            }
        }
        return false;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
