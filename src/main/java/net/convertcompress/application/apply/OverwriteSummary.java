package net.convertcompress.application.apply;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.util.List;
import net.convertcompress.util.PathUtils;

/**
 * Existing files a batch would overwrite, reported once before any processing starts.
 *
 * @param count number of colliding destinations
 * @param paths the colliding destinations
 * @param commonParent directory shared by every colliding path, when there is one
 */
public record OverwriteSummary(int count, List<Path> paths, @Nullable Path commonParent) {

    public OverwriteSummary {
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    static OverwriteSummary of(List<Path> collisions) {
        return new OverwriteSummary(collisions.size(), collisions, PathUtils.commonParent(collisions).orElse(null));
    }

    /** Confirmation prompt text, e.g. "3 files already exist in /photos and will be replaced." */
    public String describe() {
        String noun = count == 1 ? "file already exists" : "files already exist";
        if (commonParent != null) {
            return count + " " + noun + " in " + commonParent + " and will be replaced.";
        }
        return count + " " + noun + " and will be replaced.";
    }
}
