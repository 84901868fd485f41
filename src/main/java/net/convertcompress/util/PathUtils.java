package net.convertcompress.util;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Path helpers that never touch the filesystem.
 */
public final class PathUtils {

    public static final String TEMP_MARKER = "_tmp_";

    private PathUtils() {
    }

    /** File name without its last extension; dot-files keep their full name. */
    public static String stem(Path path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** Lower-case extension without the dot, or an empty string. */
    public static String extension(Path path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String fileName(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        return path.getFileName().toString();
    }

    /**
     * Parent directory of a path, falling back to the absolute form's parent for bare names.
     */
    public static Path parentDirectory(Path path) {
        Path parent = path.getParent();
        return parent != null ? parent : path.toAbsolutePath().getParent();
    }

    /**
     * Whether {@code candidate} lies under {@code root} once both are normalized.
     */
    public static boolean isUnder(Path candidate, Path root) {
        if (candidate == null || root == null) {
            return false;
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedCandidate = candidate.toAbsolutePath().normalize();
        return normalizedCandidate.startsWith(normalizedRoot);
    }

    /**
     * Unique scratch file name next to a final output: {@code <stem>_tmp_<8 hex>.<ext>}.
     */
    public static Path temporarySibling(Path directory, String stem, String extension) {
        String token = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return directory.resolve(stem + TEMP_MARKER + token + "." + extension);
    }

    /** Whether a file name looks like one produced by {@link #temporarySibling}. */
    public static boolean isTemporarySibling(Path path) {
        return fileName(path).contains(TEMP_MARKER);
    }

    public static boolean isHidden(Path path) {
        return fileName(path).startsWith(".");
    }

    /**
     * Parent directory shared by every path, when all of them share the same immediate parent.
     */
    public static Optional<Path> commonParent(Collection<Path> paths) {
        if (paths == null || paths.isEmpty()) {
            return Optional.empty();
        }
        Iterator<Path> iterator = paths.iterator();
        Path first = parentDirectory(iterator.next()).normalize();
        while (iterator.hasNext()) {
            Path next = parentDirectory(iterator.next()).normalize();
            if (!first.equals(next)) {
                return Optional.empty();
            }
        }
        return Optional.of(first);
    }
}
