package net.convertcompress.model;

import java.nio.file.Path;

/**
 * Where an asset's output will be written. Computed, never persisted.
 *
 * @param path full destination path
 * @param directory directory containing {@code path}
 * @param filenameStem file name without extension
 * @param extension extension without the dot
 */
public record DestinationPlan(Path path, Path directory, String filenameStem, String extension) {
}
