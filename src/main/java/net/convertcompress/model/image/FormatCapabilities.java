package net.convertcompress.model.image;

import java.util.Set;

/**
 * Immutable capability row for one format in the process-wide capability table.
 *
 * @param readable the codec can decode this format
 * @param writable the codec can encode this format
 * @param supportsQuality encoding honours a lossy quality setting
 * @param supportsLossless encoding is lossless
 * @param supportsAlpha the format keeps an alpha channel
 * @param supportsMetadata metadata entries survive encoding
 * @param allowedSquareSides permitted square sides, empty when any size is allowed
 */
public record FormatCapabilities(
    boolean readable,
    boolean writable,
    boolean supportsQuality,
    boolean supportsLossless,
    boolean supportsAlpha,
    boolean supportsMetadata,
    Set<Integer> allowedSquareSides
) {

    public static final FormatCapabilities NONE =
        new FormatCapabilities(false, false, false, false, false, false, Set.of());

    public FormatCapabilities {
        allowedSquareSides = allowedSquareSides == null ? Set.of() : Set.copyOf(allowedSquareSides);
    }

    public boolean isSizeRestricted() {
        return !allowedSquareSides.isEmpty();
    }
}
