package net.convertcompress.exception;

/**
 * Failure kinds surfaced by a single asset's pipeline run.
 */
public enum ProcessingFailure {
    LOAD_FAILED,
    TRANSFORM_FAILED,
    BACKGROUND_REMOVAL_UNAVAILABLE,
    EXPORT_FAILED,
    PERMISSION_DENIED
}
