package net.convertcompress.processing.operation;

import net.convertcompress.codec.ImageCodec;
import net.convertcompress.service.format.FormatCapabilityResolver;

/**
 * Collaborators available to operations while a pipeline runs.
 */
public record OperationContext(ImageCodec codec, FormatCapabilityResolver formats) {
}
