package net.convertcompress.application.estimate;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Handle for one estimation request. The result is cancelled when a newer request
 * supersedes it; otherwise it completes with the estimates that were merged.
 *
 * @param generation request sequence number, increasing per request
 * @param result estimates per asset id; assets that failed are absent
 */
public record EstimationTicket(long generation, CompletableFuture<Map<UUID, Long>> result) {
}
