package net.convertcompress.application.apply;

import java.util.List;
import net.convertcompress.model.ImageAsset;

/**
 * Outcome of one batch apply request.
 *
 * @param status how the request ended
 * @param total assets targeted
 * @param succeeded assets committed
 * @param failed assets left unchanged because their pipeline failed
 * @param updatedAssets new records for the committed assets
 */
public record BatchApplyResult(
    BatchApplyStatus status,
    int total,
    int succeeded,
    int failed,
    List<ImageAsset> updatedAssets
) {

    public BatchApplyResult {
        updatedAssets = updatedAssets == null ? List.of() : List.copyOf(updatedAssets);
    }

    static BatchApplyResult notStarted(BatchApplyStatus status, int total) {
        return new BatchApplyResult(status, total, 0, 0, List.of());
    }

    static BatchApplyResult completed(int total, List<ImageAsset> updated) {
        return new BatchApplyResult(BatchApplyStatus.COMPLETED, total, updated.size(), total - updated.size(), updated);
    }
}
