package net.convertcompress.application.apply;

public enum BatchApplyStatus {
    /** The batch ran; individual assets may still have failed. */
    COMPLETED,
    /** Nothing to process. */
    NO_TARGETS,
    /** The user declined to overwrite existing files; nothing was processed. */
    DECLINED,
    /** Another batch was already running. */
    REJECTED_BUSY
}
