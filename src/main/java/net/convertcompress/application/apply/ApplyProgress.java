package net.convertcompress.application.apply;

/**
 * Progress of the running batch; {@link #IDLE} between batches.
 */
public record ApplyProgress(int completed, int total, boolean running) {

    public static final ApplyProgress IDLE = new ApplyProgress(0, 0, false);

    /** Completed share in {@code [0, 1]}; zero while idle. */
    public double fraction() {
        if (total <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) completed / total);
    }
}
