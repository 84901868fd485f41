package net.convertcompress.application.apply;

import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

@Component
public class ApplyProgressTracker {

    private final AtomicReference<ApplyProgress> progress = new AtomicReference<>(ApplyProgress.IDLE);

    public ApplyProgress getProgress() {
        return progress.get();
    }

    void start(int total) {
        progress.set(new ApplyProgress(0, total, true));
    }

    void recordCompletion() {
        progress.updateAndGet(current -> current.running()
            ? new ApplyProgress(Math.min(current.completed() + 1, current.total()), current.total(), true)
            : current);
    }

    void reset() {
        progress.set(ApplyProgress.IDLE);
    }
}
