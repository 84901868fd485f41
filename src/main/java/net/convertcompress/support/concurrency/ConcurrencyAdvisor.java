package net.convertcompress.support.concurrency;

import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.config.ProcessingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Derives how many heavy units of work to run at once.
 *
 * <p>Starts from twice the processor count within {@code [2, 16]}, then caps it at 8
 * under moderate memory, power or CPU pressure and at 4 under severe pressure, and
 * finally clamps into the configured {@code [min, max]} range. Power saving comes from
 * {@code convert-compress.concurrency.low-power}. A positive override replaces the
 * heuristic entirely.</p>
 */
@Slf4j
@Component
public class ConcurrencyAdvisor {

    private static final long GIB = 1024L * 1024L * 1024L;
    private static final int BASELINE_MIN = 2;
    private static final int BASELINE_MAX = 16;
    private static final int MODERATE_CEILING = 8;
    private static final int SEVERE_CEILING = 4;

    private final ProcessingProperties.Concurrency settings;
    private final Supplier<SystemConditions> conditions;

    @Autowired
    public ConcurrencyAdvisor(ProcessingProperties properties) {
        this(properties.getConcurrency(), () -> SystemConditions.current(properties.getConcurrency().isLowPower()));
    }

    public ConcurrencyAdvisor(ProcessingProperties.Concurrency settings, Supplier<SystemConditions> conditions) {
        this.settings = settings;
        this.conditions = conditions;
    }

    /** Target for estimation and other unboosted work. */
    public int recommendedConcurrency() {
        if (settings.getOverride() > 0) {
            return settings.getOverride();
        }
        SystemConditions current = conditions.get();
        int recommended = recommend(current, settings.getMin(), settings.getMax());
        log.debug("Recommended concurrency {} for {}", recommended, current);
        return recommended;
    }

    /** Target for batch apply, boosted because export work overlaps well with I/O. */
    public int applyConcurrency() {
        if (settings.getOverride() > 0) {
            return settings.getOverride();
        }
        int recommended = recommendedConcurrency();
        return Math.max(recommended, (int) Math.round(recommended * settings.getApplyBoost()));
    }

    static int recommend(SystemConditions conditions, int min, int max) {
        int target = Math.min(BASELINE_MAX, Math.max(BASELINE_MIN, conditions.processors() * 2));
        if (conditions.physicalMemoryBytes() < 4 * GIB) {
            target = Math.min(target, SEVERE_CEILING);
        } else if (conditions.physicalMemoryBytes() < 8 * GIB) {
            target = Math.min(target, MODERATE_CEILING);
        }
        if (conditions.lowPower()) {
            target = Math.min(target, MODERATE_CEILING);
        }
        switch (conditions.pressure()) {
            case MODERATE -> target = Math.min(target, MODERATE_CEILING);
            case SEVERE -> target = Math.min(target, SEVERE_CEILING);
            default -> {
            }
        }
        return Math.max(min, Math.min(max, target));
    }
}
