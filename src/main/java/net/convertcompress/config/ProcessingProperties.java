package net.convertcompress.config;

import jakarta.annotation.PostConstruct;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the processing engine.
 */
@Component
@ConfigurationProperties(prefix = "convert-compress")
public class ProcessingProperties {

    private Concurrency concurrency = new Concurrency();
    private Estimation estimation = new Estimation();
    private Thumbnails thumbnails = new Thumbnails();
    private Destination destination = new Destination();
    private Encoding encoding = new Encoding();
    private Sandbox sandbox = new Sandbox();

    @PostConstruct
    void validate() {
        Assert.isTrue(concurrency.override >= 0, "convert-compress.concurrency.override must be non-negative");
        Assert.isTrue(concurrency.min >= 1, "convert-compress.concurrency.min must be at least 1");
        Assert.isTrue(concurrency.max >= concurrency.min,
            "convert-compress.concurrency.max must not be below convert-compress.concurrency.min");
        Assert.isTrue(concurrency.applyBoost >= 1.0, "convert-compress.concurrency.apply-boost must be at least 1.0");
        Assert.isTrue(estimation.batchSize >= 1, "convert-compress.estimation.batch-size must be at least 1");
        Assert.isTrue(estimation.debounce != null && !estimation.debounce.isNegative(),
            "convert-compress.estimation.debounce must be non-negative");
        Assert.isTrue(estimation.cacheSize > 0, "convert-compress.estimation.cache-size must be positive");
        Assert.isTrue(thumbnails.maxConcurrent >= 1, "convert-compress.thumbnails.max-concurrent must be at least 1");
        Assert.isTrue(thumbnails.maxSide >= 1, "convert-compress.thumbnails.max-side must be at least 1");
        Assert.isTrue(thumbnails.cacheSize > 0, "convert-compress.thumbnails.cache-size must be positive");
        Assert.isTrue(thumbnails.cacheTtl != null && !thumbnails.cacheTtl.isNegative(),
            "convert-compress.thumbnails.cache-ttl must be non-negative");
        Assert.isTrue(encoding.defaultLossyQuality > 0.0 && encoding.defaultLossyQuality <= 1.0,
            "convert-compress.encoding.default-lossy-quality must be in (0, 1]");
    }

    public Concurrency getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(Concurrency concurrency) {
        this.concurrency = concurrency;
    }

    public Estimation getEstimation() {
        return estimation;
    }

    public void setEstimation(Estimation estimation) {
        this.estimation = estimation;
    }

    public Thumbnails getThumbnails() {
        return thumbnails;
    }

    public void setThumbnails(Thumbnails thumbnails) {
        this.thumbnails = thumbnails;
    }

    public Destination getDestination() {
        return destination;
    }

    public void setDestination(Destination destination) {
        this.destination = destination;
    }

    public Encoding getEncoding() {
        return encoding;
    }

    public void setEncoding(Encoding encoding) {
        this.encoding = encoding;
    }

    public Sandbox getSandbox() {
        return sandbox;
    }

    public void setSandbox(Sandbox sandbox) {
        this.sandbox = sandbox;
    }

    public static class Concurrency {

        /**
         * Fixed concurrency target; zero derives it from the host.
         */
        private int override = 0;

        /**
         * Lower clamp for the derived target.
         */
        private int min = 2;

        /**
         * Upper clamp for the derived target.
         */
        private int max = 16;

        /**
         * Multiplier applied to the target for batch apply work.
         */
        private double applyBoost = 1.5;

        /**
         * Host is in a power saving mode; caps the derived target at the moderate ceiling.
         */
        private boolean lowPower = false;

        public boolean isLowPower() {
            return lowPower;
        }

        public void setLowPower(boolean lowPower) {
            this.lowPower = lowPower;
        }

        public int getOverride() {
            return override;
        }

        public void setOverride(int override) {
            this.override = override;
        }

        public int getMin() {
            return min;
        }

        public void setMin(int min) {
            this.min = min;
        }

        public int getMax() {
            return max;
        }

        public void setMax(int max) {
            this.max = max;
        }

        public double getApplyBoost() {
            return applyBoost;
        }

        public void setApplyBoost(double applyBoost) {
            this.applyBoost = applyBoost;
        }
    }

    public static class Estimation {

        /**
         * Assets estimated together before yielding.
         */
        private int batchSize = 4;

        /**
         * Quiet period before a settings-triggered estimation starts.
         */
        private Duration debounce = Duration.ofMillis(250);

        /**
         * Maximum number of cached estimates.
         */
        private int cacheSize = 5000;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getDebounce() {
            return debounce;
        }

        public void setDebounce(Duration debounce) {
            this.debounce = debounce;
        }

        public int getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = cacheSize;
        }
    }

    public static class Thumbnails {

        /**
         * Simultaneous thumbnail decodes.
         */
        private int maxConcurrent = 4;

        /**
         * Longest side of a generated thumbnail, in pixels.
         */
        private int maxSide = 256;

        private int cacheSize = 1000;

        private Duration cacheTtl = Duration.ofMinutes(15);

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public int getMaxSide() {
            return maxSide;
        }

        public void setMaxSide(int maxSide) {
            this.maxSide = maxSide;
        }

        public int getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(int cacheSize) {
            this.cacheSize = cacheSize;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    public static class Destination {

        /**
         * Where temp-sourced inputs (pasted, dragged) are written.
         */
        private Path downloadsDirectory = Path.of(System.getProperty("user.home"), "Downloads");

        /**
         * Root under which sources count as temporary.
         */
        private Path tempRoot = Path.of(System.getProperty("java.io.tmpdir"));

        public Path getDownloadsDirectory() {
            return downloadsDirectory;
        }

        public void setDownloadsDirectory(Path downloadsDirectory) {
            this.downloadsDirectory = downloadsDirectory;
        }

        public Path getTempRoot() {
            return tempRoot;
        }

        public void setTempRoot(Path tempRoot) {
            this.tempRoot = tempRoot;
        }
    }

    public static class Encoding {

        /**
         * Quality used for lossy formats when none is requested.
         */
        private double defaultLossyQuality = 0.9;

        public double getDefaultLossyQuality() {
            return defaultLossyQuality;
        }

        public void setDefaultLossyQuality(double defaultLossyQuality) {
            this.defaultLossyQuality = defaultLossyQuality;
        }
    }

    public static class Sandbox {

        /**
         * Restrict file access to registered directories and allowed roots.
         */
        private boolean enforce = false;

        private List<Path> allowedRoots = new ArrayList<>();

        public boolean isEnforce() {
            return enforce;
        }

        public void setEnforce(boolean enforce) {
            this.enforce = enforce;
        }

        public List<Path> getAllowedRoots() {
            return allowedRoots;
        }

        public void setAllowedRoots(List<Path> allowedRoots) {
            this.allowedRoots = allowedRoots;
        }
    }
}
