package com.pagewright.core.build;

import java.time.Duration;
import java.util.Objects;

/**
 * Counts collected during a build.
 *
 * @param rendered pages rendered through the template engine
 * @param copied files copied or linked
 * @param skipped draft pages skipped in a release build
 * @param unchanged entries pruned by the build manifest
 * @param failed entries that raised an error
 * @param indexed pages whose text went to the search index
 * @param elapsed wall clock time
 */
public record BuildReport(
    int rendered,
    int copied,
    int skipped,
    int unchanged,
    int failed,
    int indexed,
    Duration elapsed
) {
    public BuildReport {
        Objects.requireNonNull(elapsed, "elapsed must not be null");
    }

    public static BuildReport empty() {
        return new BuildReport(0, 0, 0, 0, 0, 0, Duration.ZERO);
    }

    /**
     * Adds the counts of another pass.
     *
     * @param other report of another collation pass
     * @return combined report
     */
    public BuildReport merge(BuildReport other) {
        return new BuildReport(
            rendered + other.rendered,
            copied + other.copied,
            skipped + other.skipped,
            unchanged + other.unchanged,
            failed + other.failed,
            indexed + other.indexed,
            elapsed.plus(other.elapsed)
        );
    }

    public BuildReport withElapsed(Duration value) {
        return new BuildReport(rendered, copied, skipped, unchanged, failed, indexed, value);
    }

    /**
     * Returns a human-readable summary of the build.
     *
     * @return summary string
     */
    public String getSummary() {
        return String.format(
            "Rendered: %d, Copied: %d, Drafts skipped: %d, Unchanged: %d, Failed: %d (%d ms)",
            rendered, copied, skipped, unchanged, failed, elapsed.toMillis());
    }

    /**
     * Accumulates counts while a pass runs. Not thread safe; the scheduler feeds it from one thread.
     */
    public static class Builder {
        private int rendered;
        private int copied;
        private int skipped;
        private int unchanged;
        private int failed;
        private int indexed;

        public Builder incrementRendered() {
            this.rendered++;
            return this;
        }

        public Builder incrementCopied() {
            this.copied++;
            return this;
        }

        public Builder incrementSkipped() {
            this.skipped++;
            return this;
        }

        public Builder incrementUnchanged() {
            this.unchanged++;
            return this;
        }

        public Builder incrementFailed() {
            this.failed++;
            return this;
        }

        public Builder incrementIndexed() {
            this.indexed++;
            return this;
        }

        public BuildReport build(Duration elapsed) {
            return new BuildReport(rendered, copied, skipped, unchanged, failed, indexed, elapsed);
        }
    }
}
