package com.pagewright.core.build;

import com.pagewright.core.collation.Collation;
import com.pagewright.core.collation.Collator;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.walk.DirectoryWalker;
import com.pagewright.core.walk.FileTreeWalker;
import com.pagewright.core.walk.SourceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds a site whenever its source tree changes.
 *
 * <p>The source root is probed at a fixed interval and compared with the previous probe. Changed
 * pages and files are patched into the live collations and only they are rebuilt. A change under
 * an excluded directory (layouts, partials and the like) can affect any page, so it re-collates
 * the site and rebuilds everything with the manifest ignored.
 *
 * <p>Build failures are logged and the watch goes on; the next change retries.
 */
public class SiteWatcher {

    private static final Logger log = LoggerFactory.getLogger(SiteWatcher.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(500);

    private final SiteBuilder builder;
    private final DirectoryWalker walker;
    private final Duration interval;

    private Map<String, Collation> collations;
    private SourceSnapshot snapshot = SourceSnapshot.empty();

    public SiteWatcher(SiteBuilder builder, Duration interval) {
        this(builder, new FileTreeWalker(builder.options().config().build().followLinks()), interval);
    }

    public SiteWatcher(SiteBuilder builder, DirectoryWalker walker, Duration interval) {
        this.builder = builder;
        this.walker = walker;
        this.interval = interval == null || interval.isNegative() || interval.isZero()
            ? DEFAULT_INTERVAL
            : interval;
    }

    public Duration interval() {
        return interval;
    }

    /**
     * Runs the initial build and records the first snapshot.
     *
     * @return report of the initial build
     */
    public BuildReport start() {
        snapshot = SourceSnapshot.take(walker, options().source());
        collations = builder.collate();
        return builder.build(collations, BuildScope.all());
    }

    /**
     * Probes until the calling thread is interrupted.
     *
     * @throws InterruptedException when the watch is stopped
     */
    public void run() throws InterruptedException {
        log.info("Watching {} every {} ms", options().source(), interval.toMillis());
        while (!Thread.currentThread().isInterrupted()) {
            Thread.sleep(interval.toMillis());
            try {
                poll().ifPresent(report -> log.info("Rebuilt: {}", report.getSummary()));
            } catch (BuildException e) {
                log.error("Rebuild failed: {}", e.getMessage());
                log.debug("Rebuild failure", e);
            }
        }
    }

    /**
     * Probes the source tree once and rebuilds what changed.
     *
     * @return report when anything was rebuilt
     * @throws BuildException if the rebuild fails; the next poll starts from a fresh collation
     */
    public Optional<BuildReport> poll() {
        SourceSnapshot current = SourceSnapshot.take(walker, options().source());
        SourceSnapshot.Changes changes = current.since(snapshot);
        snapshot = current;
        if (changes.isEmpty()) {
            return Optional.empty();
        }
        log.info("Detected {} modified and {} removed file(s)", changes.modified().size(), changes.removed().size());

        try {
            if (collations == null || changes.all().stream().anyMatch(this::isExcluded)) {
                return Optional.of(rebuildAll());
            }
            return Optional.of(rebuild(changes));
        } catch (BuildException e) {
            collations = null;
            throw e;
        }
    }

    private BuildReport rebuildAll() {
        log.info("Rebuilding the whole site");
        SiteBuilder forced = builder.forced();
        collations = forced.collate();
        return forced.build(collations, BuildScope.all());
    }

    private BuildReport rebuild(SourceSnapshot.Changes changes) {
        Collator collator = builder.collator();
        Set<Path> scope = new LinkedHashSet<>();
        for (Collation collation : collations.values()) {
            for (Path file : changes.modified()) {
                collator.upsert(collation, file);
            }
            for (Path file : changes.removed()) {
                collator.remove(collation, file);
            }
        }
        for (Path file : changes.all()) {
            scope.add(collator.entryKey(file));
        }
        return builder.build(collations, BuildScope.of(List.copyOf(scope)));
    }

    private boolean isExcluded(Path file) {
        return options().exclusionRoots().stream().anyMatch(file::startsWith);
    }

    private RuntimeOptions options() {
        return builder.options();
    }
}
