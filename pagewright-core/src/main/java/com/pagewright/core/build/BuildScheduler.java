package com.pagewright.core.build;

import com.pagewright.core.collation.Collation;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.error.MultiBuildException;
import com.pagewright.core.manifest.BuildManifest;
import com.pagewright.core.model.Page;
import com.pagewright.core.model.Resource;
import com.pagewright.core.model.ResourceOperation;
import com.pagewright.core.render.RenderResult;
import com.pagewright.core.render.ResourceRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one build pass over a collation.
 *
 * <p>A pass selects the entries in scope, prunes those the build manifest reports as unchanged,
 * and dispatches the rest to the {@link ResourceRenderer}, either one after another or across a
 * fixed pool of worker threads created for the pass. Each successful dispatch touches the
 * manifest before it returns.
 *
 * <p>Error handling depends on {@link RuntimeOptions#failFast()}:
 * <ul>
 *   <li>fail fast: the first error is rethrown at once. In parallel mode the pool is shut down
 *       with {@link ExecutorService#shutdownNow()}, which interrupts workers but does not wait
 *       for them; files already being written may still complete. This is a hard abort, not a
 *       cooperative cancellation.</li>
 *   <li>aggregate: every dispatched entry runs to completion and all errors are thrown together
 *       as a {@link MultiBuildException}.</li>
 * </ul>
 *
 * <p>The collation is only read during a pass.
 */
public class BuildScheduler {

    private static final Logger log = LoggerFactory.getLogger(BuildScheduler.class);

    private final RuntimeOptions options;
    private final ResourceRenderer renderer;

    public BuildScheduler(RuntimeOptions options, ResourceRenderer renderer) {
        this.options = options;
        this.renderer = renderer;
    }

    /**
     * Runs one pass.
     *
     * @param collation collation to build
     * @param scope entries to consider
     * @return counts for the pass
     * @throws BuildException the first failure in fail fast mode
     * @throws MultiBuildException every failure in aggregate mode
     */
    public BuildReport run(Collation collation, BuildScope scope) {
        Instant start = Instant.now();
        BuildReport.Builder report = new BuildReport.Builder();
        Optional<BuildManifest> manifest = collation.manifest();

        List<Job> jobs = new ArrayList<>();
        for (Map.Entry<Path, Resource> entry : collation.entries().entrySet()) {
            Path source = entry.getKey();
            Resource resource = entry.getValue();
            if (resource.operation() == ResourceOperation.NOOP || !scope.contains(source)) {
                continue;
            }
            Job job = new Job(source, resource, trackedFile(collation, source),
                resource.output(collation.outputRoot()));
            if (manifest.isPresent() && !manifest.get().isDirty(job.tracked(), job.output(), options.force())) {
                log.debug("noop {}", source);
                report.incrementUnchanged();
                continue;
            }
            jobs.add(job);
        }

        log.debug("Dispatching {} of {} entries for '{}'", jobs.size(), collation.entries().size(), collation.lang());
        List<BuildException> errors = options.parallel() && options.workers() > 1 && jobs.size() > 1
            ? dispatchParallel(collation, jobs, report)
            : dispatchSequential(collation, jobs, report);

        if (!errors.isEmpty()) {
            throw new MultiBuildException(errors);
        }
        return report.build(Duration.between(start, Instant.now()));
    }

    private List<BuildException> dispatchSequential(Collation collation, List<Job> jobs, BuildReport.Builder report) {
        List<BuildException> errors = new ArrayList<>();
        for (Job job : jobs) {
            try {
                record(report, execute(collation, job));
            } catch (BuildException e) {
                report.incrementFailed();
                if (options.failFast()) {
                    throw e;
                }
                errors.add(e);
            }
        }
        return errors;
    }

    private List<BuildException> dispatchParallel(Collation collation, List<Job> jobs, BuildReport.Builder report) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(options.workers(), jobs.size()),
            new WorkerThreadFactory());
        CompletionService<RenderResult> completion = new ExecutorCompletionService<>(pool);
        List<BuildException> errors = new ArrayList<>();
        try {
            for (Job job : jobs) {
                completion.submit(() -> execute(collation, job));
            }
            for (int i = 0; i < jobs.size(); i++) {
                try {
                    record(report, completion.take().get());
                } catch (ExecutionException e) {
                    report.incrementFailed();
                    BuildException error = unwrap(e);
                    if (options.failFast()) {
                        pool.shutdownNow();
                        throw error;
                    }
                    errors.add(error);
                }
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
            throw new BuildException("Build interrupted", null, e);
        } finally {
            pool.shutdown();
        }
        return errors;
    }

    private RenderResult execute(Collation collation, Job job) {
        RenderResult result;
        try {
            result = renderer.render(collation, job.source(), job.resource());
        } catch (BuildException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BuildException("Failed to build " + job.source() + ": " + e.getMessage(), job.source(), e);
        }
        if (result.wroteOutput()) {
            collation.manifest().ifPresent(manifest -> manifest.touch(job.tracked(), job.output()));
        }
        return result;
    }

    private static void record(BuildReport.Builder report, RenderResult result) {
        switch (result.outcome()) {
            case RENDERED -> report.incrementRendered();
            case COPIED, LINKED -> report.incrementCopied();
            case SKIPPED_DRAFT -> report.incrementSkipped();
            default -> {
                // Nothing written
            }
        }
        if (!result.text().chunks().isEmpty()) {
            report.incrementIndexed();
        }
    }

    private static BuildException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof BuildException buildException) {
            return buildException;
        }
        return new BuildException("Build task failed: " + cause, null, cause);
    }

    // Translated pages are tracked by the file they were read from
    private static Path trackedFile(Collation collation, Path source) {
        return collation.resolve(source).map(Page::template).orElse(source);
    }

    private record Job(Path source, Resource resource, Path tracked, Path output) {}

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pagewright-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
