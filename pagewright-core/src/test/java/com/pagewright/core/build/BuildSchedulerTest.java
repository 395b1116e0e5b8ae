package com.pagewright.core.build;

import com.pagewright.core.SiteTestBase;
import com.pagewright.core.collation.Collation;
import com.pagewright.core.collation.Collator;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.error.MultiBuildException;
import com.pagewright.core.manifest.BuildManifest;
import com.pagewright.core.model.Resource;
import com.pagewright.core.render.RenderOutcome;
import com.pagewright.core.render.RenderResult;
import com.pagewright.core.render.ResourceRenderer;
import com.pagewright.core.util.FileUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Tests for {@link BuildScheduler}.
 */
class BuildSchedulerTest extends SiteTestBase {

    private Path file1;
    private Path file2;
    private Path file3;

    @BeforeEach
    void createFiles() throws IOException {
        file1 = createSource("one.txt", "1");
        file2 = createSource("two.txt", "2");
        file3 = createSource("three.txt", "3");
    }

    private Collation collate(RuntimeOptions options) {
        return new Collator(options).walk().values().iterator().next();
    }

    private RenderResult write(Collation collation, Path source, Resource resource) {
        Path output = resource.output(collation.outputRoot());
        try {
            FileUtils.copy(source, output);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return RenderResult.of(source, output, RenderOutcome.COPIED);
    }

    @Test
    @DisplayName("Fail fast returns on the second file's error without waiting for the others")
    void run_failFastParallel_returnsBeforeOtherFilesComplete() throws InterruptedException {
        // Given: files 1 and 3 block until released, file 2 fails at once
        RuntimeOptions options = options().withParallel(true).withWorkers(3).withFailFast(true);
        Collation collation = collate(options);
        CountDownLatch release = new CountDownLatch(1);
        Set<Path> completed = ConcurrentHashMap.newKeySet();
        ResourceRenderer renderer = (c, source, resource) -> {
            if (source.equals(file2)) {
                throw new BuildException("broken", source);
            }
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BuildException("interrupted", source, e);
            }
            completed.add(source);
            return RenderResult.of(source, null, RenderOutcome.NOOP);
        };

        // When
        BuildException error = catchThrowableOfType(
            () -> new BuildScheduler(options, renderer).run(collation, BuildScope.all()), BuildException.class);

        // Then: the error is file 2's and neither blocked file had finished
        assertThat(error).isNotInstanceOf(MultiBuildException.class);
        assertThat(error.path()).contains(file2);
        assertThat(completed).isEmpty();
        release.countDown();
    }

    @Test
    @DisplayName("Aggregate mode completes every file and reports exactly the failing one")
    void run_aggregateParallel_collectsErrorAfterAllComplete() {
        // Given
        RuntimeOptions options = options().withParallel(true).withWorkers(3).withFailFast(false);
        Collation collation = collate(options);
        CountDownLatch started = new CountDownLatch(3);
        Set<Path> completed = ConcurrentHashMap.newKeySet();
        ResourceRenderer renderer = (c, source, resource) -> {
            started.countDown();
            try {
                // All three run at the same time
                started.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (source.equals(file2)) {
                throw new BuildException("broken", source);
            }
            completed.add(source);
            return RenderResult.of(source, null, RenderOutcome.NOOP);
        };

        // When
        MultiBuildException error = catchThrowableOfType(
            () -> new BuildScheduler(options, renderer).run(collation, BuildScope.all()), MultiBuildException.class);

        // Then
        assertThat(completed).containsExactlyInAnyOrder(file1, file3);
        assertThat(error.errors()).hasSize(1);
        assertThat(error.errors().get(0).path()).contains(file2);
    }

    @Test
    void run_aggregateSequential_visitsEveryFile() {
        RuntimeOptions options = options().withFailFast(false);
        Collation collation = collate(options);
        Set<Path> visited = ConcurrentHashMap.newKeySet();
        ResourceRenderer renderer = (c, source, resource) -> {
            visited.add(source);
            if (source.equals(file2)) {
                throw new IllegalStateException("bad template");
            }
            return RenderResult.of(source, null, RenderOutcome.NOOP);
        };

        MultiBuildException error = catchThrowableOfType(
            () -> new BuildScheduler(options, renderer).run(collation, BuildScope.all()), MultiBuildException.class);

        assertThat(visited).containsExactlyInAnyOrder(file1, file2, file3);
        assertThat(error.errors()).singleElement()
            .satisfies(e -> assertThat(e.getMessage()).contains("bad template"));
    }

    @Test
    void run_failFastSequential_throwsOriginalError() {
        RuntimeOptions options = options().withFailFast(true);
        Collation collation = collate(options);
        ResourceRenderer renderer = (c, source, resource) -> {
            if (source.equals(file2)) {
                throw new BuildException("broken", source);
            }
            return RenderResult.of(source, null, RenderOutcome.NOOP);
        };

        assertThatThrownBy(() -> new BuildScheduler(options, renderer).run(collation, BuildScope.all()))
            .isExactlyInstanceOf(BuildException.class)
            .hasMessage("broken");
    }

    @Test
    void run_scope_limitsDispatchedFiles() {
        RuntimeOptions options = options();
        Collation collation = collate(options);
        Set<Path> visited = ConcurrentHashMap.newKeySet();
        ResourceRenderer renderer = (c, source, resource) -> {
            visited.add(source);
            return RenderResult.of(source, null, RenderOutcome.NOOP);
        };

        new BuildScheduler(options, renderer).run(collation, BuildScope.of(List.of(file3)));

        assertThat(visited).containsExactly(file3);
    }

    @Test
    void run_incrementalSecondPass_skipsUnchangedFiles() {
        // Given: a pass that writes every file and touches the manifest
        RuntimeOptions options = options().withIncremental(true);
        Collation collation = collate(options);
        collation.setManifest(BuildManifest.empty(collation.outputRoot(), true));
        BuildScheduler scheduler = new BuildScheduler(options, this::write);
        BuildReport first = scheduler.run(collation, BuildScope.all());

        // When
        BuildReport second = scheduler.run(collation, BuildScope.all());

        // Then
        assertThat(first.copied()).isEqualTo(3);
        assertThat(second.copied()).isZero();
        assertThat(second.unchanged()).isEqualTo(3);
    }

    @Test
    void run_force_rebuildsUnchangedFiles() {
        RuntimeOptions options = options().withIncremental(true);
        Collation collation = collate(options);
        collation.setManifest(BuildManifest.empty(collation.outputRoot(), true));
        new BuildScheduler(options, this::write).run(collation, BuildScope.all());

        BuildReport forced = new BuildScheduler(options.withForce(true), this::write).run(collation, BuildScope.all());

        assertThat(forced.copied()).isEqualTo(3);
    }
}
