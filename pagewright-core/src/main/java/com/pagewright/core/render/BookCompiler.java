package com.pagewright.core.render;

import java.nio.file.Path;

/**
 * External book compiler.
 *
 * <p>The compiler owns the book format and any draft handling inside it. The build only hands it
 * a book directory and copies whatever it produces into the collation's output root under the
 * book's directory name. Register an implementation in
 * {@code META-INF/services/com.pagewright.core.render.BookCompiler}; without one, book
 * directories are skipped with a warning.
 */
public interface BookCompiler {

    /**
     * Compiles one book.
     *
     * @param bookDir book source directory
     * @param outputDir empty directory to write the compiled book to
     * @param release whether draft sections must be omitted
     */
    void compile(Path bookDir, Path outputDir, boolean release);
}
