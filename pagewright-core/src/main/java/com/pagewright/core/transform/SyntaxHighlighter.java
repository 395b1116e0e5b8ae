package com.pagewright.core.transform;

import java.util.Optional;

/**
 * Converts code block text to highlighted markup.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader}; register them in
 * {@code META-INF/services/com.pagewright.core.transform.SyntaxHighlighter}.
 */
public interface SyntaxHighlighter {

    /**
     * Highlights code.
     *
     * @param language canonical language name, after alias resolution
     * @param code unescaped code text
     * @return highlighted HTML, or empty when the language is not supported
     */
    Optional<String> highlight(String language, String code);

    /**
     * Highlighter that never highlights anything.
     *
     * @return no-op highlighter
     */
    static SyntaxHighlighter none() {
        return (language, code) -> Optional.empty();
    }
}
