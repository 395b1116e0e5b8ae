package com.pagewright.core.transform;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the language hint on a code block ({@code language-js}) to a canonical language name.
 *
 * <p>Built-in aliases can be extended or overridden through {@code syntax.aliases} in {@code site.yaml}.
 */
public final class LanguageAliases {

    private static final Map<String, String> BUILT_IN = Map.ofEntries(
        Map.entry("js", "javascript"),
        Map.entry("mjs", "javascript"),
        Map.entry("ts", "typescript"),
        Map.entry("rs", "rust"),
        Map.entry("py", "python"),
        Map.entry("rb", "ruby"),
        Map.entry("sh", "shell"),
        Map.entry("bash", "shell"),
        Map.entry("zsh", "shell"),
        Map.entry("yml", "yaml"),
        Map.entry("md", "markdown"),
        Map.entry("kt", "kotlin"),
        Map.entry("htm", "html"),
        Map.entry("xhtml", "html")
    );

    private final Map<String, String> aliases;

    public LanguageAliases(Map<String, String> overrides) {
        Map<String, String> merged = new HashMap<>(BUILT_IN);
        overrides.forEach((alias, language) -> merged.put(alias.toLowerCase(Locale.ROOT), language));
        this.aliases = Map.copyOf(merged);
    }

    public static LanguageAliases defaults() {
        return new LanguageAliases(Map.of());
    }

    public String resolve(String hint) {
        String key = hint.toLowerCase(Locale.ROOT);
        return aliases.getOrDefault(key, key);
    }
}
