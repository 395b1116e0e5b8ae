package com.pagewright.core.collation;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assets contributed by an already resolved plugin.
 *
 * <p>Plugin resolution and installation happen elsewhere; the collator only injects these files.
 *
 * @param name plugin name, used for the {@code plugins/<name>/} output prefix and layout namespace
 * @param base plugin directory that asset paths are relative to
 * @param assets asset files relative to {@code base}
 * @param layouts layout names mapped to files relative to {@code base}
 */
public record PluginAssets(
    String name,
    Path base,
    List<Path> assets,
    Map<String, Path> layouts
) {
    public PluginAssets {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(base, "base must not be null");
        assets = assets == null ? List.of() : List.copyOf(assets);
        layouts = layouts == null ? Map.of() : Map.copyOf(layouts);
    }

    /**
     * Output-relative destination of a plugin asset.
     *
     * @param asset asset path relative to {@code base}
     * @return {@code plugins/<name>/<asset>}
     */
    public Path destination(Path asset) {
        return Path.of("plugins", name).resolve(asset);
    }
}
