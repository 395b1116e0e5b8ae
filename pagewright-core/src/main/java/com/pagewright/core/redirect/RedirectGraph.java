package com.pagewright.core.redirect;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.error.LinkException;
import com.pagewright.core.error.RedirectException;
import com.pagewright.core.path.Hrefs;
import com.pagewright.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short link map materialized as static redirect pages.
 *
 * <p>Every chain {@code key -> value -> value ...} must end within {@value #MAX_REDIRECTS} hops
 * without revisiting a key (keys compared without a trailing slash). The whole map is validated,
 * and every destination checked, before any file is written.
 */
public final class RedirectGraph {

    private static final Logger log = LoggerFactory.getLogger(RedirectGraph.class);

    public static final int MAX_REDIRECTS = 4;
    public static final String MANIFEST_FILE = "redirects.json";

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, String> redirects;

    public RedirectGraph(Map<String, String> redirects) {
        this.redirects = Collections.unmodifiableMap(new LinkedHashMap<>(redirects));
    }

    /**
     * Combines configured redirects with page permalinks.
     *
     * @param configured redirects from {@code site.yaml}
     * @param permalinks permalink to page href
     * @return merged graph
     * @throws LinkException if a permalink is also a configured redirect key
     */
    public static RedirectGraph of(Map<String, String> configured, Map<String, String> permalinks) {
        Map<String, String> merged = new LinkedHashMap<>(configured);
        permalinks.forEach((permalink, href) -> {
            if (merged.containsKey(permalink) || merged.containsKey(permalink + "/")) {
                throw LinkException.duplicatePermalink(permalink, null);
            }
            merged.put(permalink, href);
        });
        return new RedirectGraph(merged);
    }

    public Map<String, String> redirects() {
        return redirects;
    }

    public boolean isEmpty() {
        return redirects.isEmpty();
    }

    /**
     * Validates every chain in the graph.
     *
     * @throws RedirectException with {@link RedirectException.Reason#CYCLIC_REDIRECT} or
     *         {@link RedirectException.Reason#TOO_MANY_REDIRECTS}
     */
    public void validate() {
        for (String key : redirects.keySet()) {
            follow(new ArrayList<>(), key);
        }
    }

    private void follow(List<String> stack, String key) {
        if (stack.size() >= MAX_REDIRECTS) {
            throw RedirectException.tooMany(MAX_REDIRECTS);
        }
        String normalized = Hrefs.trimTrailingSlash(key);
        if (stack.contains(normalized)) {
            throw RedirectException.cyclic(String.join(" <-> ", stack), normalized);
        }
        stack.add(normalized);

        String value = redirects.get(key);
        if (value == null) {
            return;
        }
        if (redirects.containsKey(value)) {
            follow(stack, value);
        } else {
            String trimmed = Hrefs.trimTrailingSlash(value);
            if (redirects.containsKey(trimmed)) {
                follow(stack, trimmed);
            }
        }
    }

    /**
     * Output file for a redirect key.
     *
     * @param outputRoot build target
     * @param key redirect key
     * @return {@code key} under the target, or {@code key/index.html} when the key ends in a slash
     */
    public static Path destination(Path outputRoot, String key) {
        String relative = Hrefs.trimLeadingSlash(key);
        if (relative.isEmpty() || relative.endsWith("/")) {
            relative = relative + "index.html";
        }
        return outputRoot.resolve(Hrefs.toPathSeparator(relative)).normalize();
    }

    /**
     * Validates the graph, then writes one stub page per key plus {@value #MANIFEST_FILE}.
     *
     * @param outputRoot build target
     * @return written stub files, excluding identical stubs kept from an earlier build
     * @throws RedirectException if the graph is invalid or a stub would overwrite another file
     */
    public List<Path> write(Path outputRoot) {
        validate();

        Map<Path, String> files = new LinkedHashMap<>();
        redirects.forEach((key, value) -> {
            Path file = destination(outputRoot, key);
            if (Files.exists(file)) {
                if (!isStub(file, value)) {
                    throw RedirectException.fileExists(file);
                }
                log.debug("Redirect stub {} is up to date", file);
                return;
            }
            files.put(file, value);
        });

        List<Path> written = new ArrayList<>();
        files.forEach((file, value) -> {
            log.info("Redirect {} -> {} as {}", Hrefs.toHrefSeparator(outputRoot.relativize(file)), value, file);
            writeFile(file, stub(value));
            written.add(file);
        });

        if (!redirects.isEmpty()) {
            writeFile(outputRoot.resolve(MANIFEST_FILE), toJson());
        }
        return written;
    }

    /**
     * Renders the stub page for a redirect target.
     *
     * @param location redirect target
     * @return minimal HTML document redirecting to {@code location}
     */
    public static String stub(String location) {
        return "<!doctype html><html><head>"
            + "<link rel=\"canonical\" href=\"" + location + "\">"
            + "<noscript><meta http-equiv=\"refresh\" content=\"0; " + location + "\"></noscript>"
            + "</head><body onload=\"document.location.replace('" + location + "');\"></body></html>";
    }

    // A stub left by a previous build is not a collision
    private static boolean isStub(Path file, String location) {
        try {
            return Files.isRegularFile(file) && Files.readString(file).equals(stub(location));
        } catch (IOException e) {
            throw new BuildException("Failed to read file: " + file, file, e);
        }
    }

    private String toJson() {
        try {
            return mapper.writeValueAsString(redirects);
        } catch (JsonProcessingException e) {
            throw new BuildException("Failed to serialize redirects", null, e);
        }
    }

    private static void writeFile(Path file, String content) {
        try {
            FileUtils.writeString(file, content);
        } catch (IOException e) {
            throw new BuildException("Failed to write file: " + file, file, e);
        }
    }
}
