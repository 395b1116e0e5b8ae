package com.pagewright.core.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.transform.TextExtraction;
import com.pagewright.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes extracted page text to {@code search.json} in each collation's output root.
 */
public class JsonSearchIndexer implements SearchIndexer {

    private static final Logger log = LoggerFactory.getLogger(JsonSearchIndexer.class);

    public static final String INDEX_FILE = "search.json";

    private static final ObjectMapper mapper = new ObjectMapper();

    private static final TypeReference<List<Document>> DOCUMENTS_TYPE = new TypeReference<>() {};

    /**
     * One indexed page.
     *
     * @param href page href
     * @param title page title
     * @param chunks paragraph texts
     * @param words word count
     */
    public record Document(String href, String title, List<String> chunks, int words) {}

    private final Map<String, Map<String, Document>> documents = new ConcurrentHashMap<>();

    @Override
    public void add(String lang, String href, TextExtraction text) {
        documents.computeIfAbsent(lang, key -> new ConcurrentHashMap<>())
            .put(href, new Document(href, text.title(), text.chunks(), text.words()));
    }

    public List<Document> documents(String lang) {
        return documents.getOrDefault(lang, Map.of()).values().stream()
            .sorted(Comparator.comparing(Document::href))
            .toList();
    }

    @Override
    public void write(String lang, Path outputRoot, Set<String> hrefs) {
        Path file = outputRoot.resolve(INDEX_FILE);
        Map<String, Document> indexed = documents.computeIfAbsent(lang, key -> new ConcurrentHashMap<>());
        for (Document previous : readIndex(file)) {
            indexed.putIfAbsent(previous.href(), previous);
        }
        indexed.keySet().retainAll(hrefs);

        List<Document> entries = documents(lang);
        if (entries.isEmpty() && !Files.exists(file)) {
            return;
        }
        try {
            FileUtils.writeString(file, mapper.writeValueAsString(entries));
            log.info("Wrote search index {} ({} documents)", file, entries.size());
        } catch (JsonProcessingException e) {
            throw new BuildException("Failed to serialize search index", file, e);
        } catch (IOException e) {
            throw new BuildException("Failed to write file: " + file, file, e);
        }
    }

    /**
     * Reads the index left by an earlier build. A missing or unreadable file yields nothing, in
     * which case only pages rebuilt by this pass are indexed.
     *
     * @param file index file
     * @return previously indexed documents
     */
    private static List<Document> readIndex(Path file) {
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            List<Document> previous = mapper.readValue(file.toFile(), DOCUMENTS_TYPE);
            return previous == null ? List.of() : previous;
        } catch (IOException e) {
            log.warn("Ignoring unreadable search index {}: {}", file, e.getMessage());
            return List.of();
        }
    }
}
