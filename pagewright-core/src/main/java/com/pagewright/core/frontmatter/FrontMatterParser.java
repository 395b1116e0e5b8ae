package com.pagewright.core.frontmatter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pagewright.core.error.FrontMatterException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses front matter text as YAML into page data.
 */
public class FrontMatterParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Parses a front matter block.
     *
     * @param frontMatter split file content
     * @param file file the block came from
     * @return page data, empty when there is no block
     * @throws FrontMatterException if the block is not a YAML mapping
     */
    public Map<String, Object> parse(FrontMatter frontMatter, Path file) {
        if (!frontMatter.hasFrontMatter() || frontMatter.text().isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> data = yamlMapper.readValue(frontMatter.text(), MAP_TYPE);
            return data == null ? new LinkedHashMap<>() : data;
        } catch (JsonProcessingException e) {
            throw new FrontMatterException("Invalid front matter in " + file + ": " + e.getOriginalMessage(), file, e);
        }
    }
}
