package com.pagewright.core.render;

import com.pagewright.core.model.Page;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a template can see while one page renders.
 *
 * @param page page being rendered
 * @param data template data, page data plus computed values
 * @param links link and menu helpers bound to the page's collation
 */
public record TemplateContext(Page page, Map<String, Object> data, LinkHelper links) {

    public static final String TEMPLATE = "template";

    public TemplateContext {
        Objects.requireNonNull(page, "page must not be null");
        Objects.requireNonNull(links, "links must not be null");
        data = data == null ? Map.of() : Map.copyOf(withoutNulls(data));
    }

    /**
     * Returns a context whose data also holds the rendered page body, for layouts.
     *
     * @param body rendered page content
     * @return context for rendering the layout
     */
    public TemplateContext withBody(String body) {
        Map<String, Object> values = new LinkedHashMap<>(data);
        values.put(TEMPLATE, body);
        return new TemplateContext(page, values, links);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> data) {
        Map<String, Object> values = new LinkedHashMap<>();
        data.forEach((key, value) -> {
            if (key != null && value != null) {
                values.put(key, value);
            }
        });
        return values;
    }
}
