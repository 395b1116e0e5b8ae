package com.pagewright.core.transform;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Collects headings in document order and renders them as nested lists.
 */
public class TableOfContents {

    private final List<Heading> entries = new ArrayList<>();

    public void add(String tagName, String id, String text) {
        entries.add(Heading.of(tagName, id, text));
    }

    public List<Heading> entries() {
        return Collections.unmodifiableList(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Renders headings between two levels, inclusive.
     *
     * <p>A deeper heading opens a nested list inside the previous item. When {@code to} is
     * shallower than {@code from} only the {@code from} level is rendered.
     *
     * @param tagName list element, {@code ol} or {@code ul}
     * @param className class for the outer list, may be empty
     * @param from shallowest heading tag
     * @param to deepest heading tag
     * @return list markup, empty when no heading is in range
     */
    public String toHtml(String tagName, String className, String from, String to) {
        int min = Heading.depthOf(from);
        int max = Math.max(min, Heading.depthOf(to));

        List<Heading> selected = entries.stream()
            .filter(h -> h.depth() >= min && h.depth() <= max)
            .toList();
        if (selected.isEmpty()) {
            return "";
        }

        StringBuilder markup = new StringBuilder();
        markup.append('<').append(tagName);
        if (className != null && !className.isEmpty()) {
            markup.append(" class=\"").append(HtmlEntities.escape(className)).append('"');
        }
        markup.append('>');

        Deque<Integer> levels = new ArrayDeque<>();
        Heading previous = null;
        for (Heading heading : selected) {
            if (previous == null) {
                levels.push(heading.depth());
            } else if (heading.depth() > previous.depth()) {
                markup.append('<').append(tagName).append('>');
                levels.push(heading.depth());
            } else {
                markup.append("</li>");
                while (levels.size() > 1 && heading.depth() < levels.peek()) {
                    markup.append("</").append(tagName).append("></li>");
                    levels.pop();
                }
            }
            markup.append(heading.open());
            previous = heading;
        }

        markup.append("</li>");
        while (levels.size() > 1) {
            markup.append("</").append(tagName).append("></li>");
            levels.pop();
        }
        markup.append("</").append(tagName).append('>');
        return markup.toString();
    }
}
