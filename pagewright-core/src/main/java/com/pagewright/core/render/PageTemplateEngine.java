package com.pagewright.core.render;

import com.pagewright.core.error.TemplateException;
import com.pagewright.core.transform.HtmlEntities;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Default placeholder based template engine.
 *
 * <p>Supported tags:
 * <ul>
 *   <li>{@code {{ title }}}, {@code {{ author.name }}}: value from page data, HTML escaped</li>
 *   <li>{@code {{{ template }}}}: value inserted without escaping</li>
 *   <li>{@code {{ link /docs/ }}}: href converted for the current page, verified when enabled</li>
 *   <li>{@code {{ menu main }}}: named menu rendered as a list</li>
 * </ul>
 * Missing values render as an empty string.
 */
public class PageTemplateEngine implements TemplateEngine {

    @Override
    public String getId() {
        return "page";
    }

    @Override
    public String render(Path template, String text, TemplateContext context) {
        StringBuilder out = new StringBuilder(text.length());
        int pos = 0;
        while (true) {
            int open = text.indexOf("{{", pos);
            if (open < 0) {
                out.append(text, pos, text.length());
                break;
            }
            out.append(text, pos, open);

            boolean raw = text.startsWith("{{{", open);
            String closeTag = raw ? "}}}" : "}}";
            int start = open + (raw ? 3 : 2);
            int close = text.indexOf(closeTag, start);
            if (close < 0) {
                throw new TemplateException("Unterminated tag at offset " + open + " in " + template, template);
            }

            String expression = text.substring(start, close).trim();
            String value = evaluate(expression, template, context);
            out.append(raw ? value : HtmlEntities.escape(value));
            pos = close + closeTag.length();
        }
        return out.toString();
    }

    private String evaluate(String expression, Path template, TemplateContext context) {
        if (expression.isEmpty()) {
            throw new TemplateException("Empty tag in " + template, template);
        }
        String[] parts = expression.split("\\s+", 2);
        String name = parts[0];
        String argument = parts.length > 1 ? unquote(parts[1].trim()) : null;

        switch (name) {
            case "link":
                requireArgument(name, argument, template);
                return context.links().link(argument, context.page());
            case "menu":
                requireArgument(name, argument, template);
                return context.links().menu(argument, context.page());
            default:
                if (argument != null) {
                    throw new TemplateException("Unknown helper '" + name + "' in " + template, template);
                }
                return stringValue(lookup(context.data(), name));
        }
    }

    private static void requireArgument(String helper, String argument, Path template) {
        if (argument == null || argument.isEmpty()) {
            throw new TemplateException("Helper '" + helper + "' requires an argument in " + template, template);
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
            || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    static Object lookup(Map<String, Object> data, String path) {
        Object current = data;
        for (String key : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    private static String stringValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof List<?> list) {
            return String.join(", ", list.stream().map(String::valueOf).toList());
        }
        return String.valueOf(value);
    }
}
