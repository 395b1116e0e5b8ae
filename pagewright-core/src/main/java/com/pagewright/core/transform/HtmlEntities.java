package com.pagewright.core.transform;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal HTML escaping for text and attribute values.
 */
public final class HtmlEntities {

    private static final Pattern ENTITY = Pattern.compile("&(#[0-9]+|#[xX][0-9a-fA-F]+|[a-zA-Z]+);");
    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private static final Map<String, String> NAMED = Map.of(
        "amp", "&",
        "lt", "<",
        "gt", ">",
        "quot", "\"",
        "apos", "'",
        "nbsp", " "
    );

    private HtmlEntities() {
        // Utility class
    }

    public static String escape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> out.append("&amp;");
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&#39;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    /**
     * Decodes named and numeric character references. Unknown names are left as they are.
     *
     * @param html escaped text
     * @return decoded text
     */
    public static String unescape(String html) {
        Matcher matcher = ENTITY.matcher(html);
        StringBuilder out = new StringBuilder(html.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement;
            if (name.startsWith("#x") || name.startsWith("#X")) {
                replacement = new String(Character.toChars(Integer.parseInt(name.substring(2), 16)));
            } else if (name.startsWith("#")) {
                replacement = new String(Character.toChars(Integer.parseInt(name.substring(1))));
            } else {
                replacement = NAMED.getOrDefault(name, matcher.group());
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    /**
     * Removes markup and decodes entities, leaving the visible text.
     *
     * @param html HTML fragment
     * @return plain text
     */
    public static String text(String html) {
        return unescape(TAG.matcher(html).replaceAll(""));
    }
}
