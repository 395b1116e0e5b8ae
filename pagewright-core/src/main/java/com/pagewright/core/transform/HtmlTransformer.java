package com.pagewright.core.transform;

import com.pagewright.core.util.Slugs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites rendered HTML pages: heading ids, syntax highlighting, comment stripping,
 * table of contents and word count placeholders, and text extraction.
 *
 * <p>Works on the markup with regular expressions rather than a DOM, so it only understands
 * well formed, non-nested heading and {@code pre > code} elements. Script bodies are left alone
 * unless they happen to contain markup matched by one of the patterns.
 */
public class HtmlTransformer {

    private static final Logger log = LoggerFactory.getLogger(HtmlTransformer.class);

    static final Pattern EMPTY_ELEMENT =
        Pattern.compile("<(code|h[1-6])(\\s[^>]*)?>\\s*</\\1>", Pattern.CASE_INSENSITIVE);

    static final Pattern COMMENT = Pattern.compile("<!--(?!\\[if).*?-->", Pattern.DOTALL);

    static final Pattern HEADING =
        Pattern.compile("<(h[1-6])(\\s[^>]*)?>(.*?)</\\1>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    static final Pattern CODE_BLOCK = Pattern.compile(
        "(<pre(?:\\s[^>]*)?>\\s*)<code(\\s[^>]*)?>(.*?)</code>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    static final Pattern ID_ATTRIBUTE = Pattern.compile("\\bid\\s*=\\s*\"([^\"]*)\"");

    static final Pattern CLASS_ATTRIBUTE = Pattern.compile("\\bclass\\s*=\\s*\"([^\"]*)\"");

    static final Pattern LANGUAGE = Pattern.compile("language-([^\\s\"]+)");

    static final Pattern TITLE =
        Pattern.compile("<title(?:\\s[^>]*)?>(.*?)</title>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    static final Pattern PARAGRAPH =
        Pattern.compile("<p(?:\\s[^>]*)?>(.*?)</p>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    static final Pattern TOC_PLACEHOLDER = Pattern.compile(
        "<toc data-tag=\"(ol|ul)\" data-class=\"([^\"]*)\" data-from=\"(h[1-6])\" data-to=\"(h[1-6])\" />");

    static final Pattern WORDS_PLACEHOLDER = Pattern.compile("<words( data-avg=\"([0-9]+)\")? />");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TransformFlags flags;
    private final SyntaxHighlighter highlighter;
    private final LanguageAliases aliases;

    public HtmlTransformer(TransformFlags flags, SyntaxHighlighter highlighter, LanguageAliases aliases) {
        this.flags = flags;
        this.highlighter = highlighter;
        this.aliases = aliases;
    }

    public TransformFlags flags() {
        return flags;
    }

    /**
     * Runs every enabled rewrite over a document.
     *
     * @param html rendered page
     * @return rewritten page with extracted text and headings
     */
    public TransformResult transform(String html) {
        String content = EMPTY_ELEMENT.matcher(html).replaceAll("");
        if (flags.stripComments()) {
            content = COMMENT.matcher(content).replaceAll("");
        }

        TableOfContents toc = new TableOfContents();
        if (flags.autoId() || flags.toc()) {
            content = rewriteHeadings(content, toc);
        }
        if (flags.syntaxHighlight()) {
            content = highlightCode(content);
        }

        TextExtraction text = TextExtraction.empty();
        if (flags.extractText() || flags.words()) {
            text = extractText(content);
        }
        if (flags.words()) {
            content = replaceWords(content, text.words());
        }
        if (flags.toc()) {
            content = replaceToc(content, toc);
        }
        return new TransformResult(content, flags.extractText() ? text : TextExtraction.empty(), toc.entries());
    }

    private String rewriteHeadings(String content, TableOfContents toc) {
        Set<String> seen = authorIds(content);
        Matcher matcher = HEADING.matcher(content);
        StringBuilder out = new StringBuilder(content.length());
        while (matcher.find()) {
            String tag = matcher.group(1);
            String attributes = matcher.group(2) == null ? "" : matcher.group(2);
            String inner = matcher.group(3);
            String text = HtmlEntities.text(inner).trim();

            Matcher idMatcher = ID_ATTRIBUTE.matcher(attributes);
            String id;
            if (idMatcher.find()) {
                id = idMatcher.group(1);
            } else {
                id = uniqueId(Slugs.slugify(text), seen);
                attributes = attributes + " id=\"" + HtmlEntities.escape(id) + "\"";
            }
            toc.add(tag, id, text);

            String replacement = "<" + tag + attributes + ">" + inner + "</" + tag + ">";
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // Author ids are reserved up front so a generated id never takes one of them
    private static Set<String> authorIds(String content) {
        Set<String> ids = new HashSet<>();
        Matcher matcher = HEADING.matcher(content);
        while (matcher.find()) {
            if (matcher.group(2) != null) {
                Matcher idMatcher = ID_ATTRIBUTE.matcher(matcher.group(2));
                if (idMatcher.find()) {
                    ids.add(idMatcher.group(1));
                }
            }
        }
        return ids;
    }

    private static String uniqueId(String slug, Set<String> seen) {
        String base = slug.isEmpty() ? "section" : slug;
        String candidate = base;
        for (int suffix = 2; seen.contains(candidate); suffix++) {
            candidate = base + "-" + suffix;
        }
        seen.add(candidate);
        return candidate;
    }

    private String highlightCode(String content) {
        Matcher matcher = CODE_BLOCK.matcher(content);
        StringBuilder out = new StringBuilder(content.length());
        while (matcher.find()) {
            String pre = matcher.group(1);
            String attributes = matcher.group(2) == null ? "" : matcher.group(2);
            String code = matcher.group(3);
            String replacement = matcher.group();

            Matcher classMatcher = CLASS_ATTRIBUTE.matcher(attributes);
            if (classMatcher.find()) {
                String className = classMatcher.group(1);
                Matcher languageMatcher = LANGUAGE.matcher(className);
                if (languageMatcher.find()) {
                    String language = aliases.resolve(languageMatcher.group(1));
                    Optional<String> highlighted = highlighter.highlight(language, HtmlEntities.unescape(code));
                    if (highlighted.isPresent()) {
                        String newAttributes = attributes.substring(0, classMatcher.start(1))
                            + className + " code"
                            + attributes.substring(classMatcher.end(1));
                        replacement = pre + "<code" + newAttributes + ">" + highlighted.get() + "</code>";
                    } else {
                        log.debug("No syntax highlighting for language {}", language);
                    }
                }
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static TextExtraction extractText(String content) {
        Matcher titleMatcher = TITLE.matcher(content);
        String title = titleMatcher.find() ? HtmlEntities.text(titleMatcher.group(1)).trim() : "";

        List<String> chunks = new ArrayList<>();
        int words = 0;
        Matcher paragraph = PARAGRAPH.matcher(content);
        while (paragraph.find()) {
            String text = HtmlEntities.text(paragraph.group(1)).trim();
            if (text.isEmpty()) {
                continue;
            }
            chunks.add(text);
            words += WHITESPACE.split(text).length;
        }
        return new TextExtraction(title, chunks, words);
    }

    private static String replaceWords(String content, int words) {
        Matcher matcher = WORDS_PLACEHOLDER.matcher(content);
        StringBuilder out = new StringBuilder(content.length());
        while (matcher.find()) {
            String value;
            if (matcher.group(2) != null) {
                int average = Math.max(Integer.parseInt(matcher.group(2)), 1);
                value = String.valueOf(Math.max(words / average, 2));
            } else {
                value = String.valueOf(words);
            }
            matcher.appendReplacement(out, value);
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static String replaceToc(String content, TableOfContents toc) {
        Matcher matcher = TOC_PLACEHOLDER.matcher(content);
        StringBuilder out = new StringBuilder(content.length());
        while (matcher.find()) {
            String markup = toc.toHtml(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4));
            matcher.appendReplacement(out, Matcher.quoteReplacement(markup));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
