package com.pagewright.core.transform;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Small built-in highlighter that marks keywords, strings and line comments with {@code span}
 * classes ({@code kw}, {@code str}, {@code cm}).
 *
 * <p>Registered as the default {@link SyntaxHighlighter} service. Sites that need real grammars
 * should register their own implementation.
 */
public class KeywordHighlighter implements SyntaxHighlighter {

    private static final String STRING_OR_WORD =
        "|(?<string>\"(?:[^\"\\\\\\n]|\\\\.)*\"|'(?:[^'\\\\\\n]|\\\\.)*')|(?<word>\\b[A-Za-z_][A-Za-z0-9_]*\\b)";
    private static final Pattern SLASH_TOKEN = Pattern.compile("(?<comment>//[^\\n]*)" + STRING_OR_WORD);
    private static final Pattern HASH_TOKEN = Pattern.compile("(?<comment>#[^\\n]*)" + STRING_OR_WORD);

    private static final Map<String, Set<String>> KEYWORDS = Map.of(
        "java", Set.of("abstract", "boolean", "break", "case", "catch", "class", "else", "enum", "extends",
            "final", "for", "if", "implements", "import", "int", "interface", "new", "null", "package",
            "private", "protected", "public", "record", "return", "static", "this", "throw", "throws",
            "try", "var", "void", "while"),
        "javascript", Set.of("async", "await", "break", "case", "catch", "class", "const", "else", "export",
            "for", "function", "if", "import", "let", "new", "null", "return", "this", "throw", "try",
            "undefined", "var", "while"),
        "rust", Set.of("as", "async", "await", "enum", "fn", "for", "if", "impl", "let", "loop", "match",
            "mod", "mut", "pub", "return", "self", "struct", "trait", "use", "where", "while"),
        "python", Set.of("and", "as", "class", "def", "elif", "else", "for", "from", "if", "import", "in",
            "is", "lambda", "None", "not", "or", "return", "while", "with", "yield"),
        "shell", Set.of("case", "do", "done", "elif", "else", "esac", "export", "fi", "for", "function",
            "if", "in", "then", "while")
    );

    // Languages where '#' starts a comment
    private static final Set<String> HASH_COMMENTS = Set.of("python", "shell");

    @Override
    public Optional<String> highlight(String language, String code) {
        Set<String> keywords = KEYWORDS.get(language);
        if (keywords == null) {
            return Optional.empty();
        }
        Pattern tokens = HASH_COMMENTS.contains(language) ? HASH_TOKEN : SLASH_TOKEN;

        StringBuilder out = new StringBuilder(code.length() * 2);
        Matcher matcher = tokens.matcher(code);
        int last = 0;
        while (matcher.find()) {
            out.append(HtmlEntities.escape(code.substring(last, matcher.start())));
            String token = matcher.group();
            if (matcher.group("comment") != null) {
                out.append(span("cm", token));
            } else if (matcher.group("string") != null) {
                out.append(span("str", token));
            } else if (matcher.group("word") != null && keywords.contains(token)) {
                out.append(span("kw", token));
            } else {
                out.append(HtmlEntities.escape(token));
            }
            last = matcher.end();
        }
        out.append(HtmlEntities.escape(code.substring(last)));
        return Optional.of(out.toString());
    }

    private static String span(String className, String text) {
        return "<span class=\"" + className + "\">" + HtmlEntities.escape(text) + "</span>";
    }
}
