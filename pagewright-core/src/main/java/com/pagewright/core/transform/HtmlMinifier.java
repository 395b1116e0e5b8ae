package com.pagewright.core.transform;

/**
 * Drops whitespace-only runs between tags without building a DOM.
 *
 * <p>Text between tags that contains anything besides whitespace is kept verbatim, and so is
 * everything inside a tag. Script bodies get no special treatment: a body that looks like
 * whitespace between two {@code <} / {@code >} characters loses that whitespace.
 */
public final class HtmlMinifier {

    private enum State {
        NONE,
        INSIDE,
        BETWEEN
    }

    private HtmlMinifier() {
        // Utility class
    }

    /**
     * Minifies an HTML string.
     *
     * @param content HTML
     * @return HTML without inter-tag whitespace runs
     */
    public static String minify(String content) {
        StringBuilder buf = new StringBuilder(content.length());
        StringBuilder pending = new StringBuilder();
        State state = State.NONE;
        boolean empty = true;

        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '<') {
                if (!empty) {
                    buf.append(pending);
                }
                pending.setLength(0);
                state = State.INSIDE;
            } else if (c == '>' && state == State.INSIDE) {
                state = State.BETWEEN;
                empty = true;
                buf.append(c);
                continue;
            }

            if (state == State.BETWEEN) {
                empty = empty && Character.isWhitespace(c);
                pending.append(c);
            } else {
                buf.append(c);
            }
        }

        if (!empty) {
            buf.append(pending);
        }
        return buf.toString();
    }
}
