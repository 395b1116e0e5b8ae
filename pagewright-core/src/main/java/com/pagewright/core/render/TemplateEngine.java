package com.pagewright.core.render;

import java.nio.file.Path;

/**
 * Renders page and layout templates.
 *
 * <p>The build pipeline does not know the template syntax; it hands the engine a template
 * identity, its text and the page context, and receives rendered text back. Engines are
 * discovered with {@link java.util.ServiceLoader} through
 * {@code META-INF/services/com.pagewright.core.render.TemplateEngine}; the first one found wins.
 */
public interface TemplateEngine {

    /**
     * Returns a short identifier, used in log output.
     *
     * @return engine id
     */
    String getId();

    /**
     * Renders a template.
     *
     * @param template template identity, the file the text came from
     * @param text template text without front matter
     * @param context page data and helpers
     * @return rendered text
     * @throws com.pagewright.core.error.TemplateException if the template cannot be rendered
     */
    String render(Path template, String text, TemplateContext context);
}
