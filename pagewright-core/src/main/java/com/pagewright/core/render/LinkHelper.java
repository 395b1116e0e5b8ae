package com.pagewright.core.render;

import com.pagewright.core.collation.Collation;
import com.pagewright.core.error.LinkException;
import com.pagewright.core.model.Page;
import com.pagewright.core.path.Hrefs;
import com.pagewright.core.path.PathResolver;
import com.pagewright.core.transform.HtmlEntities;

import java.util.List;

/**
 * Link and menu helpers exposed to templates.
 *
 * <p>With link verification on, a site-root-relative href that does not resolve to a page, a
 * file or an allow listed href fails the page with a {@link LinkException}.
 */
public class LinkHelper {

    private final PathResolver resolver;
    private final Collation collation;
    private final boolean verify;

    public LinkHelper(PathResolver resolver, Collation collation, boolean verify) {
        this.resolver = resolver;
        this.collation = collation;
        this.verify = verify;
    }

    /**
     * Converts an href for use in the given page.
     *
     * @param href href as written in the template
     * @param current page being rendered
     * @return href relative to the page when relative links are on
     * @throws LinkException if verification is on and the href is unknown
     */
    public String link(String href, Page current) {
        if (verify && !PathResolver.isPassthrough(href) && !collation.isKnownLink(href)) {
            throw LinkException.missing(href, current.source());
        }
        return resolver.computeRelativeHref(href, current.source(), current.cleanUrls());
    }

    /**
     * Renders a named menu as an unordered list.
     *
     * @param name menu name
     * @param current page being rendered
     * @return list markup, empty when the menu does not exist
     */
    public String menu(String name, Page current) {
        List<String> hrefs = collation.menus().get(name);
        if (hrefs == null || hrefs.isEmpty()) {
            return "";
        }
        StringBuilder markup = new StringBuilder("<ul class=\"menu\">");
        for (String href : hrefs) {
            String title = collation.findLink(href)
                .flatMap(collation::resolve)
                .map(Page::title)
                .orElse(Hrefs.trimTrailingSlash(href));
            markup.append("<li");
            if (href.equals(current.href())) {
                markup.append(" class=\"selected\"");
            }
            markup.append("><a href=\"")
                .append(HtmlEntities.escape(link(href, current)))
                .append("\">")
                .append(HtmlEntities.escape(title))
                .append("</a></li>");
        }
        return markup.append("</ul>").toString();
    }
}
