package dev.maplecms.service;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * jsoup-based cleaning of stored HTML and plain-text fields.
 */
@Slf4j
@Service
public class HtmlSanitizerService {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Structural and formatting tags only; no scripts, frames, forms or inline styles
    private static final Safelist ARTICLE_SAFELIST = Safelist.relaxed()
            .removeTags("form", "input", "textarea", "select", "button")
            .removeAttributes(":all", "style")
            .addProtocols("a", "href", "http", "https", "mailto")
            .addProtocols("img", "src", "http", "https");

    /**
     * Clean article HTML, keeping safe formatting and dropping everything executable.
     */
    public String sanitize(String html) {
        if (html == null || html.isEmpty()) {
            return html;
        }
        log.debug("Sanitizing article HTML, length={}", html.length());
        return Jsoup.clean(html, ARTICLE_SAFELIST);
    }

    /**
     * Remove every tag and collapse whitespace. Used for excerpts.
     */
    public String stripHtml(String input) {
        if (input == null || input.isEmpty()) {
            return input;
        }
        String stripped = Jsoup.clean(input, Safelist.none());
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }
}
