package com.example.notesweb;

import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.HtmlRenderer;
import org.springframework.stereotype.Component;

/**
 * CommonMark na HTML dla treści notatek. Szablony wołają {@code @markdown.render(...)}
 * przy każdym renderowaniu; surowy HTML jest escapowany, niebezpieczne linki usuwane.
 */
@Component("markdown")
public class MarkdownRenderer {

    private final Parser parser = Parser.builder().build();
    private final HtmlRenderer renderer = HtmlRenderer.builder()
            .escapeHtml(true)
            .sanitizeUrls(true)
            .build();

    public String render(String source) {
        if (source == null || source.isEmpty()) {
            return "";
        }
        return renderer.render(parser.parse(source));
    }
}
