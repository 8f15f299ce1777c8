package io.github.eutro.irhtml.core.render;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;

import java.nio.charset.StandardCharsets;

/**
 * The content stream: HTML markup around text, tracking the column the text has reached
 * on the current line, so that trailing commentary can be aligned.
 * <p>
 * Markup never counts towards the column; text counts one column per code point.
 */
public final class HtmlWriter {
    private static final Document.OutputSettings ESCAPING = new Document.OutputSettings()
            .charset(StandardCharsets.UTF_8)
            .escapeMode(Entities.EscapeMode.xhtml);

    private final StringBuilder sb = new StringBuilder();
    private final StyleSheet styles;
    private int column = 0;

    public HtmlWriter(StyleSheet styles) {
        this.styles = styles;
    }

    /**
     * Write markup verbatim.
     *
     * @param markup The markup.
     * @return This writer.
     */
    public HtmlWriter raw(String markup) {
        sb.append(markup);
        return this;
    }

    /**
     * Write text, escaping it.
     *
     * @param text The text.
     * @return This writer.
     */
    public HtmlWriter text(String text) {
        sb.append(Entities.escape(text, ESCAPING));
        int nl = text.lastIndexOf('\n');
        if (nl >= 0) {
            column = text.codePointCount(nl + 1, text.length());
        } else {
            column += text.codePointCount(0, text.length());
        }
        return this;
    }

    public HtmlWriter newline() {
        return text("\n");
    }

    public HtmlWriter span(StyleClass cls, String text) {
        styles.use(cls);
        raw("<span class=\"" + cls.cssClass + "\">");
        text(text);
        return raw("</span>");
    }

    /**
     * Write text as the target of links to {@code id}.
     *
     * @param cls  The class of the text.
     * @param id   The element id.
     * @param text The text.
     * @return This writer.
     */
    public HtmlWriter anchor(StyleClass cls, String id, String text) {
        styles.use(cls);
        raw("<span class=\"" + cls.cssClass + "\" id=\"" + id + "\">");
        text(text);
        return raw("</span>");
    }

    /**
     * Write text as a link to {@code id}.
     *
     * @param cls  The class of the text.
     * @param id   The element id linked to.
     * @param text The text.
     * @return This writer.
     */
    public HtmlWriter link(StyleClass cls, String id, String text) {
        styles.use(cls);
        raw("<a class=\"" + cls.cssClass + "\" href=\"#" + id + "\">");
        text(text);
        return raw("</a>");
    }

    /**
     * Pad the current line with spaces up to {@code target}, or with one space if it is already there.
     *
     * @param target The column to pad to.
     * @return This writer.
     */
    public HtmlWriter padToColumn(int target) {
        int spaces = Math.max(target - column, 1);
        StringBuilder pad = new StringBuilder(spaces);
        for (int i = 0; i < spaces; i++) {
            pad.append(' ');
        }
        return text(pad.toString());
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
