package io.github.eutro.irhtml.core.render;

import io.github.eutro.irhtml.core.diag.DiagnosticKind;
import io.github.eutro.irhtml.core.diag.Diagnostics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Folds the style stream into the content stream, in place of the {@link #MARKER}.
 */
public final class StreamMerger {
    private static final Logger logger = LogManager.getLogger(StreamMerger.class);

    /**
     * The marker the renderer leaves in the document head. Left unmerged, it links
     * to an external stylesheet of the same rules.
     */
    public static final String MARKER = "<link rel=\"stylesheet\" type=\"text/css\" href=\"irhtml.css\">";

    private StreamMerger() {
    }

    public static String styleBlock(String style) {
        return "<style>" + style + "</style>";
    }

    /**
     * Replace every occurrence of the marker in {@code content} with a style block holding {@code style}.
     * <p>
     * There should be exactly one. If there are none, the content is returned as is, and if there are
     * several, all are replaced; either way a {@link DiagnosticKind#MERGE_MARKER_MISMATCH} is reported.
     *
     * @param content     The content stream.
     * @param style       The style stream.
     * @param diagnostics Where to report a mismatch.
     * @return The merged document.
     */
    public static String merge(String content, String style, Diagnostics diagnostics) {
        int count = 0;
        int from = 0;
        StringBuilder sb = new StringBuilder(content.length() + style.length() + 16);
        while (true) {
            int at = content.indexOf(MARKER, from);
            if (at < 0) break;
            sb.append(content, from, at).append(styleBlock(style));
            from = at + MARKER.length();
            count++;
        }
        sb.append(content, from, content.length());
        if (count != 1) {
            logger.warn("Expected one styling marker, found {}", count);
            diagnostics.report(DiagnosticKind.MERGE_MARKER_MISMATCH,
                    count == 0 ? "styling marker not found, output is unstyled"
                            : "styling marker found " + count + " times, all were replaced",
                    "content stream");
        }
        return sb.toString();
    }
}
