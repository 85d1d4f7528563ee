package com.raditha.xnos.refs;

import java.util.Set;

/**
 * Families of pandoc output formats, by how a reference is rendered in them.
 */
public enum OutputFormat {
    /** Macro calls such as {@code \ref{fig:1}} */
    TEX,
    /** Link to the target's anchor */
    HYPERLINK,
    /** Bare number */
    PLAIN;

    private static final Set<String> TEX_FORMATS = Set.of("latex", "beamer");

    private static final Set<String> LINK_FORMATS = Set.of(
            "docx", "odt", "rst", "jats", "docbook", "docbook4", "docbook5",
            "markdown", "markdown_strict", "markdown_phpextra", "markdown_github", "markdown_mmd",
            "gfm", "commonmark", "commonmark_x",
            "revealjs", "slidy", "slideous", "dzslides", "s5");

    /**
     * Classify a pandoc format name such as {@code html5} or {@code latex}.
     * Extensions ({@code markdown+smart}) are ignored.
     */
    public static OutputFormat of(String format) {
        String base = baseName(format);
        if (TEX_FORMATS.contains(base)) {
            return TEX;
        }
        if (base.startsWith("html") || base.startsWith("epub") || LINK_FORMATS.contains(base)) {
            return HYPERLINK;
        }
        return PLAIN;
    }

    public static boolean isEpub(String format) {
        return baseName(format).startsWith("epub");
    }

    private static String baseName(String format) {
        if (format == null) {
            return "";
        }
        String base = format.trim().toLowerCase();
        int cut = indexOfExtension(base);
        return cut < 0 ? base : base.substring(0, cut);
    }

    private static int indexOfExtension(String format) {
        int plus = format.indexOf('+');
        int minus = format.indexOf('-');
        if (plus < 0) {
            return minus;
        }
        return minus < 0 ? plus : Math.min(plus, minus);
    }
}
