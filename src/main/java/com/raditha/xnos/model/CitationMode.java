package com.raditha.xnos.model;

/**
 * How a citation was written: {@code @key}, {@code [@key]} or {@code [-@key]}.
 */
public enum CitationMode {
    AUTHOR_IN_TEXT("AuthorInText"),
    NORMAL_CITATION("NormalCitation"),
    SUPPRESS_AUTHOR("SuppressAuthor");

    private final String pandocName;

    CitationMode(String pandocName) {
        this.pandocName = pandocName;
    }

    public String pandocName() {
        return pandocName;
    }

    public static CitationMode fromPandocName(String name) {
        for (CitationMode mode : values()) {
            if (mode.pandocName.equals(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown citation mode: " + name);
    }
}
