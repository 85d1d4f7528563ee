package com.raditha.xnos.model;

/**
 * Quote style of a {@link Quoted} element.
 */
public enum QuoteType {
    SINGLE_QUOTE("SingleQuote", '\''),
    DOUBLE_QUOTE("DoubleQuote", '"');

    private final String pandocName;
    private final char mark;

    QuoteType(String pandocName, char mark) {
        this.pandocName = pandocName;
        this.mark = mark;
    }

    public String pandocName() {
        return pandocName;
    }

    /**
     * The ASCII quote character this style stands for.
     */
    public char mark() {
        return mark;
    }

    public static QuoteType fromPandocName(String name) {
        for (QuoteType type : values()) {
            if (type.pandocName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown quote type: " + name);
    }
}
