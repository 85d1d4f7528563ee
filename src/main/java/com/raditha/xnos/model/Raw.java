package com.raditha.xnos.model;

import java.util.Objects;

/**
 * Format-specific raw content, inline ({@code RawInline}) or block ({@code RawBlock}).
 */
public final class Raw extends Token {

    private final TokenType type;
    private final String format;
    private final String text;

    private Raw(TokenType type, String format, String text) {
        this.type = type;
        this.format = Objects.requireNonNull(format, "format");
        this.text = Objects.requireNonNull(text, "text");
    }

    public static Raw inline(String format, String text) {
        return new Raw(TokenType.RAW_INLINE, format, text);
    }

    public static Raw block(String format, String text) {
        return new Raw(TokenType.RAW_BLOCK, format, text);
    }

    @Override
    public TokenType type() {
        return type;
    }

    public String getFormat() {
        return format;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Raw other && type == other.type && format.equals(other.format) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, format, text);
    }

    @Override
    public String toString() {
        return type.pandocName() + "(" + format + ", \"" + text + "\")";
    }
}
