package com.raditha.xnos.model;

import java.util.Objects;

/**
 * Inline code.
 */
public final class Code extends Token implements Attributed {

    private AttributeSet attributes;
    private final String text;

    public Code(AttributeSet attributes, String text) {
        this.attributes = attributes;
        this.text = text;
    }

    @Override
    public TokenType type() {
        return TokenType.CODE;
    }

    @Override
    public AttributeSet getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Code other && Objects.equals(attributes, other.attributes) && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, text);
    }

    @Override
    public String toString() {
        return "Code(\"" + text + "\")";
    }
}
