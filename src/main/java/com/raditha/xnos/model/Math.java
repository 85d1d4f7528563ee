package com.raditha.xnos.model;

import java.util.Objects;

/**
 * TeX math. Pandoc gives math no attributes; equation filters attach them.
 */
public final class Math extends Token implements Attributed {

    private AttributeSet attributes;
    private final MathType mathType;
    private final String text;

    public Math(MathType mathType, String text) {
        this(null, mathType, text);
    }

    public Math(AttributeSet attributes, MathType mathType, String text) {
        this.attributes = attributes;
        this.mathType = mathType;
        this.text = text;
    }

    @Override
    public TokenType type() {
        return TokenType.MATH;
    }

    @Override
    public AttributeSet getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes;
    }

    public MathType getMathType() {
        return mathType;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Math other && Objects.equals(attributes, other.attributes)
                && mathType == other.mathType && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, mathType, text);
    }

    @Override
    public String toString() {
        return "Math(" + (attributes == null ? "" : attributes + ", ") + mathType + ", \"" + text + "\")";
    }
}
