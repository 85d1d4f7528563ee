package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generic inline container.
 * <p>
 * Reference replacement wraps bracketed references in a Span whose attributes
 * are still {@code null}; a later attach pass either fills them in or unwraps
 * the Span again.
 */
public final class Span extends Token implements Attributed {

    private AttributeSet attributes;
    private final List<Token> children;

    public Span(AttributeSet attributes, List<Token> children) {
        this.attributes = attributes;
        this.children = new ArrayList<>(children);
    }

    @Override
    public TokenType type() {
        return TokenType.SPAN;
    }

    @Override
    public AttributeSet getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes;
    }

    public List<Token> getChildren() {
        return children;
    }

    @Override
    public List<List<Token>> childLists() {
        return List.of(children);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Span other && Objects.equals(attributes, other.attributes)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, children);
    }

    @Override
    public String toString() {
        return "Span(" + attributes + ", " + children + ")";
    }
}
