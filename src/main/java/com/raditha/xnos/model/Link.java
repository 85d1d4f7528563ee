package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Hyperlink. Links only carry attributes since pandoc 1.16, so the attribute
 * set is {@code null} for documents from older versions.
 */
public final class Link extends Token implements Attributed {

    private AttributeSet attributes;
    private final List<Token> children;
    private LinkTarget target;

    public Link(AttributeSet attributes, List<Token> children, LinkTarget target) {
        this.attributes = attributes;
        this.children = new ArrayList<>(children);
        this.target = target;
    }

    @Override
    public TokenType type() {
        return TokenType.LINK;
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

    public LinkTarget getTarget() {
        return target;
    }

    public void setTarget(LinkTarget target) {
        this.target = target;
    }

    @Override
    public List<List<Token>> childLists() {
        return List.of(children);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Link other && Objects.equals(attributes, other.attributes)
                && children.equals(other.children) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, children, target);
    }

    @Override
    public String toString() {
        return "Link(" + children + ", " + target.url() + ")";
    }
}
