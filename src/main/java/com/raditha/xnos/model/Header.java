package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Section heading. Headers always carry attributes.
 */
public final class Header extends Token implements Attributed {

    /** Class pandoc gives headers written with a trailing {@code {-}} */
    public static final String UNNUMBERED = "unnumbered";

    private final int level;
    private AttributeSet attributes;
    private final List<Token> children;

    public Header(int level, AttributeSet attributes, List<Token> children) {
        if (level < 1) {
            throw new IllegalArgumentException("Header level must be positive: " + level);
        }
        this.level = level;
        this.attributes = attributes == null ? new AttributeSet() : attributes;
        this.children = new ArrayList<>(children);
    }

    @Override
    public TokenType type() {
        return TokenType.HEADER;
    }

    public int getLevel() {
        return level;
    }

    @Override
    public AttributeSet getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes == null ? new AttributeSet() : attributes;
    }

    public List<Token> getChildren() {
        return children;
    }

    /**
     * True for a level-1 header that takes part in section numbering.
     */
    public boolean isNumberedChapter() {
        return level == 1 && !attributes.hasClass(UNNUMBERED);
    }

    @Override
    public List<List<Token>> childLists() {
        return List.of(children);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Header other && level == other.level
                && attributes.equals(other.attributes) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, attributes, children);
    }

    @Override
    public String toString() {
        return "Header(" + level + ", " + attributes + ", " + children + ")";
    }
}
