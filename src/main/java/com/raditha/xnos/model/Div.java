package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Generic block container.
 */
public final class Div extends Token implements Attributed {

    private AttributeSet attributes;
    private final List<Token> blocks;

    public Div(AttributeSet attributes, List<Token> blocks) {
        this.attributes = attributes == null ? new AttributeSet() : attributes;
        this.blocks = new ArrayList<>(blocks);
    }

    @Override
    public TokenType type() {
        return TokenType.DIV;
    }

    @Override
    public AttributeSet getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes == null ? new AttributeSet() : attributes;
    }

    public List<Token> getBlocks() {
        return blocks;
    }

    @Override
    public List<List<Token>> childLists() {
        return List.of(blocks);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Div other && attributes.equals(other.attributes) && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, blocks);
    }

    @Override
    public String toString() {
        return "Div(" + attributes + ", " + blocks + ")";
    }
}
