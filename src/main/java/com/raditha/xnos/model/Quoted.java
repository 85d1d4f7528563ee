package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Smart-quoted inlines.
 */
public final class Quoted extends Token {

    private final QuoteType quoteType;
    private final List<Token> children;

    public Quoted(QuoteType quoteType, List<Token> children) {
        this.quoteType = quoteType;
        this.children = new ArrayList<>(children);
    }

    @Override
    public TokenType type() {
        return TokenType.QUOTED;
    }

    public QuoteType getQuoteType() {
        return quoteType;
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
        return o instanceof Quoted other && quoteType == other.quoteType && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(quoteType, children);
    }

    @Override
    public String toString() {
        return "Quoted(" + quoteType + ", " + children + ")";
    }
}
