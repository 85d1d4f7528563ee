package com.raditha.xnos.model;

/**
 * Inter-word space.
 */
public final class Space extends Token {

    @Override
    public TokenType type() {
        return TokenType.SPACE;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Space;
    }

    @Override
    public int hashCode() {
        return Space.class.hashCode();
    }

    @Override
    public String toString() {
        return "Space";
    }
}
