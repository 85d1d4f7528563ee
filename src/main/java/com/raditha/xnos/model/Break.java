package com.raditha.xnos.model;

/**
 * Soft or hard line break.
 */
public final class Break extends Token {

    private final TokenType type;

    public Break(TokenType type) {
        if (type != TokenType.SOFT_BREAK && type != TokenType.LINE_BREAK) {
            throw new IllegalArgumentException("Not a break kind: " + type);
        }
        this.type = type;
    }

    @Override
    public TokenType type() {
        return type;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Break other && type == other.type;
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return type.pandocName();
    }
}
