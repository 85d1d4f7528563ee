package com.raditha.xnos.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * An element the engine never looks into (code blocks, definition lists,
 * horizontal rules, ...). Its content is carried through unchanged.
 */
public final class Opaque extends Token {

    private final String name;
    private final JsonNode content;

    /**
     * @param name    the pandoc tag
     * @param content the {@code "c"} field, or {@code null} for elements without content
     */
    public Opaque(String name, JsonNode content) {
        this.name = Objects.requireNonNull(name, "name");
        this.content = content;
    }

    @Override
    public TokenType type() {
        return TokenType.OTHER;
    }

    public String getName() {
        return name;
    }

    public JsonNode getContent() {
        return content;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Opaque other && name.equals(other.name) && Objects.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, content);
    }

    @Override
    public String toString() {
        return name;
    }
}
