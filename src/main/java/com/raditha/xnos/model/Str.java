package com.raditha.xnos.model;

import java.util.Objects;

/**
 * A run of text. The text is mutable so passes can trim brackets and
 * modifiers in place.
 */
public final class Str extends Token {

    private String text;

    public Str(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public TokenType type() {
        return TokenType.STR;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }

    public boolean startsWith(String prefix) {
        return text.startsWith(prefix);
    }

    public boolean endsWith(String suffix) {
        return text.endsWith(suffix);
    }

    /**
     * Last character of the text, or {@code 0} when empty.
     */
    public char lastChar() {
        return text.isEmpty() ? 0 : text.charAt(text.length() - 1);
    }

    /**
     * Drop the last character.
     */
    public void chopLast() {
        text = text.substring(0, text.length() - 1);
    }

    /**
     * Drop the first character.
     */
    public void chopFirst() {
        text = text.substring(1);
    }

    public void append(String more) {
        text = text + more;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Str other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "Str(\"" + text + "\")";
    }
}
