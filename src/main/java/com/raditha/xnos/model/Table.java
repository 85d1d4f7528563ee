package com.raditha.xnos.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A table. Only the caption inlines and the attributes are modelled; the
 * column specs, head, bodies and foot stay in the raw content array.
 * <p>
 * The caption sits five fields from the end of the content array in every
 * pandoc layout, but its shape changed in 2.10 and again in 2.11. The codec
 * reads and writes it according to the document's compatibility profile.
 */
public final class Table extends Token implements Attributed {

    private AttributeSet attributes;
    private final List<Token> caption;
    private final JsonNode content;

    /**
     * @param attributes attributes, or {@code null} for pre-2.10 tables nobody attached any to
     * @param caption    caption inlines
     * @param content    the full wire content array, kept for everything but the caption
     */
    public Table(AttributeSet attributes, List<Token> caption, JsonNode content) {
        this.attributes = attributes;
        this.caption = new ArrayList<>(caption);
        this.content = content;
    }

    @Override
    public TokenType type() {
        return TokenType.TABLE;
    }

    @Override
    public AttributeSet getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes;
    }

    public List<Token> getCaption() {
        return caption;
    }

    public JsonNode getContent() {
        return content;
    }

    @Override
    public List<List<Token>> childLists() {
        return List.of(caption);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Table other && Objects.equals(attributes, other.attributes)
                && caption.equals(other.caption) && Objects.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, caption, content);
    }

    @Override
    public String toString() {
        return "Table(" + (attributes == null ? "" : attributes + ", ") + caption + ")";
    }
}
