package com.raditha.xnos.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bullet or ordered list. Each item is a list of blocks. The numbering style
 * of an ordered list is kept as raw JSON since nothing here inspects it.
 */
public final class ListBlock extends Token {

    private final TokenType type;
    private final JsonNode listAttributes;
    private final List<List<Token>> items;

    public ListBlock(TokenType type, JsonNode listAttributes, List<List<Token>> items) {
        if (type != TokenType.BULLET_LIST && type != TokenType.ORDERED_LIST) {
            throw new IllegalArgumentException("Not a list kind: " + type);
        }
        if (type == TokenType.ORDERED_LIST && listAttributes == null) {
            throw new IllegalArgumentException("Ordered lists need list attributes");
        }
        this.type = type;
        this.listAttributes = listAttributes;
        this.items = new ArrayList<>();
        for (List<Token> item : items) {
            this.items.add(new ArrayList<>(item));
        }
    }

    public static ListBlock bullets(List<List<Token>> items) {
        return new ListBlock(TokenType.BULLET_LIST, null, items);
    }

    @Override
    public TokenType type() {
        return type;
    }

    /**
     * Start number, style and delimiter of an ordered list; {@code null} for bullets.
     */
    public JsonNode getListAttributes() {
        return listAttributes;
    }

    public List<List<Token>> getItems() {
        return items;
    }

    @Override
    public List<List<Token>> childLists() {
        return items;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ListBlock other && type == other.type
                && Objects.equals(listAttributes, other.listAttributes) && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, listAttributes, items);
    }

    @Override
    public String toString() {
        return type.pandocName() + items;
    }
}
