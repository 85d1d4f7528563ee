package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An element whose only content is a list of inlines: paragraphs, plain
 * blocks and the styled inline containers (emphasis, strong, ...).
 */
public final class InlineContainer extends Token {

    private static final Set<TokenType> KINDS = Set.of(
            TokenType.PARA, TokenType.PLAIN,
            TokenType.EMPH, TokenType.STRONG, TokenType.STRIKEOUT,
            TokenType.SUPERSCRIPT, TokenType.SUBSCRIPT, TokenType.SMALL_CAPS, TokenType.UNDERLINE);

    private final TokenType type;
    private final List<Token> children;

    public InlineContainer(TokenType type, List<Token> children) {
        if (!KINDS.contains(type)) {
            throw new IllegalArgumentException("Not an inline container kind: " + type);
        }
        this.type = type;
        this.children = new ArrayList<>(children);
    }

    public static InlineContainer para(List<Token> children) {
        return new InlineContainer(TokenType.PARA, children);
    }

    public static InlineContainer plain(List<Token> children) {
        return new InlineContainer(TokenType.PLAIN, children);
    }

    public static boolean isContainerKind(TokenType type) {
        return KINDS.contains(type);
    }

    @Override
    public TokenType type() {
        return type;
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
        return o instanceof InlineContainer other && type == other.type && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, children);
    }

    @Override
    public String toString() {
        return type.pandocName() + children;
    }
}
