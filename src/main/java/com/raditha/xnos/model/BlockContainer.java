package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An element whose only content is a list of blocks: block quotes and footnotes.
 */
public final class BlockContainer extends Token {

    private final TokenType type;
    private final List<Token> blocks;

    public BlockContainer(TokenType type, List<Token> blocks) {
        if (type != TokenType.BLOCK_QUOTE && type != TokenType.NOTE) {
            throw new IllegalArgumentException("Not a block container kind: " + type);
        }
        this.type = type;
        this.blocks = new ArrayList<>(blocks);
    }

    @Override
    public TokenType type() {
        return type;
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
        return o instanceof BlockContainer other && type == other.type && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, blocks);
    }

    @Override
    public String toString() {
        return type.pandocName() + blocks;
    }
}
