package com.raditha.xnos.model;

import java.util.List;

/**
 * One node of a pandoc document tree, either an inline element or a block.
 * <p>
 * Tokens own their children. Child lists are mutable and are rewritten in
 * place by the reference passes; a list object is never swapped for another.
 */
public abstract class Token {

    /**
     * Kind of this element.
     */
    public abstract TokenType type();

    /**
     * Child lists in document order, used by the tree walker.
     * Leaf elements have none.
     */
    public List<List<Token>> childLists() {
        return List.of();
    }

    public boolean is(TokenType type) {
        return type() == type;
    }
}
