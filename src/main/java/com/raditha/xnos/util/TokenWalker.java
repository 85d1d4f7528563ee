package com.raditha.xnos.util;

import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Token;

import java.util.List;

/**
 * Top-down traversal of a token tree.
 * <p>
 * The action sees a token before its children. When the action returns a
 * replacement, the replacement tokens are spliced into the parent list and
 * their children are walked instead of the original's.
 */
public final class TokenWalker {

    private TokenWalker() {
    }

    public static void walk(Document document, TokenAction action) {
        walk(document.getBlocks(), action);
    }

    public static void walk(List<Token> tokens, TokenAction action) {
        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            List<Token> replacement = action.apply(token);
            if (replacement == null) {
                walkChildren(token, action);
                i++;
            } else {
                tokens.remove(i);
                tokens.addAll(i, replacement);
                for (Token inserted : replacement) {
                    walkChildren(inserted, action);
                }
                i += replacement.size();
            }
        }
    }

    private static void walkChildren(Token token, TokenAction action) {
        for (List<Token> children : token.childLists()) {
            walk(children, action);
        }
    }
}
