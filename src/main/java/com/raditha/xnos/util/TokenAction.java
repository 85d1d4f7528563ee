package com.raditha.xnos.util;

import com.raditha.xnos.model.Token;

import java.util.List;

/**
 * Callback applied to every token of a tree by {@link TokenWalker}.
 */
@FunctionalInterface
public interface TokenAction {

    /**
     * @param token the token being visited
     * @return {@code null} to keep the token, or the tokens to splice in its place
     *         (an empty list deletes it)
     */
    List<Token> apply(Token token);
}
