package com.raditha.xnos.refs;

import com.raditha.xnos.model.Raw;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.model.TokenType;

import java.util.List;

/**
 * TeX definitions that stand in for the cleveref package.
 * <p>
 * Each fake reference sets the name to print and then calls {@code \cref} or
 * {@code \Cref}, e.g. <code>{\xrefname{fig.}\cref{fig:one}}</code>. The
 * definitions use {@code \providecommand} for the cleveref macros so a real
 * cleveref loaded in the preamble takes over.
 */
public final class CleverefFakery {

    /** First line of the block; identifies a block written by an earlier run */
    public static final String MARKER = "% pandoc-xnos: cleveref fakery";

    static final String DEFINITIONS = String.join("\n",
            MARKER,
            "\\newcommand{\\plusnamesingular}{}",
            "\\newcommand{\\starnamesingular}{}",
            "\\newcommand{\\xrefname}[1]{\\protect\\renewcommand{\\plusnamesingular}{#1}}",
            "\\newcommand{\\Xrefname}[1]{\\protect\\renewcommand{\\starnamesingular}{#1}}",
            "\\providecommand{\\cref}{\\plusnamesingular~\\ref}",
            "\\providecommand{\\Cref}{\\starnamesingular~\\ref}",
            "\\providecommand{\\crefformat}[2]{}",
            "\\providecommand{\\Crefformat}[2]{}");

    private CleverefFakery() {
    }

    /**
     * The macro text for one fake clever reference.
     */
    public static String reference(String label, String name, boolean plus) {
        return plus
                ? "{\\xrefname{" + name + "}\\cref{" + label + "}}"
                : "{\\Xrefname{" + name + "}\\Cref{" + label + "}}";
    }

    public static Raw block() {
        return Raw.block("tex", DEFINITIONS);
    }

    public static boolean isFakeryBlock(Token token) {
        return token instanceof Raw raw && raw.is(TokenType.RAW_BLOCK) && raw.getText().startsWith(MARKER);
    }

    /**
     * Insert the definitions in front of the first block that is not a raw
     * block, unless the document already holds them.
     *
     * @return true if the block was inserted
     */
    public static boolean inject(List<Token> blocks) {
        for (Token block : blocks) {
            if (isFakeryBlock(block)) {
                return false;
            }
        }
        int at = 0;
        while (at < blocks.size() && blocks.get(at).is(TokenType.RAW_BLOCK)) {
            at++;
        }
        blocks.add(at, block());
        return true;
    }
}
