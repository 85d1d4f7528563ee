package com.raditha.xnos.util;

import com.raditha.xnos.model.Code;
import com.raditha.xnos.model.Math;
import com.raditha.xnos.model.Quoted;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Token;

import java.util.List;

/**
 * Plain-text views of inline lists.
 */
public final class TokenText {

    private TokenText() {
    }

    /**
     * Concatenate the text of all tokens. Spaces and breaks become a single
     * blank; quotes are dropped and math is rendered as its TeX source.
     */
    public static String stringify(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            append(sb, token, false);
        }
        return sb.toString();
    }

    public static String stringify(Token token) {
        StringBuilder sb = new StringBuilder();
        append(sb, token, false);
        return sb.toString();
    }

    /**
     * Like {@link #stringify(List)} but smart quotes are written back as ASCII
     * quote characters and math is written as {@code $tex$}, so the result
     * reads the way the source markdown did.
     */
    public static String plainText(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            append(sb, token, true);
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, Token token, boolean literal) {
        switch (token.type()) {
            case STR -> sb.append(((Str) token).getText());
            case SPACE, SOFT_BREAK, LINE_BREAK -> sb.append(' ');
            case CODE -> sb.append(((Code) token).getText());
            case MATH -> {
                String tex = ((Math) token).getText();
                sb.append(literal ? "$" + tex + "$" : tex);
            }
            case QUOTED -> {
                Quoted quoted = (Quoted) token;
                if (literal) {
                    sb.append(quoted.getQuoteType().mark());
                }
                for (Token child : quoted.getChildren()) {
                    append(sb, child, literal);
                }
                if (literal) {
                    sb.append(quoted.getQuoteType().mark());
                }
            }
            default -> {
                for (List<Token> children : token.childLists()) {
                    for (Token child : children) {
                        append(sb, child, literal);
                    }
                }
            }
        }
    }

    /**
     * Merge runs of adjacent Str tokens in place.
     *
     * @return true if anything was merged
     */
    public static boolean joinStrings(List<Token> tokens) {
        boolean changed = false;
        int i = 0;
        while (i < tokens.size() - 1) {
            if (tokens.get(i) instanceof Str first && tokens.get(i + 1) instanceof Str second) {
                first.append(second.getText());
                tokens.remove(i + 1);
                changed = true;
            } else {
                i++;
            }
        }
        return changed;
    }
}
