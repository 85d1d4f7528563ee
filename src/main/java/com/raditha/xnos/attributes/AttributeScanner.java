package com.raditha.xnos.attributes;

import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.util.TokenText;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds a {@code {...}} attribute block written inline after an element and
 * cuts it out of the token list.
 * <p>
 * The block must start with a Str beginning with <code>{</code>. It ends at the
 * first <code>}</code> outside quotes (a backslash inside quotes escapes the
 * next character), which may sit several tokens later
 * (attribute strings containing spaces or smart quotes are split by pandoc).
 * Text glued to the closing brace stays in the list.
 */
public final class AttributeScanner {

    private AttributeScanner() {
    }

    /**
     * Extract the attribute block starting at {@code x[n]}.
     * <p>
     * On success the tokens making up the block are removed and any text that
     * followed the closing brace takes their place at index {@code n}. On
     * failure the list is left as it was.
     *
     * @throws AttributesNotFoundException if no complete block starts at {@code n}
     */
    public static AttributeSet scan(List<Token> x, int n) throws AttributesNotFoundException {
        if (n < 0 || n >= x.size()) {
            throw new AttributesNotFoundException("No token at index " + n);
        }
        if (!(x.get(n) instanceof Str start) || !start.startsWith("{")) {
            throw new AttributesNotFoundException("Attributes not found at index " + n);
        }

        char quote = 0;
        for (int i = n; i < x.size(); i++) {
            if (!(x.get(i) instanceof Str str)) {
                continue;
            }
            String text = str.getText();
            for (int j = 0; j < text.length(); j++) {
                char c = text.charAt(j);
                if (quote != 0) {
                    if (c == '\\') {
                        j++;
                    } else if (c == quote) {
                        quote = 0;
                    }
                } else if (c == '"' || c == '\'') {
                    quote = c;
                } else if (c == '}') {
                    return cut(x, n, i, j);
                }
            }
        }
        throw new AttributesNotFoundException("Unterminated attributes starting with: " + start.getText());
    }

    /**
     * Remove the block spanning {@code x[n]} up to character {@code j} of {@code x[end]}.
     */
    private static AttributeSet cut(List<Token> x, int n, int end, int j) {
        String closing = ((Str) x.get(end)).getText();
        List<Token> span = new ArrayList<>(x.subList(n, end));
        span.add(new Str(closing.substring(0, j + 1)));
        String tail = closing.substring(j + 1);

        x.subList(n, end + 1).clear();
        if (!tail.isEmpty()) {
            x.add(n, new Str(tail));
        }

        return AttributeStringParser.parse(TokenText.plainText(span).trim());
    }
}
