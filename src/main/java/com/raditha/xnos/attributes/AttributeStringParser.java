package com.raditha.xnos.attributes;

import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.Header;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses pandoc markdown attribute strings such as
 * {@code {#fig:plot .wide width="50 %"}}.
 * <p>
 * Words are separated by spaces and newlines outside single or double
 * quotes. Inside quotes a backslash escapes the quote character or another
 * backslash; any other backslash is literal.
 * <ul>
 * <li>{@code #x} sets the id; the first one wins</li>
 * <li>{@code .x} adds a class</li>
 * <li>a lone {@code -} adds the class {@code unnumbered}</li>
 * <li>{@code k=v} adds a key/value pair, with matching quotes around the value removed</li>
 * </ul>
 * A string made of a single bare word is taken as one class, the way pandoc
 * reads <code>```{python}</code>. Words that fail to parse as key/value pairs,
 * and a quote left open at the end, set the {@code parseFailed} flag; the
 * parser itself never fails.
 */
public final class AttributeStringParser {

    private AttributeStringParser() {
    }

    public static AttributeSet parse(String source) {
        String stripped = stripBraces(source == null ? "" : source);
        List<String> words = new ArrayList<>();
        boolean unterminated = split(stripped, words);

        AttributeSet attrs = new AttributeSet();
        attrs.setRawSource(source);

        if (words.size() == 1 && !unterminated && !stripped.startsWith("#") && !stripped.startsWith(".")
                && !stripped.contains("=") && !stripped.equals("-")) {
            attrs.getClasses().add(words.get(0));
            return attrs;
        }

        boolean idSeen = false;
        int kvWords = 0;
        int kvParsed = 0;
        for (String word : words) {
            if (word.startsWith("#")) {
                if (!idSeen) {
                    attrs.setId(word.substring(1));
                    idSeen = true;
                }
            } else if (word.startsWith(".")) {
                attrs.getClasses().add(word.substring(1));
            } else if (word.equals("-")) {
                attrs.getClasses().add(Header.UNNUMBERED);
            } else if (word.contains("=")) {
                kvWords++;
                if (parsePair(word, attrs)) {
                    kvParsed++;
                }
            }
        }
        attrs.setParseFailed(unterminated || kvParsed < kvWords);
        return attrs;
    }

    private static String stripBraces(String source) {
        int start = 0;
        int end = source.length();
        while (start < end && (source.charAt(start) == '{' || source.charAt(start) == '}')) {
            start++;
        }
        while (end > start && (source.charAt(end - 1) == '{' || source.charAt(end - 1) == '}')) {
            end--;
        }
        return source.substring(start, end);
    }

    /**
     * Split into words, dropping a last word whose quote never closes.
     *
     * @return true if a quote was left open
     */
    private static boolean split(String text, List<String> words) {
        StringBuilder word = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                word.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    word.append(text.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == ' ' || c == '\n') {
                if (word.length() > 0) {
                    words.add(word.toString());
                    word.setLength(0);
                }
            } else {
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                word.append(c);
            }
        }
        if (quote != 0) {
            return true;
        }
        if (word.length() > 0) {
            words.add(word.toString());
        }
        return false;
    }

    private static boolean parsePair(String word, AttributeSet attrs) {
        int eq = unquotedEquals(word);
        if (eq <= 0) {
            return false;
        }
        String key = word.substring(0, eq);
        if (key.indexOf('"') >= 0 || key.indexOf('\'') >= 0) {
            return false;
        }
        attrs.put(key, unquote(word.substring(eq + 1)));
        return true;
    }

    private static int unquotedEquals(String word) {
        char quote = 0;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '=') {
                return i;
            }
        }
        return -1;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if (first == last && (first == '"' || first == '\'')) {
                return unescape(value.substring(1, value.length() - 1), first);
            }
        }
        return value;
    }

    private static String unescape(String quoted, char quote) {
        StringBuilder value = new StringBuilder();
        for (int i = 0; i < quoted.length(); i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length()
                    && (quoted.charAt(i + 1) == quote || quoted.charAt(i + 1) == '\\')) {
                c = quoted.charAt(++i);
            }
            value.append(c);
        }
        return value.toString();
    }
}
