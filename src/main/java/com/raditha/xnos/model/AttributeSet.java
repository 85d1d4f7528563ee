package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Attributes of an element: an identifier, an ordered list of classes and an
 * ordered key/value map. This is the {@code {#id .class key=value}} bundle of
 * pandoc markdown, or the {@code [id, [classes], [[k, v]...]]} triple on the wire.
 * <p>
 * Keys are unique; putting an existing key replaces its value but keeps its
 * position. Classes may repeat.
 */
public class AttributeSet {

    private static final Pattern NEEDS_QUOTES = Pattern.compile("[\\s{}\"'=]");

    private String id;
    private final List<String> classes;
    private final Map<String, String> kvs;
    private boolean parseFailed;
    private String rawSource;

    /**
     * Create an empty attribute set.
     */
    public AttributeSet() {
        this("", List.of(), Map.of());
    }

    public AttributeSet(String id, List<String> classes, Map<String, String> kvs) {
        this.id = id == null ? "" : id;
        this.classes = new ArrayList<>(classes);
        this.kvs = new LinkedHashMap<>(kvs);
    }

    /**
     * Build from the already-split pandoc triple.
     *
     * @param pairs key/value pairs in document order; later pairs win
     */
    public static AttributeSet fromPandoc(String id, List<String> classes, List<Map.Entry<String, String>> pairs) {
        AttributeSet attrs = new AttributeSet(id, classes, Map.of());
        for (Map.Entry<String, String> pair : pairs) {
            attrs.put(pair.getKey(), pair.getValue());
        }
        return attrs;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id == null ? "" : id;
    }

    /**
     * Mutable view of the classes.
     */
    public List<String> getClasses() {
        return classes;
    }

    /**
     * Mutable view of the key/value pairs.
     */
    public Map<String, String> getKvs() {
        return kvs;
    }

    public String get(String key) {
        return kvs.get(key);
    }

    public boolean containsKey(String key) {
        return kvs.containsKey(key);
    }

    public void put(String key, String value) {
        kvs.put(key, value);
    }

    /**
     * Insert a pair in front of all others, replacing any existing value.
     */
    public void prepend(String key, String value) {
        Map<String, String> rest = new LinkedHashMap<>(kvs);
        rest.remove(key);
        kvs.clear();
        kvs.put(key, value);
        kvs.putAll(rest);
    }

    public String remove(String key) {
        return kvs.remove(key);
    }

    public boolean hasClass(String name) {
        return classes.contains(name);
    }

    public boolean isEmpty() {
        return id.isEmpty() && classes.isEmpty() && kvs.isEmpty();
    }

    public boolean isParseFailed() {
        return parseFailed;
    }

    public void setParseFailed(boolean parseFailed) {
        this.parseFailed = parseFailed;
    }

    /**
     * The string this set was parsed from, or {@code null} if it was built directly.
     */
    public String getRawSource() {
        return rawSource;
    }

    public void setRawSource(String rawSource) {
        this.rawSource = rawSource;
    }

    /**
     * Merge another set into this one: its id replaces ours, its classes are
     * appended and its pairs are put.
     */
    public void merge(AttributeSet other) {
        setId(other.id);
        classes.addAll(other.classes);
        kvs.putAll(other.kvs);
    }

    public AttributeSet copy() {
        AttributeSet copy = new AttributeSet(id, classes, kvs);
        copy.parseFailed = parseFailed;
        copy.rawSource = rawSource;
        return copy;
    }

    /**
     * Render as pandoc markdown, e.g. {@code {#fig:1 .wide width="50 %"}}.
     * Values that are empty or contain whitespace, braces, quotes or {@code =}
     * are quoted with a quote character they do not contain. A value holding
     * both kinds of quote is double-quoted with backslash escapes.
     */
    public String toMarkdown() {
        List<String> parts = new ArrayList<>();
        if (!id.isEmpty()) {
            parts.add("#" + id);
        }
        for (String cls : classes) {
            parts.add("." + cls);
        }
        for (Map.Entry<String, String> kv : kvs.entrySet()) {
            String value = kv.getValue();
            if (value.isEmpty() || NEEDS_QUOTES.matcher(value).find()) {
                value = quote(value);
            }
            parts.add(kv.getKey() + "=" + value);
        }
        return "{" + String.join(" ", parts) + "}";
    }

    private static String quote(String value) {
        if (value.indexOf('"') < 0) {
            return "\"" + escapeBackslashes(value, '"') + "\"";
        }
        if (value.indexOf('\'') < 0) {
            return "'" + escapeBackslashes(value, '\'') + "'";
        }
        return "\"" + escapeBackslashes(value, '"').replace("\"", "\\\"") + "\"";
    }

    /**
     * Double the backslashes that would otherwise be read as escapes: those
     * followed by another backslash, the quote character or the closing quote.
     */
    private static String escapeBackslashes(String value, char quote) {
        StringBuilder escaped = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            escaped.append(c);
            if (c == '\\') {
                char next = i + 1 < value.length() ? value.charAt(i + 1) : quote;
                if (next == '\\' || next == quote) {
                    escaped.append('\\');
                }
            }
        }
        return escaped.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeSet that = (AttributeSet) o;
        return id.equals(that.id) && classes.equals(that.classes) && kvs.equals(that.kvs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, classes, kvs);
    }

    @Override
    public String toString() {
        return toMarkdown();
    }
}
