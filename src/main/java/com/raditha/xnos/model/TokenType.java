package com.raditha.xnos.model;

/**
 * Kinds of element found in a pandoc document tree.
 * <p>
 * The arity is the number of content fields pandoc emits for the element when
 * it carries no attributes at all (the oldest supported layout). An element
 * whose content holds {@code arity + 1} fields has an attribute set in front,
 * either natively or because a filter attached one.
 */
public enum TokenType {
    /** Text run */
    STR("Str", 1, true),
    SPACE("Space", 0, true),
    SOFT_BREAK("SoftBreak", 0, true),
    LINE_BREAK("LineBreak", 0, true),
    EMPH("Emph", 1, true),
    STRONG("Strong", 1, true),
    STRIKEOUT("Strikeout", 1, true),
    SUPERSCRIPT("Superscript", 1, true),
    SUBSCRIPT("Subscript", 1, true),
    SMALL_CAPS("SmallCaps", 1, true),
    UNDERLINE("Underline", 1, true),
    /** Smart-quoted text (quote kind, children) */
    QUOTED("Quoted", 2, true),
    /** Math (math kind, TeX source) */
    MATH("Math", 2, true),
    /** Citation (citation records, display inlines) */
    CITE("Cite", 2, true),
    CODE("Code", 1, true),
    /** Link (children, target); attributes are native since pandoc 1.16 */
    LINK("Link", 2, true),
    /** Image (caption, target); attributes are native since pandoc 1.16 */
    IMAGE("Image", 2, true),
    SPAN("Span", 1, true),
    RAW_INLINE("RawInline", 2, true),
    NOTE("Note", 1, true),

    PARA("Para", 1, false),
    PLAIN("Plain", 1, false),
    /** Header (level, attributes, children); attributes sit in the middle */
    HEADER("Header", 3, false),
    RAW_BLOCK("RawBlock", 2, false),
    DIV("Div", 1, false),
    BLOCK_QUOTE("BlockQuote", 1, false),
    BULLET_LIST("BulletList", 1, false),
    ORDERED_LIST("OrderedList", 2, false),
    /** Table; attributes are native since pandoc 2.10 */
    TABLE("Table", 5, false),

    /** Any element the engine passes through untouched */
    OTHER(null, 0, false);

    private final String pandocName;
    private final int arity;
    private final boolean inline;

    TokenType(String pandocName, int arity, boolean inline) {
        this.pandocName = pandocName;
        this.arity = arity;
        this.inline = inline;
    }

    /**
     * The element tag used on the wire ({@code "t"} field).
     */
    public String pandocName() {
        return pandocName;
    }

    public int arity() {
        return arity;
    }

    public boolean isInline() {
        return inline;
    }

    /**
     * True if a content array of the given length carries an attribute set in
     * front of the standard fields.
     */
    public boolean isAttributed(int contentLength) {
        return contentLength == arity + 1;
    }

    /**
     * Look up a kind by its pandoc tag.
     *
     * @param name the {@code "t"} value of an element
     * @return the matching kind, or {@link #OTHER} when the tag is not modelled
     */
    public static TokenType fromPandocName(String name) {
        for (TokenType type : values()) {
            if (type.pandocName != null && type.pandocName.equals(name)) {
                return type;
            }
        }
        return OTHER;
    }

    /**
     * Parse a configuration name such as {@code "image"} or {@code "raw-inline"}.
     *
     * @throws IllegalArgumentException if the name does not denote a kind
     */
    public static TokenType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Element kind cannot be null");
        }
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (TokenType type : values()) {
            if (type.name().equals(normalized) && type != OTHER) {
                return type;
            }
        }
        TokenType byPandocName = fromPandocName(value.trim());
        if (byPandocName != OTHER) {
            return byPandocName;
        }
        throw new IllegalArgumentException("Invalid element kind: " + value);
    }
}
