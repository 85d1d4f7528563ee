package com.raditha.xnos.refs;

import com.raditha.xnos.model.AttributeSet;

/**
 * The character written in front of a reference to choose how it renders:
 * {@code +@fig:1} gives "fig. 1", {@code *@fig:1} gives "Figure 1" and
 * {@code !@fig:1} suppresses the name.
 */
public enum Modifier {
    NONE(""),
    PLUS("+"),
    STAR("*"),
    SUPPRESS("!");

    /** Key under which an extracted modifier is stored in the reference's attributes */
    public static final String KEY = "modifier";

    private final String symbol;

    Modifier(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * True for the modifiers that ask for a name in front of the number.
     */
    public boolean isClever() {
        return this == PLUS || this == STAR;
    }

    public static Modifier fromChar(char c) {
        return switch (c) {
            case '+' -> PLUS;
            case '*' -> STAR;
            case '!' -> SUPPRESS;
            default -> NONE;
        };
    }

    /**
     * The modifier recorded in a reference's attributes, or {@link #NONE}.
     */
    public static Modifier of(AttributeSet attrs) {
        String value = attrs.get(KEY);
        if (value == null || value.length() != 1) {
            return NONE;
        }
        return fromChar(value.charAt(0));
    }
}
