package com.raditha.xnos.model;

/**
 * Display or inline math.
 */
public enum MathType {
    DISPLAY_MATH("DisplayMath"),
    INLINE_MATH("InlineMath");

    private final String pandocName;

    MathType(String pandocName) {
        this.pandocName = pandocName;
    }

    public String pandocName() {
        return pandocName;
    }

    public static MathType fromPandocName(String name) {
        for (MathType type : values()) {
            if (type.pandocName.equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown math type: " + name);
    }
}
