package com.raditha.xnos.refs;

/**
 * How clever references are made available to TeX output.
 */
public enum CleverefMode {
    /** Emit {@code \cref} and let the document load the cleveref package */
    PACKAGE,
    /** Define minimal {@code \cref}/{@code \Cref} macros in the document body */
    FAKE;

    public static CleverefMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Cleveref mode cannot be null");
        }
        return switch (value.trim().toLowerCase()) {
            case "package" -> PACKAGE;
            case "fake", "fakery" -> FAKE;
            default -> throw new IllegalArgumentException("Invalid cleveref mode: " + value
                    + ". Valid values: package, fake");
        };
    }
}
