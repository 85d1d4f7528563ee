package com.raditha.xnos.refs;

/**
 * Singular and plural name of a kind of target, e.g. {@code fig.}/{@code figs.}.
 */
public record NameTable(String singular, String plural) {

    public NameTable {
        if (singular == null || plural == null) {
            throw new IllegalArgumentException("Reference names cannot be null");
        }
    }
}
