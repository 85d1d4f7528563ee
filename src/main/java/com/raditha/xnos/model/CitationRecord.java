package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One citation inside a {@link Cite}.
 *
 * @param id      the citation key, e.g. {@code fig:one}
 * @param prefix  inlines written before the key inside brackets (mutable)
 * @param suffix  inlines written after the key inside brackets (mutable)
 * @param mode    how the citation was written
 * @param noteNum footnote number assigned by pandoc
 * @param hash    pandoc's citation hash
 */
public record CitationRecord(
        String id,
        List<Token> prefix,
        List<Token> suffix,
        CitationMode mode,
        int noteNum,
        int hash) {

    public CitationRecord {
        prefix = new ArrayList<>(prefix);
        suffix = new ArrayList<>(suffix);
    }

    /**
     * An in-text citation with empty prefix and suffix.
     */
    public static CitationRecord of(String id) {
        return of(id, CitationMode.AUTHOR_IN_TEXT);
    }

    public static CitationRecord of(String id, CitationMode mode) {
        return new CitationRecord(id, List.of(), List.of(), mode, 0, 0);
    }
}
