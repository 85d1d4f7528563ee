package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A citation marker. Reference processing attaches an attribute set to the
 * citations it recognises; an unattributed Cite has not been processed.
 */
public final class Cite extends Token implements Attributed {

    private AttributeSet attributes;
    private final List<CitationRecord> citations;
    private final List<Token> display;

    public Cite(List<CitationRecord> citations, List<Token> display) {
        this(null, citations, display);
    }

    public Cite(AttributeSet attributes, List<CitationRecord> citations, List<Token> display) {
        this.attributes = attributes;
        this.citations = new ArrayList<>(citations);
        this.display = new ArrayList<>(display);
    }

    /**
     * The Cite pandoc produces for an in-text {@code @label}.
     */
    public static Cite reference(String label) {
        return reference(label, CitationMode.AUTHOR_IN_TEXT);
    }

    public static Cite reference(String label, CitationMode mode) {
        return new Cite(List.of(CitationRecord.of(label, mode)), List.of(new Str("@" + label)));
    }

    @Override
    public TokenType type() {
        return TokenType.CITE;
    }

    @Override
    public AttributeSet getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes;
    }

    public List<CitationRecord> getCitations() {
        return citations;
    }

    public List<Token> getDisplay() {
        return display;
    }

    public boolean isSingle() {
        return citations.size() == 1;
    }

    /**
     * The only citation of a single-record Cite.
     *
     * @throws IllegalStateException if the Cite holds several citations
     */
    public CitationRecord citation() {
        if (!isSingle()) {
            throw new IllegalStateException("Cite holds " + citations.size() + " citations");
        }
        return citations.get(0);
    }

    @Override
    public List<List<Token>> childLists() {
        List<List<Token>> lists = new ArrayList<>();
        for (CitationRecord citation : citations) {
            lists.add(citation.prefix());
            lists.add(citation.suffix());
        }
        lists.add(display);
        return lists;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Cite other && Objects.equals(attributes, other.attributes)
                && citations.equals(other.citations) && display.equals(other.display);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, citations, display);
    }

    @Override
    public String toString() {
        String ids = citations.stream().map(CitationRecord::id).toList().toString();
        return "Cite(" + (attributes == null ? "" : attributes + ", ") + ids + ", " + display + ")";
    }
}
