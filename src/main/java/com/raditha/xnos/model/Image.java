package com.raditha.xnos.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Image with its caption inlines.
 */
public final class Image extends Token implements Attributed {

    /** Title pandoc uses to mark an image that stands alone as a figure */
    public static final String FIGURE_TITLE = "fig:";

    private AttributeSet attributes;
    private final List<Token> caption;
    private LinkTarget target;

    public Image(AttributeSet attributes, List<Token> caption, LinkTarget target) {
        this.attributes = attributes;
        this.caption = new ArrayList<>(caption);
        this.target = target;
    }

    @Override
    public TokenType type() {
        return TokenType.IMAGE;
    }

    @Override
    public AttributeSet getAttributes() {
        return attributes;
    }

    @Override
    public void setAttributes(AttributeSet attributes) {
        this.attributes = attributes;
    }

    public List<Token> getCaption() {
        return caption;
    }

    public LinkTarget getTarget() {
        return target;
    }

    public void setTarget(LinkTarget target) {
        this.target = target;
    }

    /**
     * Mark this image as a figure the way pandoc does for a lone image in a paragraph.
     */
    public void markAsFigure() {
        target = new LinkTarget(target.url(), FIGURE_TITLE);
    }

    @Override
    public List<List<Token>> childLists() {
        return List.of(caption);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Image other && Objects.equals(attributes, other.attributes)
                && caption.equals(other.caption) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, caption, target);
    }

    @Override
    public String toString() {
        return "Image(" + (attributes == null ? "" : attributes + ", ") + caption + ", " + target.url() + ")";
    }
}
