package com.raditha.xnos.model;

/**
 * An element that can carry an {@link AttributeSet}.
 * A {@code null} attribute set means the element is unattributed.
 */
public interface Attributed {

    AttributeSet getAttributes();

    void setAttributes(AttributeSet attributes);

    default boolean hasAttributes() {
        return getAttributes() != null;
    }
}
