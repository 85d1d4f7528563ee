package com.raditha.xnos.compat;

/**
 * Where a table keeps its caption inlines on the wire.
 */
public enum TableLayout {
    /** Before 2.10: the caption field is the inline list itself */
    CAPTION_INLINES,
    /** 2.10: a tagged {@code Caption} element holding short caption and blocks */
    CAPTION_ELEMENT,
    /** 2.11 on: an untagged {@code [short, blocks]} pair */
    CAPTION_ARRAY
}
