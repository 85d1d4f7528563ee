package com.raditha.xnos.util;

/**
 * The places an inline list can live that the reference passes look into.
 */
public enum ContainerKind {
    PARA,
    PLAIN,
    EMPH,
    STRONG,
    SPAN,
    HEADER,
    IMAGE_CAPTION,
    TABLE_CAPTION,
    CITATION_PREFIX,
    CITATION_SUFFIX
}
