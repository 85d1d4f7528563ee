package com.raditha.xnos.model;

/**
 * Destination of a link or source of an image.
 *
 * @param url   the URL or anchor
 * @param title the title; pandoc marks implicit figures with {@code fig:}
 */
public record LinkTarget(String url, String title) {

    public static LinkTarget of(String url) {
        return new LinkTarget(url, "");
    }
}
