package com.raditha.xnos.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A whole pandoc document.
 */
public final class Document {

    private final List<Integer> apiVersion;
    private final JsonNode meta;
    private final List<Token> blocks;

    /**
     * @param apiVersion the {@code pandoc-api-version}, or {@code null} for the legacy layout
     * @param meta       document metadata, carried through unchanged
     * @param blocks     top-level blocks
     */
    public Document(List<Integer> apiVersion, JsonNode meta, List<Token> blocks) {
        this.apiVersion = apiVersion == null ? null : List.copyOf(apiVersion);
        this.meta = meta;
        this.blocks = new ArrayList<>(blocks);
    }

    public static Document of(List<Token> blocks) {
        return new Document(List.of(1, 22), null, blocks);
    }

    public List<Integer> getApiVersion() {
        return apiVersion;
    }

    public boolean isLegacyLayout() {
        return apiVersion == null;
    }

    public JsonNode getMeta() {
        return meta;
    }

    public List<Token> getBlocks() {
        return blocks;
    }

    @Override
    public String toString() {
        return "Document(" + apiVersion + ", " + blocks + ")";
    }
}
