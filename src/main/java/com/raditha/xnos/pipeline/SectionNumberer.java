package com.raditha.xnos.pipeline;

import com.raditha.xnos.model.Attributed;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Header;
import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.util.TokenWalker;

/**
 * Records the chapter each element lives in as a {@code secno} attribute.
 * Chapters are the level-1 headers not marked unnumbered.
 */
public class SectionNumberer {

    public static final String KEY = "secno";

    private final PipelineContext context;

    public SectionNumberer(PipelineContext context) {
        this.context = context;
    }

    public void insert(Document document, TokenType kind) {
        context.resetSectionCounter();
        TokenWalker.walk(document, token -> {
            if (token instanceof Header header && header.isNumberedChapter()) {
                context.nextSection();
            }
            if (token.type() == kind && token instanceof Attributed element && element.hasAttributes()) {
                element.getAttributes().prepend(KEY, String.valueOf(context.getSectionCounter()));
            }
            return null;
        });
    }

    public void delete(Document document, TokenType kind) {
        TokenWalker.walk(document, token -> {
            if (token.type() == kind && token instanceof Attributed element && element.hasAttributes()) {
                element.getAttributes().remove(KEY);
            }
            return null;
        });
    }
}
