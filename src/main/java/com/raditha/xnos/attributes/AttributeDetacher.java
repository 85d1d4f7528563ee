package com.raditha.xnos.attributes;

import com.raditha.xnos.compat.CompatibilityProfile;
import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.Attributed;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.pipeline.PipelineContext;
import com.raditha.xnos.util.TokenWalker;

import java.util.List;

/**
 * Removes attributes that a filter attached to elements pandoc does not give
 * attributes to, so the document can be written back in pandoc's own layout.
 * Attributes pandoc supports natively for the document's version are kept.
 */
public class AttributeDetacher {

    private final PipelineContext context;
    private final TokenType kind;
    private final boolean restore;

    /**
     * @param restore write the removed attributes back into the text after the element
     */
    public AttributeDetacher(PipelineContext context, TokenType kind, boolean restore) {
        this.context = context;
        this.kind = kind;
        this.restore = restore;
    }

    public void detach(Document document) {
        detach(document.getBlocks());
    }

    public void detach(List<Token> tokens) {
        CompatibilityProfile profile = context.getProfile();
        if (profile.hasNativeAttributes(kind)) {
            return;
        }
        TokenWalker.walk(tokens, token -> {
            if (token.type() != kind || !(token instanceof Attributed element) || !element.hasAttributes()) {
                return null;
            }
            AttributeSet attrs = element.getAttributes();
            element.setAttributes(null);
            return restore ? List.of(token, new Str(attrs.toMarkdown())) : null;
        });
    }
}
