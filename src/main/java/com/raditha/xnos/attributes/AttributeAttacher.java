package com.raditha.xnos.attributes;

import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.Attributed;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Image;
import com.raditha.xnos.model.Space;
import com.raditha.xnos.model.Span;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Table;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.pipeline.PipelineContext;
import com.raditha.xnos.util.ContainerKind;
import com.raditha.xnos.util.TokenContainers;
import com.raditha.xnos.util.TokenText;
import com.raditha.xnos.util.TokenWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Reads {@code {...}} blocks written right after elements of one kind and
 * attaches them to those elements, e.g. <code>$$ E = mc^2 $$ {#eq:einstein}</code>.
 * <p>
 * Paragraph and plain-block content is scanned. Tables are the exception:
 * their attributes are written at the end of the caption.
 */
public class AttributeAttacher {

    private static final Logger logger = LoggerFactory.getLogger(AttributeAttacher.class);

    private static final Set<ContainerKind> BLOCK_CONTENT = EnumSet.of(ContainerKind.PARA, ContainerKind.PLAIN);

    private final PipelineContext context;
    private final TokenType kind;
    private final boolean allowSpace;
    private final boolean replace;

    /**
     * @param context    run state, used for warnings
     * @param kind       the element kind to attach to
     * @param allowSpace accept one Space between the element and its attributes
     * @param replace    overwrite attributes the element already has
     */
    public AttributeAttacher(PipelineContext context, TokenType kind, boolean allowSpace, boolean replace) {
        this.context = context;
        this.kind = kind;
        this.allowSpace = allowSpace;
        this.replace = replace;
    }

    public void attach(Document document) {
        if (kind == TokenType.TABLE) {
            TokenWalker.walk(document, token -> {
                if (token instanceof Table table) {
                    attachToTable(table);
                }
                return null;
            });
            return;
        }
        TokenContainers.forEachList(document, BLOCK_CONTENT, this::attach);
    }

    /**
     * Attach attributes within one paragraph's inline list.
     */
    public void attach(List<Token> x) {
        boolean restart = true;
        while (restart) {
            restart = attachOnce(x);
        }
        if (kind == TokenType.IMAGE && x.size() == 1 && x.get(0) instanceof Image image) {
            image.markAsFigure();
        }
    }

    /**
     * @return true if the list was restructured and must be scanned again
     */
    private boolean attachOnce(List<Token> x) {
        for (int i = 0; i < x.size(); i++) {
            Token token = x.get(i);
            if (token.type() != kind || !(token instanceof Attributed element)) {
                continue;
            }
            if (element.hasAttributes() && !replace) {
                continue;
            }
            int n = i + 1;
            if (allowSpace && n < x.size() && x.get(n) instanceof Space) {
                n++;
            }
            try {
                AttributeSet attrs = AttributeScanner.scan(x, n);
                warnIfMalformed(attrs);
                element.setAttributes(attrs);
            } catch (AttributesNotFoundException e) {
                if (token instanceof Span span && !span.hasAttributes()) {
                    unwrap(x, i, span);
                    return true;
                }
                logger.debug("No attributes after {} at index {}", kind, i);
            }
        }
        return false;
    }

    /**
     * Turn an unattributed Span back into the bracketed text it was made from.
     */
    private void unwrap(List<Token> x, int i, Span span) {
        List<Token> restored = new ArrayList<>();
        restored.add(new Str("["));
        restored.addAll(span.getChildren());
        restored.add(new Str("]"));
        x.remove(i);
        x.addAll(i, restored);
        TokenText.joinStrings(x);
    }

    private void attachToTable(Table table) {
        if (table.hasAttributes() && !replace) {
            return;
        }
        List<Token> caption = table.getCaption();
        for (int k = caption.size() - 1; k >= 0; k--) {
            if (!(caption.get(k) instanceof Str str) || !str.startsWith("{")) {
                continue;
            }
            List<Token> trial = new ArrayList<>(caption);
            try {
                AttributeSet attrs = AttributeScanner.scan(trial, k);
                if (trial.size() != k) {
                    return;
                }
                caption.subList(k, caption.size()).clear();
                while (!caption.isEmpty() && caption.get(caption.size() - 1) instanceof Space) {
                    caption.remove(caption.size() - 1);
                }
                warnIfMalformed(attrs);
                table.setAttributes(attrs);
                return;
            } catch (AttributesNotFoundException e) {
                logger.debug("Caption brace at {} does not open an attribute block", k);
            }
        }
    }

    private void warnIfMalformed(AttributeSet attrs) {
        if (attrs.isParseFailed()) {
            context.warn("Malformed attributes:\n" + attrs.getRawSource());
        }
    }
}
