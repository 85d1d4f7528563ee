package com.raditha.xnos.refs;

import com.raditha.xnos.attributes.AttributeScanner;
import com.raditha.xnos.attributes.AttributesNotFoundException;
import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.CitationRecord;
import com.raditha.xnos.model.Cite;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.pipeline.PipelineContext;
import com.raditha.xnos.util.TokenContainers;
import com.raditha.xnos.util.TokenText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Normalises references to known labels so they can be replaced later.
 * <p>
 * For <code>{+@fig:1}{.nolink}</code> the processor takes the {@code +}
 * modifier and the <code>{.nolink}</code> block into the Cite's attributes and
 * drops the surrounding braces, leaving a bare Cite carrying
 * <code>{.nolink modifier=+}</code>. A Cite that carries attributes has been
 * processed and is never looked at again.
 */
public class ReferenceProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceProcessor.class);

    private final PipelineContext context;
    private final Predicate<String> known;
    private final Pattern warnPattern;
    private final boolean implicitLabels;

    /**
     * @param context        run state
     * @param known          tells whether a label names a target
     * @param warnPattern    labels matching this at their start but not known are reported;
     *                       {@code null} to report nothing
     * @param implicitLabels also accept {@code ns:id} when only {@code id} is known
     */
    public ReferenceProcessor(PipelineContext context, Predicate<String> known, Pattern warnPattern,
            boolean implicitLabels) {
        this.context = context;
        this.known = known;
        this.warnPattern = warnPattern;
        this.implicitLabels = implicitLabels;
    }

    public static ReferenceProcessor forLabels(PipelineContext context, Set<String> labels, Pattern warnPattern) {
        return new ReferenceProcessor(context, labels::contains, warnPattern, true);
    }

    public void process(Document document) {
        TokenContainers.forEachList(document, context.getProfile().referenceContainers(), this::process);
    }

    /**
     * Process every known reference in one inline list.
     *
     * @return true if any reference was processed
     */
    public boolean process(List<Token> x) {
        boolean processed = false;
        while (processFirst(x)) {
            processed = true;
        }
        return processed;
    }

    private boolean processFirst(List<Token> x) {
        for (int i = 0; i < x.size(); i++) {
            if (!(x.get(i) instanceof Cite cite) || cite.hasAttributes() || !cite.isSingle()) {
                continue;
            }
            String label = cite.citation().id();
            if (isKnown(label)) {
                normalise(x, i, cite);
                return true;
            }
            if (warnPattern != null && warnPattern.matcher(label).lookingAt() && context.reportBadLabel(label)) {
                context.warn("Bad reference: @" + label + ".");
            }
        }
        return false;
    }

    private boolean isKnown(String label) {
        if (known.test(label)) {
            return true;
        }
        int colon = label.lastIndexOf(':');
        return implicitLabels && colon >= 0 && known.test(label.substring(colon + 1));
    }

    private void normalise(List<Token> x, int i, Cite cite) {
        AttributeSet attrs = new AttributeSet();
        i = extractModifier(x, i, cite, attrs);
        i = removeBrackets(x, i, cite);

        CitationRecord citation = cite.citation();
        if (citation.suffix().isEmpty() && !TokenText.stringify(cite.getDisplay()).endsWith("]")) {
            try {
                AttributeSet given = AttributeScanner.scan(x, i + 1);
                if (given.isParseFailed()) {
                    context.warn("Malformed attributes:\n" + given.getRawSource());
                }
                attrs.merge(given);
            } catch (AttributesNotFoundException e) {
                logger.trace("No attributes follow reference {}", citation.id());
            }
        }
        cite.setAttributes(attrs);
    }

    /**
     * Move a {@code +}, {@code *} or {@code !} written in front of the Cite
     * into {@code attrs}. It is looked for at the end of the citation prefix
     * first, then at the end of the preceding Str.
     *
     * @return the Cite's index after any deletion
     */
    private int extractModifier(List<Token> x, int i, Cite cite, AttributeSet attrs) {
        List<Token> prefix = cite.citation().prefix();
        Str source = null;
        boolean inPrefix = false;
        if (!prefix.isEmpty() && prefix.get(prefix.size() - 1) instanceof Str last) {
            source = last;
            inPrefix = true;
        } else if (i > 0 && x.get(i - 1) instanceof Str previous) {
            source = previous;
        }
        if (source == null || source.isEmpty()) {
            return i;
        }

        Modifier modifier = Modifier.fromChar(source.lastChar());
        if (modifier == Modifier.NONE) {
            return i;
        }
        if (modifier.isClever()) {
            context.markCleverefRequired();
        }
        attrs.put(Modifier.KEY, modifier.symbol());

        if (source.getText().length() > 1) {
            source.chopLast();
        } else if (inPrefix) {
            prefix.remove(prefix.size() - 1);
        } else {
            x.remove(i - 1);
            i--;
        }
        return i;
    }

    /**
     * Strip one layer of <code>{</code> <code>}</code> around the Cite, inside the
     * citation when it has both prefix and suffix, otherwise in the neighbouring text.
     *
     * @return the Cite's index after any deletion
     */
    private int removeBrackets(List<Token> x, int i, Cite cite) {
        CitationRecord citation = cite.citation();
        List<Token> prefix = citation.prefix();
        List<Token> suffix = citation.suffix();

        if (!prefix.isEmpty() && !suffix.isEmpty()) {
            if (prefix.get(prefix.size() - 1) instanceof Str open && suffix.get(0) instanceof Str close
                    && open.endsWith("{") && close.startsWith("}")) {
                trimFirst(suffix, 0, close);
                trimLast(prefix, prefix.size() - 1, open);
            }
            return i;
        }

        if (i > 0 && i < x.size() - 1 && x.get(i - 1) instanceof Str open && x.get(i + 1) instanceof Str close
                && open.endsWith("{") && close.startsWith("}")) {
            trimFirst(x, i + 1, close);
            if (trimLast(x, i - 1, open)) {
                return i - 1;
            }
        }
        return i;
    }

    private static void trimFirst(List<Token> list, int index, Str str) {
        if (str.getText().length() > 1) {
            str.chopFirst();
        } else {
            list.remove(index);
        }
    }

    /**
     * @return true if the token was deleted
     */
    private static boolean trimLast(List<Token> list, int index, Str str) {
        if (str.getText().length() > 1) {
            str.chopLast();
            return false;
        }
        list.remove(index);
        return true;
    }
}
