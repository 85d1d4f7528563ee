package com.raditha.xnos.refs;

import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.CitationRecord;
import com.raditha.xnos.model.Cite;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Link;
import com.raditha.xnos.model.LinkTarget;
import com.raditha.xnos.model.Math;
import com.raditha.xnos.model.MathType;
import com.raditha.xnos.model.Raw;
import com.raditha.xnos.model.Space;
import com.raditha.xnos.model.Span;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.pipeline.PipelineContext;
import com.raditha.xnos.util.TokenText;
import com.raditha.xnos.util.TokenWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Replaces processed references with output for the target format.
 * <p>
 * For {@code +@fig:one} resolving to figure 1 the result is
 * {@code \cref{fig:one}} in LaTeX, {@code fig. [1](#fig:one)} in HTML and
 * {@code fig. 1} in plain text. References written in brackets,
 * {@code [+@fig:one]{.nolink}}, come out wrapped in an unattributed Span so
 * the attributes after them can be attached in a later pass.
 */
public class ReferenceReplacer {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceReplacer.class);

    static final String NBSP = "\u00A0";
    static final String UNRESOLVED = "??";

    private final PipelineContext context;
    private final Map<String, Target> targets;
    private final ReplaceOptions options;
    private final String format;
    private final OutputFormat outputFormat;
    private boolean fakeryNeeded;

    public ReferenceReplacer(PipelineContext context, Map<String, Target> targets, ReplaceOptions options,
            String format) {
        this.context = context;
        this.targets = targets;
        this.options = options;
        this.format = format;
        this.outputFormat = OutputFormat.of(format);
    }

    /**
     * Replace every processed reference in the document. In fake cleveref
     * mode the TeX definitions are added once if any clever reference was written.
     */
    public void replace(Document document) {
        if (options.useCleverefDefault()) {
            context.markCleverefRequired();
        }
        TokenWalker.walk(document, this::replacementFor);
        if (fakeryNeeded && CleverefFakery.inject(document.getBlocks())) {
            logger.debug("Added cleveref definitions to the document");
            context.note("Inserted TeX block:\n" + CleverefFakery.DEFINITIONS);
        }
    }

    public void replace(List<Token> tokens) {
        TokenWalker.walk(tokens, this::replacementFor);
    }

    /**
     * True once a fake clever reference has been written and the definitions are needed.
     */
    public boolean isFakeryNeeded() {
        return fakeryNeeded;
    }

    private List<Token> replacementFor(Token token) {
        if (token instanceof Cite cite && cite.hasAttributes() && cite.isSingle()) {
            return render(cite);
        }
        return null;
    }

    List<Token> render(Cite cite) {
        AttributeSet attrs = cite.getAttributes();
        CitationRecord citation = cite.citation();
        boolean nolink = "true".equalsIgnoreCase(attrs.get("nolink"));

        String label = resolveLabel(citation.id());
        Target target = targets.get(label);
        if (target == null) {
            if (context.reportUnresolvedLabel(label)) {
                context.warn("Unresolved reference: @" + label);
            }
        } else if (target.hasDuplicate()) {
            context.warn("Referenced label has duplicate: " + label);
        }

        Modifier modifier = Modifier.of(attrs);
        boolean clever = modifier == Modifier.NONE ? options.useCleverefDefault() : modifier.isClever();
        boolean plus = modifier == Modifier.NONE ? options.useCleverefDefault() : modifier == Modifier.PLUS;
        String name = target != null && target.name() != null
                ? target.name()
                : (plus ? options.plus() : options.star()).singular();

        List<Token> rendered = outputFormat == OutputFormat.TEX
                ? List.of(texReference(label, name, clever, plus, nolink))
                : textReference(label, target, name, clever, nolink);

        String display = TokenText.stringify(cite.getDisplay());
        if (display.startsWith("[") && display.endsWith("]")) {
            return List.of(bracketed(citation, rendered));
        }
        return rendered;
    }

    private String resolveLabel(String label) {
        int colon = label.lastIndexOf(':');
        if (options.allowImplicitRefs() && !targets.containsKey(label) && colon >= 0) {
            String implicit = label.substring(colon + 1);
            if (targets.containsKey(implicit)) {
                return implicit;
            }
        }
        return label;
    }

    private Token texReference(String label, String name, boolean clever, boolean plus, boolean nolink) {
        String macro;
        if (clever && options.cleverefMode() == CleverefMode.FAKE) {
            macro = CleverefFakery.reference(label, name, plus);
            fakeryNeeded = true;
        } else if (clever) {
            macro = (plus ? "\\cref{" : "\\Cref{") + label + "}";
            context.markCleverefRequired();
        } else if (options.useEqref()) {
            macro = "\\eqref{" + label + "}";
        } else {
            macro = "\\ref{" + label + "}";
        }
        if (nolink) {
            macro = "{\\protect\\NoHyper" + macro + "\\protect\\endNoHyper}";
        }
        return Raw.inline("tex", macro);
    }

    private List<Token> textReference(String label, Target target, String name, boolean clever, boolean nolink) {
        String text = target != null ? target.num() : UNRESOLVED;
        if (options.useEqref()) {
            text = "(" + text + ")";
        }
        Token element = text.length() > 1 && text.startsWith("$") && text.endsWith("$")
                ? new Math(MathType.INLINE_MATH, text.substring(1, text.length() - 1))
                : new Str(text);

        if (outputFormat == OutputFormat.HYPERLINK && !nolink && target != null) {
            String page = OutputFormat.isEpub(format) && target.sectionNo() != null && target.sectionNo() > 0
                    ? String.format("ch%03d.xhtml", target.sectionNo())
                    : "";
            AttributeSet linkAttrs = context.getProfile().hasLinkAttributes() ? new AttributeSet() : null;
            element = new Link(linkAttrs, List.of(element), LinkTarget.of(page + "#" + label));
        }

        List<Token> result = new ArrayList<>();
        if (clever) {
            result.add(new Str(name + NBSP));
        }
        result.add(element);
        return result;
    }

    /**
     * Wrap a bracketed reference with its citation prefix and suffix.
     * The Span has no attributes yet; the attach pass decides what it becomes.
     */
    private Span bracketed(CitationRecord citation, List<Token> rendered) {
        List<Token> children = new ArrayList<>(citation.prefix());
        String prefixText = TokenText.stringify(citation.prefix());
        if (!citation.prefix().isEmpty() && !endsWithAny(prefixText, "{", "+", "*", "!")) {
            children.add(new Space());
        }
        children.addAll(rendered);
        children.addAll(citation.suffix());
        return new Span(null, children);
    }

    private static boolean endsWithAny(String text, String... endings) {
        for (String ending : endings) {
            if (text.endsWith(ending)) {
                return true;
            }
        }
        return false;
    }
}
