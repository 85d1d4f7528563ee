package com.raditha.xnos.refs;

import com.raditha.xnos.compat.CompatibilityProfile;
import com.raditha.xnos.model.Cite;
import com.raditha.xnos.model.CitationMode;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.Link;
import com.raditha.xnos.model.Str;
import com.raditha.xnos.model.Token;
import com.raditha.xnos.pipeline.PipelineContext;
import com.raditha.xnos.util.TokenContainers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reassembles references mangled by bare-URI autolinking.
 * <p>
 * With {@code autolink_bare_uris} enabled, pandoc before 1.18 reads
 * <code>{@fig:one}</code> as an e-mail Link followed by a Str. This pass
 * turns each such pair back into the Str/Cite/Str sequence pandoc produces
 * without the extension.
 */
public class ReferenceRepairer {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceRepairer.class);

    /**
     * Splits {@code xxx{+@fig:1}yyy} into prefix {@code xxx{+}, label {@code fig:1}
     * and suffix <code>}yyy</code>.
     */
    static final Pattern REFERENCE = Pattern.compile("^((?:.*\\{)?[*+!-]?)@([^:]*:[\\w/-]+)(.*)",
            Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);

    private final PipelineContext context;

    public ReferenceRepairer(PipelineContext context) {
        this.context = context;
    }

    /**
     * Repair every inline list the document's pandoc version can break.
     * Does nothing for versions without the autolinking problem.
     */
    public void repair(Document document) {
        CompatibilityProfile profile = context.getProfile();
        if (!profile.repairsBareUriLinks()) {
            return;
        }
        TokenContainers.forEachList(document, profile.repairContainers(), this::repair);
    }

    /**
     * Repair one inline list in place, until no broken reference is left.
     *
     * @return true if anything was repaired
     * @throws com.raditha.xnos.pipeline.UninitializedStateException if the context has no version
     */
    public boolean repair(List<Token> x) {
        context.getVersion();
        boolean repaired = false;
        while (repairFirst(x)) {
            repaired = true;
        }
        return repaired;
    }

    private boolean repairFirst(List<Token> x) {
        for (int i = 0; i < x.size() - 1; i++) {
            Matcher matcher = brokenReference(x.get(i), x.get(i + 1));
            if (matcher != null) {
                splice(x, i, matcher.group(1), matcher.group(2), matcher.group(3));
                return true;
            }
        }
        return false;
    }

    /**
     * A matcher over the joined text if the two tokens form a broken reference.
     */
    private Matcher brokenReference(Token first, Token second) {
        if (!(first instanceof Link link) || !(second instanceof Str tail)) {
            return null;
        }
        // Link text that is not a plain Str (e.g. smart quotes) belongs to a real link
        if (link.getChildren().isEmpty() || !(link.getChildren().get(0) instanceof Str head)) {
            return null;
        }
        Matcher matcher = REFERENCE.matcher(head.getText() + tail.getText());
        return matcher.matches() ? matcher : null;
    }

    private void splice(List<Token> x, int i, String prefix, String label, String suffix) {
        CitationMode mode = CitationMode.AUTHOR_IN_TEXT;
        if (prefix.endsWith("-")) {
            mode = CitationMode.SUPPRESS_AUTHOR;
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        logger.debug("Repairing broken reference to {}", label);

        if (!suffix.isEmpty()) {
            x.add(i + 2, new Str(suffix));
        }
        x.set(i + 1, Cite.reference(label, mode));
        if (prefix.isEmpty()) {
            x.remove(i);
        } else if (i > 0 && x.get(i - 1) instanceof Str previous) {
            previous.append(prefix);
            x.remove(i);
        } else {
            x.set(i, new Str(prefix));
        }
    }
}
