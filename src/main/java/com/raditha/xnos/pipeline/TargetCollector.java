package com.raditha.xnos.pipeline;

import com.raditha.xnos.model.AttributeSet;
import com.raditha.xnos.model.Attributed;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.refs.Target;
import com.raditha.xnos.util.TokenWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Numbers the labelled elements of one kind in document order.
 * <p>
 * An element is labelled when its id starts with the kind's prefix, e.g.
 * {@code fig:plot}. A {@code tag} attribute replaces the number and does not
 * advance the count. When numbering by section the count restarts in every
 * chapter and numbers read {@code chapter.n}.
 */
public class TargetCollector {

    private static final Logger logger = LoggerFactory.getLogger(TargetCollector.class);

    public static final String TAG = "tag";

    private final PipelineContext context;
    private final boolean numberBySection;

    public TargetCollector(PipelineContext context, boolean numberBySection) {
        this.context = context;
        this.numberBySection = numberBySection;
    }

    public Map<String, Target> collect(Document document, TokenType kind, String prefix) {
        Map<String, Target> targets = new LinkedHashMap<>();
        String namespace = prefix + ":";
        int[] count = {0};
        String[] lastSection = {null};

        TokenWalker.walk(document, token -> {
            if (token.type() != kind || !(token instanceof Attributed element) || !element.hasAttributes()) {
                return null;
            }
            AttributeSet attrs = element.getAttributes();
            String label = attrs.getId();
            if (!label.startsWith(namespace) || label.length() == namespace.length()) {
                return null;
            }
            if (targets.containsKey(label)) {
                context.warn("Duplicate label: " + label);
                targets.put(label, targets.get(label).withDuplicate());
                return null;
            }

            String secno = attrs.get(SectionNumberer.KEY);
            if (numberBySection && !Objects.equals(secno, lastSection[0])) {
                count[0] = 0;
                lastSection[0] = secno;
            }
            Integer section = secno != null && secno.matches("\\d+") ? Integer.valueOf(secno) : null;

            String num;
            if (attrs.containsKey(TAG)) {
                num = attrs.get(TAG);
            } else {
                count[0]++;
                num = numberBySection && secno != null ? secno + "." + count[0] : String.valueOf(count[0]);
            }
            targets.put(label, Target.of(num).withSection(section));
            logger.debug("Target {} numbered {}", label, num);
            return null;
        });
        return targets;
    }
}
