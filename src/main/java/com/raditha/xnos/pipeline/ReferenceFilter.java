package com.raditha.xnos.pipeline;

import com.raditha.xnos.attributes.AttributeAttacher;
import com.raditha.xnos.attributes.AttributeDetacher;
import com.raditha.xnos.compat.CompatibilityProfile;
import com.raditha.xnos.config.FilterConfig;
import com.raditha.xnos.config.TargetKindConfig;
import com.raditha.xnos.model.Document;
import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.refs.CleverefMode;
import com.raditha.xnos.refs.ReferenceProcessor;
import com.raditha.xnos.refs.ReferenceRepairer;
import com.raditha.xnos.refs.ReferenceReplacer;
import com.raditha.xnos.refs.ReplaceOptions;
import com.raditha.xnos.refs.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs the whole cross-reference pipeline over one document.
 * <p>
 * The passes run in a fixed order: repair references broken by autolinking,
 * attach attribute blocks to targets, number the targets, then process and
 * replace the references to each kind of target. Finally attributes are
 * attached to bracketed references and everything pandoc cannot read back is
 * detached again.
 */
public class ReferenceFilter {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceFilter.class);

    private final FilterConfig config;
    private final PipelineContext context;

    public ReferenceFilter(FilterConfig config, PipelineContext context) {
        this.config = config;
        this.context = context;
    }

    /**
     * Rewrite the document in place.
     *
     * @param document      the document
     * @param format        the pandoc output format, e.g. {@code html5} or {@code latex}
     * @param pandocVersion the version of pandoc that produced the document
     * @throws com.raditha.xnos.compat.UnsupportedVersionException if the version is not supported
     */
    public Document apply(Document document, String format, String pandocVersion) {
        context.init(pandocVersion);
        CompatibilityProfile profile = context.getProfile();
        logger.debug("Filtering for {} with pandoc {} ({})", format, pandocVersion, profile);

        new ReferenceRepairer(context).repair(document);

        for (TargetKindConfig target : config.targets()) {
            new AttributeAttacher(context, target.kind(), target.allowSpace(),
                    profile.hasNativeAttributes(target.kind())).attach(document);
        }

        SectionNumberer numberer = new SectionNumberer(context);
        if (config.numberBySection()) {
            for (TargetKindConfig target : config.targets()) {
                numberer.insert(document, target.kind());
            }
        }

        TargetCollector collector = new TargetCollector(context, config.numberBySection());
        for (TargetKindConfig target : config.targets()) {
            Map<String, Target> targets = new LinkedHashMap<>(
                    collector.collect(document, target.kind(), target.prefix()));
            logger.debug("Found {} {} targets", targets.size(), target.prefix());

            Pattern warnPattern = Pattern.compile(Pattern.quote(target.prefix() + ":"));
            new ReferenceProcessor(context, targets::containsKey, warnPattern, config.implicitLabels())
                    .process(document);
            new ReferenceReplacer(context, targets, optionsFor(target), format).replace(document);
        }

        new AttributeAttacher(context, TokenType.SPAN, false, true).attach(document);

        for (TargetKindConfig target : config.targets()) {
            if (config.numberBySection()) {
                numberer.delete(document, target.kind());
            }
            new AttributeDetacher(context, target.kind(), false).detach(document);
        }
        new AttributeDetacher(context, TokenType.CITE, false).detach(document);

        if (context.isCleverefRequired() && !config.cleverefFakery()) {
            context.note("Clever references used; load the cleveref package in the document preamble");
        }
        return document;
    }

    private ReplaceOptions optionsFor(TargetKindConfig target) {
        return new ReplaceOptions(config.cleveref(), target.eqref(), target.plus(), target.star(),
                config.implicitLabels(), config.cleverefFakery() ? CleverefMode.FAKE : CleverefMode.PACKAGE);
    }
}
