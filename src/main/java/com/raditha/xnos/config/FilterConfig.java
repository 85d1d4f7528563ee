package com.raditha.xnos.config;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration of a filter run.
 *
 * @param warningLevel     0 silent, 1 critical warnings, 2 verbose
 * @param cleveref         render names in front of references by default
 * @param cleverefFakery   define cleveref macros in the document rather than rely on the package
 * @param numberBySection  number targets per chapter, e.g. {@code 2.1}
 * @param implicitLabels   resolve {@code ns:id} references to targets labelled {@code id}
 * @param targets          the kinds of target to number and reference
 */
public record FilterConfig(
        int warningLevel,
        boolean cleveref,
        boolean cleverefFakery,
        boolean numberBySection,
        boolean implicitLabels,
        List<TargetKindConfig> targets) {

    /**
     * Validate configuration.
     */
    public FilterConfig {
        if (warningLevel < 0 || warningLevel > 2) {
            throw new IllegalArgumentException("warning_level must be 0, 1 or 2, got: " + warningLevel);
        }
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("At least one target kind must be configured");
        }
        Set<String> prefixes = new HashSet<>();
        for (TargetKindConfig target : targets) {
            if (!prefixes.add(target.prefix())) {
                throw new IllegalArgumentException("Duplicate target prefix: " + target.prefix());
            }
        }
        targets = List.copyOf(targets);
    }

    /**
     * Figures, equations and tables, critical warnings, fake cleveref.
     */
    public static FilterConfig defaults() {
        return new FilterConfig(1, false, true, false, false, defaultTargets());
    }

    public static List<TargetKindConfig> defaultTargets() {
        return List.of(TargetKindConfig.figures(), TargetKindConfig.equations(), TargetKindConfig.tables());
    }
}
