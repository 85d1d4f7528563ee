package com.raditha.xnos.compat;

import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.util.ContainerKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.raditha.xnos.util.ContainerKind.CITATION_PREFIX;
import static com.raditha.xnos.util.ContainerKind.CITATION_SUFFIX;
import static com.raditha.xnos.util.ContainerKind.EMPH;
import static com.raditha.xnos.util.ContainerKind.HEADER;
import static com.raditha.xnos.util.ContainerKind.IMAGE_CAPTION;
import static com.raditha.xnos.util.ContainerKind.PARA;
import static com.raditha.xnos.util.ContainerKind.PLAIN;
import static com.raditha.xnos.util.ContainerKind.SPAN;
import static com.raditha.xnos.util.ContainerKind.STRONG;
import static com.raditha.xnos.util.ContainerKind.TABLE_CAPTION;

/**
 * How each supported range of pandoc versions lays out its document tree and
 * which workarounds it needs.
 * <p>
 * Ranges are half-open: a profile covers {@code from <= v < until}.
 */
public enum CompatibilityProfile {

    PANDOC_1_15("1.15", "1.16", false, true, TableLayout.CAPTION_INLINES),
    PANDOC_1_16("1.16", "1.18", true, true, TableLayout.CAPTION_INLINES),
    PANDOC_1_18("1.18", "2.10", true, false, TableLayout.CAPTION_INLINES),
    PANDOC_2_10("2.10", "2.11", true, false, TableLayout.CAPTION_ELEMENT),
    PANDOC_2_11("2.11", "4.0", true, false, TableLayout.CAPTION_ARRAY);

    private static final Set<ContainerKind> REPAIR_CONTAINERS = Collections.unmodifiableSet(
            EnumSet.of(PARA, PLAIN, IMAGE_CAPTION, TABLE_CAPTION));

    private static final Set<ContainerKind> REFERENCE_CONTAINERS = Collections.unmodifiableSet(EnumSet.of(
            PARA, PLAIN, EMPH, STRONG, SPAN, HEADER, IMAGE_CAPTION, TABLE_CAPTION,
            CITATION_PREFIX, CITATION_SUFFIX));

    private final PandocVersion from;
    private final PandocVersion until;
    private final boolean linkAttributes;
    private final boolean repairBareUriLinks;
    private final TableLayout tableLayout;

    CompatibilityProfile(String from, String until, boolean linkAttributes, boolean repairBareUriLinks,
            TableLayout tableLayout) {
        this.from = PandocVersion.bound(from);
        this.until = PandocVersion.bound(until);
        this.linkAttributes = linkAttributes;
        this.repairBareUriLinks = repairBareUriLinks;
        this.tableLayout = tableLayout;
    }

    /**
     * Find the profile covering a version.
     *
     * @throws UnsupportedVersionException if no profile covers it
     */
    public static CompatibilityProfile forVersion(PandocVersion version) {
        for (CompatibilityProfile profile : values()) {
            if (version.compareTo(profile.from) >= 0 && version.compareTo(profile.until) < 0) {
                return profile;
            }
        }
        throw new UnsupportedVersionException("Unsupported pandoc version: " + version
                + " (supported: " + PANDOC_1_15.from + " to below " + PANDOC_2_11.until + ")");
    }

    public static CompatibilityProfile forVersion(String version) {
        return forVersion(PandocVersion.parse(version));
    }

    /**
     * True if links and images carry attributes on the wire.
     */
    public boolean hasLinkAttributes() {
        return linkAttributes;
    }

    /**
     * True if bare-URI autolinking splits {@code @label} references into a
     * Link and a trailing Str that must be repaired.
     */
    public boolean repairsBareUriLinks() {
        return repairBareUriLinks;
    }

    public TableLayout tableLayout() {
        return tableLayout;
    }

    /**
     * True if pandoc itself gives elements of this kind an attribute set, as
     * opposed to one attached by a filter.
     */
    public boolean hasNativeAttributes(TokenType type) {
        return switch (type) {
            case SPAN, DIV, CODE, HEADER -> true;
            case LINK, IMAGE -> linkAttributes;
            case TABLE -> tableLayout != TableLayout.CAPTION_INLINES;
            default -> false;
        };
    }

    /**
     * Containers the reference processor looks into.
     */
    public Set<ContainerKind> referenceContainers() {
        return REFERENCE_CONTAINERS;
    }

    /**
     * Containers the bare-URI repair looks into; empty when no repair is needed.
     */
    public Set<ContainerKind> repairContainers() {
        return repairBareUriLinks ? REPAIR_CONTAINERS : Set.of();
    }
}
