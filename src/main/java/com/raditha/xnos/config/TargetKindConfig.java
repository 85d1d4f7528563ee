package com.raditha.xnos.config;

import com.raditha.xnos.model.TokenType;
import com.raditha.xnos.refs.NameTable;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Configuration for one kind of numbered target.
 *
 * @param kind       element kind that carries the target's label, e.g. {@code IMAGE}
 * @param prefix     label namespace, e.g. {@code fig} for {@code fig:plot}
 * @param plus       names used by {@code +} references
 * @param star       names used by {@code *} references
 * @param eqref      render numbers in parentheses
 * @param allowSpace allow a space between the element and its attribute block
 */
public record TargetKindConfig(
        TokenType kind,
        String prefix,
        NameTable plus,
        NameTable star,
        boolean eqref,
        boolean allowSpace) {

    private static final Set<TokenType> LABELLED_KINDS = Set.of(
            TokenType.IMAGE, TokenType.MATH, TokenType.TABLE, TokenType.SPAN,
            TokenType.DIV, TokenType.HEADER, TokenType.LINK, TokenType.CODE);

    private static final Pattern PREFIX = Pattern.compile("[A-Za-z][\\w-]*");

    /**
     * Validate configuration.
     */
    public TargetKindConfig {
        if (kind == null || !LABELLED_KINDS.contains(kind)) {
            throw new IllegalArgumentException("Elements of kind " + kind + " cannot carry labels");
        }
        if (prefix == null || !PREFIX.matcher(prefix).matches()) {
            throw new IllegalArgumentException("Invalid label prefix: " + prefix);
        }
        if (plus == null || star == null) {
            throw new IllegalArgumentException("Reference names for '" + prefix + "' cannot be null");
        }
    }

    public static TargetKindConfig figures() {
        return new TargetKindConfig(TokenType.IMAGE, "fig",
                new NameTable("fig.", "figs."), new NameTable("Figure", "Figures"), false, false);
    }

    public static TargetKindConfig equations() {
        return new TargetKindConfig(TokenType.MATH, "eq",
                new NameTable("eq.", "eqs."), new NameTable("Equation", "Equations"), true, true);
    }

    public static TargetKindConfig tables() {
        return new TargetKindConfig(TokenType.TABLE, "tbl",
                new NameTable("tbl.", "tbls."), new NameTable("Table", "Tables"), false, false);
    }
}
