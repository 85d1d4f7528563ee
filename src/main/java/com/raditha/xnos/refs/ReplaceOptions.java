package com.raditha.xnos.refs;

/**
 * Rendering choices for one kind of target.
 *
 * @param useCleverefDefault render names in front of references without a modifier
 * @param useEqref           parenthesise numbers, as for equations
 * @param plus               names used by {@code +} references
 * @param star               names used by {@code *} references
 * @param allowImplicitRefs  resolve {@code ns:id} as {@code id} when only the latter is known
 * @param cleverefMode       how clever references are provided in TeX output
 */
public record ReplaceOptions(
        boolean useCleverefDefault,
        boolean useEqref,
        NameTable plus,
        NameTable star,
        boolean allowImplicitRefs,
        CleverefMode cleverefMode) {

    public ReplaceOptions {
        if (plus == null || star == null) {
            throw new IllegalArgumentException("Both name tables are required");
        }
        if (cleverefMode == null) {
            cleverefMode = CleverefMode.FAKE;
        }
    }

    public static ReplaceOptions of(NameTable plus, NameTable star) {
        return new ReplaceOptions(false, false, plus, star, false, CleverefMode.FAKE);
    }

    public ReplaceOptions withCleverefDefault(boolean value) {
        return new ReplaceOptions(value, useEqref, plus, star, allowImplicitRefs, cleverefMode);
    }

    public ReplaceOptions withEqref(boolean value) {
        return new ReplaceOptions(useCleverefDefault, value, plus, star, allowImplicitRefs, cleverefMode);
    }

    public ReplaceOptions withImplicitRefs(boolean value) {
        return new ReplaceOptions(useCleverefDefault, useEqref, plus, star, value, cleverefMode);
    }

    public ReplaceOptions withCleverefMode(CleverefMode mode) {
        return new ReplaceOptions(useCleverefDefault, useEqref, plus, star, allowImplicitRefs, mode);
    }
}
