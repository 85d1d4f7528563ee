package com.raditha.xnos.refs;

/**
 * What a reference label resolves to.
 *
 * @param num          the number or tag to display, e.g. {@code 3}, {@code 2.1} or {@code $\star$}
 * @param sectionNo    chapter the target lives in, or {@code null}
 * @param hasDuplicate true if several targets were declared with the same label
 * @param name         an explicit name for the target, or {@code null}
 */
public record Target(String num, Integer sectionNo, boolean hasDuplicate, String name) {

    public Target {
        if (num == null) {
            throw new IllegalArgumentException("Target number cannot be null");
        }
    }

    public static Target of(int num) {
        return new Target(String.valueOf(num), null, false, null);
    }

    public static Target of(String num) {
        return new Target(num, null, false, null);
    }

    public Target withSection(Integer section) {
        return new Target(num, section, hasDuplicate, name);
    }

    public Target withDuplicate() {
        return new Target(num, sectionNo, true, name);
    }
}
