package com.raditha.xnos.compat;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A pandoc version such as {@code 2.11} or {@code 1.17.2}.
 * Versions compare numerically, field by field, with missing fields as zero.
 */
public record PandocVersion(List<Integer> parts, String text) implements Comparable<PandocVersion> {

    private static final Pattern VERSION = Pattern.compile("^[1-3]\\.[0-9]+(?:\\.[0-9]+)?(?:\\.[0-9]+)?$");

    public PandocVersion {
        parts = List.copyOf(parts);
    }

    /**
     * Parse a version string.
     *
     * @throws UnsupportedVersionException if the string is not a pandoc 1.x-3.x version
     */
    public static PandocVersion parse(String text) {
        if (text == null || !VERSION.matcher(text.trim()).matches()) {
            throw new UnsupportedVersionException("Cannot understand pandoc version: " + text);
        }
        return split(text.trim());
    }

    /**
     * Build a range bound without the supported-major check.
     */
    static PandocVersion bound(String text) {
        return split(text);
    }

    private static PandocVersion split(String text) {
        List<Integer> parts = new ArrayList<>();
        for (String part : text.split("\\.")) {
            parts.add(Integer.parseInt(part));
        }
        return new PandocVersion(parts, text);
    }

    public boolean isBefore(String other) {
        return compareTo(parse(other)) < 0;
    }

    public boolean isAtLeast(String other) {
        return compareTo(parse(other)) >= 0;
    }

    @Override
    public int compareTo(PandocVersion other) {
        int length = Math.max(parts.size(), other.parts.size());
        for (int i = 0; i < length; i++) {
            int a = i < parts.size() ? parts.get(i) : 0;
            int b = i < other.parts.size() ? other.parts.get(i) : 0;
            if (a != b) {
                return Integer.compare(a, b);
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PandocVersion other && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        List<Integer> trimmed = new ArrayList<>(parts);
        while (!trimmed.isEmpty() && trimmed.get(trimmed.size() - 1) == 0) {
            trimmed.remove(trimmed.size() - 1);
        }
        return trimmed.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
