package com.raditha.xnos.pipeline;

import java.util.List;
import java.util.Map;

/**
 * Decides which pandoc version a document came from.
 * <p>
 * In order: the version given explicitly, the {@code PANDOC_VERSION}
 * environment variable, then the document's {@code pandoc-api-version}
 * mapped to a pandoc release using it. Legacy documents without an API
 * version are from pandoc before 1.18.
 */
public final class VersionResolver {

    public static final String ENV_VARIABLE = "PANDOC_VERSION";

    private VersionResolver() {
    }

    /**
     * @param explicit    a version given on the command line, or null
     * @param environment the process environment
     * @param apiVersion  the document's API version, or null for the legacy layout
     * @return a version string, not yet validated
     */
    public static String resolve(String explicit, Map<String, String> environment, List<Integer> apiVersion) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        String fromEnv = environment.get(ENV_VARIABLE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        return fromApiVersion(apiVersion);
    }

    static String fromApiVersion(List<Integer> apiVersion) {
        if (apiVersion == null || apiVersion.isEmpty()) {
            return "1.17";
        }
        int major = apiVersion.get(0);
        int minor = apiVersion.size() > 1 ? apiVersion.get(1) : 0;
        if (major != 1) {
            return "3.0";
        }
        if (minor <= 17) {
            return "1.18";
        }
        if (minor <= 20) {
            return "2.8";
        }
        return switch (minor) {
            case 21 -> "2.10";
            case 22 -> "2.11";
            default -> "3.0";
        };
    }
}
