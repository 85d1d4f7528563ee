package com.raditha.xnos.pipeline;

import com.raditha.xnos.compat.CompatibilityProfile;
import com.raditha.xnos.compat.PandocVersion;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * State shared by the passes of one document run.
 * <p>
 * A context is created per run and initialised with the pandoc version before
 * any pass touches the document. It is not meant to be shared between runs
 * that overlap in time.
 */
public class PipelineContext {

    public static final int SILENT = 0;
    public static final int CRITICAL = 1;
    public static final int VERBOSE = 2;

    private static final String DEFAULT_FILTER_NAME = "pandoc-xnos";

    private final DiagnosticSink sink;
    private final int warningLevel;
    private String filterName = DEFAULT_FILTER_NAME;

    private PandocVersion version;
    private CompatibilityProfile profile;
    private boolean cleverefRequired;
    private int sectionCounter;
    private final Set<String> reportedBadLabels = new HashSet<>();
    private final Set<String> reportedUnresolvedLabels = new HashSet<>();

    public PipelineContext(DiagnosticSink sink, int warningLevel) {
        if (warningLevel < SILENT || warningLevel > VERBOSE) {
            throw new IllegalArgumentException("Warning level must be 0, 1 or 2, got: " + warningLevel);
        }
        this.sink = Objects.requireNonNull(sink, "sink");
        this.warningLevel = warningLevel;
    }

    /**
     * A context that logs at the critical level.
     */
    public static PipelineContext withLogging() {
        return new PipelineContext(new LoggingDiagnosticSink(), CRITICAL);
    }

    /**
     * Set the pandoc version and clear everything a previous run left behind.
     *
     * @throws com.raditha.xnos.compat.UnsupportedVersionException if the version is
     *         malformed or outside the supported range
     */
    public PandocVersion init(String pandocVersion) {
        PandocVersion parsed = PandocVersion.parse(pandocVersion);
        this.profile = CompatibilityProfile.forVersion(parsed);
        this.version = parsed;
        this.cleverefRequired = false;
        this.sectionCounter = 0;
        this.reportedBadLabels.clear();
        this.reportedUnresolvedLabels.clear();
        return parsed;
    }

    public boolean isInitialized() {
        return version != null;
    }

    public PandocVersion getVersion() {
        requireInitialized();
        return version;
    }

    public CompatibilityProfile getProfile() {
        requireInitialized();
        return profile;
    }

    private void requireInitialized() {
        if (version == null) {
            throw new UninitializedStateException("Pipeline context used before init(); set the pandoc version first");
        }
    }

    public int getWarningLevel() {
        return warningLevel;
    }

    public String getFilterName() {
        return filterName;
    }

    public void setFilterName(String filterName) {
        this.filterName = Objects.requireNonNull(filterName, "filterName");
    }

    public boolean isCleverefRequired() {
        return cleverefRequired;
    }

    public void markCleverefRequired() {
        this.cleverefRequired = true;
    }

    public int getSectionCounter() {
        return sectionCounter;
    }

    public void resetSectionCounter() {
        sectionCounter = 0;
    }

    /**
     * Advance to the next numbered chapter.
     *
     * @return the new chapter number
     */
    public int nextSection() {
        return ++sectionCounter;
    }

    /**
     * Record a label that looks like a reference but names no known target.
     *
     * @return true the first time the label is seen in this run
     */
    public boolean reportBadLabel(String label) {
        return reportedBadLabels.add(label);
    }

    /**
     * Record a label that could not be resolved to a target.
     *
     * @return true the first time the label is seen in this run
     */
    public boolean reportUnresolvedLabel(String label) {
        return reportedUnresolvedLabels.add(label);
    }

    public void warn(String message) {
        if (warningLevel >= CRITICAL) {
            sink.warning(filterName + ": " + message);
        }
    }

    public void note(String message) {
        if (warningLevel >= VERBOSE) {
            sink.note(filterName + ": " + message);
        }
    }
}
