package com.raditha.xnos.pipeline;

/**
 * Receives the messages a run reports about the document: malformed
 * attributes, unresolved labels, duplicate targets and the like.
 */
public interface DiagnosticSink {

    /**
     * A problem with the document that the user should hear about.
     */
    void warning(String message);

    /**
     * Verbose information, only reported at the highest warning level.
     */
    void note(String message);
}
