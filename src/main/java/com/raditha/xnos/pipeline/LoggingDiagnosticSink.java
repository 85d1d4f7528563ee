package com.raditha.xnos.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink: warnings and notes go to the log.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    @Override
    public void warning(String message) {
        logger.warn(message);
    }

    @Override
    public void note(String message) {
        logger.info(message);
    }
}
