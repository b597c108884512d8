package com.speccontext.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the transcript to SLF4J at INFO on the {@code com.speccontext.transcript} logger,
 * so suites that route console output through their logging setup keep it in one place.
 */
public class LoggingTranscriptSink implements TranscriptSink {

    static final String LOGGER_NAME = "com.speccontext.transcript";

    private static final Logger transcriptLog = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void emit(String transcript) {
        transcriptLog.info("\n{}", transcript);
    }
}
