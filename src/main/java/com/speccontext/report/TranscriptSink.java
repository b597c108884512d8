package com.speccontext.report;

/**
 * Where a finished transcript goes. Called once per execution cycle with the complete text.
 */
@FunctionalInterface
public interface TranscriptSink {

    void emit(String transcript);

    /** Kinds selectable through {@code SPECCONTEXT_TRANSCRIPT_SINK}. */
    enum Kind {
        CONSOLE,
        LOG;

        public TranscriptSink create() {
            return switch (this) {
                case CONSOLE -> new ConsoleTranscriptSink(System.out);
                case LOG     -> new LoggingTranscriptSink();
            };
        }
    }
}
