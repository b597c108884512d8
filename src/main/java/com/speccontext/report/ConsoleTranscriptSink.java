package com.speccontext.report;

import java.io.PrintStream;

/**
 * Prints the transcript to a stream, {@code System.out} by default.
 */
public class ConsoleTranscriptSink implements TranscriptSink {

    private final PrintStream out;

    public ConsoleTranscriptSink(PrintStream out) {
        this.out = out;
    }

    @Override
    public void emit(String transcript) {
        out.println(transcript);
        out.flush();
    }
}
