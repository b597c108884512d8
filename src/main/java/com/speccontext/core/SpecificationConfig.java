package com.speccontext.core;

import com.speccontext.report.TranscriptSink;

import java.util.Locale;

/**
 * Configuration for scenario execution.
 *
 * Load from environment variables (the default for every scenario) or construct
 * programmatically and pass to the {@link SpecificationContext} constructor.
 *
 * Recognised environment variables:
 *   SPECCONTEXT_TRANSCRIPT_SINK            - Where transcripts go: CONSOLE | LOG (default: CONSOLE)
 *   SPECCONTEXT_LEGACY_INHERITANCE_ORDER   - Reverse method lists of deep scenarios instead of
 *                                            ordering ancestors first (default: false)
 *   SPECCONTEXT_STACK_FRAME_LIMIT          - Stack frames printed per failure (default: 15)
 *   SPECCONTEXT_JSON_REPORT                - Log each cycle report as JSON (default: false)
 */
public class SpecificationConfig {

    public static final int DEFAULT_STACK_FRAME_LIMIT = 15;

    private final TranscriptSink.Kind sinkKind;
    private final TranscriptSink      transcriptSink;   // overrides sinkKind when set
    private final boolean             legacyInheritanceOrder;
    private final int                 stackFrameLimit;
    private final boolean             jsonReport;

    private SpecificationConfig(Builder b) {
        this.sinkKind               = b.sinkKind;
        this.transcriptSink         = b.transcriptSink;
        this.legacyInheritanceOrder = b.legacyInheritanceOrder;
        this.stackFrameLimit        = b.stackFrameLimit;
        this.jsonReport             = b.jsonReport;
    }

    // ── Static factory: load from environment variables ───────────────────────

    public static SpecificationConfig fromEnvironment() {
        return builder()
            .sinkKind(sinkKindEnvOrDefault("SPECCONTEXT_TRANSCRIPT_SINK", TranscriptSink.Kind.CONSOLE))
            .legacyInheritanceOrder(boolEnvOrDefault("SPECCONTEXT_LEGACY_INHERITANCE_ORDER", false))
            .stackFrameLimit(intEnvOrDefault("SPECCONTEXT_STACK_FRAME_LIMIT", DEFAULT_STACK_FRAME_LIMIT))
            .jsonReport(boolEnvOrDefault("SPECCONTEXT_JSON_REPORT", false))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public TranscriptSink.Kind getSinkKind()             { return sinkKind; }
    public boolean             isLegacyInheritanceOrder(){ return legacyInheritanceOrder; }
    public int                 getStackFrameLimit()      { return stackFrameLimit; }
    public boolean             isJsonReport()            { return jsonReport; }

    /** The sink instance given to the builder, or a new one of {@link #getSinkKind()}. */
    public TranscriptSink getTranscriptSink() {
        return transcriptSink != null ? transcriptSink : sinkKind.create();
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private TranscriptSink.Kind sinkKind = TranscriptSink.Kind.CONSOLE;
        private TranscriptSink      transcriptSink;
        private boolean             legacyInheritanceOrder = false;
        private int                 stackFrameLimit = DEFAULT_STACK_FRAME_LIMIT;
        private boolean             jsonReport = false;

        public Builder sinkKind(TranscriptSink.Kind kind)     { this.sinkKind = kind; return this; }
        public Builder transcriptSink(TranscriptSink sink)    { this.transcriptSink = sink; return this; }
        public Builder legacyInheritanceOrder(boolean b)      { this.legacyInheritanceOrder = b; return this; }
        public Builder stackFrameLimit(int n)                 { this.stackFrameLimit = n; return this; }
        public Builder jsonReport(boolean b)                  { this.jsonReport = b; return this; }

        public SpecificationConfig build() {
            if (stackFrameLimit < 0) {
                throw new IllegalArgumentException("stackFrameLimit must be >= 0, was " + stackFrameLimit);
            }
            return new SpecificationConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static int intEnvOrDefault(String key, int defaultValue) {
        try {
            String val = System.getenv(key);
            return (val != null && !val.isBlank()) ? Integer.parseInt(val.trim()) : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim()) || "1".equals(val.trim());
    }

    private static TranscriptSink.Kind sinkKindEnvOrDefault(String key, TranscriptSink.Kind defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        try { return TranscriptSink.Kind.valueOf(val.trim().toUpperCase(Locale.ROOT)); }
        catch (IllegalArgumentException e) { return defaultValue; }
    }
}
