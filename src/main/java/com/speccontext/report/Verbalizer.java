package com.speccontext.report;

import com.speccontext.model.MethodRole;
import com.speccontext.model.TestCondition;
import com.speccontext.model.TestExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds the human-readable transcript of one execution cycle and aggregates its failures.
 *
 * <pre>
 * calculator specs
 * 	when adding two positive numbers
 * 		it should equal 3 : passed
 *
 * ********** FAILURES **********
 * >> it should equal 4 - FAILED
 * expected: 4 but was: 3
 *   at ...
 * </pre>
 *
 * Example lines are indented one tab, named condition lines two tabs, and a verify
 * headline one tab. Lines accumulate in a buffer until {@link #verbalize} emits them to the
 * {@link TranscriptSink} and clears the buffer.
 */
public class Verbalizer {

    private static final Logger log = LoggerFactory.getLogger(Verbalizer.class);

    static final int    BANNER_CHARACTER_COUNT = 10;
    static final String FAILURES_BANNER =
        "*".repeat(BANNER_CHARACTER_COUNT) + " FAILURES " + "*".repeat(BANNER_CHARACTER_COUNT);

    private final StringBuilder  transcript = new StringBuilder();
    private final TranscriptSink sink;
    private final int            stackFrameLimit;

    public Verbalizer(TranscriptSink sink, int stackFrameLimit) {
        this.sink            = sink;
        this.stackFrameLimit = stackFrameLimit;
    }

    // ── Lines ─────────────────────────────────────────────────────────────────

    public void tagBanner(List<String> tags) {
        if (tags.isEmpty()) return;
        line("Tag(s):");
        tags.forEach(this::line);
        line("");
    }

    public void scenarioLine(String scenarioName, boolean skipped) {
        line(skipped ? scenarioName + " (skipped)" : scenarioName);
    }

    public void exampleLine(String exampleName) {
        line("\t" + MethodRole.normalize(exampleName));
    }

    /** Renders {@code <indent><name> : <status>} using the status recorded on the condition. */
    public void conditionLine(TestCondition condition, int indentLevel) {
        String status = condition.getStatus() != null ? condition.getStatus().label() : "not evaluated";
        line("\t".repeat(indentLevel) + condition.displayName() + " : " + status);
    }

    public void endExample() {
        line("");
    }

    // ── Aggregation ───────────────────────────────────────────────────────────

    /**
     * Appends the failure section (when anything failed), emits the transcript and clears
     * the buffer.
     *
     * @return every failed condition across {@code examples}, in example order
     */
    public List<TestCondition> verbalize(List<TestExample> examples) {
        List<TestCondition> failed = examples.stream()
            .flatMap(e -> e.failedConditions().stream())
            .toList();

        if (!failed.isEmpty()) {
            line(FAILURES_BANNER);
            for (TestCondition condition : failed) {
                line(">> " + condition.displayName() + " - FAILED");
                line(cleanFailure(condition.getFailure()));
            }
        }

        log.debug("Verbalizer: emitting transcript ({} chars, {} failure(s))", transcript.length(), failed.size());
        sink.emit(transcript.toString());
        transcript.setLength(0);
        return failed;
    }

    /** The lines accumulated since the last {@link #verbalize} or {@link #clear}. */
    public String getTranscript() {
        return transcript.toString();
    }

    public void clear() {
        transcript.setLength(0);
    }

    /**
     * The failure detail: the message lines of the captured exception's cause, blank lines
     * dropped, followed by its first stack frames. Empty when there is no cause.
     */
    String cleanFailure(Throwable failure) {
        Throwable cause = failure != null ? failure.getCause() : null;
        if (cause == null) return "";

        StringBuilder sb = new StringBuilder();
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
        message.lines()
            .filter(l -> !l.isBlank())
            .forEach(l -> sb.append(l).append('\n'));

        StackTraceElement[] frames = cause.getStackTrace();
        int limit = Math.min(stackFrameLimit, frames.length);
        for (int i = 0; i < limit; i++) {
            sb.append("  at ").append(frames[i]).append('\n');
        }
        if (frames.length > limit) {
            sb.append("  ... ").append(frames.length - limit).append(" more frames\n");
        }
        return sb.toString();
    }

    private void line(String text) {
        transcript.append(text).append('\n');
    }
}
