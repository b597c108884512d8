package com.speccontext.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.speccontext.model.ConditionStatus;
import com.speccontext.model.MethodRole;
import com.speccontext.model.TestCondition;
import com.speccontext.model.TestExample;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Structured summary of one execution cycle: which examples ran and how each condition ended.
 *
 * Kept in memory by the scenario ({@code lastReport()}) and, when
 * {@code SPECCONTEXT_JSON_REPORT=true}, logged as JSON at the end of the cycle for CI tooling.
 *
 * Immutable — use {@link #from}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CycleReport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final String              scenario;
    private final boolean             scenarioSkipped;
    private final List<String>        tags;
    private final Instant             startedAt;
    private final long                durationMillis;
    private final List<ExampleReport> examples;

    private CycleReport(String scenario, boolean scenarioSkipped, List<String> tags,
                        Instant startedAt, long durationMillis, List<ExampleReport> examples) {
        this.scenario        = scenario;
        this.scenarioSkipped = scenarioSkipped;
        this.tags            = tags;
        this.startedAt       = startedAt;
        this.durationMillis  = durationMillis;
        this.examples        = examples;
    }

    public static CycleReport from(String scenario, boolean scenarioSkipped, List<String> tags,
                                   Instant startedAt, Instant finishedAt, List<TestExample> examples) {
        List<ExampleReport> exampleReports = examples.stream()
            .map(ExampleReport::from)
            .toList();
        return new CycleReport(scenario, scenarioSkipped, List.copyOf(tags), startedAt,
            Duration.between(startedAt, finishedAt).toMillis(), exampleReports);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String              getScenario()        { return scenario; }
    public boolean             isScenarioSkipped()  { return scenarioSkipped; }
    public List<String>        getTags()            { return tags; }
    public Instant             getStartedAt()       { return startedAt; }
    public long                getDurationMillis()  { return durationMillis; }
    public List<ExampleReport> getExamples()        { return examples; }

    public int getPassed()  { return count(ConditionStatus.PASSED); }
    public int getFailed()  { return count(ConditionStatus.FAILED); }
    public int getPending() { return count(ConditionStatus.PENDING); }
    public int getSkipped() { return count(ConditionStatus.SKIPPED); }

    public boolean hasFailures() { return getFailed() > 0; }

    /** Pretty-printed JSON, ISO-8601 timestamps. */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize cycle report for " + scenario, e);
        }
    }

    private int count(ConditionStatus status) {
        return (int) examples.stream()
            .flatMap(e -> e.getConditions().stream())
            .filter(c -> c.getStatus() == status)
            .count();
    }

    @Override
    public String toString() {
        return String.format("CycleReport{scenario=%s, examples=%d, passed=%d, failed=%d, pending=%d, skipped=%d}",
            scenario, examples.size(), getPassed(), getFailed(), getPending(), getSkipped());
    }

    // ── Nested reports ────────────────────────────────────────────────────────

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ExampleReport {
        private final String                name;
        private final boolean               skipped;
        private final List<ConditionReport> conditions;

        private ExampleReport(String name, boolean skipped, List<ConditionReport> conditions) {
            this.name       = name;
            this.skipped    = skipped;
            this.conditions = conditions;
        }

        static ExampleReport from(TestExample example) {
            return new ExampleReport(MethodRole.normalize(example.getName()), example.isSkipped(),
                example.allConditions().stream().map(ConditionReport::from).toList());
        }

        public String                getName()       { return name; }
        public boolean               isSkipped()     { return skipped; }
        public List<ConditionReport> getConditions() { return conditions; }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ConditionReport {
        private final String          name;
        private final ConditionStatus status;
        private final String          failure;  // message of the underlying error; null unless FAILED

        private ConditionReport(String name, ConditionStatus status, String failure) {
            this.name    = name;
            this.status  = status;
            this.failure = failure;
        }

        static ConditionReport from(TestCondition condition) {
            String failure = null;
            if (condition.hasFailed()) {
                Throwable error = condition.getFailure().getCause() != null
                    ? condition.getFailure().getCause()
                    : condition.getFailure();
                failure = error.getClass().getSimpleName() + ": " + error.getMessage();
            }
            return new ConditionReport(condition.displayName(), condition.getStatus(), failure);
        }

        public String          getName()    { return name; }
        public ConditionStatus getStatus()  { return status; }
        public String          getFailure() { return failure; }
    }
}
