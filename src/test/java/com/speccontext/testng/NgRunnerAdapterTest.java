package com.speccontext.testng;

import com.speccontext.core.SpecificationConfig;
import com.speccontext.support.RecordingTranscriptSink;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the TestNG adapter by driving {@code execute()} directly.
 */
public class NgRunnerAdapterTest {

    public static class passing_specs extends TestNgSpecification {
        int total;

        public passing_specs(SpecificationConfig config) { super(config); }

        public void given_a_total() { total = 2; }

        public void it_holds_the_total() {
            verify = () -> assertThat(total).isEqualTo(2);
        }
    }

    public static class failing_specs extends TestNgSpecification {
        public failing_specs(SpecificationConfig config) { super(config); }

        public void when_comparing() {
            it("should match", () -> assertThat("actual").isEqualTo("expected"));
            it("should also match", () -> assertThat(1).isEqualTo(2));
        }
    }

    private RecordingTranscriptSink sink;

    @BeforeMethod
    public void setUp() {
        sink = new RecordingTranscriptSink();
    }

    @Test
    public void execute_passesWhenEveryConditionPasses() {
        passing_specs specs = new passing_specs(RecordingTranscriptSink.configFor(sink));

        specs.execute();

        assertThat(sink.last()).isEqualTo("passing specs\n\tit holds the total : passed\n\n");
        assertThat(specs.lastReport().hasFailures()).isFalse();
    }

    @Test
    public void execute_failsOnceWithTheScenarioName() {
        failing_specs specs = new failing_specs(RecordingTranscriptSink.configFor(sink));

        assertThatThrownBy(specs::execute)
            .isInstanceOf(AssertionError.class)
            .hasMessageContaining("failing specs");

        assertThat(sink.last()).contains(">> it should match - FAILED", ">> it should also match - FAILED");
        assertThat(specs.lastReport().getFailed()).isEqualTo(2);
    }

    @Test
    public void adapterBase_isTheRootForDiscovery() {
        passing_specs specs = new passing_specs(RecordingTranscriptSink.configFor(sink));

        assertThat(specs.getScenarioMethods().getExamples()).hasSize(1);
        assertThat(specs.getScenarioMethods().getArrangeMethods()).hasSize(1);
    }

    @Test
    public void fixtures_stayOutOfTheDefaultTestClassPatterns() {
        // the fixtures inherit @Test execute() but have no no-arg constructor
        for (Class<?> fixture : List.of(passing_specs.class, failing_specs.class)) {
            String binaryName = fixture.getName().substring(fixture.getName().lastIndexOf('.') + 1);
            assertThat(binaryName)
                .contains("$")
                .doesNotStartWith("Test")
                .doesNotEndWith("Test");
        }
    }
}
