package org.javai.converge.condition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.converge.DeadlineExceededException;
import org.javai.converge.ErrorKind;
import org.javai.converge.PollOutcome;
import org.javai.converge.config.ConvergeSettings;
import org.javai.converge.poll.PollContext;
import org.javai.converge.poll.TestPollers;
import org.javai.converge.resource.Condition;
import org.javai.converge.resource.JsonConditionExtractor;
import org.javai.converge.resource.ResourceKind;
import org.javai.converge.resource.ResourceLocator;
import org.javai.converge.resource.ResourceNotFoundException;
import org.javai.converge.resource.ResourceReader;
import org.javai.converge.testing.ManualClock;
import org.javai.converge.testing.RecordingPollReporter;
import org.javai.converge.testing.ScriptedResourceReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ConditionWatcherTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ResourceLocator INFRASTRUCTURE = ResourceLocator.of(
            ResourceKind.of("extensions.gardener.cloud", "v1alpha1", "Infrastructure"), "shoot--dev--app", "app");
    private static final ConditionQuery READY_TRUE =
            ConditionQuery.of(INFRASTRUCTURE, "Ready", "True", "Provisioning");

    private ManualClock clock;
    private RecordingPollReporter reporter;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        reporter = new RecordingPollReporter();
    }

    @Test
    void waitForCondition_succeedsOnceTheExpectedStateAppears() throws Exception {
        Instant start = clock.instant();
        ResourceReader<JsonNode> reader = (ctx, locator) ->
                clock.since(start).compareTo(Duration.ofSeconds(6)) < 0
                        ? resource(Condition.of("Ready", "False", "Provisioning"))
                        : resource(Condition.of("Ready", "True", "Provisioning"));

        watcher(reader).waitForCondition(context(Duration.ofSeconds(10)), READY_TRUE);

        assertThat(reporter.done).hasSize(1);
        assertThat(reporter.done.get(0).attempts()).isEqualTo(4);
        assertThat(clock.since(start)).isEqualTo(Duration.ofSeconds(6));
    }

    @Test
    void waitForCondition_failsWhenOnlyTheEarlierStateIsSeenBeforeTheDeadline() {
        ScriptedResourceReader<JsonNode> reader = new ScriptedResourceReader<JsonNode>()
                .thenReturn(resource(Condition.of("Ready", "False", "Provisioning")));

        assertThatThrownBy(() -> watcher(reader).waitForCondition(context(Duration.ofSeconds(10)), READY_TRUE))
                .isInstanceOfSatisfying(DeadlineExceededException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.DEADLINE_EXCEEDED);
                    assertThat(e.lastRetryableKind()).contains(ErrorKind.CONDITION_MISMATCH);
                    assertThat(e.locator()).contains(INFRASTRUCTURE);
                    assertThat(e.getMessage())
                            .contains("EXPECTED: (conditionType: Ready, conditionStatus: True, conditionReason: Provisioning)")
                            .contains("OBSERVED: [(conditionType: Ready, conditionStatus: False, conditionReason: Provisioning)]");
                });
        assertThat(reader.calls()).isEqualTo(5);
    }

    @Test
    void waitForCondition_everyReportedTripleCanBeAwaited() throws Exception {
        List<Condition> conditions = List.of(
                Condition.of("Ready", "True", "Provisioned"),
                Condition.of("HealthCheck", "False", "NodesUnhealthy"),
                Condition.of("ControlPlaneHealthy", "Unknown", ""));
        JsonNode resource = resource(conditions.toArray(new Condition[0]));

        for (Condition condition : conditions) {
            ConditionQuery query = ConditionQuery.of(
                    INFRASTRUCTURE, condition.type(), condition.status(), condition.reason());

            watcher((ctx, locator) -> resource).waitForCondition(context(Duration.ofSeconds(10)), query);
        }

        assertThat(reporter.done).hasSize(3).allSatisfy(d -> assertThat(d.attempts()).isEqualTo(1));
        assertThat(reporter.retries).isEmpty();
    }

    @Test
    void probe_firstMatchWins_andLaterConditionsAreNotScanned() {
        JsonNode resource = resource(
                Condition.of("Ready", "True", "Provisioning"),
                Condition.of("Ready", "True", "Provisioning"),
                Condition.of("Other", "True", "Whatever"));

        PollOutcome outcome = watcher((ctx, locator) -> resource).probe(context(Duration.ofSeconds(10)), READY_TRUE);

        assertThat(outcome).isInstanceOf(PollOutcome.Done.class);
        assertThat(reporter.observed).hasSize(1);
    }

    @Test
    void probe_matchRequiresTypeStatusAndReason() {
        JsonNode resource = resource(
                Condition.of("Ready", "True", "Provisioned"),
                Condition.of("Ready", "False", "Provisioning"),
                Condition.of("Available", "True", "Provisioning"));

        PollOutcome outcome = watcher((ctx, locator) -> resource).probe(context(Duration.ofSeconds(10)), READY_TRUE);

        assertThat(outcome).isInstanceOfSatisfying(PollOutcome.Retryable.class, r ->
                assertThat(r.kind()).isEqualTo(ErrorKind.CONDITION_MISMATCH));
        assertThat(reporter.observed).extracting(o -> o.condition().type())
                .containsExactly("Ready", "Ready", "Available");
    }

    @Test
    void probe_readFailureIsRetryableAndNamesTheResource() {
        ResourceNotFoundException notFound = new ResourceNotFoundException(INFRASTRUCTURE);

        PollOutcome outcome = watcher(new ScriptedResourceReader<JsonNode>().thenThrow(notFound))
                .probe(context(Duration.ofSeconds(10)), READY_TRUE);

        assertThat(outcome).isInstanceOfSatisfying(PollOutcome.Retryable.class, r -> {
            assertThat(r.kind()).isEqualTo(ErrorKind.READ_FAILURE);
            assertThat(r.reason())
                    .contains("unable to retrieve Infrastructure")
                    .contains("ns: shoot--dev--app")
                    .contains("name: app")
                    .contains("not found");
            assertThat(r.cause()).isSameAs(notFound);
        });
    }

    @Test
    void probe_malformedStatusIsRetryable() throws Exception {
        JsonNode malformed = MAPPER.readTree("{\"status\": {\"conditions\": \"Ready\"}}");

        PollOutcome outcome = watcher((ctx, locator) -> malformed).probe(context(Duration.ofSeconds(10)), READY_TRUE);

        assertThat(outcome).isInstanceOfSatisfying(PollOutcome.Retryable.class, r ->
                assertThat(r.kind()).isEqualTo(ErrorKind.DECODE_FAILURE));
    }

    @Test
    void probe_resourceWithoutStatusIsAMismatch() throws Exception {
        JsonNode fresh = MAPPER.readTree("{\"kind\": \"Infrastructure\"}");

        PollOutcome outcome = watcher((ctx, locator) -> fresh).probe(context(Duration.ofSeconds(10)), READY_TRUE);

        assertThat(outcome).isInstanceOfSatisfying(PollOutcome.Retryable.class, r -> {
            assertThat(r.kind()).isEqualTo(ErrorKind.CONDITION_MISMATCH);
            assertThat(r.reason()).contains("OBSERVED: no conditions");
        });
    }

    @Test
    void waitForCondition_recoversFromReadAndDecodeFailures() throws Exception {
        ScriptedResourceReader<JsonNode> reader = new ScriptedResourceReader<JsonNode>()
                .thenThrow(new ResourceNotFoundException(INFRASTRUCTURE))
                .thenReturn(MAPPER.readTree("{\"status\": {\"conditions\": [{\"type\": \"Ready\"}]}}"))
                .thenReturn(resource(Condition.of("Ready", "True", "Provisioning")));

        watcher(reader).waitForCondition(context(Duration.ofSeconds(10)), READY_TRUE);

        assertThat(reporter.retries).extracting(a -> a.outcome().kind())
                .containsExactly(ErrorKind.READ_FAILURE, ErrorKind.DECODE_FAILURE);
        assertThat(reporter.fatal).isEmpty();
        assertThat(reader.requested()).containsOnly(INFRASTRUCTURE);
    }

    @Test
    void waitForCondition_neverReportsFatal() {
        ScriptedResourceReader<JsonNode> reader = new ScriptedResourceReader<JsonNode>()
                .thenThrow(new ResourceNotFoundException(INFRASTRUCTURE));

        assertThatThrownBy(() -> watcher(reader).waitForCondition(context(Duration.ofSeconds(30)), READY_TRUE))
                .isInstanceOfSatisfying(DeadlineExceededException.class, e ->
                        assertThat(e.lastRetryableKind()).contains(ErrorKind.READ_FAILURE));
        assertThat(reporter.fatal).isEmpty();
        assertThat(reader.calls()).isEqualTo(15);
    }

    private ConditionWatcher<JsonNode> watcher(ResourceReader<JsonNode> reader) {
        return new ConditionWatcher<>(reader, new JsonConditionExtractor(), TestPollers.manual(clock, reporter),
                reporter, ConvergeSettings.defaults());
    }

    private PollContext context(Duration timeout) {
        return PollContext.background(clock).withTimeout(timeout);
    }

    private static JsonNode resource(Condition... conditions) {
        var root = MAPPER.createObjectNode();
        root.put("kind", "Infrastructure");
        var list = root.putObject("status").putArray("conditions");
        for (Condition condition : conditions) {
            list.addObject()
                    .put("type", condition.type())
                    .put("status", condition.status())
                    .put("reason", condition.reason())
                    .put("message", "observed by test");
        }
        return root;
    }
}
