package org.javai.converge.condition;

import com.fasterxml.jackson.databind.JsonNode;
import org.javai.converge.ConvergenceException;
import org.javai.converge.ErrorKind;
import org.javai.converge.PollOutcome;
import org.javai.converge.config.ConvergeSettings;
import org.javai.converge.ops.PollReporter;
import org.javai.converge.poll.PollContext;
import org.javai.converge.poll.Poller;
import org.javai.converge.resource.Condition;
import org.javai.converge.resource.ConditionDecodeException;
import org.javai.converge.resource.ConditionExtractor;
import org.javai.converge.resource.JsonConditionExtractor;
import org.javai.converge.resource.ResourceAccessException;
import org.javai.converge.resource.ResourceLocator;
import org.javai.converge.resource.ResourceReader;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Waits until a remote resource reports an expected {@code (type, status, reason)} condition.
 *
 * <p>Every attempt reads the resource afresh and scans its conditions in the order reported.
 * The first exact match completes the wait. Read failures, decode failures and a missing
 * condition are all retryable; a resource that does not exist yet is expected while it is
 * being provisioned.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ConditionWatcher<JsonNode> watcher = ConditionWatcher.forJson(seedReader, new Log4jPollReporter());
 *
 * ConditionQuery query = ConditionQuery.of(
 *     ResourceLocator.of(ResourceKind.of("extensions.gardener.cloud", "v1alpha1", "Infrastructure"), "shoot--foo", "bar"),
 *     "Ready", "True", "Provisioned");
 *
 * try (PollContext ctx = PollContext.background().withTimeout(Duration.ofMinutes(10))) {
 *     watcher.waitForCondition(ctx, query);
 * }
 * }</pre>
 *
 * @param <R> the resource representation returned by the reader
 */
public final class ConditionWatcher<R> {

    static final String OPERATION = "WaitForCondition";

    private final ResourceReader<R> reader;
    private final ConditionExtractor<R> extractor;
    private final Poller poller;
    private final PollReporter reporter;
    private final ConvergeSettings settings;

    public ConditionWatcher(ResourceReader<R> reader, ConditionExtractor<R> extractor, Poller poller,
                            PollReporter reporter, ConvergeSettings settings) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.poller = Objects.requireNonNull(poller, "poller must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Creates a watcher with settings resolved from the environment.
     */
    public static <R> ConditionWatcher<R> create(ResourceReader<R> reader, ConditionExtractor<R> extractor,
                                                 PollReporter reporter) {
        Poller poller = Poller.builder().reporter(reporter).build();
        return new ConditionWatcher<>(reader, extractor, poller, reporter, ConvergeSettings.resolve());
    }

    /**
     * Creates a watcher for generic resources read as JSON trees.
     */
    public static ConditionWatcher<JsonNode> forJson(ResourceReader<JsonNode> reader, PollReporter reporter) {
        return create(reader, new JsonConditionExtractor(), reporter);
    }

    /**
     * Waits until the queried resource reports the expected condition.
     *
     * @param context bounds the wait; cancelling it ends the wait immediately
     * @param query the resource and condition to await
     * @throws ConvergenceException a {@link org.javai.converge.DeadlineExceededException} naming the
     *         expected condition and the last observed state if the context ends first
     */
    public void waitForCondition(PollContext context, ConditionQuery query) throws ConvergenceException {
        Objects.requireNonNull(query, "query must not be null");
        poller.poll(OPERATION, query.locator(), context, settings.pollInterval(), ctx -> probe(ctx, query));
    }

    /**
     * Waits under a fresh context bounded by the configured condition timeout.
     */
    public void waitForCondition(ConditionQuery query) throws ConvergenceException {
        try (PollContext context = PollContext.background().withTimeout(settings.conditionTimeout())) {
            waitForCondition(context, query);
        }
    }

    PollOutcome probe(PollContext context, ConditionQuery query) {
        ResourceLocator locator = query.locator();
        String kind = query.resourceKind().kind();

        R resource;
        try {
            resource = reader.get(context, locator);
        } catch (ResourceAccessException e) {
            return PollOutcome.retry(ErrorKind.READ_FAILURE,
                    "unable to retrieve %s %s: %s".formatted(kind, locator, e.getMessage()), e);
        }

        List<Condition> conditions;
        try {
            conditions = extractor.extract(resource);
        } catch (ConditionDecodeException e) {
            return PollOutcome.retry(ErrorKind.DECODE_FAILURE,
                    "unable to decode conditions of %s %s: %s".formatted(kind, locator, e.getMessage()), e);
        }

        for (Condition condition : conditions) {
            reporter.reportConditionObserved(locator, condition);
            if (query.isSatisfiedBy(condition)) {
                return PollOutcome.done();
            }
        }
        return PollOutcome.retry(ErrorKind.CONDITION_MISMATCH,
                "%s %s does not yet contain expected condition. EXPECTED: %s, OBSERVED: %s".formatted(
                        kind, locator, query.expected(), describe(conditions)));
    }

    private static String describe(List<Condition> conditions) {
        if (conditions.isEmpty()) {
            return "no conditions";
        }
        return conditions.stream().map(Condition::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
