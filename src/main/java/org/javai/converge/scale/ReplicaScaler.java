package org.javai.converge.scale;

import org.javai.converge.ConvergenceException;
import org.javai.converge.ErrorKind;
import org.javai.converge.PollOutcome;
import org.javai.converge.config.ConvergeSettings;
import org.javai.converge.ops.PollReporter;
import org.javai.converge.poll.PollContext;
import org.javai.converge.poll.Poller;
import org.javai.converge.resource.DeploymentClient;
import org.javai.converge.resource.ResourceAccessException;
import org.javai.converge.resource.ResourceLocator;
import org.javai.converge.resource.ResourceNotFoundException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Sets a workload's replica count and waits until the new count is observed.
 *
 * <p>A run reads the current count, skips the write if it already equals the desired count,
 * otherwise writes once and polls until the workload reports the desired count. The read and
 * the write are one-shot: a failure of either ends the run. During verification a failed read
 * is retried.
 *
 * <p>The setup timeout bounds each segment (read, write, verify) on its own, not the whole
 * call. Pass a parent context to bound the whole call. Overloads without an explicit setup
 * timeout use {@link ConvergeSettings#setupTimeout()}; verification polls at
 * {@link ConvergeSettings#pollInterval()}.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ReplicaScaler scaler = ReplicaScaler.create(deployments, new Log4jPollReporter());
 *
 * ScaleResult result = scaler.scaleAndConverge(
 *     ResourceLocator.deployment("garden", "gardener-scheduler"), OptionalInt.of(0));
 *
 * // later, restore the previous count
 * scaler.scaleAndConverge(
 *     ResourceLocator.deployment("garden", "gardener-scheduler"), result.previousReplicas());
 * }</pre>
 */
public final class ReplicaScaler {

    static final String OPERATION = "ScaleAndConverge";
    static final String RESOURCE_MANAGER = "gardener-resource-manager";

    private final DeploymentClient client;
    private final Poller poller;
    private final PollReporter reporter;
    private final ConvergeSettings settings;

    public ReplicaScaler(DeploymentClient client, Poller poller, PollReporter reporter, ConvergeSettings settings) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.poller = Objects.requireNonNull(poller, "poller must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Creates a scaler with settings resolved from the environment.
     */
    public static ReplicaScaler create(DeploymentClient client, PollReporter reporter) {
        Poller poller = Poller.builder().reporter(reporter).build();
        return new ReplicaScaler(client, poller, reporter, ConvergeSettings.resolve());
    }

    /**
     * Scales the target, bounding each segment by the configured setup timeout.
     */
    public ScaleResult scaleAndConverge(ResourceLocator target, OptionalInt desiredReplicas)
            throws ConvergenceException {
        return scaleAndConverge(settings.setupTimeout(), target, desiredReplicas);
    }

    /**
     * Scales the target under a parent context, bounding each segment by the configured setup timeout.
     */
    public ScaleResult scaleAndConverge(PollContext parent, ResourceLocator target, OptionalInt desiredReplicas)
            throws ConvergenceException {
        return scaleAndConverge(parent, settings.setupTimeout(), target, desiredReplicas);
    }

    /**
     * Scales the target to the desired count and waits until it is observed.
     *
     * @param setupTimeout bound on each read, write and verify segment
     * @param target the workload to scale
     * @param desiredReplicas the count to set; empty means leave the target alone
     * @return the previous count and how the run ended
     * @throws ConvergenceException with kind {@code READ_FAILURE} or {@code WRITE_FAILURE} if the
     *         one-shot read or write fails, or a {@link org.javai.converge.DeadlineExceededException}
     *         if the new count is not observed in time
     */
    public ScaleResult scaleAndConverge(Duration setupTimeout, ResourceLocator target, OptionalInt desiredReplicas)
            throws ConvergenceException {
        try (PollContext parent = PollContext.background()) {
            return scaleAndConverge(parent, setupTimeout, target, desiredReplicas);
        }
    }

    /**
     * Scales the target under a caller-supplied parent context that bounds the whole call.
     */
    public ScaleResult scaleAndConverge(PollContext parent, Duration setupTimeout, ResourceLocator target,
                                        OptionalInt desiredReplicas) throws ConvergenceException {
        Objects.requireNonNull(parent, "parent must not be null");
        Objects.requireNonNull(setupTimeout, "setupTimeout must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(desiredReplicas, "desiredReplicas must not be null, use OptionalInt.empty()");
        if (desiredReplicas.isPresent() && desiredReplicas.getAsInt() < 0) {
            throw new IllegalArgumentException("desiredReplicas must be >= 0, was: " + desiredReplicas.getAsInt());
        }
        return new Run(parent, setupTimeout, target).execute(desiredReplicas);
    }

    /**
     * Scales the {@code gardener-resource-manager} deployment using the configured setup timeout.
     */
    public ScaleResult scaleResourceManager(String namespace, OptionalInt desiredReplicas)
            throws ConvergenceException {
        return scaleResourceManager(settings.setupTimeout(), namespace, desiredReplicas);
    }

    /**
     * Scales the {@code gardener-resource-manager} deployment in the given namespace.
     */
    public ScaleResult scaleResourceManager(Duration setupTimeout, String namespace, OptionalInt desiredReplicas)
            throws ConvergenceException {
        return scaleAndConverge(setupTimeout, ResourceLocator.deployment(namespace, RESOURCE_MANAGER), desiredReplicas);
    }

    /**
     * One pass through the state machine. Each step moves to its successor or throws.
     */
    private final class Run {
        private final PollContext parent;
        private final Duration setupTimeout;
        private final ResourceLocator target;
        private final List<ScaleState> path = new ArrayList<>();
        private ScaleState state = ScaleState.IDLE;

        private Run(PollContext parent, Duration setupTimeout, ResourceLocator target) {
            this.parent = parent;
            this.setupTimeout = setupTimeout;
            this.target = target;
            path.add(state);
        }

        ScaleResult execute(OptionalInt desiredReplicas) throws ConvergenceException {
            if (desiredReplicas.isEmpty()) {
                return skip(OptionalInt.empty(), ScaleDisposition.NO_DESIRED_REPLICAS);
            }
            int desired = desiredReplicas.getAsInt();

            ReplicaConvergenceState observed = read(desired);
            if (observed.isAbsent()) {
                return skip(OptionalInt.empty(), ScaleDisposition.TARGET_ABSENT);
            }
            if (observed.isConverged()) {
                return skip(observed.currentReplicas(), ScaleDisposition.ALREADY_CONVERGED);
            }

            mutate(desired);
            verify(desired);
            moveTo(ScaleState.DONE);
            return new ScaleResult(observed.currentReplicas(), ScaleDisposition.SCALED, path);
        }

        private ReplicaConvergenceState read(int desired) throws ConvergenceException {
            moveTo(ScaleState.READ);
            try (PollContext segment = parent.withTimeout(setupTimeout)) {
                return new ReplicaConvergenceState(client.getReplicas(segment, target), desired);
            } catch (ResourceNotFoundException e) {
                return new ReplicaConvergenceState(OptionalInt.empty(), desired);
            } catch (ResourceAccessException e) {
                throw fail(new ConvergenceException(ErrorKind.READ_FAILURE, target,
                        "failed to retrieve the replica count of the %s deployment: %s".formatted(target.name(), e.getMessage()), e));
            }
        }

        private void mutate(int desired) throws ConvergenceException {
            moveTo(ScaleState.MUTATE);
            try (PollContext segment = parent.withTimeout(setupTimeout)) {
                client.setReplicas(segment, target, desired);
            } catch (ResourceAccessException e) {
                throw fail(new ConvergenceException(ErrorKind.WRITE_FAILURE, target,
                        "failed to scale the replica count of the %s deployment to %d: %s".formatted(target.name(), desired, e.getMessage()), e));
            }
        }

        private void verify(int desired) throws ConvergenceException {
            moveTo(ScaleState.VERIFY);
            try (PollContext segment = parent.withTimeout(setupTimeout)) {
                poller.poll(OPERATION, target, segment, settings.pollInterval(), ctx -> probeReplicas(ctx, desired));
            } catch (ConvergenceException e) {
                throw fail(e);
            }
        }

        private PollOutcome probeReplicas(PollContext context, int desired) {
            OptionalInt reported;
            try {
                reported = client.getReplicas(context, target);
            } catch (ResourceAccessException e) {
                return PollOutcome.retry(ErrorKind.READ_FAILURE,
                        "unable to read the replica count of the %s deployment: %s".formatted(target.name(), e.getMessage()), e);
            }
            if (reported.isPresent() && reported.getAsInt() == desired) {
                return PollOutcome.done();
            }
            return PollOutcome.retry(ErrorKind.REPLICA_MISMATCH,
                    "the %s deployment is not scaled yet. EXPECTED: %d replicas, OBSERVED: %s".formatted(
                            target.name(), desired, reported.isPresent() ? String.valueOf(reported.getAsInt()) : "none"));
        }

        private ScaleResult skip(OptionalInt previous, ScaleDisposition disposition) {
            moveTo(ScaleState.SKIP);
            moveTo(ScaleState.DONE);
            return new ScaleResult(previous, disposition, path);
        }

        private ConvergenceException fail(ConvergenceException error) {
            moveTo(ScaleState.FAILED);
            return error;
        }

        private void moveTo(ScaleState next) {
            if (!state.canTransitionTo(next)) {
                throw new IllegalStateException("illegal scale transition " + state + " -> " + next);
            }
            reporter.reportScaleTransition(target, state, next);
            state = next;
            path.add(next);
        }
    }
}
