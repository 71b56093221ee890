package org.javai.converge.testing;

import org.javai.converge.poll.PollContext;
import org.javai.converge.resource.DeploymentClient;
import org.javai.converge.resource.ResourceAccessException;
import org.javai.converge.resource.ResourceLocator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * A deployment client that replays scripted replica reads and records writes.
 * The last read step repeats once the script is exhausted.
 */
public final class FakeDeploymentClient implements DeploymentClient {

    private interface Read {
        OptionalInt play() throws ResourceAccessException;
    }

    private final List<Read> reads = new ArrayList<>();
    private final List<Integer> writes = new ArrayList<>();
    private final List<Instant> readDeadlines = new ArrayList<>();
    private final List<Instant> writeDeadlines = new ArrayList<>();
    private ResourceAccessException writeFailure;
    private int readCalls;

    public FakeDeploymentClient thenReport(int replicas) {
        reads.add(() -> OptionalInt.of(replicas));
        return this;
    }

    public FakeDeploymentClient thenReportNothing() {
        reads.add(OptionalInt::empty);
        return this;
    }

    public FakeDeploymentClient thenFailRead(ResourceAccessException failure) {
        reads.add(() -> {
            throw failure;
        });
        return this;
    }

    public FakeDeploymentClient failWrites(ResourceAccessException failure) {
        this.writeFailure = failure;
        return this;
    }

    @Override
    public OptionalInt getReplicas(PollContext context, ResourceLocator locator) throws ResourceAccessException {
        if (reads.isEmpty()) {
            throw new IllegalStateException("no scripted reads");
        }
        context.deadline().ifPresent(readDeadlines::add);
        int index = Math.min(readCalls, reads.size() - 1);
        readCalls++;
        return reads.get(index).play();
    }

    @Override
    public void setReplicas(PollContext context, ResourceLocator locator, int replicas) throws ResourceAccessException {
        context.deadline().ifPresent(writeDeadlines::add);
        writes.add(replicas);
        if (writeFailure != null) {
            throw writeFailure;
        }
    }

    public int readCalls() {
        return readCalls;
    }

    public List<Integer> writes() {
        return writes;
    }

    public List<Instant> readDeadlines() {
        return readDeadlines;
    }

    public List<Instant> writeDeadlines() {
        return writeDeadlines;
    }
}
