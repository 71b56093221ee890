package org.javai.converge.resource;

import org.javai.converge.poll.PollContext;

import java.util.OptionalInt;

/**
 * Reads and writes the replica count of a workload.
 * Implemented by the surrounding resource-management system.
 */
public interface DeploymentClient {

    /**
     * Reads the desired replica count currently stored on the workload.
     *
     * @return the count, or empty if the workload does not report one
     * @throws ResourceNotFoundException if the workload does not exist
     * @throws ResourceAccessException if the read fails for any other reason
     */
    OptionalInt getReplicas(PollContext context, ResourceLocator locator) throws ResourceAccessException;

    /**
     * Sets the desired replica count of the workload.
     *
     * @throws ResourceAccessException if the write is rejected
     */
    void setReplicas(PollContext context, ResourceLocator locator, int replicas) throws ResourceAccessException;
}
