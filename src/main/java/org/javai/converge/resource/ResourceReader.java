package org.javai.converge.resource;

import org.javai.converge.poll.PollContext;

/**
 * Fetches the current representation of a remote resource.
 * Implemented by the surrounding resource-management system.
 *
 * @param <R> the representation returned, typed or generic
 */
@FunctionalInterface
public interface ResourceReader<R> {

    /**
     * Reads the resource.
     *
     * @param context bounds the read; implementations should give up once it is done
     * @param locator the resource to read
     * @return the resource as currently stored
     * @throws ResourceNotFoundException if the resource does not exist
     * @throws ResourceAccessException if the read fails for any other reason
     */
    R get(PollContext context, ResourceLocator locator) throws ResourceAccessException;
}
