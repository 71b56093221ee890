package org.javai.converge.resource;

import java.util.List;

/**
 * Decodes a resource's status block into its condition list.
 *
 * @param <R> the resource representation
 */
@FunctionalInterface
public interface ConditionExtractor<R> {

    /**
     * @return the conditions in the order the resource reports them
     * @throws ConditionDecodeException if the status block is malformed
     */
    List<Condition> extract(R resource) throws ConditionDecodeException;
}
