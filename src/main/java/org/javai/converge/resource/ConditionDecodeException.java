package org.javai.converge.resource;

/**
 * Thrown when a resource's status block cannot be decoded into a condition list.
 */
public class ConditionDecodeException extends Exception {

    public ConditionDecodeException(String message) {
        super(message);
    }

    public ConditionDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
