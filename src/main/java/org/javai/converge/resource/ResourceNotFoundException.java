package org.javai.converge.resource;

/**
 * Thrown when the requested resource does not exist.
 */
public class ResourceNotFoundException extends ResourceAccessException {

    public ResourceNotFoundException(ResourceLocator locator) {
        super(locator, locator.kind().kind() + " " + locator.namespace() + "/" + locator.name() + " not found");
    }
}
