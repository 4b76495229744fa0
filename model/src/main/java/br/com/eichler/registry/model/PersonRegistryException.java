package br.com.eichler.registry.model;

/**
 * Base type for every failure the registry reports to its callers.
 */
public abstract class PersonRegistryException extends RuntimeException {

    protected PersonRegistryException(String message) {
        super(message);
    }

    protected PersonRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
