package br.com.eichler.registry.model;

public class BackingStoreUnavailableException extends PersonRegistryException {

    public BackingStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
