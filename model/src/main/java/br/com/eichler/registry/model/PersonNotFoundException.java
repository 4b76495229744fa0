package br.com.eichler.registry.model;

public class PersonNotFoundException extends PersonRegistryException {
    private final long id;

    public PersonNotFoundException(long id) {
        super("Person not found: " + id);
        this.id = id;
    }

    public long getId() {
        return id;
    }
}
