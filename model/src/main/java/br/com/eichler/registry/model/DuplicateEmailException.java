package br.com.eichler.registry.model;

/**
 * Raised when an email is already held by another stored person.
 */
public class DuplicateEmailException extends PersonRegistryException {
    private final String email;

    public DuplicateEmailException(String email) {
        super("Email already registered: " + email);
        this.email = email;
    }

    public DuplicateEmailException(String email, Throwable cause) {
        super("Email already registered: " + email, cause);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
