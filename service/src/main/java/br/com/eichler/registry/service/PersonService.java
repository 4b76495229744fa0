package br.com.eichler.registry.service;

import br.com.eichler.registry.model.BackingStoreUnavailableException;
import br.com.eichler.registry.model.DuplicateEmailException;
import br.com.eichler.registry.model.HealthStatus;
import br.com.eichler.registry.model.Person;
import br.com.eichler.registry.model.PersonNotFoundException;
import br.com.eichler.registry.model.PersonPatch;
import br.com.eichler.registry.repository.PersonStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Person registry: id assignment, email uniqueness and partial updates over a {@link PersonStore}.
 *
 * <p>Every check-then-write sequence runs inside {@link PersonStore#inTransaction}, so
 * concurrent callers never see a duplicate email slip through or a half-applied update.
 */
public class PersonService {
    private static final Logger log = LoggerFactory.getLogger(PersonService.class);

    private final PersonStore store;

    public PersonService(PersonStore store) {
        this.store = store;
    }

    public List<Person> getAll() {
        return store.readOnly(store::findAll);
    }

    public Person getById(long id) {
        return store.readOnly(() -> store.findById(id))
                .orElseThrow(() -> new PersonNotFoundException(id));
    }

    public Person create(String name, int age, String email) {
        Person created = store.inTransaction(() -> {
            requireFreeEmail(email);
            return store.insert(name, age, email);
        });
        log.info("Created person {}", created.getId());
        return created;
    }

    /**
     * Applies the present fields of {@code patch}. If the new email belongs to another
     * person nothing is written, including name and age changes from the same patch.
     */
    public Person update(long id, PersonPatch patch) {
        Person updated = store.inTransaction(() -> {
            Person current = store.findById(id).orElseThrow(() -> new PersonNotFoundException(id));
            if (patch.isEmpty()) {
                return current;
            }
            patch.email().ifPresent(email -> {
                if (!email.equals(current.getEmail())) {
                    requireFreeEmail(email);
                }
            });
            return store.update(patch.applyTo(current))
                    .orElseThrow(() -> new PersonNotFoundException(id));
        });
        log.info("Updated person {}", id);
        return updated;
    }

    public void delete(long id) {
        boolean removed = store.inTransaction(() -> store.deleteById(id));
        if (!removed) {
            throw new PersonNotFoundException(id);
        }
        log.info("Deleted person {}", id);
    }

    public HealthStatus healthCheck() {
        try {
            store.ping();
            return HealthStatus.up();
        } catch (BackingStoreUnavailableException e) {
            log.warn("Health check failed: {}", e.getMessage(), e);
            return HealthStatus.down(e.getMessage());
        }
    }

    private void requireFreeEmail(String email) {
        if (store.existsByEmail(email)) {
            log.debug("Rejected duplicate email {}", email);
            throw new DuplicateEmailException(email);
        }
    }
}
