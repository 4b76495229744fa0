package br.com.eichler.registry.repository;

import br.com.eichler.registry.model.Person;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Backing store owning the person collection and its id sequence.
 *
 * <p>Implementations define the access discipline. Work passed to
 * {@link #inTransaction(Supplier)} runs atomically with respect to every other
 * mutation; work passed to {@link #readOnly(Supplier)} never observes a
 * partially applied mutation. Returned persons are always copies.
 */
public interface PersonStore {

    <T> T readOnly(Supplier<T> work);

    <T> T inTransaction(Supplier<T> work);

    /**
     * @return every stored person, ascending by id
     */
    List<Person> findAll();

    Optional<Person> findById(long id);

    boolean existsByEmail(String email);

    /**
     * Stores a new person under the next id of the sequence. Ids are never reused.
     *
     * @throws br.com.eichler.registry.model.DuplicateEmailException if the email is taken
     */
    Person insert(String name, int age, String email);

    /**
     * Replaces name, age and email of the person with the same id.
     *
     * @return the stored copy, or empty if the id is unknown
     * @throws br.com.eichler.registry.model.DuplicateEmailException if the email is taken by another person
     */
    Optional<Person> update(Person person);

    boolean deleteById(long id);

    /**
     * Round trip against the backing store.
     *
     * @throws br.com.eichler.registry.model.BackingStoreUnavailableException if it cannot be reached
     */
    void ping();
}
