package br.com.eichler.registry.repository;

import br.com.eichler.registry.model.DuplicateEmailException;
import br.com.eichler.registry.model.Person;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory store for Person records, guarded by a read/write lock.
 */
public class InMemoryPersonStore implements PersonStore {
    private final NavigableMap<Long, Person> store = new TreeMap<>();
    private final Map<String, Long> emailIndex = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public <T> T readOnly(Supplier<T> work) {
        return locked(lock.readLock(), work);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return locked(lock.writeLock(), work);
    }

    @Override
    public List<Person> findAll() {
        return readOnly(() -> {
            List<Person> list = new ArrayList<>(store.size());
            for (Person p : store.values()) {
                list.add(p.copy());
            }
            return list;
        });
    }

    @Override
    public Optional<Person> findById(long id) {
        return readOnly(() -> {
            Person p = store.get(id);
            return Optional.ofNullable(p == null ? null : p.copy());
        });
    }

    @Override
    public boolean existsByEmail(String email) {
        return readOnly(() -> emailIndex.containsKey(email));
    }

    @Override
    public Person insert(String name, int age, String email) {
        return inTransaction(() -> {
            if (emailIndex.containsKey(email)) {
                throw new DuplicateEmailException(email);
            }
            long id = sequence.incrementAndGet();
            Person person = new Person(id, name, age, email);
            store.put(id, person);
            emailIndex.put(email, id);
            return person.copy();
        });
    }

    @Override
    public Optional<Person> update(Person update) {
        return inTransaction(() -> {
            Long id = update.getId();
            Person current = id == null ? null : store.get(id);
            if (current == null) {
                return Optional.empty();
            }
            Long holder = emailIndex.get(update.getEmail());
            if (holder != null && !holder.equals(id)) {
                throw new DuplicateEmailException(update.getEmail());
            }
            emailIndex.remove(current.getEmail());
            emailIndex.put(update.getEmail(), id);
            Person stored = update.copy();
            store.put(id, stored);
            return Optional.of(stored.copy());
        });
    }

    @Override
    public boolean deleteById(long id) {
        return inTransaction(() -> {
            Person removed = store.remove(id);
            if (removed == null) {
                return false;
            }
            emailIndex.remove(removed.getEmail());
            return true;
        });
    }

    @Override
    public void ping() {
        // always reachable
    }

    private static <T> T locked(Lock l, Supplier<T> work) {
        l.lock();
        try {
            return work.get();
        } finally {
            l.unlock();
        }
    }
}
