package br.com.eichler.registry.model;

import java.util.Objects;

/**
 * Partial update of a {@link Person}. Each field is applied only when present.
 */
public final class PersonPatch {
    private static final PersonPatch EMPTY =
            new PersonPatch(FieldUpdate.absent(), FieldUpdate.absent(), FieldUpdate.absent());

    private final FieldUpdate<String> name;
    private final FieldUpdate<Integer> age;
    private final FieldUpdate<String> email;

    public PersonPatch(FieldUpdate<String> name, FieldUpdate<Integer> age, FieldUpdate<String> email) {
        this.name = Objects.requireNonNull(name, "name");
        this.age = Objects.requireNonNull(age, "age");
        this.email = Objects.requireNonNull(email, "email");
    }

    public static PersonPatch empty() {
        return EMPTY;
    }

    public PersonPatch withName(String value) {
        return new PersonPatch(FieldUpdate.of(value), age, email);
    }

    public PersonPatch withAge(int value) {
        return new PersonPatch(name, FieldUpdate.of(value), email);
    }

    public PersonPatch withEmail(String value) {
        return new PersonPatch(name, age, FieldUpdate.of(value));
    }

    public FieldUpdate<String> name() {
        return name;
    }

    public FieldUpdate<Integer> age() {
        return age;
    }

    public FieldUpdate<String> email() {
        return email;
    }

    public boolean isEmpty() {
        return !name.isPresent() && !age.isPresent() && !email.isPresent();
    }

    /**
     * Returns a copy of {@code current} with the present fields overwritten.
     * The id is always carried over unchanged.
     */
    public Person applyTo(Person current) {
        return new Person(
                current.getId(),
                name.orElse(current.getName()),
                age.orElse(current.getAge()),
                email.orElse(current.getEmail()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersonPatch)) return false;
        PersonPatch other = (PersonPatch) o;
        return name.equals(other.name) && age.equals(other.age) && email.equals(other.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, age, email);
    }

    @Override
    public String toString() {
        return "PersonPatch{name=" + name + ", age=" + age + ", email=" + email + "}";
    }
}
