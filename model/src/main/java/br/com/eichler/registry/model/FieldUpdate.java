package br.com.eichler.registry.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One field of a partial update: either absent (leave the stored value alone)
 * or present with a non-null replacement value.
 *
 * @param <T> the field type
 */
public final class FieldUpdate<T> {
    private final T value;

    private FieldUpdate(T value) {
        this.value = value;
    }

    public static <T> FieldUpdate<T> absent() {
        return new FieldUpdate<>(null);
    }

    public static <T> FieldUpdate<T> of(T value) {
        return new FieldUpdate<>(Objects.requireNonNull(value, "value"));
    }

    /**
     * Bridges from transport payloads where a missing field arrives as {@code null}.
     */
    public static <T> FieldUpdate<T> ofNullable(T value) {
        return value == null ? absent() : of(value);
    }

    public boolean isPresent() {
        return value != null;
    }

    public T get() {
        if (value == null) {
            throw new NoSuchElementException("field update is absent");
        }
        return value;
    }

    public T orElse(T current) {
        return value == null ? current : value;
    }

    public void ifPresent(Consumer<? super T> action) {
        if (value != null) {
            action.accept(value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldUpdate)) return false;
        return Objects.equals(value, ((FieldUpdate<?>) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "FieldUpdate.absent" : "FieldUpdate[" + value + "]";
    }
}
