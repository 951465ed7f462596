package dev.ticketing.ticket.command;

import java.util.Objects;

/**
 * Edit of a field that may be cleared. A {@code null} update leaves the field alone;
 * {@link #clear()} sets it to null.
 */
public record FieldUpdate<T>(T value) {

    public static <T> FieldUpdate<T> to(T value) {
        return new FieldUpdate<>(Objects.requireNonNull(value, "value"));
    }

    public static <T> FieldUpdate<T> clear() {
        return new FieldUpdate<>(null);
    }
}
