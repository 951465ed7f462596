package dev.ticketing.ticket.event;

/**
 * Old and new value of one edited field. Either side may be null.
 */
public record FieldChange<T>(T from, T to) {
}
