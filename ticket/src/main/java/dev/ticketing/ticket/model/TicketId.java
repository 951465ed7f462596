package dev.ticketing.ticket.model;

/**
 * Identifier of a ticket aggregate.
 */
public record TicketId(long value) {

    public static TicketId of(long value) {
        return new TicketId(value);
    }

    /**
     * Stream root used by the event store.
     */
    public String asRoot() {
        return Long.toString(value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
