package dev.ticketing.ticket.service;

import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Result of an accepted command.
 *
 * @param ticketId the ticket the command applied to
 * @param events the events appended, empty for an accepted no-op
 * @param state the ticket state after the events
 * @param version number of events in the ticket's stream afterwards
 */
public record CommandOutcome(TicketId ticketId, List<TicketEvent> events, TicketState state, int version) {

    public CommandOutcome {
        events = List.copyOf(events);
    }

    public boolean isNoOp() {
        return events.isEmpty();
    }
}
