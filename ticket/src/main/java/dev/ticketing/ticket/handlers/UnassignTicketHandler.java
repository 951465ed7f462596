package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.UnassignTicket;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.TicketUnassigned;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Functional handler for UnassignTicket command.
 */
public final class UnassignTicketHandler {

    private UnassignTicketHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(UnassignTicket cmd, TicketState state) {
        if (!state.isAssigned()) {
            return Result.err(DomainError.alreadyUnassigned());
        }

        return Result.ok(List.of(new TicketUnassigned(
            cmd.ticketId(), state.assigneeId(), cmd.actorId(), cmd.timestamp())));
    }
}
