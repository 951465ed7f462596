package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.ReopenTicket;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.event.TicketEvent.TicketReopened;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Functional handler for ReopenTicket command.
 */
public final class ReopenTicketHandler {

    private ReopenTicketHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(ReopenTicket cmd, TicketState state) {
        // Guard
        if (!state.canBeReopened()) {
            return Result.err(state.isClosed() ? DomainError.ticketAlreadyMerged() : DomainError.ticketNotClosed());
        }

        // Compute
        return Result.ok(List.of(
            new TicketReopened(cmd.ticketId(), cmd.reason(), cmd.actorId(), cmd.timestamp()),
            new StatusTransitioned(cmd.ticketId(), TicketStatus.CLOSED, TicketStatus.OPEN,
                "Reopened: " + cmd.reason(), cmd.actorId(), cmd.timestamp())));
    }
}
