package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.CloseTicket;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.event.TicketEvent.TicketClosed;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Functional handler for CloseTicket command.
 */
public final class CloseTicketHandler {

    private CloseTicketHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(CloseTicket cmd, TicketState state) {
        if (state.isClosed()) {
            return Result.err(DomainError.ticketAlreadyClosed());
        }

        // TicketClosed records the close, StatusTransitioned moves the status.
        return Result.ok(List.of(
            new TicketClosed(cmd.ticketId(), state.status(), cmd.resolution(), cmd.actorId(), cmd.timestamp()),
            new StatusTransitioned(cmd.ticketId(), state.status(), TicketStatus.CLOSED,
                cmd.resolution(), cmd.actorId(), cmd.timestamp())));
    }
}
