package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.AssignTicket;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.event.TicketEvent.TicketAssigned;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.state.TicketState;

import java.util.ArrayList;
import java.util.List;

/**
 * Functional handler for AssignTicket command.
 *
 * <p>Assigning a new ticket also starts work on it.
 */
public final class AssignTicketHandler {

    static final String AUTO_START_REASON = "Auto-transitioned on assignment";

    private AssignTicketHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(AssignTicket cmd, TicketState state) {
        // Validate
        if (cmd.assigneeId() == null) {
            return Result.err(DomainError.assigneeRequired());
        }
        if (cmd.assigneeId().equals(state.assigneeId())) {
            return Result.err(DomainError.sameAssignee());
        }

        // Compute
        List<TicketEvent> events = new ArrayList<>(2);
        events.add(new TicketAssigned(
            cmd.ticketId(), state.assigneeId(), cmd.assigneeId(), cmd.actorId(), cmd.timestamp()));

        if (state.status() == TicketStatus.NEW) {
            events.add(new StatusTransitioned(cmd.ticketId(), TicketStatus.NEW, TicketStatus.IN_PROGRESS,
                AUTO_START_REASON, cmd.actorId(), cmd.timestamp()));
        }
        return Result.ok(List.copyOf(events));
    }
}
