package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.ChangePriority;
import dev.ticketing.ticket.command.TicketCommand.EscalatePriority;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.PriorityChanged;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.model.TicketPriority;
import dev.ticketing.ticket.model.UserId;
import dev.ticketing.ticket.state.TicketState;

import java.time.Instant;
import java.util.List;

/**
 * Functional handler for ChangePriority and EscalatePriority commands.
 *
 * <p>Escalation is a priority change with {@link TicketPriority#URGENT} as the target.
 */
public final class ChangePriorityHandler {

    private ChangePriorityHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(ChangePriority cmd, TicketState state) {
        return change(cmd.ticketId(), cmd.newPriority(), cmd.reason(), cmd.actorId(), cmd.timestamp(), state);
    }

    public static Result<DomainError, List<TicketEvent>> escalate(EscalatePriority cmd, TicketState state) {
        return change(cmd.ticketId(), TicketPriority.URGENT, cmd.reason(), cmd.actorId(), cmd.timestamp(), state);
    }

    private static Result<DomainError, List<TicketEvent>> change(
            TicketId ticketId, TicketPriority target, String reason, UserId actorId, Instant timestamp,
            TicketState state) {
        if (state.priority() == target) {
            return Result.err(DomainError.samePriority());
        }

        return Result.ok(List.of(new PriorityChanged(ticketId, state.priority(), target, reason, actorId, timestamp)));
    }
}
