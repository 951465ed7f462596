package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.TransitionStatus;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.state.StatusTransitions;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Functional handler for TransitionStatus command.
 *
 * <p>Moving to the status the ticket already has is accepted and emits nothing,
 * so a retried request is harmless. Any other move must follow {@link StatusTransitions}.
 */
public final class TransitionStatusHandler {

    private TransitionStatusHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(TransitionStatus cmd, TicketState state) {
        if (state.status() == cmd.newStatus()) {
            return Result.ok(List.of());
        }

        // Guard
        if (state.isMerged()) {
            return Result.err(DomainError.ticketAlreadyMerged());
        }

        // Validate
        if (!StatusTransitions.canTransition(state.status(), cmd.newStatus())) {
            return Result.err(DomainError.invalidStatusTransition(state.status(), cmd.newStatus()));
        }

        // Compute
        return Result.ok(List.of(new StatusTransitioned(
            cmd.ticketId(), state.status(), cmd.newStatus(), cmd.reason(), cmd.actorId(), cmd.timestamp())));
    }
}
