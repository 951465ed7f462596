package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.MergeTicket;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.TicketClosed;
import dev.ticketing.ticket.event.TicketEvent.TicketMerged;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Functional handler for MergeTicket command.
 *
 * <p>Merging closes the source ticket for good. Checks run in a fixed order:
 * self-merge, then an earlier merge, then a plain close.
 */
public final class MergeTicketHandler {

    private MergeTicketHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(MergeTicket cmd, TicketState state) {
        // Validate
        if (cmd.sourceTicketId().equals(cmd.targetTicketId())) {
            return Result.err(DomainError.cannotMergeIntoSelf());
        }

        // Guard
        if (!state.canBeMerged()) {
            return Result.err(state.isMerged() ? DomainError.ticketAlreadyMerged() : DomainError.cannotMergeClosedTicket());
        }

        // Compute
        return Result.ok(List.of(
            new TicketMerged(cmd.sourceTicketId(), cmd.targetTicketId(), cmd.reason(), cmd.actorId(), cmd.timestamp()),
            new TicketClosed(cmd.sourceTicketId(), state.status(), "Merged into ticket #" + cmd.targetTicketId(),
                cmd.actorId(), cmd.timestamp())));
    }
}
