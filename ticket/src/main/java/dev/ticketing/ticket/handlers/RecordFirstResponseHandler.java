package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.RecordFirstResponse;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.FirstResponseRecorded;

import java.util.List;

/**
 * Functional handler for RecordFirstResponse command.
 */
public final class RecordFirstResponseHandler {

    private RecordFirstResponseHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(RecordFirstResponse cmd) {
        return Result.ok(List.of(new FirstResponseRecorded(
            cmd.ticketId(),
            cmd.respondedAt() != null ? cmd.respondedAt() : cmd.timestamp(),
            cmd.actorId(),
            cmd.timestamp())));
    }
}
