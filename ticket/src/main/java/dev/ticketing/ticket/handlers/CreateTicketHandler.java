package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DecideContext;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.CreateTicket;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.TicketAssigned;
import dev.ticketing.ticket.event.TicketEvent.TicketCreated;
import dev.ticketing.ticket.model.SenderInfo;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.model.TicketPriority;

import java.util.ArrayList;
import java.util.List;

/**
 * Functional handler for CreateTicket command.
 */
public final class CreateTicketHandler {

    private CreateTicketHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(CreateTicket cmd, DecideContext context) {
        // Validate
        if (cmd.title() == null || cmd.title().isBlank()) {
            return Result.err(DomainError.titleRequired());
        }
        if (cmd.reporterId() == null) {
            return Result.err(DomainError.reporterRequired());
        }

        // Compute
        TicketId ticketId = context.generateTicketId();
        List<TicketEvent> events = new ArrayList<>(2);
        events.add(new TicketCreated(
            ticketId,
            cmd.title().trim(),
            cmd.description(),
            cmd.priority() != null ? cmd.priority() : TicketPriority.MEDIUM,
            cmd.type(),
            cmd.reporterId(),
            cmd.assigneeId(),
            cmd.sender() != null ? cmd.sender() : SenderInfo.empty(),
            cmd.orderNumber(),
            cmd.trackingNumber(),
            cmd.externalMessageId(),
            cmd.conversationId(),
            cmd.shippingAddress(),
            cmd.customerId(),
            cmd.actorId(),
            cmd.timestamp()));

        if (cmd.assigneeId() != null) {
            events.add(new TicketAssigned(ticketId, null, cmd.assigneeId(), cmd.actorId(), cmd.timestamp()));
        }
        return Result.ok(List.copyOf(events));
    }
}
