package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DecideContext;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.AddComment;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.CommentAdded;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.model.CommentId;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.state.TicketState;

import java.util.ArrayList;
import java.util.List;

/**
 * Functional handler for AddComment command.
 *
 * <p>A customer reply on a ticket waiting for the customer puts it back in the queue.
 */
public final class AddCommentHandler {

    static final String CUSTOMER_REPLY_REASON = "Auto-transitioned on customer reply";

    private AddCommentHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(
            AddComment cmd, TicketState state, DecideContext context) {
        // Validate
        if (cmd.text() == null || cmd.text().isBlank()) {
            return Result.err(DomainError.commentEmpty());
        }

        // Compute
        CommentId commentId = context.generateCommentId();
        List<TicketEvent> events = new ArrayList<>(2);
        events.add(new CommentAdded(
            cmd.ticketId(),
            commentId,
            cmd.text().trim(),
            cmd.isInternalNote(),
            cmd.isFromCustomer(),
            false,
            cmd.externalMessageId(),
            cmd.attachmentIds(),
            cmd.actorId(),
            cmd.timestamp()));

        if (cmd.isFromCustomer() && state.status() == TicketStatus.PENDING_CUSTOMER) {
            events.add(new StatusTransitioned(cmd.ticketId(), TicketStatus.PENDING_CUSTOMER, TicketStatus.OPEN,
                CUSTOMER_REPLY_REASON, cmd.actorId(), cmd.timestamp()));
        }
        return Result.ok(List.copyOf(events));
    }
}
