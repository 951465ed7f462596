package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DecideContext;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.TicketCommand.AddEmailReply;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.CommentAdded;
import dev.ticketing.ticket.event.TicketEvent.EmailReplyQueued;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.model.CommentId;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.state.TicketState;

import java.util.ArrayList;
import java.util.List;

/**
 * Functional handler for AddEmailReply command.
 *
 * <p>The reply is recorded as an outgoing comment and queued for delivery under the same
 * comment id. An active ticket then waits on the customer.
 */
public final class AddEmailReplyHandler {

    static final String AWAIT_CUSTOMER_REASON = "Auto-transitioned after sending reply";

    private AddEmailReplyHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(
            AddEmailReply cmd, TicketState state, DecideContext context) {
        // Validate
        if (cmd.text() == null || cmd.text().isBlank()) {
            return Result.err(DomainError.commentEmpty());
        }

        // Compute
        CommentId commentId = context.generateCommentId();
        String text = cmd.text().trim();
        List<TicketEvent> events = new ArrayList<>(3);
        events.add(new CommentAdded(
            cmd.ticketId(), commentId, text, false, false, true, null,
            cmd.attachmentIds(), cmd.actorId(), cmd.timestamp()));
        events.add(new EmailReplyQueued(
            cmd.ticketId(), commentId, cmd.toEmail(), text, cmd.attachmentIds(), cmd.actorId(), cmd.timestamp()));

        if (state.status() == TicketStatus.OPEN || state.status() == TicketStatus.IN_PROGRESS) {
            events.add(new StatusTransitioned(cmd.ticketId(), state.status(), TicketStatus.PENDING_CUSTOMER,
                AWAIT_CUSTOMER_REASON, cmd.actorId(), cmd.timestamp()));
        }
        return Result.ok(List.copyOf(events));
    }
}
