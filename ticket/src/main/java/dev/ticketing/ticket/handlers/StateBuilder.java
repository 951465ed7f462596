package dev.ticketing.ticket.handlers;

import dev.ticketing.EventBook;
import dev.ticketing.ticket.codec.TicketEventCodec;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.CommentAdded;
import dev.ticketing.ticket.event.TicketEvent.CustomerLinked;
import dev.ticketing.ticket.event.TicketEvent.PriorityChanged;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.event.TicketEvent.TicketAssigned;
import dev.ticketing.ticket.event.TicketEvent.TicketCreated;
import dev.ticketing.ticket.event.TicketEvent.TicketMerged;
import dev.ticketing.ticket.event.TicketEvent.TicketUpdated;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Builds TicketState from events (functional style).
 *
 * <p>Applying an event never touches the state passed in; each step returns a new snapshot.
 */
public final class StateBuilder {

    private StateBuilder() {}

    /**
     * Build state from an event book by replaying all events.
     */
    public static TicketState fromEventBook(EventBook eventBook) {
        if (eventBook == null) {
            return TicketState.empty();
        }
        return applyAll(TicketState.empty(), TicketEventCodec.decodeAll(eventBook));
    }

    /**
     * Fold {@code events} over {@code state} in order.
     */
    public static TicketState applyAll(TicketState state, List<? extends TicketEvent> events) {
        TicketState current = state;
        for (TicketEvent event : events) {
            current = apply(current, event);
        }
        return current;
    }

    /**
     * Apply a single event to state.
     */
    public static TicketState apply(TicketState state, TicketEvent event) {
        TicketState.Builder next = state.toBuilder().updatedAt(event.occurredAt());

        return switch (event.kind()) {
            case TICKET_CREATED -> created((TicketCreated) event);
            case STATUS_TRANSITIONED -> next.status(((StatusTransitioned) event).toStatus()).build();
            case TICKET_ASSIGNED -> next.assigneeId(((TicketAssigned) event).newAssigneeId()).build();
            case TICKET_UNASSIGNED -> next.assigneeId(null).build();
            case COMMENT_ADDED -> {
                CommentAdded comment = (CommentAdded) event;
                // Only a visible agent comment answers the customer.
                yield next.commentCount(state.commentCount() + 1)
                    .hasFirstResponse(state.hasFirstResponse() || (!comment.isInternalNote() && !comment.isFromCustomer()))
                    .build();
            }
            case EMAIL_REPLY_QUEUED -> next.hasFirstResponse(true).build();
            // Status stays with the accompanying StatusTransitioned.
            case TICKET_CLOSED -> next.closedAt(event.occurredAt()).build();
            case TICKET_REOPENED -> next.closedAt(null).reopenCount(state.reopenCount() + 1).build();
            case PRIORITY_CHANGED -> next.priority(((PriorityChanged) event).toPriority()).build();
            case TICKET_MERGED -> next
                .mergedIntoTicketId(((TicketMerged) event).targetTicketId())
                .status(TicketStatus.CLOSED)
                .build();
            case CUSTOMER_LINKED -> next.customerId(((CustomerLinked) event).customerId()).build();
            case CUSTOMER_UNLINKED -> next.customerId(null).build();
            case TICKET_UPDATED -> updated(next, (TicketUpdated) event);
            case FIRST_RESPONSE_RECORDED -> next.hasFirstResponse(true).build();
        };
    }

    private static TicketState updated(TicketState.Builder next, TicketUpdated event) {
        if (event.title() != null) {
            next.title(event.title().to());
        }
        if (event.description() != null) {
            next.description(event.description().to());
        }
        if (event.type() != null) {
            next.type(event.type().to());
        }
        if (event.orderNumber() != null) {
            next.orderNumber(event.orderNumber().to());
        }
        if (event.trackingNumber() != null) {
            next.trackingNumber(event.trackingNumber().to());
        }
        return next.build();
    }

    private static TicketState created(TicketCreated event) {
        return TicketState.empty().toBuilder()
            .id(event.ticketId())
            .title(event.title())
            .description(event.description())
            .priority(event.priority())
            .type(event.type())
            .reporterId(event.reporterId())
            .assigneeId(event.assigneeId())
            .customerId(event.customerId())
            .sender(event.sender())
            .orderNumber(event.orderNumber())
            .trackingNumber(event.trackingNumber())
            .externalMessageId(event.externalMessageId())
            .conversationId(event.conversationId())
            .shippingAddress(event.shippingAddress())
            .createdAt(event.occurredAt())
            .updatedAt(event.occurredAt())
            .build();
    }
}
