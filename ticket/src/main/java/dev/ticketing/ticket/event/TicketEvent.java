package dev.ticketing.ticket.event;

import dev.ticketing.ticket.model.CommentId;
import dev.ticketing.ticket.model.CustomerId;
import dev.ticketing.ticket.model.SenderInfo;
import dev.ticketing.ticket.model.ShippingAddress;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.model.TicketPriority;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.model.TicketType;
import dev.ticketing.ticket.model.UserId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A fact about a ticket.
 *
 * <p>Each event carries everything needed to apply it to state, so replay never
 * looks anything up. {@code causedBy} is null for system-originated events.
 */
public sealed interface TicketEvent {

    EventKind kind();

    TicketId ticketId();

    UserId causedBy();

    Instant occurredAt();

    // =========================================================================
    // Lifecycle
    // =========================================================================

    record TicketCreated(
        TicketId ticketId,
        String title,
        String description,
        TicketPriority priority,
        TicketType type,
        UserId reporterId,
        UserId assigneeId,
        SenderInfo sender,
        String orderNumber,
        String trackingNumber,
        String externalMessageId,
        String conversationId,
        ShippingAddress shippingAddress,
        CustomerId customerId,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public TicketCreated {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(priority, "priority");
            Objects.requireNonNull(sender, "sender");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.TICKET_CREATED;
        }
    }

    record StatusTransitioned(
        TicketId ticketId,
        TicketStatus fromStatus,
        TicketStatus toStatus,
        String reason,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public StatusTransitioned {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(fromStatus, "fromStatus");
            Objects.requireNonNull(toStatus, "toStatus");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.STATUS_TRANSITIONED;
        }
    }

    record TicketClosed(
        TicketId ticketId,
        TicketStatus previousStatus,
        String resolution,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public TicketClosed {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(previousStatus, "previousStatus");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.TICKET_CLOSED;
        }
    }

    record TicketReopened(TicketId ticketId, String reason, UserId causedBy, Instant occurredAt)
        implements TicketEvent {
        public TicketReopened {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.TICKET_REOPENED;
        }
    }

    record TicketMerged(
        TicketId ticketId,
        TicketId targetTicketId,
        String reason,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public TicketMerged {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(targetTicketId, "targetTicketId");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.TICKET_MERGED;
        }
    }

    // =========================================================================
    // Assignment
    // =========================================================================

    record TicketAssigned(
        TicketId ticketId,
        UserId previousAssigneeId,
        UserId newAssigneeId,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public TicketAssigned {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(newAssigneeId, "newAssigneeId");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.TICKET_ASSIGNED;
        }
    }

    record TicketUnassigned(TicketId ticketId, UserId previousAssigneeId, UserId causedBy, Instant occurredAt)
        implements TicketEvent {
        public TicketUnassigned {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(previousAssigneeId, "previousAssigneeId");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.TICKET_UNASSIGNED;
        }
    }

    // =========================================================================
    // Priority
    // =========================================================================

    record PriorityChanged(
        TicketId ticketId,
        TicketPriority fromPriority,
        TicketPriority toPriority,
        String reason,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public PriorityChanged {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(fromPriority, "fromPriority");
            Objects.requireNonNull(toPriority, "toPriority");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.PRIORITY_CHANGED;
        }
    }

    // =========================================================================
    // Comments
    // =========================================================================

    record CommentAdded(
        TicketId ticketId,
        CommentId commentId,
        String text,
        boolean isInternalNote,
        boolean isFromCustomer,
        boolean isOutgoingReply,
        String externalMessageId,
        List<Long> attachmentIds,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public CommentAdded {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(commentId, "commentId");
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(occurredAt, "occurredAt");
            attachmentIds = attachmentIds == null ? List.of() : List.copyOf(attachmentIds);
        }

        @Override
        public EventKind kind() {
            return EventKind.COMMENT_ADDED;
        }
    }

    record EmailReplyQueued(
        TicketId ticketId,
        CommentId commentId,
        String toEmail,
        String text,
        List<Long> attachmentIds,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public EmailReplyQueued {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(commentId, "commentId");
            Objects.requireNonNull(text, "text");
            Objects.requireNonNull(occurredAt, "occurredAt");
            attachmentIds = attachmentIds == null ? List.of() : List.copyOf(attachmentIds);
        }

        @Override
        public EventKind kind() {
            return EventKind.EMAIL_REPLY_QUEUED;
        }
    }

    // =========================================================================
    // Customer linking
    // =========================================================================

    record CustomerLinked(
        TicketId ticketId,
        CustomerId customerId,
        CustomerId previousCustomerId,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public CustomerLinked {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(customerId, "customerId");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.CUSTOMER_LINKED;
        }
    }

    record CustomerUnlinked(TicketId ticketId, CustomerId previousCustomerId, UserId causedBy, Instant occurredAt)
        implements TicketEvent {
        public CustomerUnlinked {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(previousCustomerId, "previousCustomerId");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.CUSTOMER_UNLINKED;
        }
    }

    // =========================================================================
    // Details
    // =========================================================================

    /**
     * Ticket details edited after creation. A null change means the field was not touched.
     */
    record TicketUpdated(
        TicketId ticketId,
        FieldChange<String> title,
        FieldChange<String> description,
        FieldChange<TicketType> type,
        FieldChange<String> orderNumber,
        FieldChange<String> trackingNumber,
        UserId causedBy,
        Instant occurredAt
    ) implements TicketEvent {
        public TicketUpdated {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.TICKET_UPDATED;
        }
    }

    // =========================================================================
    // Responses
    // =========================================================================

    record FirstResponseRecorded(TicketId ticketId, Instant respondedAt, UserId causedBy, Instant occurredAt)
        implements TicketEvent {
        public FirstResponseRecorded {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(respondedAt, "respondedAt");
            Objects.requireNonNull(occurredAt, "occurredAt");
        }

        @Override
        public EventKind kind() {
            return EventKind.FIRST_RESPONSE_RECORDED;
        }
    }
}
