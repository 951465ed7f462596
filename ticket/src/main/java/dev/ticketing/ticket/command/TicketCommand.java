package dev.ticketing.ticket.command;

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
import java.util.Optional;

/**
 * A request to change a ticket.
 *
 * <p>Every command carries the acting user ({@code null} for system actors such as an
 * inbound customer email) and a caller-supplied timestamp. Commands are plain data;
 * validation against the ticket's state happens in the handlers.
 */
public sealed interface TicketCommand {

    CommandKind kind();

    UserId actorId();

    Instant timestamp();

    /**
     * The ticket this command targets, empty for {@link CreateTicket}.
     */
    Optional<TicketId> aggregateId();

    // =========================================================================
    // Lifecycle
    // =========================================================================

    record CreateTicket(
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
        UserId actorId,
        Instant timestamp
    ) implements TicketCommand {
        public CreateTicket {
            Objects.requireNonNull(timestamp, "timestamp");
        }

        public static Builder builder() {
            return new Builder();
        }

        @Override
        public CommandKind kind() {
            return CommandKind.CREATE_TICKET;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.empty();
        }

        public static final class Builder {
            private String title;
            private String description;
            private TicketPriority priority;
            private TicketType type;
            private UserId reporterId;
            private UserId assigneeId;
            private SenderInfo sender;
            private String orderNumber;
            private String trackingNumber;
            private String externalMessageId;
            private String conversationId;
            private ShippingAddress shippingAddress;
            private CustomerId customerId;
            private UserId actorId;
            private Instant timestamp;

            private Builder() {}

            public Builder title(String title) {
                this.title = title;
                return this;
            }

            public Builder description(String description) {
                this.description = description;
                return this;
            }

            public Builder priority(TicketPriority priority) {
                this.priority = priority;
                return this;
            }

            public Builder type(TicketType type) {
                this.type = type;
                return this;
            }

            public Builder reporterId(UserId reporterId) {
                this.reporterId = reporterId;
                return this;
            }

            public Builder assigneeId(UserId assigneeId) {
                this.assigneeId = assigneeId;
                return this;
            }

            public Builder sender(SenderInfo sender) {
                this.sender = sender;
                return this;
            }

            public Builder orderNumber(String orderNumber) {
                this.orderNumber = orderNumber;
                return this;
            }

            public Builder trackingNumber(String trackingNumber) {
                this.trackingNumber = trackingNumber;
                return this;
            }

            public Builder externalMessageId(String externalMessageId) {
                this.externalMessageId = externalMessageId;
                return this;
            }

            public Builder conversationId(String conversationId) {
                this.conversationId = conversationId;
                return this;
            }

            public Builder shippingAddress(ShippingAddress shippingAddress) {
                this.shippingAddress = shippingAddress;
                return this;
            }

            public Builder customerId(CustomerId customerId) {
                this.customerId = customerId;
                return this;
            }

            public Builder actorId(UserId actorId) {
                this.actorId = actorId;
                return this;
            }

            public Builder timestamp(Instant timestamp) {
                this.timestamp = timestamp;
                return this;
            }

            public CreateTicket build() {
                return new CreateTicket(title, description, priority, type, reporterId, assigneeId, sender,
                    orderNumber, trackingNumber, externalMessageId, conversationId, shippingAddress,
                    customerId, actorId, timestamp);
            }
        }
    }

    record TransitionStatus(
        TicketId ticketId,
        TicketStatus newStatus,
        String reason,
        UserId actorId,
        Instant timestamp
    ) implements TicketCommand {
        public TransitionStatus {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(newStatus, "newStatus");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.TRANSITION_STATUS;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    record CloseTicket(TicketId ticketId, String resolution, UserId actorId, Instant timestamp)
        implements TicketCommand {
        public CloseTicket {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.CLOSE_TICKET;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    record ReopenTicket(TicketId ticketId, String reason, UserId actorId, Instant timestamp)
        implements TicketCommand {
        public ReopenTicket {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.REOPEN_TICKET;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    /**
     * Merge {@code sourceTicketId} into {@code targetTicketId}. The source is the aggregate
     * being changed.
     */
    record MergeTicket(
        TicketId sourceTicketId,
        TicketId targetTicketId,
        String reason,
        UserId actorId,
        Instant timestamp
    ) implements TicketCommand {
        public MergeTicket {
            Objects.requireNonNull(sourceTicketId, "sourceTicketId");
            Objects.requireNonNull(targetTicketId, "targetTicketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.MERGE_TICKET;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(sourceTicketId);
        }
    }

    // =========================================================================
    // Assignment
    // =========================================================================

    /**
     * Assign the ticket. A null {@code assigneeId} is rejected by the handler, not here.
     */
    record AssignTicket(TicketId ticketId, UserId assigneeId, UserId actorId, Instant timestamp)
        implements TicketCommand {
        public AssignTicket {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.ASSIGN_TICKET;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    record UnassignTicket(TicketId ticketId, UserId actorId, Instant timestamp) implements TicketCommand {
        public UnassignTicket {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.UNASSIGN_TICKET;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    // =========================================================================
    // Priority
    // =========================================================================

    record ChangePriority(
        TicketId ticketId,
        TicketPriority newPriority,
        String reason,
        UserId actorId,
        Instant timestamp
    ) implements TicketCommand {
        public ChangePriority {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(newPriority, "newPriority");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.CHANGE_PRIORITY;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    /**
     * Raise the ticket straight to {@link TicketPriority#URGENT}.
     */
    record EscalatePriority(TicketId ticketId, String reason, UserId actorId, Instant timestamp)
        implements TicketCommand {
        public EscalatePriority {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.ESCALATE_PRIORITY;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    // =========================================================================
    // Comments
    // =========================================================================

    record AddComment(
        TicketId ticketId,
        String text,
        boolean isInternalNote,
        boolean isFromCustomer,
        String externalMessageId,
        List<Long> attachmentIds,
        UserId actorId,
        Instant timestamp
    ) implements TicketCommand {
        public AddComment {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
            attachmentIds = attachmentIds == null ? List.of() : List.copyOf(attachmentIds);
        }

        /**
         * A plain agent comment with no attachments.
         */
        public static AddComment note(TicketId ticketId, String text, UserId actorId, Instant timestamp) {
            return new AddComment(ticketId, text, false, false, null, List.of(), actorId, timestamp);
        }

        @Override
        public CommandKind kind() {
            return CommandKind.ADD_COMMENT;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    /**
     * An agent reply that is stored as a comment and queued for delivery by email.
     */
    record AddEmailReply(
        TicketId ticketId,
        String text,
        String toEmail,
        List<Long> attachmentIds,
        UserId actorId,
        Instant timestamp
    ) implements TicketCommand {
        public AddEmailReply {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
            attachmentIds = attachmentIds == null ? List.of() : List.copyOf(attachmentIds);
        }

        @Override
        public CommandKind kind() {
            return CommandKind.ADD_EMAIL_REPLY;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    // =========================================================================
    // Customer linking
    // =========================================================================

    record LinkToCustomer(TicketId ticketId, CustomerId customerId, UserId actorId, Instant timestamp)
        implements TicketCommand {
        public LinkToCustomer {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(customerId, "customerId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.LINK_TO_CUSTOMER;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    record UnlinkFromCustomer(TicketId ticketId, UserId actorId, Instant timestamp) implements TicketCommand {
        public UnlinkFromCustomer {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.UNLINK_FROM_CUSTOMER;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }

    // =========================================================================
    // Details
    // =========================================================================

    /**
     * Edit ticket details after creation. Null {@code title}, {@code description} and
     * {@code type} leave those fields unchanged; order and tracking numbers can also be cleared.
     */
    record UpdateTicket(
        TicketId ticketId,
        String title,
        String description,
        TicketType type,
        FieldUpdate<String> orderNumber,
        FieldUpdate<String> trackingNumber,
        UserId actorId,
        Instant timestamp
    ) implements TicketCommand {
        public UpdateTicket {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        public static Builder builder(TicketId ticketId) {
            return new Builder(ticketId);
        }

        @Override
        public CommandKind kind() {
            return CommandKind.UPDATE_TICKET;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }

        public static final class Builder {
            private final TicketId ticketId;
            private String title;
            private String description;
            private TicketType type;
            private FieldUpdate<String> orderNumber;
            private FieldUpdate<String> trackingNumber;
            private UserId actorId;
            private Instant timestamp;

            private Builder(TicketId ticketId) {
                this.ticketId = ticketId;
            }

            public Builder title(String title) {
                this.title = title;
                return this;
            }

            public Builder description(String description) {
                this.description = description;
                return this;
            }

            public Builder type(TicketType type) {
                this.type = type;
                return this;
            }

            public Builder orderNumber(FieldUpdate<String> orderNumber) {
                this.orderNumber = orderNumber;
                return this;
            }

            public Builder trackingNumber(FieldUpdate<String> trackingNumber) {
                this.trackingNumber = trackingNumber;
                return this;
            }

            public Builder actorId(UserId actorId) {
                this.actorId = actorId;
                return this;
            }

            public Builder timestamp(Instant timestamp) {
                this.timestamp = timestamp;
                return this;
            }

            public UpdateTicket build() {
                return new UpdateTicket(ticketId, title, description, type, orderNumber, trackingNumber,
                    actorId, timestamp);
            }
        }
    }

    // =========================================================================
    // Responses
    // =========================================================================

    /**
     * Mark the ticket as answered, e.g. after a reply sent outside the system.
     * A null {@code respondedAt} means the command timestamp.
     */
    record RecordFirstResponse(TicketId ticketId, Instant respondedAt, UserId actorId, Instant timestamp)
        implements TicketCommand {
        public RecordFirstResponse {
            Objects.requireNonNull(ticketId, "ticketId");
            Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public CommandKind kind() {
            return CommandKind.RECORD_FIRST_RESPONSE;
        }

        @Override
        public Optional<TicketId> aggregateId() {
            return Optional.of(ticketId);
        }
    }
}
