package dev.ticketing.ticket.state;

import dev.ticketing.ticket.model.CustomerId;
import dev.ticketing.ticket.model.SenderInfo;
import dev.ticketing.ticket.model.ShippingAddress;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.model.TicketPriority;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.model.TicketType;
import dev.ticketing.ticket.model.UserId;

import java.time.Instant;

/**
 * Ticket aggregate state, rebuilt from events.
 *
 * <p>Immutable. Changes go through {@link #toBuilder()} and produce a new snapshot.
 */
public record TicketState(
    TicketId id,
    String title,
    String description,
    TicketStatus status,
    TicketPriority priority,
    TicketType type,
    UserId reporterId,
    UserId assigneeId,
    CustomerId customerId,
    SenderInfo sender,
    String orderNumber,
    String trackingNumber,
    String externalMessageId,
    String conversationId,
    ShippingAddress shippingAddress,
    TicketId mergedIntoTicketId,
    int commentCount,
    boolean hasFirstResponse,
    Instant closedAt,
    int reopenCount,
    Instant createdAt,
    Instant updatedAt
) {

    private static final TicketState EMPTY = new Builder().build();

    /**
     * State of a ticket that has no history yet.
     */
    public static TicketState empty() {
        return EMPTY;
    }

    public boolean exists() {
        return id != null;
    }

    public boolean isClosed() {
        return status == TicketStatus.CLOSED;
    }

    public boolean isMerged() {
        return mergedIntoTicketId != null;
    }

    public boolean isAssigned() {
        return assigneeId != null;
    }

    public boolean canBeReopened() {
        return isClosed() && !isMerged();
    }

    public boolean canBeMerged() {
        return !isClosed() && !isMerged();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private TicketId id;
        private String title;
        private String description;
        private TicketStatus status = TicketStatus.NEW;
        private TicketPriority priority = TicketPriority.MEDIUM;
        private TicketType type;
        private UserId reporterId;
        private UserId assigneeId;
        private CustomerId customerId;
        private SenderInfo sender = SenderInfo.empty();
        private String orderNumber;
        private String trackingNumber;
        private String externalMessageId;
        private String conversationId;
        private ShippingAddress shippingAddress;
        private TicketId mergedIntoTicketId;
        private int commentCount;
        private boolean hasFirstResponse;
        private Instant closedAt;
        private int reopenCount;
        private Instant createdAt;
        private Instant updatedAt;

        Builder() {}

        private Builder(TicketState state) {
            this.id = state.id;
            this.title = state.title;
            this.description = state.description;
            this.status = state.status;
            this.priority = state.priority;
            this.type = state.type;
            this.reporterId = state.reporterId;
            this.assigneeId = state.assigneeId;
            this.customerId = state.customerId;
            this.sender = state.sender;
            this.orderNumber = state.orderNumber;
            this.trackingNumber = state.trackingNumber;
            this.externalMessageId = state.externalMessageId;
            this.conversationId = state.conversationId;
            this.shippingAddress = state.shippingAddress;
            this.mergedIntoTicketId = state.mergedIntoTicketId;
            this.commentCount = state.commentCount;
            this.hasFirstResponse = state.hasFirstResponse;
            this.closedAt = state.closedAt;
            this.reopenCount = state.reopenCount;
            this.createdAt = state.createdAt;
            this.updatedAt = state.updatedAt;
        }

        public Builder id(TicketId id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder status(TicketStatus status) {
            this.status = status;
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

        public Builder customerId(CustomerId customerId) {
            this.customerId = customerId;
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

        public Builder mergedIntoTicketId(TicketId mergedIntoTicketId) {
            this.mergedIntoTicketId = mergedIntoTicketId;
            return this;
        }

        public Builder commentCount(int commentCount) {
            this.commentCount = commentCount;
            return this;
        }

        public Builder hasFirstResponse(boolean hasFirstResponse) {
            this.hasFirstResponse = hasFirstResponse;
            return this;
        }

        public Builder closedAt(Instant closedAt) {
            this.closedAt = closedAt;
            return this;
        }

        public Builder reopenCount(int reopenCount) {
            this.reopenCount = reopenCount;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public TicketState build() {
            return new TicketState(id, title, description, status, priority, type, reporterId, assigneeId,
                customerId, sender, orderNumber, trackingNumber, externalMessageId, conversationId,
                shippingAddress, mergedIntoTicketId, commentCount, hasFirstResponse, closedAt, reopenCount,
                createdAt, updatedAt);
        }
    }
}
