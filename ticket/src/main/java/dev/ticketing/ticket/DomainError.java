package dev.ticketing.ticket;

import dev.ticketing.client.Errors;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.state.StatusTransitions;

import java.util.Objects;

/**
 * A rejected command: a stable code plus a human-readable message.
 */
public record DomainError(DomainErrorCode code, String message) {

    public DomainError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public static DomainError titleRequired() {
        return new DomainError(DomainErrorCode.TITLE_REQUIRED, "Title is required");
    }

    public static DomainError reporterRequired() {
        return new DomainError(DomainErrorCode.REPORTER_REQUIRED, "Reporter is required");
    }

    public static DomainError invalidStatusTransition(TicketStatus from, TicketStatus to) {
        return new DomainError(DomainErrorCode.INVALID_STATUS_TRANSITION, String.format(
            "Cannot transition from '%s' to '%s'. Valid transitions from '%s': %s",
            from.wireName(), to.wireName(), from.wireName(), StatusTransitions.describeTargets(from)));
    }

    public static DomainError assigneeRequired() {
        return new DomainError(DomainErrorCode.ASSIGNEE_REQUIRED, "Assignee is required");
    }

    public static DomainError sameAssignee() {
        return new DomainError(DomainErrorCode.SAME_ASSIGNEE, "Ticket is already assigned to this user");
    }

    public static DomainError alreadyUnassigned() {
        return new DomainError(DomainErrorCode.ALREADY_UNASSIGNED, "Ticket is already unassigned");
    }

    public static DomainError commentEmpty() {
        return new DomainError(DomainErrorCode.COMMENT_EMPTY, "Comment text cannot be empty");
    }

    public static DomainError ticketAlreadyClosed() {
        return new DomainError(DomainErrorCode.TICKET_ALREADY_CLOSED, "Ticket is already closed");
    }

    public static DomainError ticketNotClosed() {
        return new DomainError(DomainErrorCode.TICKET_NOT_CLOSED, "Cannot reopen a ticket that is not closed");
    }

    public static DomainError samePriority() {
        return new DomainError(DomainErrorCode.SAME_PRIORITY, "Ticket already has this priority");
    }

    public static DomainError cannotMergeIntoSelf() {
        return new DomainError(DomainErrorCode.CANNOT_MERGE_INTO_SELF, "Cannot merge a ticket into itself");
    }

    public static DomainError ticketAlreadyMerged() {
        return new DomainError(DomainErrorCode.TICKET_ALREADY_MERGED,
            "This ticket has already been merged into another ticket");
    }

    public static DomainError cannotMergeClosedTicket() {
        return new DomainError(DomainErrorCode.CANNOT_MERGE_CLOSED_TICKET, "Cannot merge a closed ticket");
    }

    public static DomainError alreadyLinkedToCustomer() {
        return new DomainError(DomainErrorCode.ALREADY_LINKED_TO_CUSTOMER, "Ticket is already linked to this customer");
    }

    public static DomainError noCustomerLinked() {
        return new DomainError(DomainErrorCode.NO_CUSTOMER_LINKED, "Ticket is not linked to any customer");
    }

    public static DomainError ticketNotFound(TicketId ticketId) {
        return new DomainError(DomainErrorCode.TICKET_NOT_FOUND, "Ticket " + ticketId + " not found");
    }

    /**
     * Convert to the exception thrown at transport edges.
     */
    public Errors.CommandRejectedError toException() {
        return new Errors.CommandRejectedError(code.name(), message, code.statusCode());
    }
}
