package dev.ticketing.ticket;

import io.grpc.Status;

/**
 * Stable rejection codes. Callers branch on these, never on message text.
 */
public enum DomainErrorCode {
    TITLE_REQUIRED(Status.Code.INVALID_ARGUMENT),
    REPORTER_REQUIRED(Status.Code.INVALID_ARGUMENT),
    COMMENT_EMPTY(Status.Code.INVALID_ARGUMENT),
    ASSIGNEE_REQUIRED(Status.Code.INVALID_ARGUMENT),
    CANNOT_MERGE_INTO_SELF(Status.Code.INVALID_ARGUMENT),
    INVALID_STATUS_TRANSITION(Status.Code.FAILED_PRECONDITION),
    SAME_ASSIGNEE(Status.Code.FAILED_PRECONDITION),
    ALREADY_UNASSIGNED(Status.Code.FAILED_PRECONDITION),
    TICKET_ALREADY_CLOSED(Status.Code.FAILED_PRECONDITION),
    TICKET_NOT_CLOSED(Status.Code.FAILED_PRECONDITION),
    SAME_PRIORITY(Status.Code.FAILED_PRECONDITION),
    TICKET_ALREADY_MERGED(Status.Code.FAILED_PRECONDITION),
    CANNOT_MERGE_CLOSED_TICKET(Status.Code.FAILED_PRECONDITION),
    ALREADY_LINKED_TO_CUSTOMER(Status.Code.FAILED_PRECONDITION),
    NO_CUSTOMER_LINKED(Status.Code.FAILED_PRECONDITION),
    TICKET_NOT_FOUND(Status.Code.NOT_FOUND);

    private final Status.Code statusCode;

    DomainErrorCode(Status.Code statusCode) {
        this.statusCode = statusCode;
    }

    /**
     * gRPC status a transport adapter should answer with.
     */
    public Status.Code statusCode() {
        return statusCode;
    }
}
