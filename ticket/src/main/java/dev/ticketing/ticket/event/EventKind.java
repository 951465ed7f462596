package dev.ticketing.ticket.event;

/**
 * Discriminant of {@link TicketEvent}.
 */
public enum EventKind {
    TICKET_CREATED,
    STATUS_TRANSITIONED,
    TICKET_ASSIGNED,
    TICKET_UNASSIGNED,
    COMMENT_ADDED,
    EMAIL_REPLY_QUEUED,
    TICKET_CLOSED,
    TICKET_REOPENED,
    PRIORITY_CHANGED,
    TICKET_MERGED,
    CUSTOMER_LINKED,
    CUSTOMER_UNLINKED,
    TICKET_UPDATED,
    FIRST_RESPONSE_RECORDED
}
