package dev.ticketing.ticket.command;

/**
 * Discriminant of {@link TicketCommand}. Dispatch switches over this enum so that a
 * new command kind fails to compile until every switch handles it.
 */
public enum CommandKind {
    CREATE_TICKET,
    TRANSITION_STATUS,
    ADD_COMMENT,
    ASSIGN_TICKET,
    UNASSIGN_TICKET,
    CLOSE_TICKET,
    REOPEN_TICKET,
    CHANGE_PRIORITY,
    ESCALATE_PRIORITY,
    MERGE_TICKET,
    ADD_EMAIL_REPLY,
    LINK_TO_CUSTOMER,
    UNLINK_FROM_CUSTOMER,
    UPDATE_TICKET,
    RECORD_FIRST_RESPONSE
}
