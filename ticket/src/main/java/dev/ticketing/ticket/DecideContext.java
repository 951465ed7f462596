package dev.ticketing.ticket;

import dev.ticketing.ticket.model.CommentId;
import dev.ticketing.ticket.model.TicketId;

/**
 * Identifier generation handed to {@code decide}.
 *
 * <p>Passed in by the caller so decisions stay deterministic under test.
 */
public interface DecideContext {

    TicketId generateTicketId();

    CommentId generateCommentId();
}
