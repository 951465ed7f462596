package dev.ticketing.ticket.service;

import dev.ticketing.ticket.DecideContext;
import dev.ticketing.ticket.model.CommentId;
import dev.ticketing.ticket.model.TicketId;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out consecutive ticket and comment ids. Safe to share between threads.
 */
public class SequentialDecideContext implements DecideContext {
    private final AtomicLong nextTicketId;
    private final AtomicLong nextCommentId;

    public SequentialDecideContext(long firstTicketId, long firstCommentId) {
        this.nextTicketId = new AtomicLong(firstTicketId);
        this.nextCommentId = new AtomicLong(firstCommentId);
    }

    public static SequentialDecideContext from(TicketEngineConfig config) {
        return new SequentialDecideContext(config.firstTicketId(), config.firstCommentId());
    }

    @Override
    public TicketId generateTicketId() {
        return TicketId.of(nextTicketId.getAndIncrement());
    }

    @Override
    public CommentId generateCommentId() {
        return CommentId.of(nextCommentId.getAndIncrement());
    }
}
