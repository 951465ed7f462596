package dev.ticketing.ticket;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.command.TicketCommand;
import dev.ticketing.ticket.command.TicketCommand.AddComment;
import dev.ticketing.ticket.command.TicketCommand.AddEmailReply;
import dev.ticketing.ticket.command.TicketCommand.AssignTicket;
import dev.ticketing.ticket.command.TicketCommand.ChangePriority;
import dev.ticketing.ticket.command.TicketCommand.CloseTicket;
import dev.ticketing.ticket.command.TicketCommand.CreateTicket;
import dev.ticketing.ticket.command.TicketCommand.EscalatePriority;
import dev.ticketing.ticket.command.TicketCommand.LinkToCustomer;
import dev.ticketing.ticket.command.TicketCommand.MergeTicket;
import dev.ticketing.ticket.command.TicketCommand.RecordFirstResponse;
import dev.ticketing.ticket.command.TicketCommand.ReopenTicket;
import dev.ticketing.ticket.command.TicketCommand.TransitionStatus;
import dev.ticketing.ticket.command.TicketCommand.UnassignTicket;
import dev.ticketing.ticket.command.TicketCommand.UnlinkFromCustomer;
import dev.ticketing.ticket.command.TicketCommand.UpdateTicket;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.handlers.AddCommentHandler;
import dev.ticketing.ticket.handlers.AddEmailReplyHandler;
import dev.ticketing.ticket.handlers.AssignTicketHandler;
import dev.ticketing.ticket.handlers.ChangePriorityHandler;
import dev.ticketing.ticket.handlers.CloseTicketHandler;
import dev.ticketing.ticket.handlers.CreateTicketHandler;
import dev.ticketing.ticket.handlers.CustomerLinkHandler;
import dev.ticketing.ticket.handlers.MergeTicketHandler;
import dev.ticketing.ticket.handlers.RecordFirstResponseHandler;
import dev.ticketing.ticket.handlers.ReopenTicketHandler;
import dev.ticketing.ticket.handlers.StateBuilder;
import dev.ticketing.ticket.handlers.TransitionStatusHandler;
import dev.ticketing.ticket.handlers.UnassignTicketHandler;
import dev.ticketing.ticket.handlers.UpdateTicketHandler;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;

/**
 * Ticket aggregate (functional pattern).
 *
 * <p>{@link #decide} turns a command and the current state into events or a rejection;
 * {@link #evolve} applies one event. Both are pure: no I/O, no clock, no shared state.
 *
 * <pre>{@code
 * TicketState state = TicketAggregate.replay(history);
 * Result<DomainError, List<TicketEvent>> decided = TicketAggregate.decide(cmd, state, context);
 * TicketState next = decided.match(events -> TicketAggregate.evolveAll(state, events), error -> state);
 * }</pre>
 */
public final class TicketAggregate {

    public static final String DOMAIN = "ticket";

    private TicketAggregate() {}

    public static TicketState emptyState() {
        return TicketState.empty();
    }

    /**
     * Decide which events a command produces against {@code state}.
     *
     * @return the events in causal order, an empty list for an accepted no-op,
     *     or the reason the command was rejected
     */
    public static Result<DomainError, List<TicketEvent>> decide(
            TicketCommand command, TicketState state, DecideContext context) {
        return switch (command.kind()) {
            case CREATE_TICKET -> CreateTicketHandler.handle((CreateTicket) command, context);
            case TRANSITION_STATUS -> TransitionStatusHandler.handle((TransitionStatus) command, state);
            case ADD_COMMENT -> AddCommentHandler.handle((AddComment) command, state, context);
            case ASSIGN_TICKET -> AssignTicketHandler.handle((AssignTicket) command, state);
            case UNASSIGN_TICKET -> UnassignTicketHandler.handle((UnassignTicket) command, state);
            case CLOSE_TICKET -> CloseTicketHandler.handle((CloseTicket) command, state);
            case REOPEN_TICKET -> ReopenTicketHandler.handle((ReopenTicket) command, state);
            case CHANGE_PRIORITY -> ChangePriorityHandler.handle((ChangePriority) command, state);
            case ESCALATE_PRIORITY -> ChangePriorityHandler.escalate((EscalatePriority) command, state);
            case MERGE_TICKET -> MergeTicketHandler.handle((MergeTicket) command, state);
            case ADD_EMAIL_REPLY -> AddEmailReplyHandler.handle((AddEmailReply) command, state, context);
            case LINK_TO_CUSTOMER -> CustomerLinkHandler.link((LinkToCustomer) command, state);
            case UNLINK_FROM_CUSTOMER -> CustomerLinkHandler.unlink((UnlinkFromCustomer) command, state);
            case UPDATE_TICKET -> UpdateTicketHandler.handle((UpdateTicket) command, state);
            case RECORD_FIRST_RESPONSE -> RecordFirstResponseHandler.handle((RecordFirstResponse) command);
        };
    }

    public static TicketState evolve(TicketState state, TicketEvent event) {
        return StateBuilder.apply(state, event);
    }

    public static TicketState evolveAll(TicketState state, List<? extends TicketEvent> events) {
        return StateBuilder.applyAll(state, events);
    }

    /**
     * Rebuild state from a ticket's full history.
     */
    public static TicketState replay(List<? extends TicketEvent> events) {
        return evolveAll(TicketState.empty(), events);
    }
}
