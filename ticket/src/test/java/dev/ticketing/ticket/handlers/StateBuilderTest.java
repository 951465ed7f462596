package dev.ticketing.ticket.handlers;

import dev.ticketing.ticket.event.FieldChange;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.CommentAdded;
import dev.ticketing.ticket.event.TicketEvent.CustomerLinked;
import dev.ticketing.ticket.event.TicketEvent.CustomerUnlinked;
import dev.ticketing.ticket.event.TicketEvent.EmailReplyQueued;
import dev.ticketing.ticket.event.TicketEvent.FirstResponseRecorded;
import dev.ticketing.ticket.event.TicketEvent.PriorityChanged;
import dev.ticketing.ticket.event.TicketEvent.StatusTransitioned;
import dev.ticketing.ticket.event.TicketEvent.TicketAssigned;
import dev.ticketing.ticket.event.TicketEvent.TicketClosed;
import dev.ticketing.ticket.event.TicketEvent.TicketCreated;
import dev.ticketing.ticket.event.TicketEvent.TicketMerged;
import dev.ticketing.ticket.event.TicketEvent.TicketReopened;
import dev.ticketing.ticket.event.TicketEvent.TicketUnassigned;
import dev.ticketing.ticket.event.TicketEvent.TicketUpdated;
import dev.ticketing.ticket.model.CommentId;
import dev.ticketing.ticket.model.SenderInfo;
import dev.ticketing.ticket.model.TicketPriority;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.model.TicketType;
import dev.ticketing.ticket.state.TicketState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dev.ticketing.ticket.TicketFixtures.AGENT;
import static dev.ticketing.ticket.TicketFixtures.CUSTOMER;
import static dev.ticketing.ticket.TicketFixtures.OTHER_TICKET;
import static dev.ticketing.ticket.TicketFixtures.REPORTER;
import static dev.ticketing.ticket.TicketFixtures.T0;
import static dev.ticketing.ticket.TicketFixtures.T1;
import static dev.ticketing.ticket.TicketFixtures.T2;
import static dev.ticketing.ticket.TicketFixtures.TICKET;
import static dev.ticketing.ticket.TicketFixtures.ticketIn;
import static org.junit.jupiter.api.Assertions.*;

class StateBuilderTest {

    private static TicketCreated created() {
        return new TicketCreated(TICKET, "Leaky valve", "Drips overnight", TicketPriority.HIGH,
            TicketType.RETURN, REPORTER, null, SenderInfo.ofEmail("buyer@example.com"), "SO-1", null, "msg-1",
            "conv-1", null, CUSTOMER, REPORTER, T0);
    }

    private static CommentAdded comment(boolean internal, boolean fromCustomer) {
        return new CommentAdded(TICKET, CommentId.of(1), "text", internal, fromCustomer, false, null, List.of(),
            AGENT, T1);
    }

    @Test
    void test_ticketCreated_initializesState() {
        TicketState state = StateBuilder.apply(TicketState.empty(), created());

        assertTrue(state.exists());
        assertEquals(TICKET, state.id());
        assertEquals("Leaky valve", state.title());
        assertEquals("Drips overnight", state.description());
        assertEquals(TicketStatus.NEW, state.status());
        assertEquals(TicketPriority.HIGH, state.priority());
        assertEquals(TicketType.RETURN, state.type());
        assertEquals(REPORTER, state.reporterId());
        assertNull(state.assigneeId());
        assertEquals(CUSTOMER, state.customerId());
        assertEquals("buyer@example.com", state.sender().email());
        assertEquals("SO-1", state.orderNumber());
        assertEquals("conv-1", state.conversationId());
        assertEquals(0, state.commentCount());
        assertFalse(state.hasFirstResponse());
        assertEquals(T0, state.createdAt());
        assertEquals(T0, state.updatedAt());
    }

    @Test
    void test_statusTransitioned_setsStatusAndUpdatedAt() {
        TicketState state = StateBuilder.apply(ticketIn(TicketStatus.NEW),
            new StatusTransitioned(TICKET, TicketStatus.NEW, TicketStatus.OPEN, null, AGENT, T1));

        assertEquals(TicketStatus.OPEN, state.status());
        assertEquals(T1, state.updatedAt());
        assertEquals(T0, state.createdAt());
    }

    @Test
    void test_assignAndUnassign() {
        TicketState assigned = StateBuilder.apply(ticketIn(TicketStatus.OPEN),
            new TicketAssigned(TICKET, null, AGENT, AGENT, T1));
        TicketState unassigned = StateBuilder.apply(assigned, new TicketUnassigned(TICKET, AGENT, AGENT, T2));

        assertEquals(AGENT, assigned.assigneeId());
        assertNull(unassigned.assigneeId());
        assertEquals(T2, unassigned.updatedAt());
    }

    @Test
    void test_internalNote_countsButIsNotFirstResponse() {
        TicketState state = StateBuilder.apply(ticketIn(TicketStatus.OPEN), comment(true, false));

        assertEquals(1, state.commentCount());
        assertFalse(state.hasFirstResponse());
    }

    @Test
    void test_publicComment_setsFirstResponseAndNeverResets() {
        TicketState state = StateBuilder.applyAll(ticketIn(TicketStatus.OPEN),
            List.of(comment(false, false), comment(true, false)));

        assertEquals(2, state.commentCount());
        assertTrue(state.hasFirstResponse());
    }

    @Test
    void test_customerComment_isNotFirstResponse() {
        TicketState state = StateBuilder.applyAll(ticketIn(TicketStatus.OPEN),
            List.of(comment(false, true), comment(false, true)));

        assertEquals(2, state.commentCount());
        assertFalse(state.hasFirstResponse());
    }

    @Test
    void test_customerCommentAfterReply_keepsFirstResponse() {
        TicketState state = StateBuilder.applyAll(ticketIn(TicketStatus.OPEN),
            List.of(comment(false, false), comment(false, true)));

        assertTrue(state.hasFirstResponse());
    }

    @Test
    void test_emailReplyQueued_setsFirstResponse() {
        TicketState state = StateBuilder.apply(ticketIn(TicketStatus.OPEN),
            new EmailReplyQueued(TICKET, CommentId.of(1), "buyer@example.com", "hi", List.of(), AGENT, T1));

        assertTrue(state.hasFirstResponse());
        assertEquals(0, state.commentCount());
    }

    @Test
    void test_ticketClosed_setsClosedAtButNotStatus() {
        TicketState state = StateBuilder.apply(ticketIn(TicketStatus.OPEN),
            new TicketClosed(TICKET, TicketStatus.OPEN, "done", AGENT, T1));

        assertEquals(TicketStatus.OPEN, state.status());
        assertEquals(T1, state.closedAt());
    }

    @Test
    void test_ticketReopened_clearsClosedAtAndCounts() {
        TicketState closed = ticketIn(TicketStatus.CLOSED).toBuilder().closedAt(T1).build();

        TicketState state = StateBuilder.apply(closed, new TicketReopened(TICKET, "again", AGENT, T2));

        assertEquals(TicketStatus.CLOSED, state.status());
        assertNull(state.closedAt());
        assertEquals(1, state.reopenCount());
    }

    @Test
    void test_priorityChanged() {
        TicketState state = StateBuilder.apply(ticketIn(TicketStatus.OPEN),
            new PriorityChanged(TICKET, TicketPriority.MEDIUM, TicketPriority.URGENT, null, AGENT, T1));

        assertEquals(TicketPriority.URGENT, state.priority());
    }

    @Test
    void test_ticketMerged_forcesClosed() {
        TicketState state = StateBuilder.apply(ticketIn(TicketStatus.IN_PROGRESS),
            new TicketMerged(TICKET, OTHER_TICKET, "dup", AGENT, T1));

        assertEquals(TicketStatus.CLOSED, state.status());
        assertEquals(OTHER_TICKET, state.mergedIntoTicketId());
    }

    @Test
    void test_customerLinkAndUnlink() {
        TicketState linked = StateBuilder.apply(ticketIn(TicketStatus.OPEN),
            new CustomerLinked(TICKET, CUSTOMER, null, null, T1));
        TicketState unlinked = StateBuilder.apply(linked, new CustomerUnlinked(TICKET, CUSTOMER, null, T2));

        assertEquals(CUSTOMER, linked.customerId());
        assertNull(unlinked.customerId());
    }

    @Test
    void test_ticketUpdated_appliesOnlyChangedFields() {
        TicketState before = StateBuilder.apply(TicketState.empty(), created());

        TicketState after = StateBuilder.apply(before, new TicketUpdated(TICKET,
            new FieldChange<>("Leaky valve", "Burst pipe"), null, new FieldChange<>(TicketType.RETURN, null),
            new FieldChange<>("SO-1", null), new FieldChange<>(null, "1Z999"), AGENT, T2));

        assertEquals("Burst pipe", after.title());
        assertEquals("Drips overnight", after.description());
        assertNull(after.type());
        assertNull(after.orderNumber());
        assertEquals("1Z999", after.trackingNumber());
        assertEquals(T2, after.updatedAt());
    }

    @Test
    void test_firstResponseRecorded_setsFlag() {
        TicketState state = StateBuilder.apply(ticketIn(TicketStatus.OPEN),
            new FirstResponseRecorded(TICKET, T1, AGENT, T2));

        assertTrue(state.hasFirstResponse());
        assertEquals(0, state.commentCount());
    }

    @Test
    void test_apply_doesNotMutateInput() {
        TicketState before = ticketIn(TicketStatus.OPEN);
        TicketState snapshot = before.toBuilder().build();

        List<TicketEvent> events = List.of(
            comment(false, false),
            new TicketAssigned(TICKET, null, AGENT, AGENT, T1),
            new TicketMerged(TICKET, OTHER_TICKET, null, AGENT, T2));
        StateBuilder.applyAll(before, events);

        assertEquals(snapshot, before);
    }

    @Test
    void test_applyAll_emptyList_returnsSameState() {
        TicketState state = ticketIn(TicketStatus.OPEN);

        assertEquals(state, StateBuilder.applyAll(state, List.of()));
    }
}
