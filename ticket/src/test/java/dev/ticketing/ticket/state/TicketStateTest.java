package dev.ticketing.ticket.state;

import dev.ticketing.ticket.model.SenderInfo;
import dev.ticketing.ticket.model.TicketId;
import dev.ticketing.ticket.model.TicketPriority;
import dev.ticketing.ticket.model.TicketStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TicketStateTest {

    @Test
    void test_empty_hasDefaults() {
        TicketState state = TicketState.empty();

        assertNull(state.id());
        assertFalse(state.exists());
        assertEquals(TicketStatus.NEW, state.status());
        assertEquals(TicketPriority.MEDIUM, state.priority());
        assertEquals(SenderInfo.empty(), state.sender());
        assertNull(state.assigneeId());
        assertNull(state.customerId());
        assertNull(state.mergedIntoTicketId());
        assertEquals(0, state.commentCount());
        assertEquals(0, state.reopenCount());
        assertFalse(state.hasFirstResponse());
        assertNull(state.createdAt());
        assertNull(state.updatedAt());
    }

    @Test
    void test_toBuilder_leavesOriginalUntouched() {
        TicketState original = TicketState.empty();

        TicketState changed = original.toBuilder().id(TicketId.of(1)).status(TicketStatus.OPEN).build();

        assertTrue(changed.exists());
        assertEquals(TicketStatus.OPEN, changed.status());
        assertEquals(TicketState.empty(), original);
        assertFalse(original.exists());
    }

    @Test
    void test_reopenAndMergeEligibility() {
        TicketState open = TicketState.empty().toBuilder().id(TicketId.of(1)).status(TicketStatus.OPEN).build();
        TicketState closed = open.toBuilder().status(TicketStatus.CLOSED).build();
        TicketState merged = closed.toBuilder().mergedIntoTicketId(TicketId.of(2)).build();

        assertTrue(open.canBeMerged());
        assertFalse(open.canBeReopened());
        assertTrue(closed.canBeReopened());
        assertFalse(closed.canBeMerged());
        assertFalse(merged.canBeReopened());
        assertFalse(merged.canBeMerged());
    }
}
