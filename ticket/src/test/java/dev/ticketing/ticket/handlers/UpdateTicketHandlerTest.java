package dev.ticketing.ticket.handlers;

import dev.ticketing.ticket.DomainErrorCode;
import dev.ticketing.ticket.command.FieldUpdate;
import dev.ticketing.ticket.command.TicketCommand.RecordFirstResponse;
import dev.ticketing.ticket.command.TicketCommand.UpdateTicket;
import dev.ticketing.ticket.event.FieldChange;
import dev.ticketing.ticket.event.TicketEvent.FirstResponseRecorded;
import dev.ticketing.ticket.event.TicketEvent.TicketUpdated;
import dev.ticketing.ticket.model.TicketStatus;
import dev.ticketing.ticket.model.TicketType;
import dev.ticketing.ticket.state.TicketState;
import org.junit.jupiter.api.Test;

import static dev.ticketing.ticket.TicketFixtures.AGENT;
import static dev.ticketing.ticket.TicketFixtures.T0;
import static dev.ticketing.ticket.TicketFixtures.T1;
import static dev.ticketing.ticket.TicketFixtures.TICKET;
import static dev.ticketing.ticket.TicketFixtures.ticketIn;
import static org.assertj.core.api.Assertions.assertThat;

class UpdateTicketHandlerTest {

    private static UpdateTicket.Builder update() {
        return UpdateTicket.builder(TICKET).actorId(AGENT).timestamp(T1);
    }

    @Test
    void only_changed_fields_are_recorded() {
        TicketState state = ticketIn(TicketStatus.OPEN).toBuilder().type(TicketType.RETURN).build();

        assertThat(UpdateTicketHandler.handle(
                update().title("  Leaky valve  ").description("Drips overnight").type(TicketType.RETURN).build(), state)
            .unwrap())
            .containsExactly(new TicketUpdated(TICKET, null, new FieldChange<>(null, "Drips overnight"), null, null,
                null, AGENT, T1));
    }

    @Test
    void new_title_is_trimmed() {
        assertThat(UpdateTicketHandler.handle(update().title("  Burst pipe ").build(), ticketIn(TicketStatus.NEW))
            .unwrap())
            .containsExactly(new TicketUpdated(TICKET, new FieldChange<>("Leaky valve", "Burst pipe"), null, null,
                null, null, AGENT, T1));
    }

    @Test
    void blank_title_is_rejected() {
        assertThat(UpdateTicketHandler.handle(update().title("   ").build(), ticketIn(TicketStatus.OPEN))
            .unwrapErr().code())
            .isEqualTo(DomainErrorCode.TITLE_REQUIRED);
    }

    @Test
    void update_without_changes_emits_nothing() {
        assertThat(UpdateTicketHandler.handle(update().title("Leaky valve").build(), ticketIn(TicketStatus.OPEN))
            .unwrap())
            .isEmpty();
        assertThat(UpdateTicketHandler.handle(update().build(), ticketIn(TicketStatus.OPEN)).unwrap()).isEmpty();
    }

    @Test
    void clearing_a_reference_records_the_old_value() {
        TicketState state = ticketIn(TicketStatus.OPEN).toBuilder().orderNumber("SO-1").trackingNumber("1Z999").build();

        assertThat(UpdateTicketHandler.handle(
                update().orderNumber(FieldUpdate.clear()).trackingNumber(FieldUpdate.to("1Z999")).build(), state)
            .unwrap())
            .containsExactly(new TicketUpdated(TICKET, null, null, null, new FieldChange<>("SO-1", null), null,
                AGENT, T1));
    }

    @Test
    void first_response_defaults_to_command_time() {
        assertThat(RecordFirstResponseHandler.handle(new RecordFirstResponse(TICKET, null, AGENT, T1)).unwrap())
            .containsExactly(new FirstResponseRecorded(TICKET, T1, AGENT, T1));
        assertThat(RecordFirstResponseHandler.handle(new RecordFirstResponse(TICKET, T0, AGENT, T1)).unwrap())
            .containsExactly(new FirstResponseRecorded(TICKET, T0, AGENT, T1));
    }
}
