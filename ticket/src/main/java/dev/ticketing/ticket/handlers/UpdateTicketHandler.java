package dev.ticketing.ticket.handlers;

import dev.ticketing.client.Result;
import dev.ticketing.ticket.DomainError;
import dev.ticketing.ticket.command.FieldUpdate;
import dev.ticketing.ticket.command.TicketCommand.UpdateTicket;
import dev.ticketing.ticket.event.FieldChange;
import dev.ticketing.ticket.event.TicketEvent;
import dev.ticketing.ticket.event.TicketEvent.TicketUpdated;
import dev.ticketing.ticket.model.TicketType;
import dev.ticketing.ticket.state.TicketState;

import java.util.List;
import java.util.Objects;

/**
 * Functional handler for UpdateTicket command.
 *
 * <p>Only fields whose value actually changes end up in the event. An update that
 * changes nothing is accepted with no events.
 */
public final class UpdateTicketHandler {

    private UpdateTicketHandler() {}

    public static Result<DomainError, List<TicketEvent>> handle(UpdateTicket cmd, TicketState state) {
        // Validate
        if (cmd.title() != null && cmd.title().isBlank()) {
            return Result.err(DomainError.titleRequired());
        }

        // Compute
        FieldChange<String> title = cmd.title() == null ? null : change(state.title(), cmd.title().trim());
        FieldChange<String> description = cmd.description() == null
            ? null : change(state.description(), cmd.description());
        FieldChange<TicketType> type = cmd.type() == null ? null : change(state.type(), cmd.type());
        FieldChange<String> orderNumber = edit(state.orderNumber(), cmd.orderNumber());
        FieldChange<String> trackingNumber = edit(state.trackingNumber(), cmd.trackingNumber());

        if (title == null && description == null && type == null && orderNumber == null && trackingNumber == null) {
            return Result.ok(List.of());
        }
        return Result.ok(List.of(new TicketUpdated(
            cmd.ticketId(), title, description, type, orderNumber, trackingNumber, cmd.actorId(), cmd.timestamp())));
    }

    private static FieldChange<String> edit(String current, FieldUpdate<String> update) {
        return update == null ? null : change(current, update.value());
    }

    private static <T> FieldChange<T> change(T current, T next) {
        return Objects.equals(current, next) ? null : new FieldChange<>(current, next);
    }
}
